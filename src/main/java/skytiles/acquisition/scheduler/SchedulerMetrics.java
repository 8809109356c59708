package skytiles.acquisition.scheduler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters, exposed through the status endpoint.
 */
public class SchedulerMetrics {

    private final LongAdder ticks = new LongAdder();
    private final LongAdder dispatched = new LongAdder();
    private final LongAdder succeeded = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder gaveUp = new LongAdder();
    private final LongAdder conflicts = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final LongAdder reaped = new LongAdder();
    private final AtomicInteger inFlight = new AtomicInteger();

    void tick() {
        ticks.increment();
    }

    void dispatched() {
        dispatched.increment();
        inFlight.incrementAndGet();
    }

    void settled(DispatchOutcome outcome) {
        inFlight.decrementAndGet();
        switch (outcome) {
            case SUCCEEDED -> succeeded.increment();
            case FAILED -> failed.increment();
            case GAVE_UP -> {
                failed.increment();
                gaveUp.increment();
            }
            default -> {
            }
        }
    }

    void conflict() {
        conflicts.increment();
    }

    void timeout() {
        timeouts.increment();
    }

    void reaped(int count) {
        reaped.add(count);
    }

    public int inFlight() {
        return inFlight.get();
    }

    public long succeeded() {
        return succeeded.sum();
    }

    public long failed() {
        return failed.sum();
    }

    public long timeouts() {
        return timeouts.sum();
    }

    public long conflicts() {
        return conflicts.sum();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put("ticks", ticks.sum());
        values.put("dispatched", dispatched.sum());
        values.put("succeeded", succeeded.sum());
        values.put("failed", failed.sum());
        values.put("gaveUp", gaveUp.sum());
        values.put("conflicts", conflicts.sum());
        values.put("timeouts", timeouts.sum());
        values.put("reaped", reaped.sum());
        values.put("inFlight", (long) inFlight.get());
        return values;
    }
}
