package skytiles.acquisition.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Ticks immediately, then every interval, on a single daemon thread.
 * A tick that overruns delays the next one instead of overlapping it.
 */
public class FixedRateTickSource implements TickSource {

    private static final Logger log = LoggerFactory.getLogger(FixedRateTickSource.class);

    private final ScheduledExecutorService executor;
    private final Duration interval;
    private final Duration stopTimeout;

    private volatile boolean running = false;

    public FixedRateTickSource(Duration interval, Duration stopTimeout) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "skytiles-tick");
            t.setDaemon(true);
            return t;
        });
        this.interval = interval;
        this.stopTimeout = stopTimeout;
    }

    @Override
    public void start(Runnable tick) {
        if (running) {
            log.warn("Tick source already running");
            return;
        }

        running = true;
        executor.scheduleAtFixedRate(wrapRunnable(tick), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Ticking every {}ms", interval.toMillis());
    }

    /**
     * Stop ticking. A tick in progress gets the stop timeout to finish, then is interrupted.
     */
    @Override
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Tick source forcefully stopped");
            } else {
                log.info("Tick source stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // An exception escaping scheduleAtFixedRate would cancel all future ticks
    private Runnable wrapRunnable(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Tick error", e);
            }
        };
    }
}
