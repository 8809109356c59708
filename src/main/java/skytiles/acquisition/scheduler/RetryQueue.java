package skytiles.acquisition.scheduler;

import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Back-off queue of failed timestamps.
 * <p>
 * Derived state only: the state store remains the record of every failure, and
 * {@link #rebuild(List)} restores the queue from it after a restart with attempts
 * (and therefore back-off) preserved.
 * <p>
 * Delay after {@code n} attempts is {@code base * 2^min(n, capExponent)}. Once a timestamp
 * reaches {@code maxAttempts} it is given up: removed from the queue and reported instead.
 */
public class RetryQueue {

    private static final Logger log = LoggerFactory.getLogger(RetryQueue.class);

    public enum PushResult {
        /** Queued (or re-queued) with a new eligibility instant */
        QUEUED,
        /** Attempt threshold reached; not retried automatically */
        GAVE_UP
    }

    private final Clock clock;
    private final Duration base;
    private final int capExponent;
    private final int maxAttempts;

    private final PriorityQueue<RetryEntry> heap = new PriorityQueue<>();
    private final Map<ImageTimestamp, RetryEntry> index = new HashMap<>();
    private final SortedSet<ImageTimestamp> givenUp = new TreeSet<>();

    public RetryQueue(Clock clock, Duration base, int capExponent, int maxAttempts) {
        this.clock = clock;
        this.base = base;
        this.capExponent = capExponent;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Queue a timestamp after a failed attempt, eligible {@code backoff(attempts)} from now.
     *
     * @param timestamp the failed timestamp
     * @param attempts  completed attempts so far
     */
    public PushResult push(ImageTimestamp timestamp, int attempts) {
        return push(timestamp, attempts, clock.instant());
    }

    private synchronized PushResult push(ImageTimestamp timestamp, int attempts, Instant failedAt) {
        removeEntry(timestamp);

        if (attempts >= maxAttempts) {
            givenUp.add(timestamp);
            log.debug("Timestamp {} reached {} attempts, not re-queued", timestamp, attempts);
            return PushResult.GAVE_UP;
        }

        givenUp.remove(timestamp);
        RetryEntry entry = new RetryEntry(timestamp, attempts, failedAt.plus(backoff(attempts)));
        heap.add(entry);
        index.put(timestamp, entry);
        log.debug("Timestamp {} queued for retry at {} (attempt {} of {})",
                timestamp, entry.nextEligibleAt(), attempts, maxAttempts);
        return PushResult.QUEUED;
    }

    /**
     * Remove and return the earliest entry eligible at {@code now}.
     */
    public synchronized Optional<ImageTimestamp> popEligible(Instant now) {
        RetryEntry head = heap.peek();
        if (head == null || !head.isEligible(now)) {
            return Optional.empty();
        }
        heap.poll();
        index.remove(head.timestamp());
        return Optional.of(head.timestamp());
    }

    /**
     * Remove and return every entry eligible at {@code now}, in queue order.
     */
    public synchronized List<ImageTimestamp> popAllEligible(Instant now) {
        List<ImageTimestamp> eligible = new ArrayList<>();
        for (RetryEntry entry : popAllEligibleEntries(now)) {
            eligible.add(entry.timestamp());
        }
        return eligible;
    }

    /**
     * Like {@link #popAllEligible} but keeps each entry's attempt count, so an entry that could
     * not be dispatched can be {@link #restore restored}.
     */
    public synchronized List<RetryEntry> popAllEligibleEntries(Instant now) {
        List<RetryEntry> eligible = new ArrayList<>();
        RetryEntry head;
        while ((head = heap.peek()) != null && head.isEligible(now)) {
            heap.poll();
            index.remove(head.timestamp());
            eligible.add(head);
        }
        return eligible;
    }

    /**
     * Put back a popped entry unchanged. Ignored if the timestamp was re-queued meanwhile.
     */
    public synchronized void restore(RetryEntry entry) {
        if (index.containsKey(entry.timestamp()) || givenUp.contains(entry.timestamp())) {
            return;
        }
        heap.add(entry);
        index.put(entry.timestamp(), entry);
    }

    /**
     * Replace the queue contents with the given incomplete records.
     * Each entry keeps its stored attempt count; eligibility is measured from the
     * record's last finish so that a restart does not shorten the back-off.
     *
     * @param incomplete FAILED records from the state store
     * @return number of entries queued
     */
    public synchronized int rebuild(List<TaskRecord> incomplete) {
        heap.clear();
        index.clear();
        givenUp.clear();

        int queued = 0;
        for (TaskRecord record : incomplete) {
            Instant failedAt = record.finishedAt() != null ? record.finishedAt()
                    : record.lastAttemptAt() != null ? record.lastAttemptAt()
                    : clock.instant();
            if (push(record.timestamp(), record.attempts(), failedAt) == PushResult.QUEUED) {
                queued++;
            }
        }
        return queued;
    }

    /**
     * Drop a timestamp from the queue and the given-up set (e.g. after a manual success).
     */
    public synchronized void remove(ImageTimestamp timestamp) {
        removeEntry(timestamp);
        givenUp.remove(timestamp);
    }

    public synchronized Optional<RetryEntry> entry(ImageTimestamp timestamp) {
        return Optional.ofNullable(index.get(timestamp));
    }

    public synchronized boolean contains(ImageTimestamp timestamp) {
        return index.containsKey(timestamp);
    }

    public synchronized boolean isGivenUp(ImageTimestamp timestamp) {
        return givenUp.contains(timestamp);
    }

    public synchronized List<ImageTimestamp> givenUp() {
        return List.copyOf(givenUp);
    }

    public synchronized int size() {
        return heap.size();
    }

    /**
     * Back-off delay after the given number of attempts.
     */
    public Duration backoff(int attempts) {
        int exponent = Math.min(Math.max(attempts, 0), capExponent);
        return base.multipliedBy(1L << exponent);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void removeEntry(ImageTimestamp timestamp) {
        RetryEntry existing = index.remove(timestamp);
        if (existing != null) {
            heap.remove(existing);
        }
    }
}
