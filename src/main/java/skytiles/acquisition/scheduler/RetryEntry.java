package skytiles.acquisition.scheduler;

import skytiles.acquisition.model.ImageTimestamp;

import java.time.Instant;
import java.util.Comparator;

/**
 * A failed timestamp waiting for its next attempt.
 * Ordered by eligibility, then oldest timestamp first.
 */
public record RetryEntry(ImageTimestamp timestamp, int attempts, Instant nextEligibleAt)
        implements Comparable<RetryEntry> {

    private static final Comparator<RetryEntry> ORDER = Comparator
            .comparing(RetryEntry::nextEligibleAt)
            .thenComparing(RetryEntry::timestamp);

    public boolean isEligible(Instant now) {
        return !nextEligibleAt.isAfter(now);
    }

    @Override
    public int compareTo(RetryEntry other) {
        return ORDER.compare(this, other);
    }
}
