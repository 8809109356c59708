package skytiles.acquisition.scheduler;

import skytiles.acquisition.model.ImageTimestamp;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps wall-clock time onto the source's publication cadence.
 * Slots are aligned to multiples of the cadence since the epoch (00, 15, 30, 45 for 15 minutes).
 * Pure: no clock, no state.
 */
public final class TimestampResolver {

    private final long cadenceSeconds;
    private final Duration publicationDelay;

    public TimestampResolver(Duration cadence, Duration publicationDelay) {
        if (cadence.getSeconds() <= 0) {
            throw new IllegalArgumentException("cadence must be at least one second");
        }
        this.cadenceSeconds = cadence.getSeconds();
        this.publicationDelay = publicationDelay;
    }

    /**
     * Every cadence-aligned timestamp in {@code [from, to]}, ascending, both ends inclusive.
     * Empty when {@code from} is after {@code to}.
     */
    public List<ImageTimestamp> expectedTimestamps(Instant from, Instant to) {
        List<ImageTimestamp> result = new ArrayList<>();
        if (from.isAfter(to)) {
            return result;
        }
        long first = ceilToCadence(from);
        long last = to.getEpochSecond();
        for (long s = first; s <= last; s += cadenceSeconds) {
            result.add(ImageTimestamp.ofEpochSecond(s));
        }
        return result;
    }

    /**
     * The most recent slot the source should have published by {@code now}.
     */
    public ImageTimestamp latestExpected(Instant now) {
        return floor(now.minus(publicationDelay));
    }

    /**
     * The slot containing the given instant.
     */
    public ImageTimestamp floor(Instant instant) {
        long s = instant.getEpochSecond();
        return ImageTimestamp.ofEpochSecond(s - Math.floorMod(s, cadenceSeconds));
    }

    public boolean isAligned(ImageTimestamp timestamp) {
        return Math.floorMod(timestamp.epochSecond(), cadenceSeconds) == 0;
    }

    public Duration cadence() {
        return Duration.ofSeconds(cadenceSeconds);
    }

    private long ceilToCadence(Instant instant) {
        long s = instant.getEpochSecond();
        if (instant.getNano() > 0) {
            s++;
        }
        long rem = Math.floorMod(s, cadenceSeconds);
        return rem == 0 ? s : s + (cadenceSeconds - rem);
    }
}
