package skytiles.acquisition.scheduler;

import java.time.Instant;
import java.util.Collection;

/**
 * Summary of one scheduler tick.
 */
public record TickReport(
        Instant startedAt,
        int reaped,
        int candidates,
        int succeeded,
        int failed,
        int gaveUp,
        int skipped) {

    public static TickReport empty(Instant at) {
        return new TickReport(at, 0, 0, 0, 0, 0, 0);
    }

    static TickReport of(Instant startedAt, int reaped, int candidates, Collection<DispatchOutcome> outcomes) {
        int succeeded = 0;
        int failed = 0;
        int gaveUp = 0;
        int skipped = 0;
        for (DispatchOutcome outcome : outcomes) {
            switch (outcome) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case GAVE_UP -> gaveUp++;
                default -> skipped++;
            }
        }
        return new TickReport(startedAt, reaped, candidates, succeeded, failed, gaveUp, skipped);
    }
}
