package skytiles.acquisition.scheduler;

import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.model.TaskRecord;
import skytiles.acquisition.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recovers RUNNING records nobody will ever complete.
 * <p>
 * Records get stuck when the process dies mid-run (crash, kill, power loss). The reaper:
 * 1. Finds records RUNNING longer than the liveness timeout
 * 2. Skips the ones this process is still executing
 * 3. Reclassifies the rest as FAILED so the retry queue picks them up
 */
public class StaleRunReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleRunReaper.class);

    private final TaskRecordRepository repository;
    private final Clock clock;
    private final Duration livenessTimeout;

    public StaleRunReaper(TaskRecordRepository repository, Clock clock, Duration livenessTimeout) {
        this.repository = repository;
        this.clock = clock;
        this.livenessTimeout = livenessTimeout;
    }

    /**
     * Find and reclassify stale runs.
     *
     * @param inFlight timestamps this process is currently running
     * @return the records now FAILED
     */
    public List<TaskRecord> reap(Set<ImageTimestamp> inFlight) {
        Instant cutoff = clock.instant().minus(livenessTimeout);

        List<TaskRecord> stale = repository.findStaleRunning(cutoff);
        if (stale.isEmpty()) {
            log.debug("No stale runs found");
            return List.of();
        }

        List<TaskRecord> reaped = new ArrayList<>();
        int skipped = 0;
        for (TaskRecord record : stale) {
            if (inFlight.contains(record.timestamp())) {
                skipped++;
                continue;
            }
            try {
                repository.markStale(record.timestamp(), cutoff).ifPresent(failed -> {
                    reaped.add(failed);
                    log.warn("Run for {} stale since {}, marked failed (attempt {})",
                            failed.timestamp(), record.lastAttemptAt(), failed.attempts());
                });
            } catch (RuntimeException e) {
                log.error("Failed to reap {}", record.timestamp(), e);
            }
        }

        log.info("Stale run reaper: {} reclassified, {} still in flight, {} total stale",
                reaped.size(), skipped, stale.size());
        return reaped;
    }
}
