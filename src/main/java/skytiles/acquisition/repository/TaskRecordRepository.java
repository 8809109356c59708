package skytiles.acquisition.repository;

import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.model.TaskRecord;
import skytiles.acquisition.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-timestamp outcome store.
 * The only owner of task record lifecycle; every mutating call is durable when it returns.
 */
public interface TaskRecordRepository {

    /**
     * Find the record for a timestamp.
     *
     * @param timestamp the timestamp
     * @return the record if the timestamp was ever attempted
     */
    Optional<TaskRecord> get(ImageTimestamp timestamp);

    /**
     * Claim a timestamp for one pipeline run.
     * Creates the record if absent. This is the single mutual-exclusion point per timestamp.
     *
     * @param timestamp the timestamp to run
     * @return the record, now RUNNING
     * @throws ConflictException if the timestamp is already RUNNING or already SUCCEEDED
     */
    TaskRecord markRunning(ImageTimestamp timestamp);

    /**
     * Claim a timestamp, optionally re-running one that already succeeded.
     *
     * @param timestamp the timestamp to run
     * @param force     allow SUCCEEDED to be re-run
     * @return the record, now RUNNING
     * @throws ConflictException if the timestamp is already RUNNING (or SUCCEEDED without force)
     */
    TaskRecord markRunning(ImageTimestamp timestamp, boolean force);

    /**
     * Record a successful run. Idempotent: repeated calls leave the record untouched.
     *
     * @param timestamp    the timestamp
     * @param artifactPath final artifact of the run (may be null)
     * @return the record, now SUCCEEDED
     */
    TaskRecord markSucceeded(ImageTimestamp timestamp, String artifactPath);

    /**
     * Record a failed attempt: increments attempts, stores the error, sets FAILED.
     *
     * @param timestamp the timestamp
     * @param error     short error summary
     * @return the record, now FAILED
     */
    TaskRecord markFailed(ImageTimestamp timestamp, String error);

    /**
     * Records that need another attempt.
     * Stale RUNNING records (last attempt older than the liveness timeout) are first
     * reclassified to FAILED, so nothing stays RUNNING forever after a crash.
     *
     * @param now             current instant
     * @param livenessTimeout how long a run may go without reporting
     * @return FAILED records, oldest timestamp first
     */
    List<TaskRecord> listIncomplete(Instant now, Duration livenessTimeout);

    /**
     * RUNNING records whose last attempt started before the cutoff.
     *
     * @param cutoff last-attempt threshold
     * @return stale candidates ordered by last attempt
     */
    List<TaskRecord> findStaleRunning(Instant cutoff);

    /**
     * Reclassify one stale RUNNING record as FAILED (attempts incremented).
     * No-op if the record is no longer RUNNING or has reported since the cutoff.
     *
     * @param timestamp the timestamp
     * @param cutoff    last-attempt threshold
     * @return the FAILED record, or empty if nothing changed
     */
    Optional<TaskRecord> markStale(ImageTimestamp timestamp, Instant cutoff);

    /**
     * Most recent records by timestamp, newest first.
     */
    List<TaskRecord> findRecent(int limit);

    /**
     * Count records with the given status.
     */
    int countByStatus(TaskStatus status);
}
