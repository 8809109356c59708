package skytiles.acquisition.scheduler;

/**
 * What happened to one dispatch request.
 */
public enum DispatchOutcome {
    SUCCEEDED,
    /** Failed and queued for retry */
    FAILED,
    /** Failed and reached the attempt threshold */
    GAVE_UP,
    /** Another run holds the timestamp */
    SKIPPED_RUNNING,
    /** Already succeeded and not forced */
    SKIPPED_SUCCEEDED,
    /** Scheduler is shutting down */
    REJECTED;

    public boolean isFailure() {
        return this == FAILED || this == GAVE_UP;
    }

    public boolean isSkipped() {
        return this == SKIPPED_RUNNING || this == SKIPPED_SUCCEEDED;
    }
}
