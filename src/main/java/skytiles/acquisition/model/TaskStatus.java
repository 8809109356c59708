package skytiles.acquisition.model;

/**
 * Processing status of one timestamp.
 */
public enum TaskStatus {
    /** Known but never attempted */
    PENDING,
    /** A pipeline run is in flight (at most one per timestamp) */
    RUNNING,
    /** Tiles published; terminal unless explicitly forced */
    SUCCEEDED,
    /** Last attempt failed (retried with back-off until the give-up threshold) */
    FAILED
}
