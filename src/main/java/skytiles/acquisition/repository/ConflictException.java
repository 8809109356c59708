package skytiles.acquisition.repository;

import skytiles.acquisition.model.ImageTimestamp;

/**
 * Raised when a timestamp cannot be claimed for a run.
 * The scheduler treats it as "someone else has it" and skips silently.
 */
public class ConflictException extends RuntimeException {

    public enum Reason {
        ALREADY_RUNNING,
        ALREADY_SUCCEEDED
    }

    private final ImageTimestamp timestamp;
    private final Reason reason;

    public ConflictException(ImageTimestamp timestamp, Reason reason) {
        super("Timestamp " + timestamp + " cannot be claimed: " + reason);
        this.timestamp = timestamp;
        this.reason = reason;
    }

    public ImageTimestamp timestamp() {
        return timestamp;
    }

    public Reason reason() {
        return reason;
    }
}
