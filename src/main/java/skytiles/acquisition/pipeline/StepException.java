package skytiles.acquisition.pipeline;

/**
 * A pipeline step could not produce its artifact.
 * Both kinds are retried through the retry queue; they differ in how they are reported.
 */
public abstract class StepException extends Exception {

    protected StepException(String message) {
        super(message);
    }

    protected StepException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Network or I/O trouble that is expected to clear by itself */
    public abstract boolean isTransient();
}
