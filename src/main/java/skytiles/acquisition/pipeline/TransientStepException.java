package skytiles.acquisition.pipeline;

/**
 * Network or I/O failure (source not yet published, connection reset, disk hiccup).
 */
public class TransientStepException extends StepException {

    public TransientStepException(String message) {
        super(message);
    }

    public TransientStepException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
