package skytiles.acquisition.pipeline;

/**
 * Malformed input, unsupported geometry, missing asset or a tool that rejected its input.
 * Still retried up to the give-up threshold since upstream data can self-correct.
 */
public class PermanentStepException extends StepException {

    public PermanentStepException(String message) {
        super(message);
    }

    public PermanentStepException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
