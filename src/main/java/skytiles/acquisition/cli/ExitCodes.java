package skytiles.acquisition.cli;

import skytiles.acquisition.scheduler.DispatchOutcome;

/**
 * Process exit codes.
 */
public final class ExitCodes {

    /** Success, including "already succeeded, nothing to do" */
    public static final int OK = 0;
    /** A pipeline step failed */
    public static final int STEP_FAILURE = 1;
    /** Invalid flags, paths or configuration */
    public static final int CONFIGURATION = 2;
    /** State store or filesystem unavailable */
    public static final int RESOURCE = 3;
    /** The timestamp is already running elsewhere */
    public static final int CONFLICT = 4;

    private ExitCodes() {
    }

    public static int of(DispatchOutcome outcome) {
        return switch (outcome) {
            case SUCCEEDED, SKIPPED_SUCCEEDED -> OK;
            case FAILED, GAVE_UP -> STEP_FAILURE;
            case SKIPPED_RUNNING -> CONFLICT;
            case REJECTED -> RESOURCE;
        };
    }
}
