package skytiles.acquisition.pipeline;

import skytiles.acquisition.model.ImageTimestamp;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of one pipeline run: either the final artifact, or the step that failed.
 */
public record RunResult(
        ImageTimestamp timestamp,
        Path finalArtifact,
        int failedStepIndex,
        String failedStep,
        StepException error) {

    public static RunResult success(ImageTimestamp timestamp, Path finalArtifact) {
        return new RunResult(timestamp, finalArtifact, -1, null, null);
    }

    public static RunResult failure(ImageTimestamp timestamp, int stepIndex, String stepName, StepException error) {
        return new RunResult(timestamp, null, stepIndex, stepName, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public Optional<Path> artifact() {
        return Optional.ofNullable(finalArtifact);
    }

    public boolean isPermanentFailure() {
        return error != null && !error.isTransient();
    }

    /** e.g. {@code step 2 (adjust): crop_x 900 too large for width 1500} */
    public String errorSummary() {
        if (succeeded()) {
            return null;
        }
        return "step " + failedStepIndex + " (" + failedStep + "): " + error.getMessage();
    }
}
