package skytiles.acquisition.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One stage of the pipeline: consumes the previous stage's artifact, writes its own.
 * Steps hold no per-run state; the same instance may serve concurrent runs of different timestamps.
 */
public interface PipelineStep {

    /** Short name used in logs and error summaries */
    String name();

    /**
     * Where this step writes its artifact for the given run.
     */
    Path destination(StepContext context);

    /**
     * Produce {@code destination} from {@code source}.
     *
     * @param context     run parameters
     * @param source      previous step's artifact, or null for the first step
     * @param destination where to write
     * @throws StepException        if the artifact cannot be produced
     * @throws InterruptedException if the run is cancelled
     */
    void execute(StepContext context, Path source, Path destination) throws StepException, InterruptedException;

    /**
     * Whether an existing destination is already correct output.
     * When false the runner removes any leftover destination before executing; when true a
     * failure counts as success if {@link #isComplete} holds afterwards.
     */
    default boolean idempotentSafe() {
        return false;
    }

    /**
     * Whether this step's work for the run is fully done. Consulted for idempotent-safe steps
     * that fail; must not throw.
     */
    default boolean isComplete(StepContext context, Path destination) {
        return Files.exists(destination);
    }
}
