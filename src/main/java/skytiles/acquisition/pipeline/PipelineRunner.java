package skytiles.acquisition.pipeline;

import skytiles.acquisition.model.ImageTimestamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an ordered list of steps for one timestamp, each consuming the previous step's artifact.
 * <p>
 * The first failing step aborts the run. Intermediates are cleaned up on every path; only the
 * final artifact survives (or everything, with keep-files). A step may keep a resume cache in
 * the work dir across failed attempts; {@link #discard} removes it when the slot is given up.
 * The runner never touches the state store: the caller records the outcome.
 */
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final Path workRoot;
    private final boolean keepFiles;

    public PipelineRunner(Path workRoot, boolean keepFiles) {
        this.workRoot = workRoot;
        this.keepFiles = keepFiles;
    }

    /**
     * Run all steps for a timestamp.
     *
     * @param timestamp the slot to process
     * @param steps     ordered steps, at least one
     * @return success with the final artifact, or the failing step and its error
     */
    public RunResult run(ImageTimestamp timestamp, List<PipelineStep> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("pipeline has no steps");
        }

        Path workDir = workRoot.resolve(timestamp.id());
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            return RunResult.failure(timestamp, 1, steps.get(0).name(),
                    new TransientStepException("cannot create work dir " + workDir + ": " + e.getMessage(), e));
        }

        StepContext context = new StepContext(timestamp, workDir, keepFiles);
        RunResult result;
        try (ArtifactSet artifacts = new ArtifactSet(keepFiles)) {
            result = runSteps(context, steps, artifacts);
        }
        removeIfEmpty(workDir);
        return result;
    }

    private RunResult runSteps(StepContext context, List<PipelineStep> steps, ArtifactSet artifacts) {
        ImageTimestamp timestamp = context.timestamp();
        Path source = null;

        for (int i = 0; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            int number = i + 1;
            Path destination = step.destination(context);

            if (Thread.currentThread().isInterrupted()) {
                return RunResult.failure(timestamp, number, step.name(),
                        new TransientStepException("run cancelled before " + step.name()));
            }

            log.info("Step {}/{} {} -> {}", number, steps.size(), step.name(), destination.getFileName());
            long started = System.currentTimeMillis();

            StepException error = null;
            if (!step.idempotentSafe()) {
                artifacts.register(destination);
                try {
                    FileTrees.deleteRecursively(destination);
                } catch (IOException e) {
                    return RunResult.failure(timestamp, number, step.name(),
                            new TransientStepException("cannot clear stale " + destination + ": " + e.getMessage(), e));
                }
            }

            try {
                step.execute(context, source, destination);
            } catch (StepException e) {
                error = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = new TransientStepException("interrupted during " + step.name(), e);
            } catch (UncheckedIOException e) {
                error = new TransientStepException(e.getMessage(), e);
            } catch (RuntimeException e) {
                error = new PermanentStepException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            }

            if (error != null && step.idempotentSafe() && !Thread.currentThread().isInterrupted()
                    && step.isComplete(context, destination)) {
                log.info("Step {} failed ({}) but its output is already complete, continuing",
                        step.name(), error.getMessage());
                error = null;
            }
            if (error == null && !Files.exists(destination)) {
                error = new PermanentStepException(step.name() + " produced no output at " + destination);
            }
            if (error != null) {
                log.debug("Step {} failed after {}ms", step.name(), System.currentTimeMillis() - started);
                return RunResult.failure(timestamp, number, step.name(), error);
            }

            artifacts.register(destination);
            log.debug("Step {} finished in {}ms", step.name(), System.currentTimeMillis() - started);
            source = destination;
        }

        artifacts.keep(source);
        return RunResult.success(timestamp, source);
    }

    /**
     * Delete whatever a slot left in its work dir, such as the acquire step's tile cache that
     * lets a retry resume. Called once the slot will not be retried. No-op with keep-files.
     */
    public void discard(ImageTimestamp timestamp) {
        if (keepFiles) {
            return;
        }
        Path workDir = workRoot.resolve(timestamp.id());
        try {
            if (FileTrees.deleteRecursively(workDir)) {
                log.info("Removed leftover work files for {}", timestamp);
            }
        } catch (IOException e) {
            log.warn("Could not remove work dir {}: {}", workDir, e.getMessage());
        }
    }

    private void removeIfEmpty(Path workDir) {
        if (keepFiles) {
            return;
        }
        try (var entries = Files.list(workDir)) {
            if (entries.findAny().isEmpty()) {
                Files.delete(workDir);
            }
        } catch (IOException e) {
            log.debug("Work dir {} left in place: {}", workDir, e.getMessage());
        }
    }
}
