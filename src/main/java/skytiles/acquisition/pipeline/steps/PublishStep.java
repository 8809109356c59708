package skytiles.acquisition.pipeline.steps;

import skytiles.acquisition.pipeline.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Moves the staged tile pyramid to {@code tiles/<epochSecond>/} and lists it in the index.
 * Safe to repeat: a folder that is already published and indexed counts as done.
 */
public class PublishStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(PublishStep.class);

    private final Path tilesDir;
    private final TimestampIndex index;

    public PublishStep(Path tilesDir, TimestampIndex index) {
        this.tilesDir = tilesDir;
        this.index = index;
    }

    @Override
    public String name() {
        return "publish";
    }

    @Override
    public Path destination(StepContext context) {
        return tilesDir.resolve(Long.toString(context.timestamp().epochSecond()));
    }

    @Override
    public boolean idempotentSafe() {
        return true;
    }

    /**
     * Published means the folder is in place and the index lists it.
     */
    @Override
    public boolean isComplete(StepContext context, Path destination) {
        if (!Files.isDirectory(destination)) {
            return false;
        }
        try {
            return index.read().contains(context.timestamp().epochSecond());
        } catch (IOException e) {
            log.warn("Cannot read index to confirm {}: {}", destination.getFileName(), e.getMessage());
            return false;
        }
    }

    @Override
    public void execute(StepContext context, Path source, Path destination) throws StepException {
        try {
            Files.createDirectories(tilesDir);
            if (source != null && Files.isDirectory(source)) {
                if (FileTrees.deleteRecursively(destination)) {
                    log.info("Replacing previously published {}", destination.getFileName());
                }
                FileTrees.move(source, destination);
            } else if (!Files.isDirectory(destination)) {
                throw new PermanentStepException("nothing to publish: " + source);
            }
            if (index.add(context.timestamp().epochSecond())) {
                log.info("Published {} as {}", context.timestamp(), destination);
            }
        } catch (IOException e) {
            throw new TransientStepException("publish failed: " + e.getMessage(), e);
        }
    }
}
