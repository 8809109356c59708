package skytiles.acquisition.pipeline;

import skytiles.acquisition.model.ImageTimestamp;

import java.nio.file.Path;

/**
 * Per-run parameters shared by every step of one pipeline run.
 *
 * @param timestamp the slot being processed
 * @param workDir   directory for this slot's intermediate artifacts
 * @param keepFiles keep intermediates instead of deleting them
 */
public record StepContext(ImageTimestamp timestamp, Path workDir, boolean keepFiles) {

    /** Work-dir artifact named after the source frame, e.g. {@code fy4b_full_disk_<id>_adjusted.png}. */
    public Path artifact(String suffix) {
        return workDir.resolve("fy4b_full_disk_" + timestamp.id() + suffix);
    }
}
