package skytiles.acquisition.retention;

import skytiles.acquisition.pipeline.FileTrees;
import skytiles.acquisition.pipeline.TimestampIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Thins a published tile tree down to one frame per day: the one at local noon.
 * <p>
 * Frames whose epoch second is not exactly 12:00:00 in the given UTC offset lose their
 * {@code <epochSecond>/} folder and their index entry. Without {@code execute} nothing is
 * changed and the report only says what would be removed.
 */
public class NoonRetentionCleaner {

    private static final Logger log = LoggerFactory.getLogger(NoonRetentionCleaner.class);
    private static final LocalTime NOON = LocalTime.NOON;

    private final Path tilesDir;
    private final ZoneOffset offset;
    private final TimestampIndex index;

    public NoonRetentionCleaner(Path tilesDir, int utcOffsetHours) {
        this.tilesDir = tilesDir;
        this.offset = ZoneOffset.ofHours(utcOffsetHours);
        this.index = new TimestampIndex(tilesDir);
    }

    /**
     * @param execute delete folders and rewrite the index; otherwise a dry run
     * @throws IOException if the index is missing or malformed
     */
    public CleanupReport clean(boolean execute) throws IOException {
        if (!Files.exists(index.file())) {
            throw new NoSuchFileException(index.file().toString(), null, "no timestamp index");
        }
        List<Long> all = index.read();

        List<Long> keep = new ArrayList<>();
        List<Long> remove = new ArrayList<>();
        for (Long ts : all) {
            if (isNoon(ts)) {
                keep.add(ts);
            } else {
                remove.add(ts);
            }
        }
        log.info("{}: keeping {} noon frames (UTC{}), removing {}{}",
                tilesDir, keep.size(), offset, remove.size(), execute ? "" : " (dry run)");

        int deleted = 0;
        int missing = 0;
        List<Long> failed = new ArrayList<>();
        for (Long ts : remove) {
            Path folder = tilesDir.resolve(Long.toString(ts));
            if (!Files.isDirectory(folder)) {
                missing++;
                log.debug("Folder {} already gone", folder);
                continue;
            }
            if (!execute) {
                log.info("Would delete {}", folder);
                continue;
            }
            try {
                FileTrees.deleteRecursively(folder);
                deleted++;
                log.info("Deleted {}", folder);
            } catch (IOException e) {
                failed.add(ts);
                log.error("Could not delete {}: {}", folder, e.getMessage());
            }
        }

        if (execute && !remove.isEmpty()) {
            // frames whose folder survived stay listed so viewers don't lose them
            List<Long> listed = new ArrayList<>(keep);
            listed.addAll(failed);
            index.replace(listed);
            log.info("Index rewritten with {} timestamps", listed.size());
        }

        return new CleanupReport(keep.size(), remove.size(), deleted, missing, failed.size(), execute);
    }

    boolean isNoon(long epochSecond) {
        LocalTime local = Instant.ofEpochSecond(epochSecond).atOffset(offset).toLocalTime();
        return local.equals(NOON);
    }

    /**
     * @param kept          frames at local noon
     * @param toRemove      frames outside noon
     * @param deleted       folders actually deleted
     * @param missing       folders that were already absent
     * @param failed        folders that could not be deleted
     * @param executed      false for a dry run
     */
    public record CleanupReport(int kept, int toRemove, int deleted, int missing, int failed, boolean executed) {
    }
}
