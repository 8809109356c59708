package skytiles.acquisition.retention;

import skytiles.acquisition.pipeline.TimestampIndex;
import skytiles.acquisition.retention.NoonRetentionCleaner.CleanupReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoonRetentionCleanerTest {

    // 2025-03-01 04:00 UTC, noon at UTC+8
    private static final long NOON_MAR_1 = 1740801600L;
    // 2025-02-28 04:00 UTC
    private static final long NOON_FEB_28 = 1740715200L;
    private static final long QUARTER_PAST = NOON_MAR_1 + 900;
    private static final long EVENING = NOON_MAR_1 + 6 * 3600;

    @TempDir
    Path tilesDir;

    private TimestampIndex index;

    @BeforeEach
    void setUp() throws Exception {
        index = new TimestampIndex(tilesDir);
        index.replace(List.of(NOON_FEB_28, NOON_MAR_1, QUARTER_PAST, EVENING));
        for (long ts : List.of(NOON_FEB_28, NOON_MAR_1, QUARTER_PAST)) {
            Files.createDirectories(tilesDir.resolve(Long.toString(ts)).resolve("3"));
        }
        // EVENING is listed but its folder is already gone
    }

    @Test
    void dryRunChangesNothing() throws Exception {
        CleanupReport report = new NoonRetentionCleaner(tilesDir, 8).clean(false);

        assertEquals(2, report.kept());
        assertEquals(2, report.toRemove());
        assertEquals(0, report.deleted());
        assertFalse(report.executed());
        assertTrue(Files.exists(tilesDir.resolve(Long.toString(QUARTER_PAST))));
        assertEquals(4, index.read().size());
    }

    @Test
    void executeDeletesNonNoonFramesAndRewritesIndex() throws Exception {
        CleanupReport report = new NoonRetentionCleaner(tilesDir, 8).clean(true);

        assertEquals(1, report.deleted());
        assertEquals(1, report.missing());
        assertEquals(0, report.failed());
        assertFalse(Files.exists(tilesDir.resolve(Long.toString(QUARTER_PAST))));
        assertTrue(Files.exists(tilesDir.resolve(Long.toString(NOON_MAR_1))));
        assertEquals(List.of(NOON_FEB_28, NOON_MAR_1), index.read());
    }

    @Test
    void noonDependsOnOffset() {
        assertTrue(new NoonRetentionCleaner(tilesDir, 8).isNoon(NOON_MAR_1));
        assertFalse(new NoonRetentionCleaner(tilesDir, 0).isNoon(NOON_MAR_1));
        assertTrue(new NoonRetentionCleaner(tilesDir, 0).isNoon(NOON_MAR_1 + 8 * 3600));
        assertFalse(new NoonRetentionCleaner(tilesDir, 8).isNoon(NOON_MAR_1 + 1));
    }

    @Test
    void missingIndexIsAnError() throws Exception {
        Files.delete(index.file());

        assertThrows(NoSuchFileException.class, () -> new NoonRetentionCleaner(tilesDir, 8).clean(false));
    }

    @Test
    void malformedIndexIsAnError() throws Exception {
        Files.writeString(index.file(), "not json");

        assertThrows(IOException.class, () -> new NoonRetentionCleaner(tilesDir, 8).clean(true));
        assertTrue(Files.exists(tilesDir.resolve(Long.toString(QUARTER_PAST))));
    }
}
