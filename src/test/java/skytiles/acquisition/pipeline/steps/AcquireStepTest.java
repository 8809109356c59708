package skytiles.acquisition.pipeline.steps;

import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.pipeline.StepContext;
import skytiles.acquisition.pipeline.StepException;
import skytiles.acquisition.pipeline.TransientStepException;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class AcquireStepTest {

    private static final ImageTimestamp TS = ImageTimestamp.parse("20250301101500");
    private static final int TILE = AcquireStep.BLANK_TILE_SIZE;

    @TempDir
    Path workDir;

    private MockWebServer server;
    private final Set<String> missing = ConcurrentHashMap.newKeySet();
    private final Set<String> tiny = ConcurrentHashMap.newKeySet();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                // /<timestamp>/<z>/<x>/<y>.png
                String[] parts = request.getPath().substring(1).replace(".png", "").split("/");
                if (!TS.id().equals(parts[0]) || !"4".equals(parts[1])) {
                    return new MockResponse().setResponseCode(404);
                }
                int x = Integer.parseInt(parts[2]);
                int y = Integer.parseInt(parts[3]);
                String key = x + "/" + y;
                if (missing.contains(key)) {
                    return new MockResponse().setResponseCode(404);
                }
                byte[] body = tiny.contains(key) ? new byte[16] : tilePng(x, y);
                return new MockResponse()
                        .setResponseCode(200)
                        .addHeader("Content-Type", "image/png")
                        .setBody(new Buffer().write(body));
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private AcquisitionConfig config() {
        return AcquisitionConfig.defaults()
                .withSourceUrlTemplate(server.url("/").toString() + "{timestamp}/{z}/{x}/{y}.png")
                .withGrid(2, 2)
                .withDownloadConcurrency(2)
                .withMaxBlankTiles(1);
    }

    private AcquireStep step(AcquisitionConfig config) {
        return new AcquireStep(config, HttpClient.newHttpClient(), Duration.ZERO);
    }

    /** Noisy tile (so the PNG stays above the minimum size) with its corner pixel encoding x and y */
    private static byte[] tilePng(int x, int y) {
        BufferedImage image = new BufferedImage(TILE, TILE, BufferedImage.TYPE_INT_RGB);
        Random random = new Random(31L * x + y);
        for (int py = 0; py < TILE; py++) {
            for (int px = 0; px < TILE; px++) {
                image.setRGB(px, py, random.nextInt(0xffffff));
            }
        }
        image.setRGB(0, 0, cornerColor(x, y));
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static int cornerColor(int x, int y) {
        return (40 + 100 * x) << 16 | (40 + 100 * y) << 8 | 200;
    }

    @Test
    void stitchesGridWithXIndexingRows() throws Exception {
        StepContext context = new StepContext(TS, workDir, false);
        Path out = context.artifact(".png");

        step(config()).execute(context, null, out);

        BufferedImage image = ImageIO.read(out.toFile());
        assertEquals(2 * TILE, image.getWidth());
        assertEquals(2 * TILE, image.getHeight());
        for (int x = 0; x < 2; x++) {
            for (int y = 0; y < 2; y++) {
                assertEquals(cornerColor(x, y), image.getRGB(y * TILE, x * TILE) & 0xffffff, "tile " + x + "/" + y);
            }
        }
        assertFalse(Files.exists(workDir.resolve(AcquireStep.TILE_DIR)), "tile cache removed");
        assertEquals(4, server.getRequestCount());
    }

    @Test
    void missingTileWithinLimitIsBlackened() throws Exception {
        missing.add("1/0");
        StepContext context = new StepContext(TS, workDir, false);
        Path out = context.artifact(".png");

        step(config()).execute(context, null, out);

        BufferedImage image = ImageIO.read(out.toFile());
        assertEquals(0, image.getRGB(0, TILE) & 0xffffff);
        assertEquals(0, image.getRGB(TILE - 1, 2 * TILE - 1) & 0xffffff);
        assertEquals(cornerColor(1, 1), image.getRGB(TILE, TILE) & 0xffffff);
        // three tries for the missing tile, one for each of the others
        assertEquals(3 + AcquireStep.TILE_ATTEMPTS, server.getRequestCount());
    }

    @Test
    void tooManyMissingTilesIsTransient() {
        missing.add("0/0");
        missing.add("1/1");
        StepContext context = new StepContext(TS, workDir, false);

        StepException e = assertThrows(StepException.class,
                () -> step(config()).execute(context, null, context.artifact(".png")));

        assertTrue(e.isTransient());
        assertEquals("2 of 4 tiles missing for " + TS, e.getMessage());
    }

    @Test
    void unpublishedTimestampIsTransient() {
        ImageTimestamp future = ImageTimestamp.parse("20250301103000");
        StepContext context = new StepContext(future, workDir, false);

        TransientStepException e = assertThrows(TransientStepException.class,
                () -> step(config()).execute(context, null, context.artifact(".png")));

        assertEquals("no tiles available for " + future, e.getMessage());
    }

    @Test
    void undersizedTileCountsAsMissing() throws Exception {
        tiny.add("0/1");
        Path tileDir = Files.createDirectories(workDir.resolve(AcquireStep.TILE_DIR));

        boolean real = step(config()).fetchTile(TS, 0, 1, tileDir);

        assertFalse(real);
        assertEquals(AcquireStep.TILE_ATTEMPTS, server.getRequestCount());
        BufferedImage blank = ImageIO.read(tileDir.resolve("tile_0_1.png").toFile());
        assertEquals(AcquireStep.BLANK_TILE_SIZE, blank.getWidth());
    }

    @Test
    void cachedTilesAreNotFetchedAgain() throws Exception {
        Path tileDir = Files.createDirectories(workDir.resolve(AcquireStep.TILE_DIR));
        Files.write(tileDir.resolve("tile_0_0.png"), tilePng(0, 0));
        Files.write(tileDir.resolve("tile_1_1.png"), tilePng(1, 1));
        StepContext context = new StepContext(TS, workDir, true);

        step(config()).execute(context, null, context.artifact(".png"));

        assertEquals(2, server.getRequestCount());
        assertTrue(Files.exists(tileDir.resolve("tile_0_1.png")), "keep-files leaves the tile cache");
    }

    @Test
    void tileUrlSubstitutesPlaceholders() {
        AcquireStep step = new AcquireStep(AcquisitionConfig.defaults());

        assertEquals("http://rsapp.nsmc.org.cn/swapQuery/public/tileServer/getTile/fy-4b/full_disk/"
                        + "NatureColor_NoLit/20250301101500/jpg/4/3/12.png",
                step.tileUrl(TS, 3, 12));
    }
}
