package skytiles.acquisition.pipeline.steps;

import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.pipeline.*;
import skytiles.acquisition.util.MdcPropagation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads the full-disk tile grid for a timestamp and stitches it into one PNG.
 * <p>
 * Tiles already on disk and larger than the minimum size are reused, so a retried run only
 * fetches what is missing. Each tile is tried three times; a tile that never arrives is
 * replaced by a black tile. Too many black tiles fail the step (transiently), since the
 * source has usually just not finished publishing.
 */
public class AcquireStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(AcquireStep.class);

    static final int TILE_ATTEMPTS = 3;
    static final int BLANK_TILE_SIZE = 256;
    static final String TILE_DIR = "source-tiles";

    private final HttpClient http;
    private final String urlTemplate;
    private final int zoom;
    private final int gridWidth;
    private final int gridHeight;
    private final int downloadConcurrency;
    private final int minTileBytes;
    private final int maxBlankTiles;
    private final Duration retryPause;
    private final Duration requestTimeout;

    public AcquireStep(AcquisitionConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), Duration.ofSeconds(1));
    }

    public AcquireStep(AcquisitionConfig config, HttpClient http, Duration retryPause) {
        this.http = http;
        this.urlTemplate = config.sourceUrlTemplate();
        this.zoom = config.sourceZoom();
        this.gridWidth = config.gridWidth();
        this.gridHeight = config.gridHeight();
        this.downloadConcurrency = config.downloadConcurrency();
        this.minTileBytes = config.minTileBytes();
        this.maxBlankTiles = config.maxBlankTiles();
        this.retryPause = retryPause;
        this.requestTimeout = Duration.ofSeconds(30);
    }

    @Override
    public String name() {
        return "acquire";
    }

    @Override
    public Path destination(StepContext context) {
        return context.artifact(".png");
    }

    @Override
    public void execute(StepContext context, Path source, Path destination)
            throws StepException, InterruptedException {
        Path tileDir = context.workDir().resolve(TILE_DIR);
        try {
            Files.createDirectories(tileDir);
        } catch (IOException e) {
            throw new TransientStepException("cannot create tile cache " + tileDir + ": " + e.getMessage(), e);
        }

        int blank = downloadAll(context.timestamp(), tileDir);
        int total = gridWidth * gridHeight;
        if (blank == total) {
            throw new TransientStepException("no tiles available for " + context.timestamp());
        }
        if (blank > maxBlankTiles) {
            throw new TransientStepException(blank + " of " + total + " tiles missing for " + context.timestamp());
        }
        if (blank > 0) {
            log.warn("{} of {} tiles missing, filled with black", blank, total);
        }

        try {
            stitch(tileDir, destination);
        } catch (IOException e) {
            throw new TransientStepException("stitching failed: " + e.getMessage(), e);
        }

        if (!context.keepFiles()) {
            try {
                FileTrees.deleteRecursively(tileDir);
            } catch (IOException e) {
                log.warn("Could not delete tile cache {}: {}", tileDir, e.getMessage());
            }
        }
    }

    /**
     * @return number of tiles that had to be blanked
     */
    private int downloadAll(ImageTimestamp timestamp, Path tileDir) throws InterruptedException {
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(downloadConcurrency, r -> {
            Thread t = new Thread(r, "skytiles-download-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int x = 0; x < gridWidth; x++) {
                for (int y = 0; y < gridHeight; y++) {
                    int tx = x;
                    int ty = y;
                    futures.add(pool.submit(MdcPropagation.wrapCallable(
                            () -> fetchTile(timestamp, tx, ty, tileDir))));
                }
            }

            int blank = 0;
            for (Future<Boolean> future : futures) {
                try {
                    if (!future.get()) {
                        blank++;
                    }
                } catch (ExecutionException e) {
                    log.warn("Tile download crashed: {}", e.getCause().toString());
                    blank++;
                }
            }
            return blank;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * @return true if a real tile is on disk, false if a blank one was written
     */
    boolean fetchTile(ImageTimestamp timestamp, int x, int y, Path tileDir) throws InterruptedException, IOException {
        Path tile = tileDir.resolve("tile_" + x + "_" + y + ".png");
        if (Files.exists(tile) && Files.size(tile) > minTileBytes) {
            return true;
        }

        URI uri = URI.create(tileUrl(timestamp, x, y));
        for (int attempt = 1; attempt <= TILE_ATTEMPTS; attempt++) {
            try {
                HttpResponse<byte[]> response = http.send(HttpRequest.newBuilder(uri)
                                .timeout(requestTimeout)
                                .header("User-Agent", "skytiles/1.0")
                                .GET()
                                .build(),
                        HttpResponse.BodyHandlers.ofByteArray());

                String contentType = response.headers().firstValue("Content-Type").orElse("");
                byte[] body = response.body();
                if (response.statusCode() == 200 && contentType.contains("image") && body.length > minTileBytes) {
                    Path tmp = tileDir.resolve(tile.getFileName() + ".part");
                    Files.write(tmp, body);
                    FileTrees.move(tmp, tile);
                    return true;
                }
                log.debug("Tile {}/{} attempt {}: status {}, type '{}', {} bytes",
                        x, y, attempt, response.statusCode(), contentType, body.length);
            } catch (IOException e) {
                log.debug("Tile {}/{} attempt {} failed: {}", x, y, attempt, e.getMessage());
            }
            if (attempt < TILE_ATTEMPTS) {
                Thread.sleep(retryPause.toMillis());
            }
        }

        log.debug("Tile {}/{} unavailable, writing blank", x, y);
        BufferedImage black = new BufferedImage(BLANK_TILE_SIZE, BLANK_TILE_SIZE, BufferedImage.TYPE_INT_RGB);
        ImageIO.write(black, "png", tile.toFile());
        return false;
    }

    String tileUrl(ImageTimestamp timestamp, int x, int y) {
        return urlTemplate
                .replace("{timestamp}", timestamp.id())
                .replace("{z}", Integer.toString(zoom))
                .replace("{x}", Integer.toString(x))
                .replace("{y}", Integer.toString(y));
    }

    /**
     * Tile (x, y) lands at pixel (y * tileWidth, x * tileHeight): x indexes rows in the source grid.
     */
    private void stitch(Path tileDir, Path destination) throws IOException, StepException {
        BufferedImage[][] tiles = new BufferedImage[gridWidth][gridHeight];
        int tileWidth = 0;
        int tileHeight = 0;
        for (int x = 0; x < gridWidth; x++) {
            for (int y = 0; y < gridHeight; y++) {
                Path file = tileDir.resolve("tile_" + x + "_" + y + ".png");
                BufferedImage image = Files.exists(file) ? ImageIO.read(file.toFile()) : null;
                if (image == null) {
                    log.warn("Tile {}/{} unreadable, leaving black", x, y);
                    continue;
                }
                tiles[x][y] = image;
                tileWidth = Math.max(tileWidth, image.getWidth());
                tileHeight = Math.max(tileHeight, image.getHeight());
            }
        }
        if (tileWidth == 0) {
            throw new TransientStepException("no readable tiles in " + tileDir);
        }

        BufferedImage full = new BufferedImage(tileWidth * gridHeight, tileHeight * gridWidth,
                BufferedImage.TYPE_INT_RGB);
        var graphics = full.createGraphics();
        try {
            for (int x = 0; x < gridWidth; x++) {
                for (int y = 0; y < gridHeight; y++) {
                    if (tiles[x][y] != null) {
                        graphics.drawImage(tiles[x][y], y * tileWidth, x * tileHeight, null);
                    }
                }
            }
        } finally {
            graphics.dispose();
        }

        if (!ImageIO.write(full, "png", destination.toFile())) {
            throw new IOException("no PNG writer available");
        }
        log.info("Stitched {}x{} image from {}x{} grid", full.getWidth(), full.getHeight(), gridWidth, gridHeight);
    }
}
