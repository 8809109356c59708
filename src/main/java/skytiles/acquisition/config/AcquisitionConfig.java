package skytiles.acquisition.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Configuration holder for the acquisition daemon.
 * All settings have sensible defaults; environment variables and CLI flags override them.
 */
public final class AcquisitionConfig {

    private static final Pattern ZOOM_RANGE = Pattern.compile("(\\d{1,2})-(\\d{1,2})");

    public static final String DEFAULT_SOURCE_URL_TEMPLATE =
            "http://rsapp.nsmc.org.cn/swapQuery/public/tileServer/getTile/fy-4b/full_disk/NatureColor_NoLit/{timestamp}/jpg/{z}/{x}/{y}.png";

    // Paths
    private Path dataDir = Path.of("data");
    private Path stateDir = Path.of("state");

    // Database settings
    private String databaseUrl = null; // derived from stateDir when unset
    private int databasePoolSize = 4;

    // Cadence
    private Duration cadence = Duration.ofMinutes(15);
    private Duration publicationDelay = Duration.ofMinutes(15);
    private Duration tickInterval = Duration.ofMinutes(15);
    private Duration backfillWindow = Duration.ofHours(2);

    // Dispatch
    private int concurrency = 2;
    private int maxAttempts = 8;
    private Duration backoffBase = Duration.ofMinutes(2);
    private int backoffCapExponent = 5;
    private Duration livenessTimeout = Duration.ofMinutes(45);
    private Duration runTimeout = null; // defaults to livenessTimeout
    private Duration shutdownGrace = Duration.ofSeconds(30);

    // Acquire
    private String sourceUrlTemplate = DEFAULT_SOURCE_URL_TEMPLATE;
    private int sourceZoom = 4;
    private int gridWidth = 16;
    private int gridHeight = 16;
    private int downloadConcurrency = 10;
    private int maxBlankTiles = 8;
    private int minTileBytes = 1024;

    // Adjust
    private int cropX = -135;
    private int cropY = -162;
    private int threshold = 10;

    // Georeference
    private double north = 55.0;
    private double south = -55.0;
    private double west = 60.0;
    private double east = 150.0;

    // Overlay (optional)
    private String overlayCommand = null;
    private Path overlayAsset = null;

    // Tile
    private String zoomRange = "1-6";

    // External tools
    private String gdalTranslate = "gdal_translate";
    private String gdalwarp = "gdalwarp";
    private String gdal2tiles = "gdal2tiles.py";
    private Duration commandTimeout = Duration.ofMinutes(30);

    private boolean keepFiles = false;

    // Status endpoint (0 = disabled)
    private int statusPort = 0;
    private String statusHost = "0.0.0.0";

    private AcquisitionConfig() {
    }

    public static AcquisitionConfig defaults() {
        return new AcquisitionConfig();
    }

    public static AcquisitionConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Apply overrides from an environment lookup.
     *
     * @param env variable name to value (null when unset)
     */
    public static AcquisitionConfig fromEnv(Function<String, String> env) {
        AcquisitionConfig config = new AcquisitionConfig();

        String dataDir = env.apply("SKYTILES_DATA_DIR");
        if (notBlank(dataDir)) {
            config.dataDir = Path.of(dataDir);
        }

        String stateDir = env.apply("SKYTILES_STATE_DIR");
        if (notBlank(stateDir)) {
            config.stateDir = Path.of(stateDir);
        }

        String dbUrl = env.apply("SKYTILES_DB_URL");
        if (notBlank(dbUrl)) {
            config.databaseUrl = dbUrl;
        }

        String cadence = env.apply("SKYTILES_CADENCE");
        if (notBlank(cadence)) {
            config.cadence = parseDuration("SKYTILES_CADENCE", cadence);
        }

        String maxAttempts = env.apply("SKYTILES_MAX_ATTEMPTS");
        if (notBlank(maxAttempts)) {
            config.maxAttempts = parseInt("SKYTILES_MAX_ATTEMPTS", maxAttempts);
        }

        String statusPort = env.apply("SKYTILES_STATUS_PORT");
        if (notBlank(statusPort)) {
            config.statusPort = parseInt("SKYTILES_STATUS_PORT", statusPort);
        }

        // Names kept from the original deployment's .env file
        String downloadConcurrency = env.apply("DOWNLOAD_CONCURRENCY");
        if (notBlank(downloadConcurrency)) {
            config.downloadConcurrency = parseInt("DOWNLOAD_CONCURRENCY", downloadConcurrency);
        }

        String cropX = env.apply("ADJUST_CROP_X");
        if (notBlank(cropX)) {
            config.cropX = parseInt("ADJUST_CROP_X", cropX);
        }

        String cropY = env.apply("ADJUST_CROP_Y");
        if (notBlank(cropY)) {
            config.cropY = parseInt("ADJUST_CROP_Y", cropY);
        }

        String threshold = env.apply("ADJUST_THRESHOLD");
        if (notBlank(threshold)) {
            config.threshold = parseInt("ADJUST_THRESHOLD", threshold);
        }

        return config;
    }

    /**
     * Check value ranges. Does not touch the filesystem.
     *
     * @return this config
     * @throws ConfigurationException on the first invalid setting
     */
    public AcquisitionConfig validate() {
        requirePositive("cadence", cadence);
        requirePositive("tick-interval", tickInterval);
        requirePositive("backoff-base", backoffBase);
        requirePositive("liveness-timeout", livenessTimeout);
        requirePositive("run-timeout", runTimeout());
        requirePositive("command-timeout", commandTimeout);
        if (publicationDelay.isNegative()) {
            throw new ConfigurationException("publication-delay must not be negative");
        }
        if (backfillWindow.isNegative()) {
            throw new ConfigurationException("backfill-window must not be negative");
        }
        if (cadence.getNano() != 0) {
            throw new ConfigurationException("cadence must be a whole number of seconds: " + cadence);
        }
        if (concurrency < 1) {
            throw new ConfigurationException("concurrency must be at least 1, got " + concurrency);
        }
        if (downloadConcurrency < 1) {
            throw new ConfigurationException("download-concurrency must be at least 1, got " + downloadConcurrency);
        }
        if (maxAttempts < 1) {
            throw new ConfigurationException("max-attempts must be at least 1, got " + maxAttempts);
        }
        if (backoffCapExponent < 0 || backoffCapExponent > 20) {
            throw new ConfigurationException("backoff-cap-exponent must be within 0..20, got " + backoffCapExponent);
        }
        if (gridWidth < 1 || gridHeight < 1) {
            throw new ConfigurationException("tile grid must be at least 1x1");
        }
        if (north <= south || north > 90 || south < -90) {
            throw new ConfigurationException("invalid latitude bounds: north=" + north + " south=" + south);
        }
        if (east <= west || east > 180 || west < -180) {
            throw new ConfigurationException("invalid longitude bounds: west=" + west + " east=" + east);
        }
        int[] zoom = parseZoomRange(zoomRange);
        if (zoom[0] > zoom[1]) {
            throw new ConfigurationException("zoom-range min exceeds max: " + zoomRange);
        }
        if (statusPort < 0 || statusPort > 65535) {
            throw new ConfigurationException("status-port out of range: " + statusPort);
        }
        if (overlayAsset != null && overlayCommand == null) {
            throw new ConfigurationException("overlay-asset given without overlay-command");
        }
        Path data = dataDir.toAbsolutePath().normalize();
        Path state = stateDir.toAbsolutePath().normalize();
        if (state.startsWith(data)) {
            throw new ConfigurationException("state-dir must live outside data-dir: " + stateDir);
        }
        return this;
    }

    /**
     * Parse a {@code min-max} zoom range.
     *
     * @throws ConfigurationException if malformed
     */
    public static int[] parseZoomRange(String range) {
        Matcher m = range == null ? null : ZOOM_RANGE.matcher(range.trim());
        if (m == null || !m.matches()) {
            throw new ConfigurationException("zoom-range must look like 'min-max', got: " + range);
        }
        return new int[] { Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)) };
    }

    // Getters
    public Path dataDir() {
        return dataDir;
    }

    public Path stateDir() {
        return stateDir;
    }

    public String databaseUrl() {
        if (databaseUrl != null) {
            return databaseUrl;
        }
        return "jdbc:h2:file:" + stateDir.toAbsolutePath().normalize().resolve("skytiles")
                + ";DATABASE_TO_UPPER=FALSE";
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration cadence() {
        return cadence;
    }

    public Duration publicationDelay() {
        return publicationDelay;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public Duration backfillWindow() {
        return backfillWindow;
    }

    public int concurrency() {
        return concurrency;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration backoffBase() {
        return backoffBase;
    }

    public int backoffCapExponent() {
        return backoffCapExponent;
    }

    public Duration livenessTimeout() {
        return livenessTimeout;
    }

    public Duration runTimeout() {
        return runTimeout != null ? runTimeout : livenessTimeout;
    }

    public Duration shutdownGrace() {
        return shutdownGrace;
    }

    public String sourceUrlTemplate() {
        return sourceUrlTemplate;
    }

    public int sourceZoom() {
        return sourceZoom;
    }

    public int gridWidth() {
        return gridWidth;
    }

    public int gridHeight() {
        return gridHeight;
    }

    public int downloadConcurrency() {
        return downloadConcurrency;
    }

    public int maxBlankTiles() {
        return maxBlankTiles;
    }

    public int minTileBytes() {
        return minTileBytes;
    }

    public int cropX() {
        return cropX;
    }

    public int cropY() {
        return cropY;
    }

    public int threshold() {
        return threshold;
    }

    public double north() {
        return north;
    }

    public double south() {
        return south;
    }

    public double west() {
        return west;
    }

    public double east() {
        return east;
    }

    public String overlayCommand() {
        return overlayCommand;
    }

    public Path overlayAsset() {
        return overlayAsset;
    }

    public boolean overlayEnabled() {
        return overlayCommand != null && !overlayCommand.isBlank();
    }

    public String zoomRange() {
        return zoomRange;
    }

    public String gdalTranslate() {
        return gdalTranslate;
    }

    public String gdalwarp() {
        return gdalwarp;
    }

    public String gdal2tiles() {
        return gdal2tiles;
    }

    public Duration commandTimeout() {
        return commandTimeout;
    }

    public boolean keepFiles() {
        return keepFiles;
    }

    public int statusPort() {
        return statusPort;
    }

    public String statusHost() {
        return statusHost;
    }

    /** Intermediate artifacts for one timestamp live below this directory */
    public Path workDir() {
        return dataDir.resolve("work");
    }

    /** Published tiles and the timestamp index live below this directory */
    public Path tilesDir() {
        return dataDir.resolve("tiles");
    }

    // Fluent setters for CLI, tests and customization
    public AcquisitionConfig withDataDir(Path dir) {
        this.dataDir = dir;
        return this;
    }

    public AcquisitionConfig withStateDir(Path dir) {
        this.stateDir = dir;
        return this;
    }

    public AcquisitionConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public AcquisitionConfig withCadence(Duration cadence) {
        this.cadence = cadence;
        return this;
    }

    public AcquisitionConfig withPublicationDelay(Duration delay) {
        this.publicationDelay = delay;
        return this;
    }

    public AcquisitionConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    public AcquisitionConfig withBackfillWindow(Duration window) {
        this.backfillWindow = window;
        return this;
    }

    public AcquisitionConfig withConcurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    public AcquisitionConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public AcquisitionConfig withBackoffBase(Duration base) {
        this.backoffBase = base;
        return this;
    }

    public AcquisitionConfig withBackoffCapExponent(int exponent) {
        this.backoffCapExponent = exponent;
        return this;
    }

    public AcquisitionConfig withLivenessTimeout(Duration timeout) {
        this.livenessTimeout = timeout;
        return this;
    }

    public AcquisitionConfig withRunTimeout(Duration timeout) {
        this.runTimeout = timeout;
        return this;
    }

    public AcquisitionConfig withShutdownGrace(Duration grace) {
        this.shutdownGrace = grace;
        return this;
    }

    public AcquisitionConfig withSourceUrlTemplate(String template) {
        this.sourceUrlTemplate = template;
        return this;
    }

    public AcquisitionConfig withGrid(int width, int height) {
        this.gridWidth = width;
        this.gridHeight = height;
        return this;
    }

    public AcquisitionConfig withDownloadConcurrency(int concurrency) {
        this.downloadConcurrency = concurrency;
        return this;
    }

    public AcquisitionConfig withMaxBlankTiles(int maxBlankTiles) {
        this.maxBlankTiles = maxBlankTiles;
        return this;
    }

    public AcquisitionConfig withMinTileBytes(int minTileBytes) {
        this.minTileBytes = minTileBytes;
        return this;
    }

    public AcquisitionConfig withCrop(int cropX, int cropY) {
        this.cropX = cropX;
        this.cropY = cropY;
        return this;
    }

    public AcquisitionConfig withThreshold(int threshold) {
        this.threshold = threshold;
        return this;
    }

    public AcquisitionConfig withBoundingBox(double north, double south, double west, double east) {
        this.north = north;
        this.south = south;
        this.west = west;
        this.east = east;
        return this;
    }

    public AcquisitionConfig withOverlay(String command, Path asset) {
        this.overlayCommand = command;
        this.overlayAsset = asset;
        return this;
    }

    public AcquisitionConfig withZoomRange(String range) {
        this.zoomRange = range;
        return this;
    }

    public AcquisitionConfig withGdalTools(String translate, String warp, String tiles) {
        this.gdalTranslate = translate;
        this.gdalwarp = warp;
        this.gdal2tiles = tiles;
        return this;
    }

    public AcquisitionConfig withCommandTimeout(Duration timeout) {
        this.commandTimeout = timeout;
        return this;
    }

    public AcquisitionConfig withKeepFiles(boolean keep) {
        this.keepFiles = keep;
        return this;
    }

    public AcquisitionConfig withStatusPort(int port) {
        this.statusPort = port;
        return this;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got: " + value, e);
        }
    }

    /** Accepts ISO-8601 ({@code PT15M}) or a plain number of minutes. */
    public static Duration parseDuration(String name, String value) {
        String v = value.trim();
        try {
            if (v.chars().allMatch(Character::isDigit)) {
                return Duration.ofMinutes(Long.parseLong(v));
            }
            return Duration.parse(v);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new ConfigurationException(name + " must be a duration such as PT15M, got: " + value, e);
        }
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new ConfigurationException(name + " must be positive, got " + d);
        }
    }

    @Override
    public String toString() {
        return "AcquisitionConfig{" +
                "dataDir=" + dataDir +
                ", stateDir=" + stateDir +
                ", cadence=" + cadence +
                ", concurrency=" + concurrency +
                ", maxAttempts=" + maxAttempts +
                ", livenessTimeout=" + livenessTimeout +
                ", keepFiles=" + keepFiles +
                ", overlay=" + overlayEnabled() +
                ", statusPort=" + statusPort +
                '}';
    }
}
