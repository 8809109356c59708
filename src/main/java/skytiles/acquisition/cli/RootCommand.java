package skytiles.acquisition.cli;

import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.config.ConfigurationException;
import skytiles.acquisition.config.Dependencies;
import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.model.TaskRecord;
import skytiles.acquisition.repository.StateStoreException;
import skytiles.acquisition.scheduler.DispatchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * {@code skytiles}: run the acquisition daemon, or process one timestamp with {@code --timestamp}.
 */
@Command(
        name = "skytiles",
        mixinStandardHelpOptions = true,
        version = "skytiles 1.0.0",
        description = "Fetches full-disk satellite frames on their publication cadence and publishes web-map tiles.",
        subcommands = {CleanupCommand.class}
)
public class RootCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RootCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"--timestamp", "-t"}, description = "Process this one timestamp (YYYYMMDDHHMMSS, UTC), retrying until it succeeds or is given up, then exit.")
    String timestamp;

    @Option(names = "--force", description = "With --timestamp: re-run even if it already succeeded.")
    boolean force;

    @Option(names = "--data-dir", description = "Work files and published tiles (default: ./data).")
    Path dataDir;

    @Option(names = "--state-dir", description = "State store directory, outside the data dir (default: ./state).")
    Path stateDir;

    @Option(names = "--db-url", description = "JDBC URL of the state store (overrides --state-dir).")
    String databaseUrl;

    @Option(names = "--concurrency", description = "Timestamps processed in parallel (default: 2).")
    Integer concurrency;

    @Option(names = "--download-concurrency", description = "Parallel tile downloads per run (default: 10).")
    Integer downloadConcurrency;

    @Option(names = "--crop-x", description = "Pixels trimmed from each side horizontally; negative pads (default: -135).")
    Integer cropX;

    @Option(names = "--crop-y", description = "Pixels trimmed from each side vertically; negative pads (default: -162).")
    Integer cropY;

    @Option(names = {"--keep-files", "--keep-source"}, description = "Keep intermediate files.")
    boolean keepFiles;

    @Option(names = "--zoom-range", description = "Tile zoom levels, min-max (default: 1-6).")
    String zoomRange;

    @Option(names = "--north", description = "Bounding box north latitude (default: 55).")
    Double north;

    @Option(names = "--south", description = "Bounding box south latitude (default: -55).")
    Double south;

    @Option(names = "--west", description = "Bounding box west longitude (default: 60).")
    Double west;

    @Option(names = "--east", description = "Bounding box east longitude (default: 150).")
    Double east;

    @Option(names = "--cadence", description = "Source publication cadence, PT15M or minutes (default: 15).")
    String cadence;

    @Option(names = "--publication-delay", description = "Wait this long after a slot before fetching it (default: 15).")
    String publicationDelay;

    @Option(names = "--tick-interval", description = "How often the daemon looks for work (default: 15).")
    String tickInterval;

    @Option(names = "--backfill-window", description = "How far back missing slots are filled in (default: PT2H, 0 disables).")
    String backfillWindow;

    @Option(names = "--max-attempts", description = "Give up after this many failed attempts (default: 8).")
    Integer maxAttempts;

    @Option(names = "--backoff-base", description = "First retry delay (default: 2).")
    String backoffBase;

    @Option(names = "--backoff-cap-exponent", description = "Retry delay stops doubling after this many attempts (default: 5).")
    Integer backoffCapExponent;

    @Option(names = "--liveness-timeout", description = "A run silent this long is failed (default: 45).")
    String livenessTimeout;

    @Option(names = "--overlay-command", description = "Annotation command; {input}, {output} and {asset} are substituted.")
    String overlayCommand;

    @Option(names = "--overlay-asset", description = "File the overlay command needs (e.g. boundaries).")
    Path overlayAsset;

    @Option(names = "--status-port", description = "Serve the status API on this port (default: 0, disabled).")
    Integer statusPort;

    private final Function<AcquisitionConfig, Dependencies> dependencyFactory;

    public RootCommand() {
        this(Dependencies::create);
    }

    RootCommand(Function<AcquisitionConfig, Dependencies> dependencyFactory) {
        this.dependencyFactory = dependencyFactory;
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        PrintWriter out = spec.commandLine().getOut();

        AcquisitionConfig config;
        ImageTimestamp target = null;
        try {
            config = buildConfig(AcquisitionConfig.fromEnv()).validate();
            if (timestamp != null) {
                target = ImageTimestamp.parse(timestamp);
            } else if (force) {
                throw new ConfigurationException("--force requires --timestamp");
            }
        } catch (ConfigurationException | IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            return ExitCodes.CONFIGURATION;
        }

        try (Dependencies deps = dependencyFactory.apply(config)) {
            if (target != null) {
                return runOnce(deps, target, out, err);
            }
            return runDaemon(deps);
        } catch (StateStoreException | UncheckedIOException e) {
            log.error("Resource failure", e);
            err.println("Resource failure: " + e.getMessage());
            return ExitCodes.RESOURCE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return ExitCodes.RESOURCE;
        }
    }

    AcquisitionConfig buildConfig(AcquisitionConfig config) {
        if (dataDir != null) config.withDataDir(dataDir);
        if (stateDir != null) config.withStateDir(stateDir);
        if (databaseUrl != null) config.withDatabaseUrl(databaseUrl);
        if (concurrency != null) config.withConcurrency(concurrency);
        if (downloadConcurrency != null) config.withDownloadConcurrency(downloadConcurrency);
        if (cropX != null || cropY != null) {
            config.withCrop(cropX != null ? cropX : config.cropX(), cropY != null ? cropY : config.cropY());
        }
        if (keepFiles) config.withKeepFiles(true);
        if (zoomRange != null) config.withZoomRange(zoomRange);
        if (north != null || south != null || west != null || east != null) {
            config.withBoundingBox(
                    north != null ? north : config.north(),
                    south != null ? south : config.south(),
                    west != null ? west : config.west(),
                    east != null ? east : config.east());
        }
        if (cadence != null) config.withCadence(duration("cadence", cadence));
        if (publicationDelay != null) config.withPublicationDelay(duration("publication-delay", publicationDelay));
        if (tickInterval != null) config.withTickInterval(duration("tick-interval", tickInterval));
        if (backfillWindow != null) config.withBackfillWindow(duration("backfill-window", backfillWindow));
        if (maxAttempts != null) config.withMaxAttempts(maxAttempts);
        if (backoffBase != null) config.withBackoffBase(duration("backoff-base", backoffBase));
        if (backoffCapExponent != null) config.withBackoffCapExponent(backoffCapExponent);
        if (livenessTimeout != null) config.withLivenessTimeout(duration("liveness-timeout", livenessTimeout));
        if (overlayCommand != null || overlayAsset != null) config.withOverlay(overlayCommand, overlayAsset);
        if (statusPort != null) config.withStatusPort(statusPort);
        return config;
    }

    /**
     * Run one timestamp until it succeeds or is given up, waiting out the back-off between
     * failed attempts.
     */
    private int runOnce(Dependencies deps, ImageTimestamp target, PrintWriter out, PrintWriter err)
            throws InterruptedException {
        boolean forceNext = force;
        while (true) {
            DispatchOutcome outcome;
            try {
                outcome = deps.scheduler().trigger(target, forceNext).get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof StateStoreException sse) {
                    throw sse;
                }
                log.error("Run for {} failed unexpectedly", target, cause);
                err.println("Unexpected failure: " + cause);
                return ExitCodes.STEP_FAILURE;
            }
            forceNext = false;

            TaskRecord record = deps.repository().get(target).orElse(null);
            if (outcome == DispatchOutcome.FAILED) {
                int attempts = record != null ? record.attempts() : 1;
                Duration wait = deps.retryQueue().backoff(attempts);
                err.println(target + " failed attempt " + attempts + ": "
                        + (record != null ? record.lastError() : "unknown error") + "; retrying in " + wait);
                Thread.sleep(wait.toMillis());
                continue;
            }

            switch (outcome) {
                case SUCCEEDED -> out.println(target + " succeeded: "
                        + (record != null ? record.artifactPath() : "(no artifact)"));
                case SKIPPED_SUCCEEDED -> out.println(target + " already succeeded; use --force to re-run");
                case SKIPPED_RUNNING -> err.println(target + " is already running in another process");
                case REJECTED -> err.println(target + " was not dispatched: shutting down");
                case FAILED, GAVE_UP -> err.println(target + " gave up after attempt "
                        + (record != null ? record.attempts() : "?") + ": "
                        + (record != null ? record.lastError() : "unknown error"));
            }
            return ExitCodes.of(outcome);
        }
    }

    private int runDaemon(Dependencies deps) throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "skytiles-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        deps.startDaemon();
        log.info("Daemon running; stop with SIGTERM or Ctrl-C");
        stopped.await();
        return ExitCodes.OK;
    }

    private static Duration duration(String name, String value) {
        return AcquisitionConfig.parseDuration("--" + name, value);
    }
}
