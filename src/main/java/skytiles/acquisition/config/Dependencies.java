package skytiles.acquisition.config;

import skytiles.acquisition.api.v1.HealthController;
import skytiles.acquisition.api.v1.TimestampController;
import skytiles.acquisition.pipeline.PipelineDefinition;
import skytiles.acquisition.pipeline.PipelineRunner;
import skytiles.acquisition.pipeline.TimestampIndex;
import skytiles.acquisition.repository.TaskRecordRepository;
import skytiles.acquisition.scheduler.AcquisitionScheduler;
import skytiles.acquisition.scheduler.FixedRateTickSource;
import skytiles.acquisition.scheduler.RetryQueue;
import skytiles.acquisition.scheduler.TickSource;
import skytiles.acquisition.server.RouterHandler;
import skytiles.acquisition.server.StatusServer;
import skytiles.acquisition.store.Database;
import skytiles.acquisition.store.JdbcTaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.function.BiFunction;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(AcquisitionConfig.fromEnv().validate());
 * deps.startDaemon(); // rebuild retry queue, start ticking
 * // ... run until signalled ...
 * deps.close(); // drain in-flight runs, close the store
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final AcquisitionConfig config;
    private final Clock clock;
    private final Database database;
    private final TaskRecordRepository repository;
    private final RetryQueue retryQueue;
    private final TimestampIndex timestampIndex;
    private final PipelineDefinition pipeline;
    private final PipelineRunner runner;
    private final AcquisitionScheduler scheduler;

    // Lazy-initialized, daemon mode only
    private TickSource tickSource;
    private RouterHandler routerHandler;
    private StatusServer statusServer;

    private boolean closed = false;

    private Dependencies(AcquisitionConfig config, Clock clock,
                         BiFunction<AcquisitionConfig, TimestampIndex, PipelineDefinition> pipelineFactory) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Directories
        createDirectories(config.workDir(), config.tilesDir(), config.stateDir());

        // Infrastructure
        this.database = new Database(config);
        this.repository = new JdbcTaskRecordRepository(database, clock);

        // Scheduling
        this.retryQueue = new RetryQueue(clock, config.backoffBase(), config.backoffCapExponent(),
                config.maxAttempts());
        this.timestampIndex = new TimestampIndex(config.tilesDir());
        this.pipeline = pipelineFactory.apply(config, timestampIndex);
        this.runner = new PipelineRunner(config.workDir(), config.keepFiles());
        this.scheduler = new AcquisitionScheduler(repository, retryQueue, runner, pipeline, clock, config);

        log.info("Dependencies initialized, pipeline: {}", pipeline.stepNames());
    }

    /**
     * Create dependencies with the given config and the standard pipeline.
     */
    public static Dependencies create(AcquisitionConfig config) {
        return create(config, Clock.systemUTC(), PipelineDefinition::standard);
    }

    /**
     * Create dependencies with a custom clock and pipeline (tests, dry runs).
     */
    public static Dependencies create(AcquisitionConfig config, Clock clock,
                                      BiFunction<AcquisitionConfig, TimestampIndex, PipelineDefinition> pipelineFactory) {
        return new Dependencies(config, clock, pipelineFactory);
    }

    // Getters
    public AcquisitionConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRecordRepository repository() {
        return repository;
    }

    public RetryQueue retryQueue() {
        return retryQueue;
    }

    public TimestampIndex timestampIndex() {
        return timestampIndex;
    }

    public PipelineDefinition pipeline() {
        return pipeline;
    }

    public AcquisitionScheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, repository, scheduler))
                    .registerController(new TimestampController(repository, scheduler, config.maxAttempts()));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized StatusServer statusServer() {
        if (statusServer == null) {
            statusServer = new StatusServer(routerHandler());
        }
        return statusServer;
    }

    public synchronized TickSource tickSource() {
        if (tickSource == null) {
            tickSource = new FixedRateTickSource(config.tickInterval(), config.shutdownGrace());
        }
        return tickSource;
    }

    /**
     * Rebuild the retry queue from the store, start the status API (if configured) and start ticking.
     */
    public void startDaemon() {
        scheduler.rebuild();
        if (config.statusPort() > 0) {
            statusServer().start(config.statusHost(), config.statusPort());
        }
        tickSource().start(scheduler::tick);
    }

    private static void createDirectories(Path... dirs) {
        for (Path dir : dirs) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("cannot create " + dir, e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Closing dependencies...");

        // Drain runs first so a tick waiting on them can finish
        try {
            scheduler.close();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        if (tickSource != null) {
            try {
                tickSource.stop();
            } catch (Exception e) {
                log.warn("Error stopping tick source: {}", e.getMessage());
            }
        }

        if (statusServer != null) {
            try {
                statusServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping status API: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
