package skytiles.acquisition.scheduler;

import skytiles.acquisition.MutableClock;
import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.model.TaskRecord;
import skytiles.acquisition.model.TaskStatus;
import skytiles.acquisition.pipeline.*;
import skytiles.acquisition.repository.StateStoreException;
import skytiles.acquisition.repository.TaskRecordRepository;
import skytiles.acquisition.store.Database;
import skytiles.acquisition.store.JdbcTaskRecordRepository;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AcquisitionSchedulerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final ImageTimestamp NOON = ImageTimestamp.parse("20250301120000");

    private static Database db;
    private static JdbcTaskRecordRepository repo;
    private static MutableClock clock;

    @TempDir
    Path workRoot;

    private AcquisitionScheduler scheduler;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-scheduler;DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE", 8);
        clock = new MutableClock(T0);
        repo = new JdbcTaskRecordRepository(db, clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanRecords() throws Exception {
        clock.set(T0);
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_records");
            conn.commit();
        }
    }

    @AfterEach
    void closeScheduler() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    private static AcquisitionConfig config() {
        return AcquisitionConfig.defaults()
                .withPublicationDelay(Duration.ZERO)
                .withBackfillWindow(Duration.ZERO)
                .withConcurrency(2)
                .withMaxAttempts(5)
                .withBackoffBase(Duration.ofMinutes(1))
                .withRunTimeout(Duration.ofSeconds(30))
                .withShutdownGrace(Duration.ofSeconds(2));
    }

    private AcquisitionScheduler scheduler(AcquisitionConfig config, PipelineStep... steps) {
        return scheduler(repo, config, steps);
    }

    private AcquisitionScheduler scheduler(TaskRecordRepository repository, AcquisitionConfig config,
            PipelineStep... steps) {
        RetryQueue queue = new RetryQueue(clock, config.backoffBase(), config.backoffCapExponent(),
                config.maxAttempts());
        scheduler = new AcquisitionScheduler(repository, queue, new PipelineRunner(workRoot, false),
                new PipelineDefinition(List.of(steps)), clock, config);
        return scheduler;
    }

    @Test
    void failsTwiceThenSucceedsAcrossTicks() {
        ScriptedStep step = new ScriptedStep("acquire", ".png", (ctx, n) -> {
            if (n <= 2) {
                throw new TransientStepException("HTTP 404 for tile 3/7");
            }
        });
        AcquisitionScheduler s = scheduler(config(), step);

        TickReport first = s.tick();
        assertEquals(1, first.failed());
        TaskRecord afterFirst = repo.get(NOON).orElseThrow();
        assertEquals(TaskStatus.FAILED, afterFirst.status());
        assertEquals(1, afterFirst.attempts());
        assertEquals("step 1 (acquire): HTTP 404 for tile 3/7", afterFirst.lastError());

        // still backing off: nothing to do
        clock.advance(Duration.ofMinutes(1));
        assertEquals(0, s.tick().candidates());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(1, s.tick().failed());
        assertEquals(2, repo.get(NOON).orElseThrow().attempts());

        clock.advance(Duration.ofMinutes(5));
        TickReport third = s.tick();
        assertEquals(1, third.succeeded());

        TaskRecord done = repo.get(NOON).orElseThrow();
        assertEquals(TaskStatus.SUCCEEDED, done.status());
        assertEquals(3, done.attempts());
        assertNull(done.lastError());
        assertEquals(3, step.invocations());
        assertFalse(s.retryQueue().contains(NOON));
        assertTrue(Files.exists(Path.of(done.artifactPath())));
    }

    @Test
    void succeededSlotIsNotRunAgain() {
        ScriptedStep step = ScriptedStep.succeeding("acquire", ".png");
        AcquisitionScheduler s = scheduler(config(), step);

        assertEquals(1, s.tick().succeeded());
        clock.advance(Duration.ofMinutes(5));
        assertEquals(0, s.tick().candidates());
        assertEquals(1, step.invocations());
    }

    @Test
    void triggerDuringRunningTickIsSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedStep step = new ScriptedStep("acquire", ".png", (ctx, n) -> {
            entered.countDown();
            release.await();
        });
        AcquisitionScheduler s = scheduler(config(), step);

        ExecutorService tickThread = Executors.newSingleThreadExecutor();
        try {
            Future<TickReport> tick = tickThread.submit(s::tick);
            assertTrue(entered.await(10, TimeUnit.SECONDS));
            assertEquals(Set.of(NOON), s.inFlight());

            DispatchOutcome manual = s.trigger(NOON, false).get(10, TimeUnit.SECONDS);
            assertEquals(DispatchOutcome.SKIPPED_RUNNING, manual);

            release.countDown();
            assertEquals(1, tick.get(10, TimeUnit.SECONDS).succeeded());
        } finally {
            release.countDown();
            tickThread.shutdownNow();
        }

        assertEquals(1, step.invocations());
        assertEquals(1, s.metrics().conflicts());
        assertEquals(AcquisitionScheduler.State.IDLE, s.state());
    }

    @Test
    void triggerWithoutForceSkipsSucceededSlot() throws Exception {
        ScriptedStep step = ScriptedStep.succeeding("acquire", ".png");
        AcquisitionScheduler s = scheduler(config(), step);

        assertEquals(DispatchOutcome.SUCCEEDED, s.trigger(NOON, false).get(10, TimeUnit.SECONDS));
        assertEquals(DispatchOutcome.SKIPPED_SUCCEEDED, s.trigger(NOON, false).get(10, TimeUnit.SECONDS));
        assertEquals(DispatchOutcome.SUCCEEDED, s.trigger(NOON, true).get(10, TimeUnit.SECONDS));
        assertEquals(2, step.invocations());
    }

    @Test
    void givesUpAfterMaxAttemptsUntilManuallyTriggered() throws Exception {
        ScriptedStep step = new ScriptedStep("adjust", ".png", (ctx, n) -> {
            throw new PermanentStepException("crop_x 900 too large for width 1500");
        });
        AcquisitionScheduler s = scheduler(config().withMaxAttempts(2), step);

        assertEquals(1, s.tick().failed());
        clock.advance(Duration.ofMinutes(3));
        TickReport second = s.tick();
        assertEquals(1, second.gaveUp());
        assertTrue(s.retryQueue().isGivenUp(NOON));

        clock.advance(Duration.ofMinutes(10));
        assertEquals(0, s.tick().candidates());
        assertEquals(2, step.invocations());

        DispatchOutcome manual = s.trigger(NOON, false).get(10, TimeUnit.SECONDS);
        assertEquals(DispatchOutcome.GAVE_UP, manual);
        assertEquals(3, step.invocations());
        assertEquals(3, repo.get(NOON).orElseThrow().attempts());
    }

    @Test
    void runExceedingTimeoutIsFailedAndFreesItsSlot() throws Exception {
        CountDownLatch abandoned = new CountDownLatch(1);
        ScriptedStep step = new ScriptedStep("tile", ".tif", (ctx, n) -> {
            if (n == 1) {
                try {
                    Thread.sleep(30_000);
                } finally {
                    abandoned.countDown();
                }
            }
        });
        AcquisitionScheduler s = scheduler(config().withRunTimeout(Duration.ofMillis(300)).withConcurrency(1), step);

        TickReport report = s.tick();

        assertEquals(1, report.failed());
        assertEquals(1, s.metrics().timeouts());
        TaskRecord record = repo.get(NOON).orElseThrow();
        assertEquals(TaskStatus.FAILED, record.status());
        assertTrue(record.lastError().startsWith("timed out after"), record.lastError());
        assertEquals(0, s.metrics().inFlight());

        // the abandoned worker is interrupted; let it finish cleaning its work dir
        assertTrue(abandoned.await(10, TimeUnit.SECONDS));
        Thread.sleep(200);

        // the only slot is free again
        clock.advance(Duration.ofMinutes(3));
        assertEquals(1, s.tick().succeeded());
    }

    @Test
    void rebuildRecoversRunLeftByCrashedProcess() {
        ImageTimestamp orphan = ImageTimestamp.parse("20250301114500");
        repo.markRunning(orphan);
        clock.advance(Duration.ofHours(1));

        ScriptedStep step = ScriptedStep.succeeding("acquire", ".png");
        AcquisitionScheduler s = scheduler(config(), step);

        assertEquals(1, s.rebuild());
        assertTrue(s.retryQueue().contains(orphan));
        TaskRecord failed = repo.get(orphan).orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(1, failed.attempts());

        clock.advance(Duration.ofMinutes(3));
        s.tick();

        assertEquals(TaskStatus.SUCCEEDED, repo.get(orphan).orElseThrow().status());
    }

    @Test
    void candidatesAreLatestThenGapsOldestFirst() {
        AcquisitionScheduler s = scheduler(config().withBackfillWindow(Duration.ofHours(1)),
                ScriptedStep.succeeding("acquire", ".png"));
        repo.markRunning(ImageTimestamp.parse("20250301113000"));
        repo.markSucceeded(ImageTimestamp.parse("20250301113000"), null);

        List<ImageTimestamp> candidates = s.resolveCandidates(T0);

        assertEquals(List.of(
                NOON,
                ImageTimestamp.parse("20250301110000"),
                ImageTimestamp.parse("20250301111500"),
                ImageTimestamp.parse("20250301114500")), candidates);
    }

    @Test
    void concurrencyIsBounded() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ScriptedStep step = new ScriptedStep("acquire", ".png", (ctx, n) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(150);
            } finally {
                running.decrementAndGet();
            }
        });
        AcquisitionScheduler s = scheduler(config().withBackfillWindow(Duration.ofHours(1)), step);

        TickReport report = s.tick();

        assertEquals(5, report.candidates());
        assertEquals(5, report.succeeded());
        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
        assertEquals(5, step.invocations());
    }

    @Test
    void closedSchedulerRejectsWork() throws Exception {
        AcquisitionScheduler s = scheduler(config(), ScriptedStep.succeeding("acquire", ".png"));
        s.close();

        assertFalse(s.isAccepting());
        assertEquals(DispatchOutcome.REJECTED, s.trigger(NOON, false).get(1, TimeUnit.SECONDS));
        assertEquals(0, s.tick().candidates());
        assertTrue(repo.get(NOON).isEmpty());
    }

    @Test
    @DisplayName("A store error while claiming one retry keeps it queued and dispatches the rest")
    void storeErrorDuringDispatchKeepsRetryQueued() {
        ImageTimestamp a = ImageTimestamp.parse("20250301113000");
        ImageTimestamp b = ImageTimestamp.parse("20250301114500");
        for (ImageTimestamp ts : List.of(a, b)) {
            repo.markRunning(ts);
            repo.markFailed(ts, "step 1 (acquire): HTTP 503 from tile server");
        }
        ScriptedStep step = ScriptedStep.succeeding("acquire", ".png");
        FailingOnceRepository flaky = new FailingOnceRepository(repo, a);
        AcquisitionScheduler s = scheduler(flaky, config(), step);
        assertEquals(2, s.rebuild());
        clock.advance(Duration.ofMinutes(3));

        TickReport first = assertDoesNotThrow(s::tick);

        assertEquals(1, flaky.failures.get());
        assertTrue(s.retryQueue().contains(a));
        assertFalse(s.retryQueue().contains(b));
        assertEquals(TaskStatus.FAILED, repo.get(a).orElseThrow().status());
        assertEquals(1, repo.get(a).orElseThrow().attempts());
        assertEquals(TaskStatus.SUCCEEDED, repo.get(b).orElseThrow().status());
        assertEquals(2, first.succeeded());

        TickReport second = s.tick();

        assertEquals(1, second.succeeded());
        assertEquals(TaskStatus.SUCCEEDED, repo.get(a).orElseThrow().status());
        assertFalse(s.retryQueue().contains(a));
    }

    @Test
    void givingUpRemovesTileCache() throws Exception {
        ScriptedStep step = new ScriptedStep("acquire", ".png", (ctx, n) -> {
            Path cache = ctx.workDir().resolve("source-tiles");
            try {
                Files.createDirectories(cache);
                Files.writeString(cache.resolve("tile_0_" + n + ".png"), "tile");
            } catch (java.io.IOException e) {
                throw new TransientStepException("cannot write tile cache", e);
            }
            throw new TransientStepException("HTTP 503 for tile 4/" + n);
        });
        AcquisitionScheduler s = scheduler(config().withMaxAttempts(2), step);
        Path workDir = workRoot.resolve(NOON.id());

        assertEquals(1, s.tick().failed());
        assertTrue(Files.exists(workDir.resolve("source-tiles").resolve("tile_0_1.png")),
                "cache is kept while the slot can still be retried");

        clock.advance(Duration.ofMinutes(3));
        assertEquals(1, s.tick().gaveUp());

        assertFalse(Files.exists(workDir));
    }

    /** Delegates to the real store but fails the first claim of one timestamp. */
    private static final class FailingOnceRepository implements TaskRecordRepository {

        private final TaskRecordRepository delegate;
        private final ImageTimestamp target;
        private final AtomicInteger failures = new AtomicInteger();

        FailingOnceRepository(TaskRecordRepository delegate, ImageTimestamp target) {
            this.delegate = delegate;
            this.target = target;
        }

        @Override
        public Optional<TaskRecord> get(ImageTimestamp timestamp) {
            return delegate.get(timestamp);
        }

        @Override
        public TaskRecord markRunning(ImageTimestamp timestamp) {
            return markRunning(timestamp, false);
        }

        @Override
        public TaskRecord markRunning(ImageTimestamp timestamp, boolean force) {
            if (timestamp.equals(target) && failures.compareAndSet(0, 1)) {
                throw new StateStoreException("Failed to mark " + timestamp + " running",
                        new SQLException("Connection is not available, request timed out after 30000ms"));
            }
            return delegate.markRunning(timestamp, force);
        }

        @Override
        public TaskRecord markSucceeded(ImageTimestamp timestamp, String artifactPath) {
            return delegate.markSucceeded(timestamp, artifactPath);
        }

        @Override
        public TaskRecord markFailed(ImageTimestamp timestamp, String error) {
            return delegate.markFailed(timestamp, error);
        }

        @Override
        public List<TaskRecord> listIncomplete(Instant now, Duration livenessTimeout) {
            return delegate.listIncomplete(now, livenessTimeout);
        }

        @Override
        public List<TaskRecord> findStaleRunning(Instant cutoff) {
            return delegate.findStaleRunning(cutoff);
        }

        @Override
        public Optional<TaskRecord> markStale(ImageTimestamp timestamp, Instant cutoff) {
            return delegate.markStale(timestamp, cutoff);
        }

        @Override
        public List<TaskRecord> findRecent(int limit) {
            return delegate.findRecent(limit);
        }

        @Override
        public int countByStatus(TaskStatus status) {
            return delegate.countByStatus(status);
        }
    }
}
