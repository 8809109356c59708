package skytiles.acquisition.scheduler;

import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.model.TaskRecord;
import skytiles.acquisition.model.TaskStatus;
import skytiles.acquisition.pipeline.PipelineDefinition;
import skytiles.acquisition.pipeline.PipelineRunner;
import skytiles.acquisition.pipeline.RunResult;
import skytiles.acquisition.repository.ConflictException;
import skytiles.acquisition.repository.TaskRecordRepository;
import skytiles.acquisition.util.MdcPropagation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Decides which timestamps to run and dispatches them with bounded concurrency.
 * <p>
 * One tick moves through {@link State#RESOLVING} (reap stale runs, pick the latest slot, gap
 * slots and eligible retries), {@link State#DISPATCHING} (claim each candidate in the state store
 * and hand it to a worker, waiting for a free slot when all are busy) and {@link State#AWAITING}
 * (wait for the dispatched runs to settle) before returning to {@link State#IDLE}.
 * <p>
 * Every dispatch ends in exactly one terminal store write, performed before its slot is released.
 * A watchdog fails runs that exceed the run timeout and frees their slot even if the step never
 * returns; whatever the abandoned worker reports afterwards is ignored.
 */
public class AcquisitionScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AcquisitionScheduler.class);

    public enum State {
        IDLE,
        RESOLVING,
        DISPATCHING,
        AWAITING
    }

    private final TaskRecordRepository repository;
    private final RetryQueue retryQueue;
    private final TimestampResolver resolver;
    private final PipelineRunner runner;
    private final PipelineDefinition pipeline;
    private final StaleRunReaper reaper;
    private final Clock clock;
    private final SchedulerMetrics metrics = new SchedulerMetrics();

    private final Duration backfillWindow;
    private final Duration livenessTimeout;
    private final Duration runTimeout;
    private final Duration shutdownGrace;

    private final Semaphore slots;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final Set<ImageTimestamp> inFlight = ConcurrentHashMap.newKeySet();
    private final ReentrantLock tickLock = new ReentrantLock();

    private volatile State state = State.IDLE;
    private volatile boolean accepting = true;

    public AcquisitionScheduler(TaskRecordRepository repository,
                                RetryQueue retryQueue,
                                PipelineRunner runner,
                                PipelineDefinition pipeline,
                                Clock clock,
                                AcquisitionConfig config) {
        this.repository = repository;
        this.retryQueue = retryQueue;
        this.resolver = new TimestampResolver(config.cadence(), config.publicationDelay());
        this.runner = runner;
        this.pipeline = pipeline;
        this.reaper = new StaleRunReaper(repository, clock, config.livenessTimeout());
        this.clock = clock;
        this.backfillWindow = config.backfillWindow();
        this.livenessTimeout = config.livenessTimeout();
        this.runTimeout = config.runTimeout();
        this.shutdownGrace = config.shutdownGrace();
        this.slots = new Semaphore(config.concurrency(), true);

        AtomicInteger workerCounter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "skytiles-worker-" + workerCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "skytiles-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Restore the retry queue from the state store. Call once at startup, before the first tick.
     * Stale RUNNING records left by a crashed process are reclassified as FAILED on the way.
     *
     * @return number of timestamps queued for retry
     */
    public int rebuild() {
        List<TaskRecord> incomplete = repository.listIncomplete(clock.instant(), livenessTimeout);
        int queued = retryQueue.rebuild(incomplete);
        List<ImageTimestamp> givenUp = retryQueue.givenUp();
        log.info("Retry queue rebuilt: {} queued, {} given up", queued, givenUp.size());
        for (ImageTimestamp ts : givenUp) {
            log.error("Timestamp {} is permanently failed; re-trigger it manually to retry", ts);
        }
        return queued;
    }

    /**
     * Run one tick and wait for everything it dispatched to settle.
     */
    public TickReport tick() {
        Instant startedAt = clock.instant();
        if (!accepting) {
            return TickReport.empty(startedAt);
        }

        tickLock.lock();
        try {
            metrics.tick();

            state = State.RESOLVING;
            int reaped = reapStale();
            Map<ImageTimestamp, RetryEntry> popped = new HashMap<>();
            List<ImageTimestamp> candidates = resolveCandidates(startedAt, popped);
            log.debug("Tick at {}: {} candidates", startedAt, candidates.size());

            state = State.DISPATCHING;
            List<CompletableFuture<DispatchOutcome>> dispatched = new ArrayList<>();
            for (int i = 0; i < candidates.size(); i++) {
                if (!accepting || Thread.currentThread().isInterrupted()) {
                    restore(popped, candidates.subList(i, candidates.size()));
                    break;
                }
                ImageTimestamp ts = candidates.get(i);
                try {
                    dispatched.add(dispatch(ts, false));
                } catch (RuntimeException e) {
                    log.error("Could not dispatch {}, leaving it for the next tick", ts, e);
                    restore(popped, List.of(ts));
                }
            }

            state = State.AWAITING;
            List<DispatchOutcome> outcomes = new ArrayList<>();
            for (CompletableFuture<DispatchOutcome> future : dispatched) {
                try {
                    outcomes.add(future.get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Tick interrupted while awaiting runs");
                    break;
                } catch (ExecutionException e) {
                    log.error("Dispatch failed unexpectedly", e.getCause());
                }
            }

            TickReport report = TickReport.of(startedAt, reaped, candidates.size(), outcomes);
            if (!candidates.isEmpty() || reaped > 0) {
                log.info("Tick done: {} candidates, {} succeeded, {} failed, {} gave up, {} skipped",
                        report.candidates(), report.succeeded(), report.failed(), report.gaveUp(), report.skipped());
            }
            return report;
        } finally {
            state = State.IDLE;
            tickLock.unlock();
        }
    }

    /**
     * One-shot dispatch of a single timestamp, outside the cadence.
     * Ignores back-off and the give-up threshold; still refused while the timestamp is running.
     *
     * @param timestamp the slot to run
     * @param force     re-run a slot that already succeeded
     * @return completes with the outcome once the run has settled
     */
    public CompletableFuture<DispatchOutcome> trigger(ImageTimestamp timestamp, boolean force) {
        if (!accepting) {
            return CompletableFuture.completedFuture(DispatchOutcome.REJECTED);
        }
        log.info("Manual trigger for {}{}", timestamp, force ? " (forced)" : "");
        try {
            return CompletableFuture.supplyAsync(() -> dispatch(timestamp, force), workers)
                    .thenCompose(f -> f);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(DispatchOutcome.REJECTED);
        }
    }

    private int reapStale() {
        List<TaskRecord> reaped = reaper.reap(Set.copyOf(inFlight));
        for (TaskRecord record : reaped) {
            if (retryQueue.push(record.timestamp(), record.attempts()) == RetryQueue.PushResult.GAVE_UP) {
                giveUp(record.timestamp(), record.attempts());
            }
        }
        metrics.reaped(reaped.size());
        return reaped.size();
    }

    /**
     * Latest slot first, then gap slots oldest first, then eligible retries in queue order.
     */
    List<ImageTimestamp> resolveCandidates(Instant now) {
        return resolveCandidates(now, new HashMap<>());
    }

    /**
     * @param popped receives the retry entries taken off the queue, so undispatched ones can be restored
     */
    private List<ImageTimestamp> resolveCandidates(Instant now, Map<ImageTimestamp, RetryEntry> popped) {
        Set<ImageTimestamp> candidates = new LinkedHashSet<>();

        ImageTimestamp latest = resolver.latestExpected(now);
        if (isLiveCandidate(latest)) {
            candidates.add(latest);
        }
        if (!backfillWindow.isZero()) {
            Instant from = latest.instant().minus(backfillWindow);
            for (ImageTimestamp ts : resolver.expectedTimestamps(from, latest.instant())) {
                if (isLiveCandidate(ts)) {
                    candidates.add(ts);
                }
            }
        }
        for (RetryEntry entry : retryQueue.popAllEligibleEntries(now)) {
            if (!inFlight.contains(entry.timestamp())) {
                candidates.add(entry.timestamp());
                popped.put(entry.timestamp(), entry);
            }
        }
        return new ArrayList<>(candidates);
    }

    private void restore(Map<ImageTimestamp, RetryEntry> popped, List<ImageTimestamp> undispatched) {
        for (ImageTimestamp ts : undispatched) {
            RetryEntry entry = popped.get(ts);
            if (entry != null) {
                retryQueue.restore(entry);
            }
        }
    }

    // FAILED slots belong to the retry queue (or are given up)
    private boolean isLiveCandidate(ImageTimestamp ts) {
        if (inFlight.contains(ts)) {
            return false;
        }
        Optional<TaskRecord> record = repository.get(ts);
        return record.isEmpty() || record.get().status() == TaskStatus.PENDING;
    }

    /**
     * Wait for a slot, claim the timestamp and start the run.
     * Blocks the caller only while all slots are busy.
     */
    private CompletableFuture<DispatchOutcome> dispatch(ImageTimestamp timestamp, boolean force) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.completedFuture(DispatchOutcome.REJECTED);
        }
        if (!accepting) {
            slots.release();
            return CompletableFuture.completedFuture(DispatchOutcome.REJECTED);
        }

        try {
            repository.markRunning(timestamp, force);
        } catch (ConflictException e) {
            slots.release();
            metrics.conflict();
            log.debug("Skipping {}: {}", timestamp, e.reason());
            return CompletableFuture.completedFuture(e.reason() == ConflictException.Reason.ALREADY_RUNNING
                    ? DispatchOutcome.SKIPPED_RUNNING
                    : DispatchOutcome.SKIPPED_SUCCEEDED);
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }

        inFlight.add(timestamp);
        metrics.dispatched();

        Run run = new Run(timestamp);
        try {
            run.worker = workers.submit(() -> execute(run));
        } catch (RejectedExecutionException e) {
            settle(run, () -> fail(timestamp, "scheduler shutting down", false));
            return run.outcome;
        }
        ScheduledFuture<?> timeout = watchdog.schedule(() -> timeOut(run),
                runTimeout.toMillis(), TimeUnit.MILLISECONDS);
        run.outcome.whenComplete((outcome, error) -> timeout.cancel(false));
        return run.outcome;
    }

    private void execute(Run run) {
        MDC.put(MdcPropagation.TIMESTAMP_KEY, run.timestamp.id());
        try {
            RunResult result = runner.run(run.timestamp, pipeline.steps());
            if (result.succeeded()) {
                settle(run, () -> succeed(run.timestamp, result));
            } else {
                settle(run, () -> fail(run.timestamp, result.errorSummary(), result.isPermanentFailure()));
            }
        } catch (RuntimeException e) {
            log.error("Run for {} crashed", run.timestamp, e);
            settle(run, () -> fail(run.timestamp, "unexpected error: " + e, true));
        } finally {
            MDC.remove(MdcPropagation.TIMESTAMP_KEY);
        }
    }

    private void timeOut(Run run) {
        settle(run, () -> {
            metrics.timeout();
            Future<?> worker = run.worker;
            if (worker != null) {
                worker.cancel(true);
            }
            log.warn("Run for {} exceeded {}, abandoning it", run.timestamp, runTimeout);
            return fail(run.timestamp, "timed out after " + runTimeout, false);
        });
    }

    /**
     * The first caller wins: writes the terminal state, releases the slot and completes the run.
     */
    private void settle(Run run, Supplier<DispatchOutcome> terminalWrite) {
        if (!run.settled.compareAndSet(false, true)) {
            log.debug("Ignoring late result for {}", run.timestamp);
            return;
        }
        DispatchOutcome outcome = DispatchOutcome.FAILED;
        try {
            outcome = terminalWrite.get();
        } catch (RuntimeException e) {
            // record stays RUNNING; the stale reaper recovers it
            log.error("Could not record outcome for {}", run.timestamp, e);
        } finally {
            inFlight.remove(run.timestamp);
            slots.release();
            metrics.settled(outcome);
            run.outcome.complete(outcome);
        }
    }

    private DispatchOutcome succeed(ImageTimestamp timestamp, RunResult result) {
        String artifact = result.artifact().map(Object::toString).orElse(null);
        TaskRecord record = repository.markSucceeded(timestamp, artifact);
        retryQueue.remove(timestamp);
        log.info("Timestamp {} succeeded after {} attempts: {}", timestamp, record.attempts(), artifact);
        return DispatchOutcome.SUCCEEDED;
    }

    private DispatchOutcome fail(ImageTimestamp timestamp, String error, boolean permanent) {
        TaskRecord record = repository.markFailed(timestamp, error);
        if (permanent) {
            log.warn("Timestamp {} failed permanently (attempt {}): {}", timestamp, record.attempts(), error);
        } else {
            log.warn("Timestamp {} failed (attempt {}): {}", timestamp, record.attempts(), error);
        }
        if (retryQueue.push(timestamp, record.attempts()) == RetryQueue.PushResult.GAVE_UP) {
            giveUp(timestamp, record.attempts());
            return DispatchOutcome.GAVE_UP;
        }
        return DispatchOutcome.FAILED;
    }

    private void giveUp(ImageTimestamp timestamp, int attempts) {
        log.error("Giving up on {} after {} attempts; re-trigger it manually to retry", timestamp, attempts);
        runner.discard(timestamp);
    }

    public State state() {
        return state;
    }

    public SchedulerMetrics metrics() {
        return metrics;
    }

    public RetryQueue retryQueue() {
        return retryQueue;
    }

    public Set<ImageTimestamp> inFlight() {
        return Set.copyOf(inFlight);
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Stop accepting work, give in-flight runs the shutdown grace to finish, then interrupt them.
     */
    @Override
    public void close() {
        if (!accepting) {
            return;
        }
        accepting = false;
        log.info("Scheduler shutting down, {} runs in flight", inFlight.size());

        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Interrupting {} runs still in flight", inFlight.size());
                workers.shutdownNow();
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Some runs ignored interruption; they will be recovered as stale");
                }
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        watchdog.shutdownNow();
        log.info("Scheduler stopped");
    }

    private static final class Run {
        final ImageTimestamp timestamp;
        final AtomicBoolean settled = new AtomicBoolean();
        final CompletableFuture<DispatchOutcome> outcome = new CompletableFuture<>();
        volatile Future<?> worker;

        Run(ImageTimestamp timestamp) {
            this.timestamp = timestamp;
        }
    }
}
