package org.promoharvest.pipeline.services;

import com.typesafe.config.Config;
import org.promoharvest.pipeline.api.backlog.IIdentityBacklog;
import org.promoharvest.pipeline.api.fetch.IAuthenticator;
import org.promoharvest.pipeline.api.fetch.IRecordFetcher;
import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.api.records.IdentityResolver;
import org.promoharvest.pipeline.api.resources.IResource;
import org.promoharvest.pipeline.resources.storage.CheckpointStore;
import org.promoharvest.pipeline.resources.storage.FailedIdentityLedger;
import org.promoharvest.pipeline.resources.storage.MergeReport;
import org.promoharvest.pipeline.resources.storage.RecordBatcher;
import org.promoharvest.pipeline.resources.storage.RecordLogRepairer;
import org.promoharvest.pipeline.resources.storage.RepairReport;
import org.promoharvest.pipeline.resources.storage.ResumePoint;
import org.promoharvest.pipeline.utils.resilience.AdaptiveRateLimiter;
import org.promoharvest.pipeline.utils.resilience.CircuitBreaker;
import org.promoharvest.pipeline.utils.resilience.Retrier;
import org.promoharvest.pipeline.utils.resilience.RetryPolicy;
import org.promoharvest.pipeline.utils.resilience.Sleeper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one ingestion run: pulls pending identities, fetches them through the rate limiter, circuit
 * breaker and retry loop, hands records to the {@link RecordBatcher} and keeps resume state on disk.
 * <p>
 * Resources:
 * <ul>
 *   <li>{@code fetcher}: {@link IRecordFetcher}, required</li>
 *   <li>{@code backlog}: {@link IIdentityBacklog}, required</li>
 *   <li>{@code batcher}: {@link RecordBatcher}, required</li>
 *   <li>{@code repairer}: {@link RecordLogRepairer}, required</li>
 *   <li>{@code authenticator}: {@link IAuthenticator}, optional; defaults to the fetcher if it implements it</li>
 * </ul>
 * <p>
 * Startup validates the record log and collects ingested identities from the log and the batch files.
 * The main pass starts after the identity recorded in {@code <log>.resume}; identities before it that are
 * still not ingested are queued behind the main pass. Identities rejected by an open breaker are retried
 * in up to {@code maxDeferredPasses} extra passes.
 * <p>
 * On completion the batch files are merged into the log, the log is validated and the resume file is
 * removed. On stop the partial batch is flushed and the resume file kept. A storage failure is
 * process-fatal: whatever can still be persisted is persisted and the service ends in ERROR.
 */
public class FetchOrchestrator extends AbstractService {

    private final IRecordFetcher fetcher;
    private final IIdentityBacklog backlog;
    private final RecordBatcher batcher;
    private final RecordLogRepairer repairer;
    private final IAuthenticator authenticator;

    private final AdaptiveRateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final IdentityFetcher identityFetcher;
    private final IdentityResolver resolver;
    private final CheckpointStore checkpoints;
    private final FailedIdentityLedger ledger;
    private final Clock clock;
    private final Sleeper sleeper;

    private final int progressEvery;
    private final Duration heartbeatInterval;
    private final int maxDeferredPasses;
    private final int maxConcurrentFetches;
    private final boolean mergeOnCompletion;

    private volatile PipelineState state;
    private volatile RunStatus lastRunStatus;

    public FetchOrchestrator(String name, Config options, Map<String, List<IResource>> resources) {
        this(name, options, resources, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public FetchOrchestrator(String name, Config options, Map<String, List<IResource>> resources,
                             Clock clock, Sleeper sleeper) {
        super(name, options, resources);
        this.clock = clock;
        this.sleeper = sleeper;

        this.fetcher = getRequiredResource("fetcher", IRecordFetcher.class);
        this.backlog = getRequiredResource("backlog", IIdentityBacklog.class);
        this.batcher = getRequiredResource("batcher", RecordBatcher.class);
        this.repairer = getRequiredResource("repairer", RecordLogRepairer.class);
        this.authenticator = getOptionalResource("authenticator", IAuthenticator.class)
            .orElse(fetcher instanceof IAuthenticator ? (IAuthenticator) fetcher : null);

        int maxPerMinute = options.hasPath("maxPerMinute") ? options.getInt("maxPerMinute") : 25;
        long minDelayMs = options.hasPath("minDelayMs") ? options.getLong("minDelayMs") : 1500;
        int breakerThreshold = options.hasPath("circuitBreakerThreshold") ? options.getInt("circuitBreakerThreshold") : 10;
        long breakerCoolDownSeconds = options.hasPath("circuitBreakerCoolDownSeconds") ? options.getLong("circuitBreakerCoolDownSeconds") : 60;
        int reauthAttempts = options.hasPath("reauthAttempts") ? options.getInt("reauthAttempts") : 1;
        long reauthDelayMs = options.hasPath("reauthDelayMs") ? options.getLong("reauthDelayMs") : 1000;
        this.progressEvery = options.hasPath("progressEvery") ? options.getInt("progressEvery") : 10;
        this.heartbeatInterval = Duration.ofSeconds(options.hasPath("heartbeatIntervalSeconds") ? options.getLong("heartbeatIntervalSeconds") : 60);
        this.maxDeferredPasses = options.hasPath("maxDeferredPasses") ? options.getInt("maxDeferredPasses") : 3;
        this.maxConcurrentFetches = options.hasPath("maxConcurrentFetches") ? options.getInt("maxConcurrentFetches") : 1;
        this.mergeOnCompletion = !options.hasPath("mergeOnCompletion") || options.getBoolean("mergeOnCompletion");

        if (progressEvery <= 0) {
            throw new IllegalArgumentException("progressEvery must be positive");
        }
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatIntervalSeconds must be positive");
        }
        if (maxDeferredPasses < 0) {
            throw new IllegalArgumentException("maxDeferredPasses cannot be negative");
        }
        if (maxConcurrentFetches < 1) {
            throw new IllegalArgumentException("maxConcurrentFetches must be >= 1");
        }

        RetryPolicy fetchPolicy = RetryPolicy.fromConfig(options, RetryPolicy.of(3, Duration.ofSeconds(2)));
        RetryPolicy reauthPolicy = RetryPolicy.of(reauthAttempts, Duration.ofMillis(reauthDelayMs));

        this.rateLimiter = new AdaptiveRateLimiter(maxPerMinute, Duration.ofMillis(minDelayMs), clock, sleeper);
        this.circuitBreaker = new CircuitBreaker(breakerThreshold, Duration.ofSeconds(breakerCoolDownSeconds), clock);
        this.resolver = batcher.getIdentityResolver();
        this.identityFetcher = new IdentityFetcher(fetcher, authenticator, rateLimiter, circuitBreaker,
            new Retrier(fetchPolicy, sleeper), new Retrier(reauthPolicy, sleeper), resolver);
        this.checkpoints = new CheckpointStore(batcher.getRecordLog());
        this.ledger = new FailedIdentityLedger(batcher.getRecordLog());

        log.debug("FetchOrchestrator initialized: rate=[{}/min, minDelay={}ms], retry=[max={}, delay={}ms], breaker=[{} failures, {}s], workers={}",
            maxPerMinute, minDelayMs, fetchPolicy.maxAttempts(), fetchPolicy.initialDelay().toMillis(),
            breakerThreshold, breakerCoolDownSeconds, maxConcurrentFetches);
    }

    @Override
    protected void logStarted() {
        log.info("FetchOrchestrator started: log={}, batchSize={}, workers={}, reauth={}",
            batcher.getRecordLog(), batcher.getBatchSize(), maxConcurrentFetches, authenticator != null ? "enabled" : "disabled");
    }

    @Override
    protected void run() throws InterruptedException {
        PipelineState run = new PipelineState(clock.instant());
        this.state = run;
        this.lastRunStatus = null;
        RunStatus outcome = RunStatus.FAILED;
        IOException fatal = null;
        boolean interrupted = false;

        try (ProgressReporter progress = new ProgressReporter(batcher.getRecordLog(), clock)) {
            progress.transition(run, RunStatus.STARTING, "validating record log");
            progress.startHeartbeat(run, heartbeatInterval, serviceName + "-heartbeat");
            try {
                WorkPlan plan = prepare(run);
                progress.transition(run, RunStatus.RUNNING, String.format("%d identities pending", run.total()));

                List<String> deferred = new ArrayList<>();
                deferred.addAll(runPass(plan.main, true, run, progress));
                deferred.addAll(runPass(plan.requeued, false, run, progress));
                for (int pass = 1; pass <= maxDeferredPasses && !deferred.isEmpty() && !isStopRequested(); pass++) {
                    waitForBreaker();
                    log.info("Deferred pass {}/{} over {} identities", pass, maxDeferredPasses, deferred.size());
                    deferred = runPass(deferred, false, run, progress);
                }

                if (isStopRequested()) {
                    outcome = RunStatus.STOPPED;
                } else {
                    if (!deferred.isEmpty()) {
                        log.warn("{} identities still deferred after {} passes, leaving them for the next run",
                            deferred.size(), maxDeferredPasses);
                    }
                    outcome = run.failed() > 0 || !deferred.isEmpty() ? RunStatus.COMPLETED_WITH_ERRORS : RunStatus.COMPLETED;
                }
            } catch (InterruptedException e) {
                interrupted = true;
                outcome = RunStatus.STOPPED;
            } catch (IOException | UncheckedIOException e) {
                fatal = e instanceof UncheckedIOException ? ((UncheckedIOException) e).getCause() : (IOException) e;
                outcome = RunStatus.FAILED;
            } finally {
                // Clear the interrupt flag so the shutdown writes can complete
                boolean wasInterrupted = Thread.interrupted() || interrupted;
                try {
                    outcome = shutdown(run, outcome, progress);
                } catch (IOException e) {
                    if (fatal == null) {
                        fatal = e;
                    } else {
                        fatal.addSuppressed(e);
                    }
                    outcome = RunStatus.FAILED;
                } finally {
                    lastRunStatus = outcome;
                    if (wasInterrupted) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
        }
        if (fatal != null) {
            throw new UncheckedIOException("Ingestion aborted on storage failure", fatal);
        }
    }

    private static final class WorkPlan {
        final List<String> main = new ArrayList<>();
        final List<String> requeued = new ArrayList<>();
    }

    private WorkPlan prepare(PipelineState run) throws IOException {
        RepairReport validation = repairer.validate();
        if (validation.repaired()) {
            log.info("Record log repaired before ingestion: {} invalid, {} duplicates removed",
                validation.invalid(), validation.duplicates());
        }
        Set<String> inLog = repairer.readIdentities();
        Set<String> inBatches = batcher.knownIdentities();
        inLog.forEach(run.ingested()::markIngested);
        inBatches.forEach(run.ingested()::markIngested);

        List<String> identities = backlog.loadIdentities();
        int start = 0;
        Optional<ResumePoint> resume = checkpoints.readResumePoint();
        if (resume.isPresent() && resume.get().lastAttemptedIdentity() != null) {
            String resumeIdentity = resume.get().lastAttemptedIdentity();
            int position = identities.indexOf(resumeIdentity);
            if (position < 0) {
                log.warn("Checkpointed identity '{}' not found in backlog, resuming from position 0", resumeIdentity);
            } else {
                start = position + 1;
                log.info("Resuming after identity '{}' at position {}/{}", resumeIdentity, start, identities.size());
            }
        }

        WorkPlan plan = new WorkPlan();
        for (int i = 0; i < identities.size(); i++) {
            String identity = identities.get(i);
            if (run.ingested().isIngested(identity)) {
                run.skipped.incrementAndGet();
            } else if (i >= start) {
                plan.main.add(identity);
            } else {
                plan.requeued.add(identity);
            }
        }
        run.requeued.set(plan.requeued.size());
        run.total.set(plan.main.size() + plan.requeued.size());
        log.info("Backlog: {} identities, {} already ingested ({} in log, {} in batch files), {} pending, {} re-queued",
            identities.size(), run.skipped(), inLog.size(), inBatches.size(), plan.main.size(), plan.requeued.size());
        return plan;
    }

    /**
     * Fetches the given identities and returns those deferred by the circuit breaker.
     * Stops early, without error, when a stop is requested.
     */
    private List<String> runPass(List<String> identities, boolean advanceResume, PipelineState run,
                                 ProgressReporter progress) throws InterruptedException, IOException {
        if (maxConcurrentFetches > 1) {
            return runParallelPass(identities, advanceResume, run, progress);
        }
        List<String> deferred = new ArrayList<>();
        for (String identity : identities) {
            checkPause();
            if (isStopRequested()) {
                break;
            }
            if (run.ingested().isIngested(identity)) {
                continue;
            }
            FetchOutcome outcome = identityFetcher.fetch(identity, this::isStopRequested);
            consume(outcome, advanceResume, run, progress, deferred);
        }
        return deferred;
    }

    private List<String> runParallelPass(List<String> identities, boolean advanceResume, PipelineState run,
                                         ProgressReporter progress) throws InterruptedException, IOException {
        List<String> deferred = new ArrayList<>();
        AtomicInteger workerId = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(maxConcurrentFetches, r -> {
            Thread t = new Thread(r, serviceName + "-fetch-" + workerId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<FetchOutcome> completions = new ExecutorCompletionService<>(pool);
        try {
            int next = 0;
            int inFlight = 0;
            while (true) {
                while (inFlight < maxConcurrentFetches && next < identities.size() && !isStopRequested()) {
                    checkPause();
                    String identity = identities.get(next++);
                    if (run.ingested().isIngested(identity)) {
                        continue;
                    }
                    completions.submit(() -> identityFetcher.fetch(identity, this::isStopRequested));
                    inFlight++;
                }
                if (inFlight == 0) {
                    break;
                }
                Future<FetchOutcome> done = completions.take();
                inFlight--;
                consume(unwrap(done), advanceResume, run, progress, deferred);
            }
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
        return deferred;
    }

    private static FetchOutcome unwrap(Future<FetchOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                throw (InterruptedException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Fetch worker failed", cause);
        }
    }

    /**
     * Applies one outcome to the batcher and run state. Runs only on the orchestrator thread.
     */
    private void consume(FetchOutcome outcome, boolean advanceResume, PipelineState run,
                         ProgressReporter progress, List<String> deferred) throws IOException {
        String identity = outcome.identity();
        switch (outcome.status()) {
            case RECORD:
                HarvestRecord record = outcome.record();
                RecordBatcher.AddResult added = batcher.add(record);
                run.ingested().markIngested(identity);
                resolver.resolve(record).ifPresent(run.ingested()::markIngested);
                run.clearFailure(identity);
                if (added == RecordBatcher.AddResult.DUPLICATE) {
                    run.duplicates.incrementAndGet();
                } else {
                    run.succeeded.incrementAndGet();
                    if (added == RecordBatcher.AddResult.FLUSHED) {
                        run.batchesFlushed.incrementAndGet();
                    }
                }
                break;
            case EMPTY:
                run.empty.incrementAndGet();
                log.info("No record available for identity '{}'", identity);
                break;
            case FAILED:
                run.recordFailure(new PipelineState.Failure(identity, outcome.errorKind(), outcome.message(), outcome.attempts()));
                ledger.append(new FailedIdentityLedger.Entry(identity, outcome.errorKind().name(),
                    outcome.message(), outcome.attempts(), clock.instant().toString()));
                log.warn("Failed to fetch identity '{}' after {} attempts ({}): {}",
                    identity, outcome.attempts(), outcome.errorKind(), outcome.message());
                recordError("FETCH_FAILED", "Identity could not be fetched",
                    String.format("Identity: %s, Kind: %s, Message: %s", identity, outcome.errorKind(), outcome.message()));
                break;
            case DEFERRED:
                run.deferred.incrementAndGet();
                deferred.add(identity);
                log.debug("Circuit breaker open, deferring identity '{}'", identity);
                break;
            case ABORTED:
                log.debug("Stop requested, leaving identity '{}' for the next run", identity);
                break;
            default:
                throw new IllegalStateException("Unknown outcome: " + outcome.status());
        }
        long processed = run.processed.incrementAndGet();
        run.lastIdentity(identity);
        if (advanceResume && outcome.status() != FetchOutcome.Status.ABORTED) {
            checkpoints.writeResumePoint(new ResumePoint(identity, processed, clock.instant().toString()));
        }
        if (processed % progressEvery == 0) {
            progress.writeProgress(run);
            progress.writeHeartbeat(run.status(), String.format("processed %d/%d", processed, run.total()));
        }
    }

    private void waitForBreaker() throws InterruptedException {
        long remaining = circuitBreaker.remainingCoolDownMs();
        while (remaining > 0 && !isStopRequested()) {
            long slice = Math.min(remaining, 1000);
            sleeper.sleep(slice);
            remaining = circuitBreaker.remainingCoolDownMs();
        }
    }

    /**
     * Flushes the partial batch and persists final state. Merges and clears the resume point only
     * for a completed run.
     *
     * @return the final status
     */
    private RunStatus shutdown(PipelineState run, RunStatus outcome, ProgressReporter progress) throws IOException {
        RunStatus status = outcome;
        IOException failure = null;
        try {
            if (batcher.bufferedCount() > 0) {
                log.info("Flushing partial batch of {} records", batcher.bufferedCount());
                if (batcher.flush().isPresent()) {
                    run.batchesFlushed.incrementAndGet();
                }
            }
            if (status.isCompleted()) {
                if (mergeOnCompletion) {
                    MergeReport merged = batcher.merge();
                    RepairReport validated = repairer.validate();
                    log.debug("Merged {} records, log checkpoint now {}", merged.written(), validated.toCheckpoint());
                }
                checkpoints.clearResumePoint();
            }
        } catch (IOException e) {
            failure = e;
            status = RunStatus.FAILED;
        }
        try {
            Map<String, FailedIdentityLedger.Entry> outstanding = new LinkedHashMap<>(ledger.load());
            run.outstandingFailures().forEach((identity, failed) -> outstanding.put(identity,
                new FailedIdentityLedger.Entry(identity, failed.kind().name(), failed.message(), failed.attempts(),
                    clock.instant().toString())));
            outstanding.keySet().removeIf(run.ingested()::isIngested);
            ledger.rewrite(outstanding.values());
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
            status = RunStatus.FAILED;
        }
        progress.transition(run, status, summary(run, status));
        log.info("Ingestion {}: {} fetched, {} failed, {} empty, {} skipped, {} batches flushed",
            status.wireName(), run.succeeded(), run.failed(), run.empty(), run.skipped(), run.batchesFlushed());
        if (failure != null) {
            throw failure;
        }
        return status;
    }

    private static String summary(PipelineState run, RunStatus status) {
        return String.format("%s: %d fetched, %d failed, %d processed of %d",
            status.wireName(), run.succeeded(), run.failed(), run.processed(), run.total());
    }

    /**
     * @return the final status of the last finished run, or {@code null} while running or before the first run
     */
    public RunStatus getLastRunStatus() {
        return lastRunStatus;
    }

    /**
     * @return the state of the current or last run, or {@code null} before the first run
     */
    public PipelineState getPipelineState() {
        return state;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public AdaptiveRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public Path getRecordLog() {
        return batcher.getRecordLog();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        PipelineState current = state;
        if (current != null) {
            metrics.put("identities_total", current.total());
            metrics.put("identities_processed", current.processed());
            metrics.put("records_fetched", current.succeeded());
            metrics.put("identities_failed", current.failed());
            metrics.put("identities_empty", current.empty());
            metrics.put("identities_skipped", current.skipped());
            metrics.put("identities_deferred", current.deferred());
            metrics.put("batches_flushed", current.batchesFlushed());
        }
        metrics.put("circuit_breaker_trips", circuitBreaker.getTripCount());
        metrics.put("rate_limiter_failures", rateLimiter.getFailureCount());
    }
}
