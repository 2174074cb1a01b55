package org.promoharvest.pipeline.services;

import org.promoharvest.pipeline.api.fetch.FetchErrorKind;
import org.promoharvest.pipeline.api.resources.IIdentityTracker;
import org.promoharvest.pipeline.resources.idempotency.InMemoryIdentityTracker;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable state of one ingestion run, created at run start and owned by the orchestrator thread.
 * Counters and status are safe to read from the heartbeat thread.
 */
public final class PipelineState {

    /**
     * Why an identity ended the run without a record.
     */
    public record Failure(String identity, FetchErrorKind kind, String message, int attempts) {
    }

    private final Instant startedAt;
    private final IIdentityTracker ingested = new InMemoryIdentityTracker();
    private final Map<String, Failure> failures = Collections.synchronizedMap(new LinkedHashMap<>());

    final AtomicLong total = new AtomicLong();
    final AtomicLong processed = new AtomicLong();
    final AtomicLong succeeded = new AtomicLong();
    final AtomicLong failed = new AtomicLong();
    final AtomicLong empty = new AtomicLong();
    final AtomicLong skipped = new AtomicLong();
    final AtomicLong deferred = new AtomicLong();
    final AtomicLong requeued = new AtomicLong();
    final AtomicLong duplicates = new AtomicLong();
    final AtomicLong batchesFlushed = new AtomicLong();

    private volatile RunStatus status = RunStatus.STARTING;
    private volatile String lastIdentity;

    public PipelineState(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public IIdentityTracker ingested() {
        return ingested;
    }

    public RunStatus status() {
        return status;
    }

    void status(RunStatus status) {
        this.status = status;
    }

    public String lastIdentity() {
        return lastIdentity;
    }

    void lastIdentity(String identity) {
        this.lastIdentity = identity;
    }

    void recordFailure(Failure failure) {
        failures.put(failure.identity(), failure);
        failed.incrementAndGet();
    }

    void clearFailure(String identity) {
        failures.remove(identity);
    }

    /**
     * @return failures of identities that are still not ingested, in first-failure order
     */
    public Map<String, Failure> outstandingFailures() {
        synchronized (failures) {
            Map<String, Failure> copy = new LinkedHashMap<>(failures);
            copy.keySet().removeIf(ingested::isIngested);
            return copy;
        }
    }

    public long total() {
        return total.get();
    }

    public long processed() {
        return processed.get();
    }

    public long succeeded() {
        return succeeded.get();
    }

    public long failed() {
        return failed.get();
    }

    public long empty() {
        return empty.get();
    }

    public long skipped() {
        return skipped.get();
    }

    public long deferred() {
        return deferred.get();
    }

    public long requeued() {
        return requeued.get();
    }

    public long duplicates() {
        return duplicates.get();
    }

    public long batchesFlushed() {
        return batchesFlushed.get();
    }
}
