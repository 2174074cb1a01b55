package org.promoharvest.pipeline.services;

import org.promoharvest.pipeline.api.fetch.FetchResult;
import org.promoharvest.pipeline.api.fetch.IAuthenticator;
import org.promoharvest.pipeline.api.fetch.IRecordFetcher;
import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.api.records.IdentityResolver;
import org.promoharvest.pipeline.utils.resilience.AdaptiveRateLimiter;
import org.promoharvest.pipeline.utils.resilience.CircuitBreaker;
import org.promoharvest.pipeline.utils.resilience.Retrier;
import org.promoharvest.pipeline.utils.resilience.RetryDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Fetches one identity through the rate limiter and circuit breaker, retrying per the error taxonomy.
 * <p>
 * Every attempt, retries included, first acquires a rate-limiter slot and then asks the breaker. The
 * result of each attempt feeds back into both:
 * <ul>
 *   <li>record or empty: success for both</li>
 *   <li>retryable: failure for both, exponential backoff</li>
 *   <li>rate limited: failure for the limiter only, longer backoff</li>
 *   <li>auth expired: one re-authentication, then an immediate retry; fatal if that fails</li>
 *   <li>fatal: no retry, no breaker credit</li>
 * </ul>
 * Thread-safe; used by parallel fetch workers.
 */
class IdentityFetcher {

    private static final Logger log = LoggerFactory.getLogger(IdentityFetcher.class);

    private final IRecordFetcher fetcher;
    private final IAuthenticator authenticator;
    private final AdaptiveRateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final Retrier retrier;
    private final Retrier reauthRetrier;
    private final IdentityResolver resolver;
    private final Object authLock = new Object();

    /**
     * @param authenticator may be {@code null}, in which case auth failures are fatal right away
     */
    IdentityFetcher(IRecordFetcher fetcher, IAuthenticator authenticator, AdaptiveRateLimiter rateLimiter,
                    CircuitBreaker circuitBreaker, Retrier retrier, Retrier reauthRetrier, IdentityResolver resolver) {
        this.fetcher = fetcher;
        this.authenticator = authenticator;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retrier = retrier;
        this.reauthRetrier = reauthRetrier;
        this.resolver = resolver;
    }

    /** Per-attempt result; {@code null} fetch result means the breaker rejected the attempt. */
    private record Attempt(FetchResult result) {
        boolean gated() {
            return result == null;
        }
    }

    FetchOutcome fetch(String identity, BooleanSupplier stopRequested) throws InterruptedException {
        boolean[] reauthenticated = {false};
        Retrier.Outcome<Attempt> outcome = retrier.execute(
            attemptNumber -> {
                rateLimiter.acquire();
                if (!circuitBreaker.allow()) {
                    return new Attempt(null);
                }
                FetchResult result = fetcher.fetch(identity);
                log.debug("Fetch {} attempt {}: {}", identity, attemptNumber, result);
                return new Attempt(result);
            },
            (attempt, attemptNumber) -> classify(identity, attempt, reauthenticated),
            stopRequested);

        Attempt last = outcome.value();
        if (last.gated()) {
            return FetchOutcome.deferred(identity, outcome.attempts() - 1);
        }
        FetchResult result = last.result();
        if (result.isRecord()) {
            return FetchOutcome.record(identity, withIdentity(result.record().orElseThrow(), identity), outcome.attempts());
        }
        if (!result.isFailure()) {
            return FetchOutcome.empty(identity, outcome.attempts());
        }
        if (outcome.aborted()) {
            return FetchOutcome.aborted(identity, outcome.attempts());
        }
        return FetchOutcome.failed(identity, result.errorKind(), result.message(), outcome.attempts());
    }

    private RetryDirective classify(String identity, Attempt attempt, boolean[] reauthenticated) throws InterruptedException {
        if (attempt.gated()) {
            return RetryDirective.DONE;
        }
        FetchResult result = attempt.result();
        if (!result.isFailure()) {
            circuitBreaker.onSuccess();
            rateLimiter.recordSuccess();
            return RetryDirective.DONE;
        }
        switch (result.errorKind()) {
            case RETRYABLE:
                circuitBreaker.onFailure();
                rateLimiter.recordFailure();
                return RetryDirective.RETRY;
            case RATE_LIMITED:
                circuitBreaker.onNeutral();
                rateLimiter.recordFailure();
                return RetryDirective.RETRY_THROTTLED;
            case AUTH_EXPIRED:
                circuitBreaker.onNeutral();
                if (authenticator == null || reauthenticated[0]) {
                    return RetryDirective.DONE;
                }
                reauthenticated[0] = true;
                return reauthenticate(identity) ? RetryDirective.RETRY_IMMEDIATELY : RetryDirective.DONE;
            case FATAL:
            default:
                circuitBreaker.onNeutral();
                return RetryDirective.DONE;
        }
    }

    private boolean reauthenticate(String identity) throws InterruptedException {
        synchronized (authLock) {
            log.info("Credentials rejected while fetching {}, re-authenticating", identity);
            Retrier.Outcome<Boolean> outcome = reauthRetrier.execute(
                attemptNumber -> authenticator.reauthenticate(),
                (ok, attemptNumber) -> ok ? RetryDirective.DONE : RetryDirective.RETRY);
            if (!outcome.value()) {
                log.warn("Re-authentication failed after {} attempts", outcome.attempts());
            }
            return outcome.value();
        }
    }

    private HarvestRecord withIdentity(HarvestRecord record, String identity) {
        Optional<String> resolved = resolver.resolve(record);
        if (resolved.isPresent()) {
            if (!resolved.get().equals(identity)) {
                log.debug("Record fetched for {} carries identity {}", identity, resolved.get());
            }
            return record;
        }
        return record.withField(resolver.primaryField(), identity);
    }
}
