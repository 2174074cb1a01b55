package org.promoharvest.pipeline.utils.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Single retry/backoff loop shared by the fetch path and the re-authentication path.
 * <p>
 * Callers supply the attempt and a classifier that maps each result to a {@link RetryDirective};
 * the retrier owns attempt counting, backoff computation and sleeping.
 */
public class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    @FunctionalInterface
    public interface Attempt<T> {
        /**
         * @param attemptNumber 1-based attempt number within this execution
         */
        T call(int attemptNumber) throws InterruptedException;
    }

    @FunctionalInterface
    public interface Classifier<T> {
        RetryDirective classify(T result, int attemptNumber) throws InterruptedException;
    }

    /**
     * @param value      the last attempt's result
     * @param attempts   number of attempts made
     * @param exhausted  {@code true} if the loop ended because a retry budget ran out
     * @param aborted    {@code true} if the abort check stopped further retries
     */
    public record Outcome<T>(T value, int attempts, boolean exhausted, boolean aborted) {

        public boolean gaveUp() {
            return exhausted || aborted;
        }
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public Retrier(RetryPolicy policy) {
        this(policy, Sleeper.SYSTEM);
    }

    public Retrier(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> Outcome<T> execute(Attempt<T> attempt, Classifier<T> classifier) throws InterruptedException {
        return execute(attempt, classifier, () -> false);
    }

    /**
     * Runs {@code attempt} until the classifier says {@link RetryDirective#DONE}, a budget runs out,
     * or {@code abortCheck} returns {@code true} before a backoff.
     *
     * @throws InterruptedException if interrupted during an attempt or a backoff
     */
    public <T> Outcome<T> execute(Attempt<T> attempt, Classifier<T> classifier, BooleanSupplier abortCheck)
            throws InterruptedException {
        int failures = 0;
        int throttles = 0;
        boolean immediateUsed = false;
        int attemptNumber = 0;
        while (true) {
            attemptNumber++;
            T result = attempt.call(attemptNumber);
            RetryDirective directive = classifier.classify(result, attemptNumber);
            long delayMs;
            switch (directive) {
                case DONE:
                    return new Outcome<>(result, attemptNumber, false, false);
                case RETRY:
                    failures++;
                    if (failures >= policy.maxAttempts()) {
                        log.debug("Giving up after {} failed attempts", failures);
                        return new Outcome<>(result, attemptNumber, true, false);
                    }
                    delayMs = policy.delayMs(failures);
                    break;
                case RETRY_THROTTLED:
                    throttles++;
                    if (throttles > policy.maxThrottledRetries()) {
                        log.debug("Giving up after {} throttle signals", throttles);
                        return new Outcome<>(result, attemptNumber, true, false);
                    }
                    delayMs = policy.throttleDelayMs(throttles);
                    break;
                case RETRY_IMMEDIATELY:
                    if (immediateUsed) {
                        return new Outcome<>(result, attemptNumber, true, false);
                    }
                    immediateUsed = true;
                    delayMs = 0;
                    break;
                default:
                    throw new IllegalStateException("Unknown directive: " + directive);
            }
            if (abortCheck.getAsBoolean()) {
                log.debug("Retry aborted after attempt {}", attemptNumber);
                return new Outcome<>(result, attemptNumber, false, true);
            }
            if (delayMs > 0) {
                log.debug("Attempt {} -> {}, backing off {} ms", attemptNumber, directive, delayMs);
                sleeper.sleep(delayMs);
            }
        }
    }
}
