package org.promoharvest.pipeline.utils.resilience;

/**
 * What {@link Retrier} does after classifying an attempt's result.
 */
public enum RetryDirective {
    /** Stop and return the result. */
    DONE,
    /** Back off exponentially and try again; consumes one of {@link RetryPolicy#maxAttempts()}. */
    RETRY,
    /** Back off longer and try again; consumes one of {@link RetryPolicy#maxThrottledRetries()}. */
    RETRY_THROTTLED,
    /** Try again at once without consuming budget, e.g. after fresh credentials. At most once per execution. */
    RETRY_IMMEDIATELY
}
