package org.promoharvest.pipeline.api.fetch;

/**
 * Failure taxonomy of a single fetch attempt. The orchestrator branches on these kinds.
 */
public enum FetchErrorKind {
    /** Timeout, connection reset, 5xx. Retried with backoff and counted by the circuit breaker. */
    RETRYABLE,
    /** Explicit throttle from the producer. Longer backoff, not counted by the circuit breaker. */
    RATE_LIMITED,
    /** Credentials rejected. One re-authentication, then fatal for the identity. */
    AUTH_EXPIRED,
    /** Malformed response or permanently missing resource. Not retried. */
    FATAL
}
