package org.promoharvest.pipeline.utils.resilience;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Backoff parameters for {@link Retrier}.
 *
 * @param maxAttempts          total attempts for ordinary retryable failures
 * @param initialDelay         delay after the first failure; doubles per further failure
 * @param maxDelay             upper bound on a single backoff
 * @param maxThrottledRetries  extra attempts allowed after throttle signals
 * @param throttleMultiplier   factor applied to the backoff after a throttle signal
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay,
                          int maxThrottledRetries, double throttleMultiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (maxThrottledRetries < 0) {
            throw new IllegalArgumentException("maxThrottledRetries must be >= 0: " + maxThrottledRetries);
        }
        if (throttleMultiplier < 1.0) {
            throw new IllegalArgumentException("throttleMultiplier must be >= 1.0: " + throttleMultiplier);
        }
    }

    public static RetryPolicy of(int maxAttempts, Duration initialDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, Duration.ofSeconds(60), 5, 4.0);
    }

    /**
     * Reads a policy from a config block, falling back to the given defaults for absent keys.
     * Keys: {@code maxRetries}, {@code retryDelayMs}, {@code maxRetryDelayMs},
     * {@code maxRateLimitRetries}, {@code rateLimitBackoffMultiplier}.
     */
    public static RetryPolicy fromConfig(Config options, RetryPolicy defaults) {
        return new RetryPolicy(
            options.hasPath("maxRetries") ? options.getInt("maxRetries") : defaults.maxAttempts(),
            options.hasPath("retryDelayMs") ? Duration.ofMillis(options.getLong("retryDelayMs")) : defaults.initialDelay(),
            options.hasPath("maxRetryDelayMs") ? Duration.ofMillis(options.getLong("maxRetryDelayMs")) : defaults.maxDelay(),
            options.hasPath("maxRateLimitRetries") ? options.getInt("maxRateLimitRetries") : defaults.maxThrottledRetries(),
            options.hasPath("rateLimitBackoffMultiplier") ? options.getDouble("rateLimitBackoffMultiplier") : defaults.throttleMultiplier());
    }

    /**
     * Backoff after the {@code failure}-th counted failure: {@code initialDelay * 2^(failure-1)}, capped.
     */
    public long delayMs(int failure) {
        return capped(initialDelay.toMillis(), failure, 1.0);
    }

    /**
     * Backoff after the {@code throttle}-th throttle signal: the regular backoff scaled by the throttle multiplier.
     */
    public long throttleDelayMs(int throttle) {
        return capped(initialDelay.toMillis(), throttle, throttleMultiplier);
    }

    private long capped(long base, int n, double factor) {
        int shift = Math.min(Math.max(n - 1, 0), 30);
        double delay = base * (double) (1L << shift) * factor;
        return (long) Math.min(delay, maxDelay.toMillis() * Math.max(factor, 1.0));
    }
}
