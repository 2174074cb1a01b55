package org.promoharvest.pipeline.utils.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounds the fetch rate over a sliding 60 second window and enforces a minimum spacing between attempts.
 * <p>
 * The spacing grows while failures accumulate: once more than {@value #FAILURE_THRESHOLD} failures are
 * outstanding and the last one happened within the window, the minimum delay is multiplied by
 * {@code 1 + 0.5 * (failures - 5)}. Each success pays one failure back.
 * <p>
 * Thread-safe. Waiting happens outside the monitor; the attempt slot is taken under it after re-checking.
 */
public class AdaptiveRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateLimiter.class);

    static final long WINDOW_MS = 60_000;
    static final long MAX_WAIT_MS = 30_000;
    static final int FAILURE_THRESHOLD = 5;
    static final double SLOWDOWN_STEP = 0.5;

    private final int maxPerMinute;
    private final long minDelayMs;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Deque<Long> window = new ArrayDeque<>();
    private long lastAttemptAt = Long.MIN_VALUE;
    private int failures;
    private long lastFailureAt = Long.MIN_VALUE;

    public AdaptiveRateLimiter(int maxPerMinute, Duration minDelay) {
        this(maxPerMinute, minDelay, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public AdaptiveRateLimiter(int maxPerMinute, Duration minDelay, Clock clock, Sleeper sleeper) {
        if (maxPerMinute < 1) {
            throw new IllegalArgumentException("maxPerMinute must be >= 1: " + maxPerMinute);
        }
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must not be negative: " + minDelay);
        }
        this.maxPerMinute = maxPerMinute;
        this.minDelayMs = minDelay.toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until an attempt is permitted, then records it.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitMs;
            synchronized (this) {
                long now = clock.millis();
                evictExpired(now);
                waitMs = 0;
                if (window.size() >= maxPerMinute) {
                    waitMs = Math.min(window.peekFirst() + WINDOW_MS - now, MAX_WAIT_MS);
                }
                if (lastAttemptAt != Long.MIN_VALUE) {
                    waitMs = Math.max(waitMs, lastAttemptAt + effectiveDelayMs(now) - now);
                }
                if (waitMs <= 0) {
                    window.addLast(now);
                    lastAttemptAt = now;
                    return;
                }
            }
            log.debug("Rate limiter waiting {} ms", waitMs);
            sleeper.sleep(waitMs);
        }
    }

    public synchronized void recordFailure() {
        failures++;
        lastFailureAt = clock.millis();
    }

    public synchronized void recordSuccess() {
        if (failures > 0) {
            failures--;
        }
    }

    public synchronized int getFailureCount() {
        return failures;
    }

    /**
     * @return attempts recorded within the last 60 seconds
     */
    public synchronized int getWindowCount() {
        evictExpired(clock.millis());
        return window.size();
    }

    /**
     * @return the current minimum spacing between attempts, including adaptive slowdown
     */
    public synchronized long getCurrentDelayMs() {
        return effectiveDelayMs(clock.millis());
    }

    private long effectiveDelayMs(long now) {
        if (failures > FAILURE_THRESHOLD && lastFailureAt != Long.MIN_VALUE && now - lastFailureAt < WINDOW_MS) {
            double multiplier = 1 + SLOWDOWN_STEP * (failures - FAILURE_THRESHOLD);
            return (long) (minDelayMs * multiplier);
        }
        return minDelayMs;
    }

    private void evictExpired(long now) {
        while (!window.isEmpty() && now - window.peekFirst() >= WINDOW_MS) {
            window.pollFirst();
        }
    }
}
