package org.promoharvest.pipeline.utils.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Consecutive-failure circuit breaker guarding the fetch call.
 * <p>
 * After {@code threshold} consecutive failures the breaker opens and {@link #allow()} returns
 * {@code false} until the cool-down has elapsed. The first call after that is let through as a probe
 * (half-open); further calls are rejected until the probe reports back. A failed probe re-opens the
 * breaker with a fresh cool-down, a successful one closes it. Thread-safe.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final int threshold;
    private final long coolDownMs;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private long openedAt;
    private boolean probeInFlight;
    private long tripCount;

    public CircuitBreaker(int threshold, Duration coolDown) {
        this(threshold, coolDown, Clock.systemUTC());
    }

    public CircuitBreaker(int threshold, Duration coolDown, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1: " + threshold);
        }
        this.threshold = threshold;
        this.coolDownMs = coolDown.toMillis();
        this.clock = clock;
    }

    public synchronized boolean allow() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.millis() - openedAt >= coolDownMs) {
                    state = State.HALF_OPEN;
                    probeInFlight = true;
                    log.info("Circuit breaker half-open, letting one probe through");
                    return true;
                }
                return false;
            default:
                if (!probeInFlight) {
                    probeInFlight = true;
                    return true;
                }
                return false;
        }
    }

    public synchronized void onSuccess() {
        if (state != State.CLOSED) {
            log.info("Circuit breaker closed after successful probe");
        }
        state = State.CLOSED;
        consecutiveFailures = 0;
        probeInFlight = false;
    }

    public synchronized void onFailure() {
        consecutiveFailures++;
        if (state == State.HALF_OPEN) {
            open("probe failed");
        } else if (state == State.CLOSED && consecutiveFailures >= threshold) {
            open(consecutiveFailures + " consecutive failures");
        }
    }

    /**
     * Reports an outcome that neither counts as failure nor proves recovery (e.g. a throttle signal).
     * A pending probe is released so the next {@link #allow()} may probe again.
     */
    public synchronized void onNeutral() {
        probeInFlight = false;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized long getTripCount() {
        return tripCount;
    }

    /**
     * @return milliseconds until the breaker lets a probe through, {@code 0} unless open
     */
    public synchronized long remainingCoolDownMs() {
        if (state != State.OPEN) {
            return 0;
        }
        return Math.max(0, openedAt + coolDownMs - clock.millis());
    }

    private void open(String reason) {
        state = State.OPEN;
        openedAt = clock.millis();
        probeInFlight = false;
        tripCount++;
        log.warn("Circuit breaker opened ({}), pausing fetches for {} ms", reason, coolDownMs);
    }
}
