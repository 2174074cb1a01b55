package org.promoharvest.pipeline.utils.resilience;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.promoharvest.junit.extensions.logging.ExpectLog;
import org.promoharvest.junit.extensions.logging.LogLevel;
import org.promoharvest.junit.extensions.logging.LogWatchExtension;
import org.promoharvest.test.utils.ManualClock;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CircuitBreakerTest {

    private final ManualClock clock = new ManualClock();
    private final CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofSeconds(60), clock);

    @Test
    void staysClosedBelowThreshold() {
        breaker.onFailure();
        breaker.onFailure();
        breaker.onSuccess();
        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.allow()).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Circuit breaker opened \\(3 consecutive failures\\).*")
    void opensAfterConsecutiveFailures() {
        tripBreaker();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.allow()).isFalse();
        assertThat(breaker.remainingCoolDownMs()).isEqualTo(60_000);
        assertThat(breaker.getTripCount()).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Circuit breaker opened.*")
    void halfOpenLetsExactlyOneProbeThrough() {
        tripBreaker();
        clock.advance(Duration.ofSeconds(60));

        assertThat(breaker.allow()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThat(breaker.allow()).isFalse();

        breaker.onSuccess();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isZero();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Circuit breaker opened.*", occurrences = 2)
    void failedProbeReopensWithFreshCoolDown() {
        tripBreaker();
        clock.advance(Duration.ofSeconds(60));
        assertThat(breaker.allow()).isTrue();

        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.remainingCoolDownMs()).isEqualTo(60_000);
        assertThat(breaker.getTripCount()).isEqualTo(2);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Circuit breaker opened.*")
    void neutralOutcomeReleasesProbe() {
        tripBreaker();
        clock.advance(Duration.ofSeconds(60));
        assertThat(breaker.allow()).isTrue();

        breaker.onNeutral();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThat(breaker.allow()).isTrue();
    }

    private void tripBreaker() {
        for (int i = 0; i < 3; i++) {
            breaker.onFailure();
        }
    }
}
