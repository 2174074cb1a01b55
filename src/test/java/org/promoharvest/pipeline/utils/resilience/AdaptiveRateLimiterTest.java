package org.promoharvest.pipeline.utils.resilience;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.promoharvest.test.utils.ManualClock;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AdaptiveRateLimiterTest {

    private final ManualClock clock = new ManualClock();

    @Test
    void acquire_firstAttemptDoesNotWait() throws Exception {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(25, Duration.ofMillis(1500), clock, clock.sleeper());

        limiter.acquire();

        assertThat(clock.sleeps()).isEmpty();
        assertThat(limiter.getWindowCount()).isEqualTo(1);
    }

    @Test
    void acquire_enforcesMinimumSpacing() throws Exception {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(25, Duration.ofMillis(1500), clock, clock.sleeper());

        limiter.acquire();
        clock.advanceMillis(500);
        limiter.acquire();

        assertThat(clock.sleeps()).containsExactly(1000L);
    }

    @Test
    void acquire_neverExceedsBudgetWithinWindow() throws Exception {
        // Given: 3 per minute without spacing
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(3, Duration.ZERO, clock, clock.sleeper());
        long start = clock.millis();

        // When: a fourth attempt is made
        for (int i = 0; i < 4; i++) {
            limiter.acquire();
        }

        // Then: it waited for the oldest attempt to leave the window
        assertThat(clock.millis() - start).isGreaterThanOrEqualTo(AdaptiveRateLimiter.WINDOW_MS);
        assertThat(limiter.getWindowCount()).isEqualTo(1);
    }

    @Test
    void acquire_capsSingleWaitButStillRespectsWindow() throws Exception {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(1, Duration.ZERO, clock, clock.sleeper());

        limiter.acquire();
        limiter.acquire();

        assertThat(clock.sleeps()).allMatch(ms -> ms <= AdaptiveRateLimiter.MAX_WAIT_MS);
        assertThat(clock.totalSlept()).isEqualTo(AdaptiveRateLimiter.WINDOW_MS);
    }

    @Test
    void slowdown_startsAfterFailureThreshold() {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(25, Duration.ofMillis(1000), clock, clock.sleeper());

        for (int i = 0; i < 5; i++) {
            limiter.recordFailure();
        }
        assertThat(limiter.getCurrentDelayMs()).isEqualTo(1000);

        limiter.recordFailure();
        limiter.recordFailure();
        assertThat(limiter.getCurrentDelayMs()).isEqualTo(2000);

        limiter.recordSuccess();
        assertThat(limiter.getFailureCount()).isEqualTo(6);
        assertThat(limiter.getCurrentDelayMs()).isEqualTo(1500);
    }

    @Test
    void slowdown_expiresWhenLastFailureLeavesWindow() {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(25, Duration.ofMillis(1000), clock, clock.sleeper());
        for (int i = 0; i < 8; i++) {
            limiter.recordFailure();
        }

        clock.advance(Duration.ofSeconds(61));

        assertThat(limiter.getCurrentDelayMs()).isEqualTo(1000);
    }

    @Test
    void constructor_rejectsInvalidBudget() {
        assertThatThrownBy(() -> new AdaptiveRateLimiter(0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
