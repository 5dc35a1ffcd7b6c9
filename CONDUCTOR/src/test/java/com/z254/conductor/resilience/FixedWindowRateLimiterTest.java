package com.z254.conductor.resilience;

import com.z254.conductor.testing.fixtures.TestDataFactories;
import com.z254.conductor.testing.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FixedWindowRateLimiter}.
 */
class FixedWindowRateLimiterTest {

    private MutableClock clock;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestDataFactories.REFERENCE_INSTANT);
        limiter = new FixedWindowRateLimiter(3, Duration.ofSeconds(60), clock);
    }

    @Test
    @DisplayName("should reject once the window is exhausted")
    void rejectsBeyondLimit() {
        assertThat(limiter.tryAcquire("knowledge-base").isAllowed()).isTrue();
        assertThat(limiter.tryAcquire("knowledge-base").isAllowed()).isTrue();
        assertThat(limiter.tryAcquire("knowledge-base").getRemaining()).isZero();

        clock.advance(Duration.ofSeconds(20));
        FixedWindowRateLimiter.Decision rejected = limiter.tryAcquire("knowledge-base");

        assertThat(rejected.isAllowed()).isFalse();
        assertThat(rejected.getRetryAfter()).isEqualTo(Duration.ofSeconds(40));
    }

    @Test
    @DisplayName("should start a fresh window after the window size")
    void resetsAfterWindow() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("knowledge-base");
        }

        clock.advance(Duration.ofSeconds(60));

        assertThat(limiter.tryAcquire("knowledge-base").isAllowed()).isTrue();
        assertThat(limiter.getRemaining("knowledge-base")).isEqualTo(2);
    }

    @Test
    @DisplayName("should count each API separately")
    void separateApis() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("knowledge-base");
        }

        assertThat(limiter.tryAcquire("code-examples").isAllowed()).isTrue();
        assertThat(limiter.getRemaining("agent-delegation")).isEqualTo(3);
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new FixedWindowRateLimiter(0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
