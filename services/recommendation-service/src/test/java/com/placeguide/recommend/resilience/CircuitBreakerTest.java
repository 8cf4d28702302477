package com.placeguide.recommend.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {
    private final AtomicLong now = new AtomicLong(1_000L);

    @Test
    void opensAfterConsecutiveFailuresAndClosesAfterWindow() {
        CircuitBreaker breaker = new CircuitBreaker("geo", 2, 500L, now::get);

        breaker.recordFailure();
        assertThat(breaker.allowRequest()).isTrue();

        breaker.recordFailure();
        assertThat(breaker.isOpen()).isTrue();

        now.addAndGet(499L);
        assertThat(breaker.allowRequest()).isFalse();

        now.addAndGet(1L);
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    void successResetsFailureStreak() {
        CircuitBreaker breaker = new CircuitBreaker("vector", 2, 500L, now::get);

        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertThat(breaker.allowRequest()).isTrue();
        assertThat(breaker.getName()).isEqualTo("vector");
    }
}
