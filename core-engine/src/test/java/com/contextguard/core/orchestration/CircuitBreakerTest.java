package com.contextguard.core.orchestration;

import com.contextguard.core.detection.HealthProbe;
import com.contextguard.core.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CircuitBreaker}.
 */
class CircuitBreakerTest {

    private static final Duration INTERVAL = Duration.ofMinutes(5);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private final AtomicInteger probes = new AtomicInteger();
    private CircuitBreaker breaker;

    @AfterEach
    void tearDown() {
        if (breaker != null) {
            breaker.close();
        }
    }

    @Test
    @DisplayName("Should start half-open and close after a healthy probe")
    void shouldCloseAfterHealthyProbe() {
        breaker = breaker(countingProbe(), Duration.ofSeconds(1));
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);

        assertThat(breaker.allowRequest()).isTrue();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(probes.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Closed breaker should admit calls without probing until the interval elapsed")
    void shouldNotReprobeWithinInterval() {
        breaker = breaker(countingProbe(), Duration.ofSeconds(1));
        breaker.allowRequest();

        clock.advance(Duration.ofMinutes(4));
        assertThat(breaker.allowRequest()).isTrue();
        assertThat(probes.get()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(1));
        healthy.set(false);
        assertThat(breaker.allowRequest()).isFalse();
        assertThat(probes.get()).isEqualTo(2);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("Open breaker should skip calls until the interval elapsed, then probe again")
    void shouldRecoverAfterInterval() {
        healthy.set(false);
        breaker = breaker(countingProbe(), Duration.ofSeconds(1));

        assertThat(breaker.allowRequest()).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        clock.advance(Duration.ofMinutes(1));
        assertThat(breaker.allowRequest()).isFalse();
        assertThat(probes.get()).isEqualTo(1);

        healthy.set(true);
        clock.advance(INTERVAL);
        assertThat(breaker.allowRequest()).isTrue();
        assertThat(probes.get()).isEqualTo(2);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("A probe that throws should open the breaker")
    void shouldOpenOnProbeException() {
        breaker = breaker(timeout -> {
            throw new IllegalStateException("connection refused");
        }, Duration.ofSeconds(1));

        assertThat(breaker.allowRequest()).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("A probe that exceeds its timeout should open the breaker")
    void shouldOpenOnProbeTimeout() {
        breaker = breaker(timeout -> {
            Thread.sleep(5_000);
            return true;
        }, Duration.ofMillis(50));

        long started = System.nanoTime();
        assertThat(breaker.allowRequest()).isFalse();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(3));
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("recordFailure() should open the breaker until the interval elapsed")
    void shouldOpenOnRecordedFailure() {
        breaker = breaker(countingProbe(), Duration.ofSeconds(1));
        breaker.allowRequest();

        breaker.recordFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.allowRequest()).isFalse();
        assertThat(probes.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("recordSuccess() should close the breaker")
    void shouldCloseOnRecordedSuccess() {
        breaker = breaker(countingProbe(), Duration.ofSeconds(1));

        breaker.recordSuccess();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.allowRequest()).isTrue();
        assertThat(probes.get()).isZero();
    }

    @Test
    @DisplayName("Callers arriving during a half-open probe should be skipped")
    void shouldSkipCallersDuringProbe() throws Exception {
        CountDownLatch probeStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        breaker = breaker(timeout -> {
            probes.incrementAndGet();
            probeStarted.countDown();
            return release.await(5, TimeUnit.SECONDS);
        }, Duration.ofSeconds(10));

        CompletableFuture<Boolean> first = CompletableFuture.supplyAsync(breaker::allowRequest);
        assertThat(probeStarted.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(breaker.allowRequest()).isFalse();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(probes.get()).isEqualTo(1);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should reject non-positive durations")
    void shouldRejectInvalidDurations() {
        assertThatThrownBy(() -> new CircuitBreaker(countingProbe(), Duration.ZERO, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreaker(countingProbe(), INTERVAL, Duration.ofMillis(-1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CircuitBreaker breaker(HealthProbe probe, Duration timeout) {
        return new CircuitBreaker(probe, INTERVAL, timeout, clock);
    }

    private HealthProbe countingProbe() {
        return timeout -> {
            probes.incrementAndGet();
            return healthy.get();
        };
    }
}
