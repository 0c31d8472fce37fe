package com.contextguard.core.orchestration;

import com.contextguard.core.detection.HealthProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gate in front of the remote detection tier.
 *
 * <h3>States</h3>
 * <ul>
 * <li>{@code HALF_OPEN}: the next call runs a health probe first. This is
 * the initial state.</li>
 * <li>{@code CLOSED}: calls are admitted; once the probe interval has
 * elapsed since the last check, the next call re-probes.</li>
 * <li>{@code OPEN}: calls are skipped until the probe interval has elapsed,
 * then the breaker moves to {@code HALF_OPEN}.</li>
 * </ul>
 *
 * <p>
 * A probe runs on a dedicated thread and is abandoned after the probe
 * timeout; timeout, exception and an unhealthy answer all open the breaker.
 * Only one probe runs at a time; callers arriving meanwhile are skipped in
 * {@code HALF_OPEN} and admitted in {@code CLOSED}.
 * </p>
 *
 * @since 1.0.0
 */
public class CircuitBreaker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final HealthProbe probe;
    private final Duration probeInterval;
    private final Duration probeTimeout;
    private final Clock clock;
    private final ExecutorService probeExecutor;

    // guarded by this
    private State state = State.HALF_OPEN;
    private Instant lastCheck;
    private boolean probing;

    /**
     * @param probe         reachability check of the guarded service
     * @param probeInterval time between checks
     * @param probeTimeout  upper bound of a single check
     * @param clock         time source
     * @throws IllegalArgumentException if a duration is not positive
     */
    public CircuitBreaker(HealthProbe probe, Duration probeInterval, Duration probeTimeout, Clock clock) {
        this.probe = Objects.requireNonNull(probe, "HealthProbe must not be null");
        this.probeInterval = Objects.requireNonNull(probeInterval, "probeInterval must not be null");
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (probeInterval.isZero() || probeInterval.isNegative()) {
            throw new IllegalArgumentException("probeInterval must be > 0, got: " + probeInterval);
        }
        if (probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be > 0, got: " + probeTimeout);
        }
        this.probeExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "context-guard-health-probe");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Decide whether the guarded service may be called now, probing it
     * first when due.
     *
     * @return {@code true} if the call is admitted
     */
    public boolean allowRequest() {
        synchronized (this) {
            Instant now = clock.instant();
            boolean due = lastCheck == null || !now.isBefore(lastCheck.plus(probeInterval));
            switch (state) {
                case OPEN:
                    if (!due) {
                        return false;
                    }
                    transition(State.HALF_OPEN);
                    break;
                case CLOSED:
                    if (!due) {
                        return true;
                    }
                    break;
                case HALF_OPEN:
                default:
                    break;
            }
            if (probing) {
                return state == State.CLOSED;
            }
            probing = true;
        }

        boolean healthy = runProbe();

        synchronized (this) {
            probing = false;
            lastCheck = clock.instant();
            transition(healthy ? State.CLOSED : State.OPEN);
            return healthy;
        }
    }

    /**
     * A call through the breaker failed.
     */
    public synchronized void recordFailure() {
        lastCheck = clock.instant();
        transition(State.OPEN);
    }

    /**
     * A call through the breaker succeeded.
     */
    public synchronized void recordSuccess() {
        if (lastCheck == null) {
            lastCheck = clock.instant();
        }
        transition(State.CLOSED);
    }

    public synchronized State getState() {
        return state;
    }

    @Override
    public void close() {
        probeExecutor.shutdownNow();
    }

    private boolean runProbe() {
        Future<Boolean> check;
        try {
            check = probeExecutor.submit(() -> probe.isHealthy(probeTimeout));
        } catch (RejectedExecutionException e) {
            LOG.warn("Health probe rejected: {}", e.getMessage());
            return false;
        }
        try {
            return Boolean.TRUE.equals(check.get(probeTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            check.cancel(true);
            LOG.warn("Health probe timed out after {}", probeTimeout);
            return false;
        } catch (ExecutionException e) {
            LOG.warn("Health probe failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            check.cancel(true);
            return false;
        }
    }

    private void transition(State next) {
        if (state != next) {
            LOG.info("Remote circuit breaker {} -> {}", state, next);
            state = next;
        }
    }
}
