package com.z254.butterfly.concierge.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-capability circuit breaker.
 * <p>
 * CLOSED until {@code failureThreshold} failures are recorded, then OPEN. Once more than
 * {@code recoveryTimeout} has passed since the last failure, the next call to
 * {@link #currentState()} moves the breaker to HALF_OPEN; there is no background timer.
 * A failure while HALF_OPEN reopens immediately, a success from any state closes it.
 * <p>
 * Fields are not synchronized. Concurrent failures may both trip the breaker, which ends in
 * the same OPEN state either way.
 */
@Slf4j
public class CircuitBreaker {

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private volatile CircuitState state = CircuitState.CLOSED;
    private volatile int failureCount;
    private volatile Instant lastFailureTime = Instant.EPOCH;

    public CircuitBreaker(String name) {
        this(name, DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1: " + failureThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("Recovery timeout must not be negative: " + recoveryTimeout);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    /**
     * Read the state, moving OPEN to HALF_OPEN when the recovery timeout has elapsed.
     *
     * @return the state after any timed transition
     */
    public CircuitState currentState() {
        if (state == CircuitState.OPEN
                && Duration.between(lastFailureTime, clock.instant()).compareTo(recoveryTimeout) > 0) {
            state = CircuitState.HALF_OPEN;
            log.info("CircuitBreaker[{}]: OPEN -> HALF_OPEN", name);
        }
        return state;
    }

    /**
     * @return true unless the breaker is OPEN
     */
    public boolean isAvailable() {
        return currentState() != CircuitState.OPEN;
    }

    public void recordSuccess() {
        if (state != CircuitState.CLOSED) {
            log.info("CircuitBreaker[{}]: {} -> CLOSED", name, state);
        }
        state = CircuitState.CLOSED;
        failureCount = 0;
    }

    public void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (failureCount >= failureThreshold || state == CircuitState.HALF_OPEN) {
            if (state != CircuitState.OPEN) {
                log.warn("CircuitBreaker[{}]: {} -> OPEN (failures={})", name, state, failureCount);
            }
            state = CircuitState.OPEN;
        }
    }

    public String getName() {
        return name;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public Instant getLastFailureTime() {
        return lastFailureTime;
    }
}
