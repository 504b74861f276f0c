package com.mouse.odds.resilience;

import com.mouse.odds.config.SourceConfig;
import com.mouse.odds.enums.CircuitState;
import com.mouse.odds.events.CircuitBreakerReset;
import com.mouse.odds.events.CircuitBreakerStateChange;
import com.mouse.odds.exception.CircuitOpenException;
import com.mouse.odds.interfaces.SignalPublisher;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * CLOSED -> OPEN after {@code failureThreshold} consecutive failures; OPEN -> HALF_OPEN on the first
 * call after {@code resetTimeout}; HALF_OPEN admits exactly one trial which closes or re-opens it.
 */
@Slf4j
public class CircuitBreaker {

    private final String sourceId;
    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final Clock clock;
    private final SignalPublisher publisher;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private long lastFailureTime;
    private boolean trialInFlight;

    public CircuitBreaker(SourceConfig config, Clock clock, SignalPublisher publisher) {
        this.sourceId = config.getSourceId();
        this.failureThreshold = config.getFailureThreshold();
        this.resetTimeoutMs = config.getResetTimeoutMs();
        this.clock = clock;
        this.publisher = publisher;
    }

    /**
     * @throws CircuitOpenException if the call must not reach the network
     */
    public synchronized void beforeCall() {
        if (state == CircuitState.OPEN) {
            long elapsed = clock.millis() - lastFailureTime;
            if (elapsed < resetTimeoutMs) {
                throw new CircuitOpenException(sourceId, resetTimeoutMs - elapsed);
            }
            transitionTo(CircuitState.HALF_OPEN);
            trialInFlight = true;
            return;
        }

        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                throw new CircuitOpenException(sourceId, 0);
            }
            trialInFlight = true;
        }
    }

    public synchronized void onSuccess() {
        failureCount = 0;
        trialInFlight = false;
        if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.CLOSED);
        }
    }

    public synchronized void onFailure() {
        failureCount++;
        lastFailureTime = clock.millis();

        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            log.warn("Trial call failed for {}, re-opening circuit", sourceId);
            transitionTo(CircuitState.OPEN);
        } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            log.warn("{} consecutive failures for {}, opening circuit for {}ms", failureCount, sourceId, resetTimeoutMs);
            transitionTo(CircuitState.OPEN);
        }
    }

    /**
     * Administrative override: forces CLOSED and forgets past failures.
     */
    public synchronized void reset() {
        failureCount = 0;
        lastFailureTime = 0;
        trialInFlight = false;
        if (state != CircuitState.CLOSED) {
            transitionTo(CircuitState.CLOSED);
        }
        log.info("Circuit breaker reset for {}", sourceId);
        publisher.publish(new CircuitBreakerReset(sourceId));
    }

    /**
     * True while the circuit is OPEN and its reset timeout has not elapsed.
     */
    public synchronized boolean isRejecting() {
        return state == CircuitState.OPEN && clock.millis() - lastFailureTime < resetTimeoutMs;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime == 0 ? null : Instant.ofEpochMilli(lastFailureTime);
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        log.info("Circuit breaker {} | {} -> {}", sourceId, previous, next);
        publisher.publish(new CircuitBreakerStateChange(sourceId, next));
    }
}
