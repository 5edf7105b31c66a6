package com.agentbacktest.common.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure circuit breaker for a single channel.
 *
 * <pre>
 *   CLOSED    --threshold consecutive failures-->  OPEN(now + cooldown)
 *   OPEN      --first call after cooldown------->  HALF_OPEN (that call is the trial)
 *   HALF_OPEN --trial succeeds------------------>  CLOSED, counter reset
 *   HALF_OPEN --trial fails--------------------->  OPEN(now + cooldown)
 * </pre>
 *
 * <p>While OPEN, and while a HALF_OPEN trial is in flight, {@link #tryAcquirePermission()}
 * returns false so callers fail fast without touching the dependency.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String channel;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private CircuitState.Status status = CircuitState.Status.CLOSED;
    private Instant openUntil;
    private int consecutiveFailures;
    private boolean trialInFlight;

    public CircuitBreaker(String channel, int failureThreshold, Duration cooldown, Clock clock) {
        this.channel = channel;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public synchronized boolean tryAcquirePermission() {
        switch (status) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.instant().isBefore(openUntil)) {
                    return false;
                }
                status = CircuitState.Status.HALF_OPEN;
                openUntil = null;
                trialInFlight = true;
                log.info("[CircuitBreaker] HALF_OPEN channel={} admitting trial call", channel);
                return true;
            case HALF_OPEN:
            default:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
        }
    }

    public synchronized void onSuccess() {
        if (status != CircuitState.Status.CLOSED) {
            log.info("[CircuitBreaker] CLOSED channel={} after successful trial", channel);
        }
        status = CircuitState.Status.CLOSED;
        openUntil = null;
        consecutiveFailures = 0;
        trialInFlight = false;
    }

    public synchronized void onFailure() {
        consecutiveFailures++;
        if (status == CircuitState.Status.HALF_OPEN) {
            open("trial call failed");
        } else if (status == CircuitState.Status.CLOSED && consecutiveFailures >= failureThreshold) {
            open(consecutiveFailures + " consecutive failures");
        }
    }

    public synchronized CircuitState state() {
        return new CircuitState(status, openUntil, consecutiveFailures);
    }

    private void open(String reason) {
        status = CircuitState.Status.OPEN;
        openUntil = clock.instant().plus(cooldown);
        trialInFlight = false;
        log.warn("[CircuitBreaker] OPEN channel={} reason=\"{}\" openUntil={}", channel, reason, openUntil);
    }
}
