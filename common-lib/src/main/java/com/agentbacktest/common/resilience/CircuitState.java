package com.agentbacktest.common.resilience;

import java.time.Instant;

/**
 * Snapshot of one channel's breaker.
 *
 * @param openUntil end of the cooldown when {@code status == OPEN}, otherwise {@code null}
 */
public record CircuitState(
    Status status,
    Instant openUntil,
    int consecutiveFailures
) {

    public enum Status { CLOSED, OPEN, HALF_OPEN }

    public static CircuitState closed() {
        return new CircuitState(Status.CLOSED, null, 0);
    }

    public boolean isOpen() {
        return status == Status.OPEN;
    }
}
