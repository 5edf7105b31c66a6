package com.agentbacktest.common.exception;

import com.agentbacktest.common.model.AgentRole;

import java.time.Instant;

/** Raised without touching the provider while a channel's breaker rejects calls. */
public class CircuitOpenException extends AgentException {
    private final Instant openUntil;

    public CircuitOpenException(AgentRole role, Instant openUntil) {
        super(role, "Circuit open until " + openUntil);
        this.openUntil = openUntil;
    }

    public Instant getOpenUntil() {
        return openUntil;
    }
}
