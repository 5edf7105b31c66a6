package com.agentbacktest.common.exception;

import com.agentbacktest.common.model.AgentRole;

/**
 * Base failure raised while obtaining an opinion for one agent role.
 * Never escapes the decision orchestrator: every subtype is either retried
 * or replaced by a neutral opinion.
 */
public class AgentException extends RuntimeException {
    private final AgentRole role;

    public AgentException(AgentRole role, String message) {
        super("[" + role + "] " + message);
        this.role = role;
    }

    public AgentException(AgentRole role, String message, Throwable cause) {
        super("[" + role + "] " + message, cause);
        this.role = role;
    }

    public AgentRole getRole() {
        return role;
    }

    /** Whether the resilient caller may retry the attempt that raised this failure. */
    public boolean isTransient() {
        return false;
    }
}
