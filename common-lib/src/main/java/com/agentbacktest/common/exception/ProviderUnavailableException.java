package com.agentbacktest.common.exception;

import com.agentbacktest.common.model.AgentRole;

/** Transient provider failure (network, overload, unexpected runtime error). */
public class ProviderUnavailableException extends AgentException {

    public ProviderUnavailableException(AgentRole role, String message) {
        super(role, message);
    }

    public ProviderUnavailableException(AgentRole role, String message, Throwable cause) {
        super(role, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
