package com.agentbacktest.common.exception;

import com.agentbacktest.common.model.AgentRole;

import java.time.Duration;

public class ProviderTimeoutException extends AgentException {
    private final Duration timeout;

    public ProviderTimeoutException(AgentRole role, Duration timeout) {
        super(role, "Decision provider did not answer within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
