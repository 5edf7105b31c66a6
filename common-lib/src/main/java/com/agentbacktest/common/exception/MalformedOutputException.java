package com.agentbacktest.common.exception;

import com.agentbacktest.common.model.AgentRole;

/** Provider content that does not parse into, or validate as, the role's payload type. */
public class MalformedOutputException extends AgentException {

    public MalformedOutputException(AgentRole role, String message) {
        super(role, message);
    }

    public MalformedOutputException(AgentRole role, String message, Throwable cause) {
        super(role, message, cause);
    }
}
