package com.agentbacktest.common.exception;

/**
 * Fatal configuration error. Raised before any simulation state is touched
 * and never recovered inside the engine.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
