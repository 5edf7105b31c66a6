package com.agentbacktest.common.model;

/**
 * Typed content of an {@link AgentOpinion}. Every {@link AgentRole} maps to exactly
 * one implementation, see {@link AgentRole#payloadType()}.
 */
public interface OpinionPayload {

    /**
     * Checks field ranges after deserialization.
     *
     * @throws IllegalArgumentException naming the first invalid field
     */
    void validate();

    static void requireUnit(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(field + " must be within [0,1], was " + value);
        }
    }

    static void requireSignedUnit(String field, double value) {
        if (Double.isNaN(value) || value < -1.0 || value > 1.0) {
            throw new IllegalArgumentException(field + " must be within [-1,1], was " + value);
        }
    }

    static void requirePresent(String field, Object value) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
