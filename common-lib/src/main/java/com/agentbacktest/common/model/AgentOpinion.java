package com.agentbacktest.common.model;

import java.time.Instant;

/**
 * Immutable result of one agent invocation.
 *
 * @param degraded true when the payload is the role's neutral placeholder
 *                 (provider failure, open circuit or invalid content)
 */
public record AgentOpinion(
    AgentRole role,
    Instant timestamp,
    OpinionPayload payload,
    double confidence,
    String rationale,
    long durationMs,
    boolean degraded
) {

    /** Confidence assigned to placeholder opinions. */
    public static final double NEUTRAL_CONFIDENCE = 0.1;

    public AgentOpinion {
        if (payload != null && role != null && !role.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                + " does not match role " + role);
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static AgentOpinion neutral(AgentRole role, Instant timestamp, String reason) {
        return new AgentOpinion(role, timestamp, role.neutralPayload(),
            NEUTRAL_CONFIDENCE, "Neutral placeholder: " + reason, 0L, true);
    }

    public <T extends OpinionPayload> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
