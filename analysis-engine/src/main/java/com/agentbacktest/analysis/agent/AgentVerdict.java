package com.agentbacktest.analysis.agent;

import com.agentbacktest.common.model.OpinionPayload;

/** Typed answer of a {@link RoleAgent} before it is serialized for the orchestrator. */
public record AgentVerdict(
    OpinionPayload payload,
    double confidence,
    String rationale
) {

    public static AgentVerdict of(OpinionPayload payload, double confidence, String rationale) {
        return new AgentVerdict(payload, Math.max(0.0, Math.min(1.0, confidence)), rationale);
    }
}
