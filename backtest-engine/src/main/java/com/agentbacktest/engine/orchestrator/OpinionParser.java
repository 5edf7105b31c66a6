package com.agentbacktest.engine.orchestrator;

import com.agentbacktest.common.exception.MalformedOutputException;
import com.agentbacktest.common.model.AgentOpinion;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.OpinionPayload;
import com.agentbacktest.common.provider.ProviderReply;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;

/**
 * Binds a provider reply to the payload type of its role and validates it.
 * Anything that does not bind or validate is a {@link MalformedOutputException}.
 */
public class OpinionParser {

    private final ObjectMapper objectMapper;

    public OpinionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public AgentOpinion parse(AgentRole role, ProviderReply reply, Instant timestamp, long durationMs) {
        if (reply == null || reply.content() == null || reply.content().isBlank()) {
            throw new MalformedOutputException(role, "Empty reply");
        }
        if (!(reply.confidence() >= 0.0 && reply.confidence() <= 1.0)) {
            throw new MalformedOutputException(role, "Confidence out of [0,1]: " + reply.confidence());
        }

        OpinionPayload payload;
        try {
            payload = objectMapper.readValue(reply.content(), role.payloadType());
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException(role, "Unparseable payload: " + e.getOriginalMessage(), e);
        }
        if (payload == null) {
            throw new MalformedOutputException(role, "Payload is null");
        }
        try {
            payload.validate();
        } catch (IllegalArgumentException e) {
            throw new MalformedOutputException(role, "Invalid payload: " + e.getMessage(), e);
        }
        String rationale = reply.rationale() == null ? "" : reply.rationale();
        return new AgentOpinion(role, timestamp, payload, reply.confidence(), rationale, durationMs, false);
    }
}
