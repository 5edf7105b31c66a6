package com.agentbacktest.analysis.service;

import com.agentbacktest.analysis.agent.AgentVerdict;
import com.agentbacktest.analysis.agent.RoleAgent;
import com.agentbacktest.common.exception.AgentException;
import com.agentbacktest.common.exception.MalformedOutputException;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.provider.AgentContext;
import com.agentbacktest.common.provider.DecisionProvider;
import com.agentbacktest.common.provider.ProviderReply;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic {@link DecisionProvider} backed by one rule-based {@link RoleAgent} per role.
 *
 * <p>Answers are serialized to JSON exactly as an external provider would return them, so the
 * orchestrator's parsing and validation path is exercised the same way in every run.
 */
@Service
public class RuleBasedDecisionProvider implements DecisionProvider {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedDecisionProvider.class);

    private final Map<AgentRole, RoleAgent> agents = new EnumMap<>(AgentRole.class);
    private final ObjectMapper objectMapper;

    public RuleBasedDecisionProvider(List<RoleAgent> agents, ObjectMapper objectMapper) {
        for (RoleAgent agent : agents) {
            RoleAgent previous = this.agents.put(agent.role(), agent);
            if (previous != null) {
                throw new IllegalStateException("Two agents registered for role " + agent.role());
            }
        }
        this.objectMapper = objectMapper;
        log.info("[RuleBasedProvider] {} role agents registered: {}", this.agents.size(), this.agents.keySet());
    }

    @Override
    public ProviderReply generate(AgentRole role, AgentContext context) {
        RoleAgent agent = agents.get(role);
        if (agent == null) {
            throw new AgentException(role, "No agent registered for role");
        }
        AgentVerdict verdict = agent.analyze(context);
        try {
            String content = objectMapper.writeValueAsString(verdict.payload());
            log.debug("[RuleBasedProvider] role={} symbol={} confidence={}",
                      role, context.symbol(), verdict.confidence());
            return new ProviderReply(content, verdict.confidence(), verdict.rationale());
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException(role, "Could not serialize payload", e);
        }
    }

    @Override
    public String providerName() {
        return "rule-based";
    }
}
