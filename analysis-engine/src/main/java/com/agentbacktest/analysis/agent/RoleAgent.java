package com.agentbacktest.analysis.agent;

import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.provider.AgentContext;

public interface RoleAgent {
    AgentVerdict analyze(AgentContext context);
    AgentRole role();
}
