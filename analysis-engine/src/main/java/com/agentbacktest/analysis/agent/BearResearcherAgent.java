package com.agentbacktest.analysis.agent;

import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.TradeAction;
import org.springframework.stereotype.Component;

@Component
public class BearResearcherAgent extends ResearcherAgent {

    @Override
    public AgentRole role() { return AgentRole.BEAR_RESEARCHER; }

    @Override
    protected TradeAction favoured() { return TradeAction.SELL; }
}
