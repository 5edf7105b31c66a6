package com.agentbacktest.engine.support;

import com.agentbacktest.analysis.agent.AggressiveDebatorAgent;
import com.agentbacktest.analysis.agent.BearResearcherAgent;
import com.agentbacktest.analysis.agent.BullResearcherAgent;
import com.agentbacktest.analysis.agent.ConservativeDebatorAgent;
import com.agentbacktest.analysis.agent.FundamentalsAnalystAgent;
import com.agentbacktest.analysis.agent.MarketAnalystAgent;
import com.agentbacktest.analysis.agent.NeutralDebatorAgent;
import com.agentbacktest.analysis.agent.NewsAnalystAgent;
import com.agentbacktest.analysis.agent.SentimentAnalystAgent;
import com.agentbacktest.analysis.service.RuleBasedDecisionProvider;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

public final class Providers {

    private Providers() {}

    public static RuleBasedDecisionProvider ruleBased(ObjectMapper mapper) {
        return new RuleBasedDecisionProvider(List.of(
            new MarketAnalystAgent(), new SentimentAnalystAgent(), new NewsAnalystAgent(),
            new FundamentalsAnalystAgent(), new BullResearcherAgent(), new BearResearcherAgent(),
            new AggressiveDebatorAgent(), new ConservativeDebatorAgent(), new NeutralDebatorAgent()),
            mapper);
    }
}
