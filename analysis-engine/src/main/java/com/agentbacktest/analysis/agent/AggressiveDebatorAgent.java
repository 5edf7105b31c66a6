package com.agentbacktest.analysis.agent;

import com.agentbacktest.common.model.AgentRole;
import org.springframework.stereotype.Component;

/** Argues for pressing strong convictions; discounts risk. */
@Component
public class AggressiveDebatorAgent extends RiskDebatorAgent {

    @Override
    public AgentRole role() { return AgentRole.AGGRESSIVE_DEBATOR; }

    @Override
    protected double endorse(double conviction, double risk) {
        return 0.2 + 0.8 * conviction - 0.3 * risk;
    }

    @Override
    protected double confidence(double risk) {
        return 0.7 - 0.2 * risk;
    }
}
