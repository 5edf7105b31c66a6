package com.agentbacktest.analysis.agent;

import com.agentbacktest.common.model.AgentRole;
import org.springframework.stereotype.Component;

/** Argues for capital preservation; gains weight as risk rises and conviction falls. */
@Component
public class ConservativeDebatorAgent extends RiskDebatorAgent {

    @Override
    public AgentRole role() { return AgentRole.CONSERVATIVE_DEBATOR; }

    @Override
    protected double endorse(double conviction, double risk) {
        return 0.25 + 0.6 * risk - 0.3 * conviction;
    }

    @Override
    protected double confidence(double risk) {
        return 0.6 + 0.2 * risk;
    }
}
