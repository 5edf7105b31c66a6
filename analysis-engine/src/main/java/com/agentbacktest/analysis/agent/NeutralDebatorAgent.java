package com.agentbacktest.analysis.agent;

import com.agentbacktest.common.model.AgentRole;
import org.springframework.stereotype.Component;

/** Balanced view; strongest when neither conviction nor risk is extreme. */
@Component
public class NeutralDebatorAgent extends RiskDebatorAgent {

    @Override
    public AgentRole role() { return AgentRole.NEUTRAL_DEBATOR; }

    @Override
    protected double endorse(double conviction, double risk) {
        return 0.45 - 0.2 * Math.abs(conviction - 0.5) - 0.1 * Math.abs(risk - 0.5);
    }

    @Override
    protected double confidence(double risk) {
        return 0.65;
    }
}
