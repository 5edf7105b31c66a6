package com.agentbacktest.engine.orchestrator;

import com.agentbacktest.common.model.AgentOpinion;
import com.agentbacktest.common.model.ResearchThesis;
import com.agentbacktest.common.model.TradeAction;

/**
 * Deterministic merge of the bull and bear theses.
 *
 * <p>{@code signedScore} is the mean over both theses of
 * {@code direction(recommendation) × conviction × confidence}; its sign gives the
 * provisional action and its magnitude the conviction.
 */
public record DebateSynthesis(
    TradeAction action,
    double conviction,
    double signedScore,
    double bullConfidence,
    double bearConfidence
) {

    public static DebateSynthesis of(AgentOpinion bull, AgentOpinion bear) {
        double signed = (contribution(bull) + contribution(bear)) / 2.0;
        return new DebateSynthesis(TradeAction.fromDirection(signed), Math.abs(signed), signed,
            bull.confidence(), bear.confidence());
    }

    private static double contribution(AgentOpinion opinion) {
        ResearchThesis thesis = opinion.payloadAs(ResearchThesis.class);
        return thesis.recommendation().direction() * thesis.conviction() * opinion.confidence();
    }

    public double strongerConfidence() {
        return Math.max(bullConfidence, bearConfidence);
    }
}
