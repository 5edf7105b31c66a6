package com.agentbacktest.common.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of the risk discussion: winning stance, the score of every stance,
 * and the analyzer's composite score and sizing factor.
 */
public record RiskAssessment(
    RiskStance stance,
    Map<RiskStance, Double> stanceScores,
    List<String> keyRisks,
    double riskScore,
    double positionSizeAdjustment
) {

    public RiskAssessment {
        stanceScores = Map.copyOf(stanceScores);
        keyRisks = List.copyOf(keyRisks);
    }

    public static RiskAssessment neutral() {
        return new RiskAssessment(RiskStance.NEUTRAL,
            Map.of(RiskStance.AGGRESSIVE, 0.0, RiskStance.NEUTRAL, 0.0, RiskStance.CONSERVATIVE, 0.0),
            List.of(), 0.0, 1.0);
    }

    public double score(RiskStance s) {
        return stanceScores.getOrDefault(s, 0.0);
    }
}
