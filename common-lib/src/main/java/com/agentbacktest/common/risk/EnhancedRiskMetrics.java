package com.agentbacktest.common.risk;

import java.util.List;

/**
 * Everything the risk layer knows about one symbol on one date.
 *
 * @param adjustedVar            historical VaR (a return, negative for a loss) widened for gap risk
 * @param positionSizeAdjustment multiplier applied to the requested position size
 * @param riskScore              composite score in [0,100], higher is riskier
 */
public record EnhancedRiskMetrics(
    GapRiskMetrics gapRisk,
    CorrelationRiskMetrics correlationRisk,
    double adjustedVar,
    double positionSizeAdjustment,
    double riskScore,
    List<String> recommendations
) {

    public EnhancedRiskMetrics {
        recommendations = List.copyOf(recommendations);
    }

    public static EnhancedRiskMetrics neutral() {
        return new EnhancedRiskMetrics(GapRiskMetrics.NONE, CorrelationRiskMetrics.singleAsset(),
            0.0, 1.0, 0.0, List.of());
    }
}
