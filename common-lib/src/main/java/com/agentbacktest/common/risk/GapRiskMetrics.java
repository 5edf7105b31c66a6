package com.agentbacktest.common.risk;

/**
 * Overnight gap statistics of one symbol over the lookback window.
 *
 * @param averageGapPct mean of the significant gaps only, 0 when there are none
 * @param gapFrequency  significant gap days / observed gap days
 */
public record GapRiskMetrics(
    double maxGapPct,
    double averageGapPct,
    double gapFrequency,
    double expectedSlippage
) {

    public static final GapRiskMetrics NONE = new GapRiskMetrics(0.0, 0.0, 0.0, 0.0);
}
