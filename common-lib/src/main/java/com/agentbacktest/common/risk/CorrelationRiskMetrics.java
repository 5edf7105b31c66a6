package com.agentbacktest.common.risk;

/**
 * Pairwise return correlation of the assets considered together.
 *
 * @param diversificationRatio volatility of the equal-weighted portfolio of standardized returns:
 *                             1 for one asset or perfectly correlated assets, lower values mean
 *                             more diversification benefit
 * @param assetCount           number of assets the metrics were computed over
 */
public record CorrelationRiskMetrics(
    double portfolioCorrelation,
    double maxPairCorrelation,
    double correlationConcentration,
    double diversificationRatio,
    int assetCount
) {

    public static CorrelationRiskMetrics singleAsset() {
        return new CorrelationRiskMetrics(0.0, 0.0, 0.0, 1.0, 1);
    }
}
