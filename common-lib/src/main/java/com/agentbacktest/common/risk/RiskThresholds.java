package com.agentbacktest.common.risk;

import com.agentbacktest.common.exception.InvalidConfigurationException;

/**
 * Configuration of {@link RiskAnalyzer}. {@link #defaults()} carries the calibrated values.
 */
public record RiskThresholds(
    int lookbackDays,
    int correlationWindow,
    double gapThreshold,
    double slippageMultiplier,
    double varConfidence,
    double varGapWeight,
    double gapRiskSensitivity,
    double correlationRiskSensitivity,
    double minGapFactor,
    double minCorrelationFactor,
    double maxDiversificationBonus,
    double minPositionAdjustment,
    double highRiskScore,
    double moderateRiskScore,
    double largeGapThreshold,
    double frequentGapThreshold,
    double highCorrelationThreshold,
    double extremeCorrelationThreshold,
    double lowDiversificationThreshold
) {

    // composite score weights
    static final double GAP_MAX_WEIGHT           = 100.0;
    static final double GAP_FREQUENCY_WEIGHT     = 50.0;
    static final double GAP_SLIPPAGE_WEIGHT      = 100.0;
    static final double CORR_PORTFOLIO_WEIGHT    = 30.0;
    static final double CORR_MAX_PAIR_WEIGHT     = 20.0;
    static final double CORR_DIVERSIFICATION_WEIGHT = 10.0;
    static final double CONCENTRATION_WEIGHT     = 40.0;
    static final double GAP_SUBSCORE_CAP         = 30.0;
    static final double CORR_SUBSCORE_CAP        = 30.0;

    public static RiskThresholds defaults() {
        return new RiskThresholds(
            30, 60,
            0.02, 0.5,
            0.95, 1.0,
            2.0, 0.5,
            0.5, 0.7, 1.2, 0.3,
            70.0, 50.0,
            0.05, 0.10, 0.7, 0.9, 0.9);
    }

    public RiskThresholds withGapThreshold(double value) {
        return new RiskThresholds(lookbackDays, correlationWindow, value, slippageMultiplier,
            varConfidence, varGapWeight, gapRiskSensitivity, correlationRiskSensitivity,
            minGapFactor, minCorrelationFactor, maxDiversificationBonus, minPositionAdjustment,
            highRiskScore, moderateRiskScore, largeGapThreshold, frequentGapThreshold,
            highCorrelationThreshold, extremeCorrelationThreshold, lowDiversificationThreshold);
    }

    public RiskThresholds withVarConfidence(double value) {
        return new RiskThresholds(lookbackDays, correlationWindow, gapThreshold, slippageMultiplier,
            value, varGapWeight, gapRiskSensitivity, correlationRiskSensitivity,
            minGapFactor, minCorrelationFactor, maxDiversificationBonus, minPositionAdjustment,
            highRiskScore, moderateRiskScore, largeGapThreshold, frequentGapThreshold,
            highCorrelationThreshold, extremeCorrelationThreshold, lowDiversificationThreshold);
    }

    public RiskThresholds withHighCorrelationThreshold(double value) {
        return new RiskThresholds(lookbackDays, correlationWindow, gapThreshold, slippageMultiplier,
            varConfidence, varGapWeight, gapRiskSensitivity, correlationRiskSensitivity,
            minGapFactor, minCorrelationFactor, maxDiversificationBonus, minPositionAdjustment,
            highRiskScore, moderateRiskScore, largeGapThreshold, frequentGapThreshold,
            value, extremeCorrelationThreshold, lowDiversificationThreshold);
    }

    public RiskThresholds validate() {
        if (lookbackDays < 2) throw new InvalidConfigurationException("lookbackDays must be >= 2");
        if (correlationWindow < 2) throw new InvalidConfigurationException("correlationWindow must be >= 2");
        if (!(gapThreshold > 0 && gapThreshold < 1)) {
            throw new InvalidConfigurationException("gapThreshold must be within (0,1), was " + gapThreshold);
        }
        if (!(varConfidence > 0.5 && varConfidence < 1)) {
            throw new InvalidConfigurationException("varConfidence must be within (0.5,1), was " + varConfidence);
        }
        if (!(highCorrelationThreshold > 0 && highCorrelationThreshold <= 1)) {
            throw new InvalidConfigurationException("highCorrelationThreshold must be within (0,1]");
        }
        if (!(minPositionAdjustment > 0 && minPositionAdjustment <= 1)) {
            throw new InvalidConfigurationException("minPositionAdjustment must be within (0,1]");
        }
        return this;
    }
}
