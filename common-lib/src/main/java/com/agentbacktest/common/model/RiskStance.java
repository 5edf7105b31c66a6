package com.agentbacktest.common.model;

/**
 * Risk posture taken by one of the three risk debators.
 *
 * <p>Each stance carries the default position-size multiplier and exit levels
 * applied when the stance wins the risk discussion.
 */
public enum RiskStance {
    AGGRESSIVE(1.5, 0.15, 0.30),
    NEUTRAL(1.0, 0.10, 0.20),
    CONSERVATIVE(0.5, 0.05, 0.10);

    private final double sizeMultiplier;
    private final double stopLossPct;
    private final double takeProfitPct;

    RiskStance(double sizeMultiplier, double stopLossPct, double takeProfitPct) {
        this.sizeMultiplier = sizeMultiplier;
        this.stopLossPct = stopLossPct;
        this.takeProfitPct = takeProfitPct;
    }

    public double sizeMultiplier() { return sizeMultiplier; }
    public double stopLossPct()    { return stopLossPct; }
    public double takeProfitPct()  { return takeProfitPct; }
}
