package com.agentbacktest.engine.data;

import com.agentbacktest.common.model.MarketSnapshot;

import java.util.Optional;

/**
 * Price consistency checks applied to every bar read from disk. A bar that fails any
 * check is treated as missing for its date.
 */
public final class BarValidator {

    private BarValidator() {}

    /** Reason the bar is unusable, or empty when it passes every check. */
    public static Optional<String> defect(MarketSnapshot bar) {
        double open = bar.open();
        double high = bar.high();
        double low = bar.low();
        double close = bar.close();
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low) || !Double.isFinite(close)) {
            return Optional.of("non-finite price");
        }
        if (open <= 0 || high <= 0 || low <= 0 || close <= 0) {
            return Optional.of("non-positive price");
        }
        if (high < low) {
            return Optional.of("high below low");
        }
        if (open > high || close > high) {
            return Optional.of("open or close above high");
        }
        if (open < low || close < low) {
            return Optional.of("open or close below low");
        }
        if (bar.volume() < 0) {
            return Optional.of("negative volume");
        }
        return Optional.empty();
    }
}
