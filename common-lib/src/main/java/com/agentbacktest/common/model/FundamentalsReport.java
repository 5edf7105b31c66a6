package com.agentbacktest.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code valuation} is one of UNDERVALUED, FAIR, OVERVALUED. */
public record FundamentalsReport(
    @JsonProperty("signal") TradeAction signal,
    @JsonProperty("valuation") String valuation,
    @JsonProperty("fairValueGapPct") double fairValueGapPct
) implements OpinionPayload {

    public static FundamentalsReport neutral() {
        return new FundamentalsReport(TradeAction.HOLD, "FAIR", 0.0);
    }

    @Override
    public void validate() {
        OpinionPayload.requirePresent("signal", signal);
        OpinionPayload.requirePresent("valuation", valuation);
        if (!Double.isFinite(fairValueGapPct)) {
            throw new IllegalArgumentException("fairValueGapPct must be finite");
        }
    }
}
