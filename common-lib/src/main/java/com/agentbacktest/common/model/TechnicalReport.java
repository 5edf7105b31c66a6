package com.agentbacktest.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Market/technical analyst output. {@code rsi} and {@code macd} may be absent on short history. */
public record TechnicalReport(
    @JsonProperty("signal") TradeAction signal,
    @JsonProperty("trend") String trend,
    @JsonProperty("rsi") Double rsi,
    @JsonProperty("macd") Double macd
) implements OpinionPayload {

    public static TechnicalReport neutral() {
        return new TechnicalReport(TradeAction.HOLD, "SIDEWAYS", null, null);
    }

    @Override
    public void validate() {
        OpinionPayload.requirePresent("signal", signal);
        OpinionPayload.requirePresent("trend", trend);
        if (rsi != null && (rsi < 0 || rsi > 100)) {
            throw new IllegalArgumentException("rsi must be within [0,100], was " + rsi);
        }
    }
}
