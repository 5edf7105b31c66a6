package com.agentbacktest.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record NewsReport(
    @JsonProperty("signal") TradeAction signal,
    @JsonProperty("impactScore") double impactScore,
    @JsonProperty("headlines") List<String> headlines
) implements OpinionPayload {

    public NewsReport {
        headlines = headlines == null ? List.of() : List.copyOf(headlines);
    }

    public static NewsReport neutral() {
        return new NewsReport(TradeAction.HOLD, 0.0, List.of());
    }

    @Override
    public void validate() {
        OpinionPayload.requirePresent("signal", signal);
        OpinionPayload.requireSignedUnit("impactScore", impactScore);
    }
}
