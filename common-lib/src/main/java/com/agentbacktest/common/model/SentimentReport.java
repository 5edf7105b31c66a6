package com.agentbacktest.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SentimentReport(
    @JsonProperty("signal") TradeAction signal,
    @JsonProperty("sentimentScore") double sentimentScore,
    @JsonProperty("mood") String mood
) implements OpinionPayload {

    public static SentimentReport neutral() {
        return new SentimentReport(TradeAction.HOLD, 0.0, "NEUTRAL");
    }

    @Override
    public void validate() {
        OpinionPayload.requirePresent("signal", signal);
        OpinionPayload.requireSignedUnit("sentimentScore", sentimentScore);
    }
}
