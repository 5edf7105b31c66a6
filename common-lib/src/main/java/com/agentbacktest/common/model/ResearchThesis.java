package com.agentbacktest.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Bull or bear advocacy built from the analyst reports. */
public record ResearchThesis(
    @JsonProperty("recommendation") TradeAction recommendation,
    @JsonProperty("conviction") double conviction,
    @JsonProperty("arguments") List<String> arguments
) implements OpinionPayload {

    public ResearchThesis {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static ResearchThesis neutral() {
        return new ResearchThesis(TradeAction.HOLD, 0.0, List.of());
    }

    @Override
    public void validate() {
        OpinionPayload.requirePresent("recommendation", recommendation);
        OpinionPayload.requireUnit("conviction", conviction);
    }
}
