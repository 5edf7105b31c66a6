package com.agentbacktest.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One risk debator's view: how strongly it endorses its stance and the sizing it proposes. */
public record RiskPerspective(
    @JsonProperty("stance") RiskStance stance,
    @JsonProperty("score") double score,
    @JsonProperty("positionSizeMultiplier") double positionSizeMultiplier,
    @JsonProperty("stopLossPct") double stopLossPct,
    @JsonProperty("takeProfitPct") double takeProfitPct,
    @JsonProperty("keyRisks") List<String> keyRisks
) implements OpinionPayload {

    public RiskPerspective {
        keyRisks = keyRisks == null ? List.of() : List.copyOf(keyRisks);
    }

    public static RiskPerspective neutral(RiskStance stance) {
        return new RiskPerspective(stance, 0.0, stance.sizeMultiplier(),
            stance.stopLossPct(), stance.takeProfitPct(), List.of());
    }

    @Override
    public void validate() {
        OpinionPayload.requirePresent("stance", stance);
        OpinionPayload.requireUnit("score", score);
        if (!(positionSizeMultiplier > 0.0 && positionSizeMultiplier <= 3.0)) {
            throw new IllegalArgumentException("positionSizeMultiplier must be within (0,3], was "
                + positionSizeMultiplier);
        }
        if (!(stopLossPct > 0.0 && stopLossPct < 1.0)) {
            throw new IllegalArgumentException("stopLossPct must be within (0,1), was " + stopLossPct);
        }
        if (!(takeProfitPct > 0.0 && takeProfitPct <= 5.0)) {
            throw new IllegalArgumentException("takeProfitPct must be within (0,5], was " + takeProfitPct);
        }
    }
}
