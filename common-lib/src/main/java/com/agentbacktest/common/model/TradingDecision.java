package com.agentbacktest.common.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Final output of one decision cycle. Immutable once produced and kept for audit.
 *
 * @param quantity requested quantity; {@code 0} means the position manager sizes the order
 */
public record TradingDecision(
    String id,
    LocalDate date,
    String symbol,
    TradeAction action,
    double quantity,
    OrderKind orderKind,
    double confidence,
    String rationale,
    double positionSizePct,
    double stopLossPct,
    double takeProfitPct,
    RiskAssessment riskAssessment,
    List<AgentOpinion> opinions
) {

    public TradingDecision {
        opinions = opinions == null ? List.of() : List.copyOf(opinions);
    }

    public static TradingDecision hold(String id, LocalDate date, String symbol, String rationale) {
        return new TradingDecision(id, date, symbol, TradeAction.HOLD, 0.0, OrderKind.MARKET, 0.0,
            rationale, 0.0, RiskStance.NEUTRAL.stopLossPct(), RiskStance.NEUTRAL.takeProfitPct(),
            RiskAssessment.neutral(), List.of());
    }

    public TradingDecision withQuantity(double newQuantity) {
        return new TradingDecision(id, date, symbol, action, newQuantity, orderKind, confidence,
            rationale, positionSizePct, stopLossPct, takeProfitPct, riskAssessment, opinions);
    }
}
