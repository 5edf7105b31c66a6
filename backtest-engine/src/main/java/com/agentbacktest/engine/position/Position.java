package com.agentbacktest.engine.position;

import java.time.LocalDate;

/**
 * Read-only view of an open position, as captured in a {@link PortfolioState}.
 *
 * @param entryPrice  volume-weighted fill price of all buys into the position
 * @param markPrice   latest price the position was marked to
 * @param realizedPnl P&amp;L already booked by partial sells
 */
public record Position(
    String symbol,
    double quantity,
    double entryPrice,
    LocalDate entryDate,
    double stopLossPct,
    double takeProfitPct,
    double markPrice,
    double realizedPnl
) {

    public double marketValue() {
        return quantity * markPrice;
    }

    public double unrealizedPnl() {
        return (markPrice - entryPrice) * quantity;
    }

    public double unrealizedReturn() {
        return entryPrice > 0.0 ? (markPrice - entryPrice) / entryPrice : 0.0;
    }
}
