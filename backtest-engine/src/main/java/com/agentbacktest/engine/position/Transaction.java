package com.agentbacktest.engine.position;

import com.agentbacktest.common.model.TradeAction;

import java.time.LocalDate;

/**
 * One filled order.
 *
 * @param totalCost cash paid for a BUY (notional plus costs) or cash received for a SELL
 *                  (notional minus costs)
 * @param note      free text, e.g. the exit reason of a forced sell
 */
public record Transaction(
    LocalDate date,
    String symbol,
    TradeAction action,
    double quantity,
    double price,
    double commission,
    double slippage,
    double totalCost,
    String decisionId,
    String note
) {

    public double notional() {
        return quantity * price;
    }
}
