package com.agentbacktest.engine.position;

import java.time.LocalDate;
import java.util.Map;

/**
 * Immutable snapshot of the portfolio at one point of the simulation.
 *
 * @param totalValue   cash plus the marked value of every position
 * @param exposure     marked value of all positions over total value
 * @param realizedPnl  P&amp;L booked by every sell so far, closed positions included
 */
public record PortfolioState(
    LocalDate date,
    double cash,
    Map<String, Position> positions,
    double totalValue,
    double exposure,
    double realizedPnl,
    double unrealizedPnl,
    double totalReturn
) {

    public PortfolioState {
        positions = Map.copyOf(positions);
    }

    public double quantity(String symbol) {
        Position p = positions.get(symbol);
        return p == null ? 0.0 : p.quantity();
    }

    public double positionsValue() {
        return positions.values().stream().mapToDouble(Position::marketValue).sum();
    }
}
