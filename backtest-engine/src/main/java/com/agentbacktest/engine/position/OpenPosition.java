package com.agentbacktest.engine.position;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Mutable position record owned by {@link PositionManager}. Only touched while the
 * manager's lock is held; everything outside sees {@link Position} snapshots.
 */
@Data
@NoArgsConstructor
class OpenPosition {

    private String    symbol;
    private double    quantity;
    private double    entryPrice;
    private LocalDate entryDate;
    private double    stopLossPct;
    private double    takeProfitPct;
    private double    markPrice;
    private double    realizedPnl;

    Position toSnapshot() {
        return new Position(symbol, quantity, entryPrice, entryDate,
            stopLossPct, takeProfitPct, markPrice, realizedPnl);
    }
}
