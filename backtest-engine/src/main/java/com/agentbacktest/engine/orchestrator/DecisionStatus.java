package com.agentbacktest.engine.orchestrator;

public enum DecisionStatus {
    /** BUY or SELL filled by the position manager. */
    EXECUTED,
    /** BUY or SELL refused by a business rule; the portfolio is unchanged. */
    REJECTED,
    HOLD,
    /** No market data for the symbol on that date. */
    SKIPPED,
    /** The run was cancelled before the cycle reached execution. */
    CANCELLED
}
