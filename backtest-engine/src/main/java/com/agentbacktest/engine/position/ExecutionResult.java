package com.agentbacktest.engine.position;

import com.agentbacktest.common.model.TradingDecision;

/**
 * Outcome of handing a decision to the {@link PositionManager}: either a filled
 * {@link Transaction} or a typed rejection. Rejections leave the portfolio untouched.
 */
public record ExecutionResult(
    TradingDecision decision,
    Transaction transaction,
    RejectionReason rejectionReason,
    String message
) {

    public static ExecutionResult filled(TradingDecision decision, Transaction transaction) {
        return new ExecutionResult(decision, transaction, null, transaction.note());
    }

    public static ExecutionResult rejected(TradingDecision decision, RejectionReason reason, String message) {
        return new ExecutionResult(decision, null, reason, message);
    }

    public boolean isFilled() {
        return transaction != null;
    }
}
