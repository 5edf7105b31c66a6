package com.agentbacktest.engine.position;

/**
 * A transaction broke a business rule. Raised during validation, before any state is
 * committed, and translated by {@link PositionManager} into a rejected {@link ExecutionResult}.
 */
public class TransactionRejectedException extends RuntimeException {
    private final RejectionReason reason;

    public TransactionRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
