package com.agentbacktest.engine.position;

public class InsufficientFundsException extends TransactionRejectedException {

    public InsufficientFundsException(double required, double available) {
        super(RejectionReason.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds: required=%.2f available=%.2f", required, available));
    }
}
