package com.agentbacktest.engine.position;

public class InsufficientPositionException extends TransactionRejectedException {

    public InsufficientPositionException(String symbol, double requested, double held) {
        super(RejectionReason.INSUFFICIENT_POSITION,
            String.format("Insufficient position in %s: requested=%.4f held=%.4f", symbol, requested, held));
    }
}
