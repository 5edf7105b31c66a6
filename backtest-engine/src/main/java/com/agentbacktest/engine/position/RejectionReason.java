package com.agentbacktest.engine.position;

public enum RejectionReason {
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_POSITION,
    ZERO_QUANTITY
}
