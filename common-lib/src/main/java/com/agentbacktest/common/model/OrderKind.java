package com.agentbacktest.common.model;

public enum OrderKind {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT
}
