package com.agentbacktest.engine.data;

/** A market data file exists but cannot be read or parsed. */
public class MarketDataException extends RuntimeException {

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
