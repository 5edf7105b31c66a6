package com.agentbacktest.common.provider;

import com.agentbacktest.common.model.MarketSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only, deterministic market data source for one run.
 */
public interface MarketDataProvider {

    /** Bar of {@code symbol} on {@code date}, empty when the market has no data for that day. */
    Optional<MarketSnapshot> get(String symbol, LocalDate date);

    /**
     * Up to {@code lookback} bars ending on {@code date} (inclusive), oldest first.
     */
    List<MarketSnapshot> history(String symbol, LocalDate date, int lookback);
}
