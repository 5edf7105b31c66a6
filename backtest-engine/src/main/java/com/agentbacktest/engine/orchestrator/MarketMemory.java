package com.agentbacktest.engine.orchestrator;

import com.agentbacktest.common.history.BoundedHistory;
import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.provider.MarketDataProvider;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-symbol recent bars and recent decisions of one run.
 *
 * <p>The bar history of a symbol is seeded from the data provider the first time the
 * symbol is observed and then grows by one bar per observed date, evicting the oldest
 * once {@code lookback} bars are held.
 */
public class MarketMemory {

    private final MarketDataProvider marketData;
    private final int lookback;
    private final int decisionCapacity;

    private final Map<String, BoundedHistory<MarketSnapshot>> bars      = new ConcurrentHashMap<>();
    private final Map<String, BoundedHistory<TradeAction>>    decisions = new ConcurrentHashMap<>();

    public MarketMemory(MarketDataProvider marketData, int lookback, int decisionCapacity) {
        this.marketData = marketData;
        this.lookback = lookback;
        this.decisionCapacity = decisionCapacity;
    }

    /**
     * Adds {@code snapshot} to its symbol's history unless it is not newer than the latest
     * bar held, and returns the history, oldest first.
     */
    public List<MarketSnapshot> observe(MarketSnapshot snapshot) {
        BoundedHistory<MarketSnapshot> history = bars.computeIfAbsent(snapshot.symbol(), symbol -> {
            BoundedHistory<MarketSnapshot> seeded = new BoundedHistory<>(lookback);
            marketData.history(symbol, snapshot.date(), lookback).forEach(seeded::append);
            return seeded;
        });
        boolean newer = history.latest()
            .map(last -> snapshot.date().isAfter(last.date()))
            .orElse(true);
        if (newer) history.append(snapshot);
        return history.all();
    }

    public List<MarketSnapshot> bars(String symbol) {
        BoundedHistory<MarketSnapshot> history = bars.get(symbol);
        return history == null ? List.of() : history.all();
    }

    public void recordDecision(String symbol, TradeAction action) {
        decisions.computeIfAbsent(symbol, s -> new BoundedHistory<>(decisionCapacity)).append(action);
    }

    /** Latest decisions of {@code symbol}, oldest first. */
    public List<TradeAction> recentActions(String symbol) {
        BoundedHistory<TradeAction> history = decisions.get(symbol);
        return history == null ? List.of() : history.all();
    }
}
