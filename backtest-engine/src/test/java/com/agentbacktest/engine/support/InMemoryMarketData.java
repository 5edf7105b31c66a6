package com.agentbacktest.engine.support;

import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.provider.MarketDataProvider;
import com.agentbacktest.engine.simulation.TradingCalendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** Market data held in memory; bars are generated on trading days only. */
public final class InMemoryMarketData implements MarketDataProvider {

    private final Map<String, NavigableMap<LocalDate, MarketSnapshot>> bars = new ConcurrentHashMap<>();

    /** One gap-free bar per trading day from {@code start}, closing at the given prices. */
    public InMemoryMarketData withCloses(String symbol, LocalDate start, double... closes) {
        NavigableMap<LocalDate, MarketSnapshot> series = bars.computeIfAbsent(symbol, s -> new TreeMap<>());
        LocalDate day = start;
        double previous = closes.length > 0 ? closes[0] : 0.0;
        for (double close : closes) {
            while (!TradingCalendar.isTradingDay(day)) day = day.plusDays(1);
            double high = Math.max(previous, close);
            double low = Math.min(previous, close);
            series.put(day, MarketSnapshot.of(symbol, day, previous, high, low, close, 1_000_000L));
            previous = close;
            day = day.plusDays(1);
        }
        return this;
    }

    /** {@code days} trading days at a constant price. */
    public InMemoryMarketData withFlat(String symbol, LocalDate start, int days, double price) {
        double[] closes = new double[days];
        Arrays.fill(closes, price);
        return withCloses(symbol, start, closes);
    }

    public InMemoryMarketData with(MarketSnapshot snapshot) {
        bars.computeIfAbsent(snapshot.symbol(), s -> new TreeMap<>()).put(snapshot.date(), snapshot);
        return this;
    }

    @Override
    public Optional<MarketSnapshot> get(String symbol, LocalDate date) {
        NavigableMap<LocalDate, MarketSnapshot> series = bars.get(symbol);
        return series == null ? Optional.empty() : Optional.ofNullable(series.get(date));
    }

    @Override
    public List<MarketSnapshot> history(String symbol, LocalDate date, int lookback) {
        NavigableMap<LocalDate, MarketSnapshot> series = bars.get(symbol);
        if (series == null || lookback <= 0) return List.of();
        List<MarketSnapshot> out = new ArrayList<>(series.headMap(date, true).values());
        return Collections.unmodifiableList(out.subList(Math.max(0, out.size() - lookback), out.size()));
    }
}
