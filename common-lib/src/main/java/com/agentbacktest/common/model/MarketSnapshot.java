package com.agentbacktest.common.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * One daily OHLCV bar with derived indicator values. Read-only for the whole run.
 */
public record MarketSnapshot(
    String symbol,
    LocalDate date,
    double open,
    double high,
    double low,
    double close,
    long volume,
    Map<String, Double> indicators
) {

    public static final String RSI         = "rsi";
    public static final String MACD        = "macd";
    public static final String MACD_SIGNAL = "macd_signal";
    public static final String SMA_20      = "sma_20";
    public static final String SMA_50      = "sma_50";
    public static final String SENTIMENT   = "sentiment";
    public static final String NEWS_IMPACT = "news_impact";
    public static final String PE_RATIO    = "pe_ratio";

    public MarketSnapshot {
        indicators = indicators == null ? Map.of() : Map.copyOf(indicators);
    }

    public static MarketSnapshot of(String symbol, LocalDate date,
                                    double open, double high, double low, double close, long volume) {
        return new MarketSnapshot(symbol, date, open, high, low, close, volume, Map.of());
    }

    /** Indicator value or {@code NaN} when the indicator was not derived for this bar. */
    public double indicator(String name) {
        Double value = indicators.get(name);
        return value != null ? value : Double.NaN;
    }

    public MarketSnapshot withIndicators(Map<String, Double> values) {
        return new MarketSnapshot(symbol, date, open, high, low, close, volume, values);
    }
}
