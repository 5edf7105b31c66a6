package com.agentbacktest.analysis.indicator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure calculation utilities for technical indicators.
 * Input prices are expected newest-first (index 0 = most recent close).
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * RSI using Wilder's smoothed moving average.
     * @param prices  closing prices, newest-first
     * @param period  lookback period (typically 14)
     * @return RSI value 0–100, or NaN if insufficient data
     */
    public static double rsi(List<Double> prices, int period) {
        if (prices == null || prices.size() < period + 1) return Double.NaN;

        List<Double> oldest = oldestFirst(prices);
        int n = oldest.size();

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Moving averages ──────────────────────────────────────────────────────

    /**
     * @return SMA of the newest {@code period} prices, or NaN if insufficient data
     */
    public static double sma(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = 0; i < period; i++) sum += prices.get(i);
        return sum / period;
    }

    /**
     * @return most-recent EMA value, or NaN if insufficient data
     */
    public static double ema(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        List<Double> series = emaSeries(oldestFirst(prices), period);
        return series.get(series.size() - 1);
    }

    // ── MACD ────────────────────────────────────────────────────────────────

    /** MACD line = EMA(12) - EMA(26). */
    public static double macd(List<Double> prices) {
        double ema12 = ema(prices, 12);
        double ema26 = ema(prices, 26);
        if (Double.isNaN(ema12) || Double.isNaN(ema26)) return Double.NaN;
        return ema12 - ema26;
    }

    /** Signal line = EMA(9) of the MACD line; needs at least 26 + 9 prices. */
    public static double macdSignal(List<Double> prices) {
        if (prices == null || prices.size() < 26 + 9) return Double.NaN;
        List<Double> oldest = oldestFirst(prices);
        List<Double> fast = emaSeries(oldest, 12);
        List<Double> slow = emaSeries(oldest, 26);
        List<Double> macdLine = new ArrayList<>(oldest.size());
        for (int i = 0; i < oldest.size(); i++) {
            macdLine.add(fast.get(i) - slow.get(i));
        }
        List<Double> signal = emaSeries(macdLine.subList(25, macdLine.size()), 9);
        return signal.get(signal.size() - 1);
    }

    // ── Volatility ───────────────────────────────────────────────────────────

    public static double stdDev(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double mean = sma(prices, period);
        double variance = 0;
        for (int i = 0; i < period; i++) {
            double diff = prices.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    /** Return over the last {@code period} closes, NaN if insufficient data. */
    public static double momentum(List<Double> prices, int period) {
        if (prices == null || prices.size() < period + 1 || prices.get(period) <= 0) return Double.NaN;
        return prices.get(0) / prices.get(period) - 1.0;
    }

    // ── Signal helpers ───────────────────────────────────────────────────────

    public static String rsiSignal(double rsi) {
        if (Double.isNaN(rsi)) return "INSUFFICIENT_DATA";
        if (rsi < 30) return "OVERSOLD";
        if (rsi > 70) return "OVERBOUGHT";
        return "NEUTRAL";
    }

    public static String trendSignal(double sma20, double sma50, double currentPrice) {
        if (Double.isNaN(sma20) || Double.isNaN(sma50)) return "INSUFFICIENT_DATA";
        if (currentPrice > sma20 && sma20 > sma50) return "UPTREND";
        if (currentPrice < sma20 && sma20 < sma50) return "DOWNTREND";
        return "SIDEWAYS";
    }

    // ── internals ────────────────────────────────────────────────────────────

    private static List<Double> oldestFirst(List<Double> newestFirst) {
        List<Double> copy = new ArrayList<>(newestFirst);
        Collections.reverse(copy);
        return copy;
    }

    /** EMA at every index of an oldest-first series, seeded with the first value. */
    private static List<Double> emaSeries(List<Double> oldest, int period) {
        double k = 2.0 / (period + 1);
        List<Double> out = new ArrayList<>(oldest.size());
        double ema = oldest.get(0);
        out.add(ema);
        for (int i = 1; i < oldest.size(); i++) {
            ema = oldest.get(i) * k + ema * (1 - k);
            out.add(ema);
        }
        return out;
    }
}
