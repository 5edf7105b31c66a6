package com.agentbacktest.analysis.agent;

import com.agentbacktest.analysis.indicator.TechnicalIndicators;
import com.agentbacktest.common.exception.AgentException;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.model.TechnicalReport;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.provider.AgentContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Technical analyst: trend from SMA20/SMA50, momentum from RSI and MACD.
 * Prefers indicator values already attached to the snapshot and computes the rest.
 */
@Component
public class MarketAnalystAgent implements RoleAgent {

    private static final Logger log = LoggerFactory.getLogger(MarketAnalystAgent.class);

    private static final int RSI_PERIOD = 14;
    private static final double OVERBOUGHT = 70;
    private static final double OVERSOLD = 30;

    @Override
    public AgentRole role() { return AgentRole.MARKET_ANALYST; }

    @Override
    public AgentVerdict analyze(AgentContext context) {
        List<Double> prices = PriceSeries.closes(context);
        if (prices.isEmpty()) {
            throw new AgentException(role(), "No price data for symbol=" + context.symbol());
        }
        MarketSnapshot snap = context.snapshot();
        double current = snap.close();

        double rsi   = PriceSeries.indicatorOr(snap, MarketSnapshot.RSI, TechnicalIndicators.rsi(prices, RSI_PERIOD));
        double sma20 = PriceSeries.indicatorOr(snap, MarketSnapshot.SMA_20, TechnicalIndicators.sma(prices, 20));
        double sma50 = PriceSeries.indicatorOr(snap, MarketSnapshot.SMA_50, TechnicalIndicators.sma(prices, 50));
        double macd  = PriceSeries.indicatorOr(snap, MarketSnapshot.MACD, TechnicalIndicators.macd(prices));

        String trend = TechnicalIndicators.trendSignal(sma20, sma50, current);
        TradeAction signal = signal(trend, rsi, macd);
        double confidence = confidence(trend, rsi, macd, signal);

        log.debug("[MarketAnalyst] symbol={} trend={} rsi={} macd={} signal={}",
                  context.symbol(), trend, rsi, macd, signal);

        TechnicalReport report = new TechnicalReport(signal,
            "INSUFFICIENT_DATA".equals(trend) ? "SIDEWAYS" : trend,
            Double.isNaN(rsi) ? null : rsi,
            Double.isNaN(macd) ? null : macd);
        String rationale = String.format("Trend=%s | RSI=%s (%s) | MACD=%s → %s",
            trend, Double.isNaN(rsi) ? "N/A" : String.format("%.2f", rsi),
            TechnicalIndicators.rsiSignal(rsi),
            Double.isNaN(macd) ? "N/A" : String.format("%.4f", macd), signal);
        return AgentVerdict.of(report, confidence, rationale);
    }

    private TradeAction signal(String trend, double rsi, double macd) {
        boolean rsiKnown = !Double.isNaN(rsi);
        if (rsiKnown && rsi < OVERSOLD) return TradeAction.BUY;
        if (rsiKnown && rsi > OVERBOUGHT) return TradeAction.SELL;
        if ("UPTREND".equals(trend) && (Double.isNaN(macd) || macd >= 0)) return TradeAction.BUY;
        if ("DOWNTREND".equals(trend) && (Double.isNaN(macd) || macd <= 0)) return TradeAction.SELL;
        return TradeAction.HOLD;
    }

    private double confidence(String trend, double rsi, double macd, TradeAction signal) {
        if ("INSUFFICIENT_DATA".equals(trend) && Double.isNaN(rsi)) return 0.3;
        double base = 0.5;
        if (!Double.isNaN(rsi) && (rsi > 75 || rsi < 25)) base += 0.2;
        if (!Double.isNaN(macd) && Math.signum(macd) == signal.direction() && signal != TradeAction.HOLD) {
            base += 0.15;
        }
        if (("UPTREND".equals(trend) && signal == TradeAction.BUY)
            || ("DOWNTREND".equals(trend) && signal == TradeAction.SELL)) {
            base += 0.1;
        }
        return Math.min(base, 0.95);
    }
}
