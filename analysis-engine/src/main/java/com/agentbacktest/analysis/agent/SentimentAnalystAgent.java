package com.agentbacktest.analysis.agent;

import com.agentbacktest.analysis.indicator.TechnicalIndicators;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.model.SentimentReport;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.provider.AgentContext;
import org.springframework.stereotype.Component;

/**
 * Market sentiment from the snapshot's {@code sentiment} feed, or from five-day price
 * momentum when no feed value is attached.
 */
@Component
public class SentimentAnalystAgent implements RoleAgent {

    private static final double SIGNAL_THRESHOLD = 0.2;
    private static final double MOMENTUM_SCALE = 10.0;   // 10% move over 5 days = full score

    @Override
    public AgentRole role() { return AgentRole.SENTIMENT_ANALYST; }

    @Override
    public AgentVerdict analyze(AgentContext context) {
        MarketSnapshot snap = context.snapshot();
        double feed = snap.indicator(MarketSnapshot.SENTIMENT);
        boolean fromFeed = !Double.isNaN(feed);

        double score;
        if (fromFeed) {
            score = PriceSeries.clamp(feed, -1.0, 1.0);
        } else {
            double momentum = TechnicalIndicators.momentum(PriceSeries.closes(context), 5);
            score = Double.isNaN(momentum) ? 0.0 : PriceSeries.clamp(momentum * MOMENTUM_SCALE, -1.0, 1.0);
        }

        TradeAction signal = score > SIGNAL_THRESHOLD ? TradeAction.BUY
            : score < -SIGNAL_THRESHOLD ? TradeAction.SELL : TradeAction.HOLD;
        String mood = score > SIGNAL_THRESHOLD ? "BULLISH" : score < -SIGNAL_THRESHOLD ? "BEARISH" : "NEUTRAL";
        double confidence = (fromFeed ? 0.5 : 0.35) + 0.4 * Math.abs(score);

        return AgentVerdict.of(new SentimentReport(signal, score, mood), confidence,
            String.format("Sentiment %s score=%.2f source=%s", mood, score, fromFeed ? "feed" : "momentum"));
    }
}
