package com.agentbacktest.analysis.agent;

import com.agentbacktest.analysis.indicator.TechnicalIndicators;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.model.NewsReport;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.provider.AgentContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * News impact from the snapshot's {@code news_impact} feed. Without a feed, unusual volume
 * on the day is read as news flow in the direction of the day's move.
 */
@Component
public class NewsAnalystAgent implements RoleAgent {

    private static final double SIGNAL_THRESHOLD = 0.3;
    private static final double VOLUME_SPIKE = 1.5;

    @Override
    public AgentRole role() { return AgentRole.NEWS_ANALYST; }

    @Override
    public AgentVerdict analyze(AgentContext context) {
        MarketSnapshot snap = context.snapshot();
        List<String> headlines = new ArrayList<>();
        double impact = snap.indicator(MarketSnapshot.NEWS_IMPACT);

        if (!Double.isNaN(impact)) {
            impact = PriceSeries.clamp(impact, -1.0, 1.0);
            headlines.add(String.format("News feed impact %.2f for %s", impact, context.symbol()));
        } else {
            List<Double> volumes = PriceSeries.volumes(context);
            double avgVolume = TechnicalIndicators.sma(volumes.size() > 1 ? volumes.subList(1, volumes.size()) : volumes,
                Math.min(20, Math.max(1, volumes.size() - 1)));
            double dayMove = snap.open() > 0 ? snap.close() / snap.open() - 1.0 : 0.0;
            double ratio = avgVolume > 0 ? snap.volume() / avgVolume : 1.0;
            impact = 0.0;
            if (ratio >= VOLUME_SPIKE) {
                impact = PriceSeries.clamp((ratio - 1.0) * 0.5 * Math.signum(dayMove), -1.0, 1.0);
                headlines.add(String.format("Volume %.1fx average on a %s session", ratio, dayMove >= 0 ? "up" : "down"));
            }
        }

        TradeAction signal = impact > SIGNAL_THRESHOLD ? TradeAction.BUY
            : impact < -SIGNAL_THRESHOLD ? TradeAction.SELL : TradeAction.HOLD;
        double confidence = headlines.isEmpty() ? 0.3 : 0.4 + 0.4 * Math.abs(impact);

        return AgentVerdict.of(new NewsReport(signal, impact, headlines), confidence,
            headlines.isEmpty() ? "No material news flow" : String.join("; ", headlines));
    }
}
