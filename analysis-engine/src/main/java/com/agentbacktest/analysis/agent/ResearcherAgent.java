package com.agentbacktest.analysis.agent;

import com.agentbacktest.common.model.AgentOpinion;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.FundamentalsReport;
import com.agentbacktest.common.model.NewsReport;
import com.agentbacktest.common.model.RecentPerformance;
import com.agentbacktest.common.model.ResearchThesis;
import com.agentbacktest.common.model.SentimentReport;
import com.agentbacktest.common.model.TechnicalReport;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.provider.AgentContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Advocate for one side of the trade. Conviction is the confidence-weighted share of analyst
 * votes for the favoured action; the advocate recommends it only when that share wins.
 */
abstract class ResearcherAgent implements RoleAgent {

    private static final double MIN_SHARE = 0.5;

    /** BUY for the bull, SELL for the bear. */
    protected abstract TradeAction favoured();

    @Override
    public AgentVerdict analyze(AgentContext context) {
        double supportWeight = 0.0;
        double totalWeight = 0.0;
        double supportConfidence = 0.0;
        int supporters = 0;
        List<String> arguments = new ArrayList<>();

        for (AgentRole analyst : AgentRole.analysts()) {
            AgentOpinion opinion = context.opinion(analyst);
            if (opinion == null) continue;
            TradeAction vote = signalOf(opinion);
            totalWeight += opinion.confidence();
            if (vote == favoured()) {
                supportWeight += opinion.confidence();
                supportConfidence += opinion.confidence();
                supporters++;
                arguments.add(String.format("%s favours %s (%.2f)", analyst, vote, opinion.confidence()));
            } else if (vote != TradeAction.HOLD) {
                arguments.add(String.format("%s disagrees: %s (%.2f)", analyst, vote, opinion.confidence()));
            }
        }

        RecentPerformance record = context.performance();
        if (record.tradeCount() > 0) {
            arguments.add(String.format(Locale.ROOT, "last %d closed trades: win rate %.2f, average return %.4f",
                record.tradeCount(), record.winRate(), record.averageReturn()));
        }

        double share = totalWeight > 0 ? supportWeight / totalWeight : 0.0;
        boolean recommend = supporters > 0 && share >= MIN_SHARE;
        TradeAction recommendation = recommend ? favoured() : TradeAction.HOLD;
        double conviction = recommend ? share : share / 2;
        double confidence = supporters > 0 ? supportConfidence / supporters : 0.3;

        return AgentVerdict.of(new ResearchThesis(recommendation, conviction, arguments), confidence,
            String.format("%s case: %d of %d analysts, weighted share %.2f → %s",
                favoured(), supporters, AgentRole.analysts().size(), share, recommendation));
    }

    static TradeAction signalOf(AgentOpinion opinion) {
        if (opinion.payload() instanceof TechnicalReport t) return t.signal();
        if (opinion.payload() instanceof SentimentReport s) return s.signal();
        if (opinion.payload() instanceof NewsReport n) return n.signal();
        if (opinion.payload() instanceof FundamentalsReport f) return f.signal();
        return TradeAction.HOLD;
    }
}
