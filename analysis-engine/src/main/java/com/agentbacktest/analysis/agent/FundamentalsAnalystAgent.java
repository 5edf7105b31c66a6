package com.agentbacktest.analysis.agent;

import com.agentbacktest.analysis.indicator.TechnicalIndicators;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.FundamentalsReport;
import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.provider.AgentContext;
import org.springframework.stereotype.Component;

/**
 * Valuation from the P/E ratio when the snapshot carries one; otherwise the distance of
 * price from its 50-day mean stands in for a fair-value gap.
 */
@Component
public class FundamentalsAnalystAgent implements RoleAgent {

    private static final double CHEAP_PE = 15.0;
    private static final double RICH_PE = 30.0;
    private static final double FAIR_VALUE_BAND = 0.05;

    @Override
    public AgentRole role() { return AgentRole.FUNDAMENTALS_ANALYST; }

    @Override
    public AgentVerdict analyze(AgentContext context) {
        MarketSnapshot snap = context.snapshot();
        double pe = snap.indicator(MarketSnapshot.PE_RATIO);

        if (!Double.isNaN(pe) && pe > 0) {
            String valuation = pe < CHEAP_PE ? "UNDERVALUED" : pe > RICH_PE ? "OVERVALUED" : "FAIR";
            double fairPe = (CHEAP_PE + RICH_PE) / 2;
            double gapPct = fairPe / pe - 1.0;
            return AgentVerdict.of(new FundamentalsReport(signalFor(valuation), valuation, gapPct), 0.6,
                String.format("P/E %.1f → %s", pe, valuation));
        }

        double fair = PriceSeries.indicatorOr(snap, MarketSnapshot.SMA_50,
            TechnicalIndicators.sma(PriceSeries.closes(context), 50));
        if (Double.isNaN(fair) || snap.close() <= 0) {
            return AgentVerdict.of(FundamentalsReport.neutral(), 0.2, "Insufficient history for valuation");
        }
        double gapPct = fair / snap.close() - 1.0;
        String valuation = gapPct > FAIR_VALUE_BAND ? "UNDERVALUED"
            : gapPct < -FAIR_VALUE_BAND ? "OVERVALUED" : "FAIR";
        return AgentVerdict.of(new FundamentalsReport(signalFor(valuation), valuation, gapPct),
            0.4 + Math.min(0.3, Math.abs(gapPct)),
            String.format("Price %.2f vs 50-day mean %.2f (%+.1f%%) → %s",
                snap.close(), fair, gapPct * 100, valuation));
    }

    private static TradeAction signalFor(String valuation) {
        return switch (valuation) {
            case "UNDERVALUED" -> TradeAction.BUY;
            case "OVERVALUED"  -> TradeAction.SELL;
            default            -> TradeAction.HOLD;
        };
    }
}
