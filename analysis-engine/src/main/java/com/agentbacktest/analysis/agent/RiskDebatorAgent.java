package com.agentbacktest.analysis.agent;

import com.agentbacktest.analysis.indicator.TechnicalIndicators;
import com.agentbacktest.common.model.RiskPerspective;
import com.agentbacktest.common.model.RiskStance;
import com.agentbacktest.common.provider.AgentContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared risk reading for the three risk debators: RSI extremes, drawdown from the
 * 20-day high, coefficient of variation and the analyzer's composite score. Each stance
 * then scores how strongly it endorses itself given that reading and the debate conviction.
 */
abstract class RiskDebatorAgent implements RoleAgent {

    private static final Logger log = LoggerFactory.getLogger(RiskDebatorAgent.class);

    private static final double OVERBOUGHT = 70;
    private static final double OVERSOLD = 30;
    private static final double MAX_DRAWDOWN_THRESHOLD = 0.05;  // 5% drawdown = elevated risk
    private static final double HIGH_CV = 0.03;
    private static final double ELEVATED_SCORE = 50.0;

    /** Stance score in [0,1] given the debate conviction and normalized risk (0–1). */
    protected abstract double endorse(double conviction, double risk);

    protected abstract double confidence(double risk);

    @Override
    public AgentVerdict analyze(AgentContext context) {
        RiskStance stance = role().stance();
        List<Double> prices = PriceSeries.closes(context);
        List<String> keyRisks = keyRisks(context, prices);

        double risk = PriceSeries.clamp(context.riskScore() / 100.0 + 0.1 * keyRisks.size(), 0.0, 1.0);
        double conviction = context.provisionalConviction();
        double score = PriceSeries.clamp(endorse(conviction, risk), 0.0, 1.0);

        log.debug("[RiskDebator] stance={} symbol={} conviction={} risk={} score={}",
                  stance, context.symbol(), conviction, risk, score);

        RiskPerspective perspective = new RiskPerspective(stance, score, stance.sizeMultiplier(),
            stance.stopLossPct(), stance.takeProfitPct(), keyRisks);
        return AgentVerdict.of(perspective, confidence(risk),
            String.format("%s stance score=%.2f with risk=%.2f, conviction=%.2f, flags=%s",
                stance, score, risk, conviction, keyRisks));
    }

    private List<String> keyRisks(AgentContext context, List<Double> prices) {
        List<String> risks = new ArrayList<>();
        if (prices.isEmpty()) {
            risks.add("NO_PRICE_HISTORY");
            return risks;
        }
        double rsi = TechnicalIndicators.rsi(prices, 14);
        if (!Double.isNaN(rsi) && rsi > OVERBOUGHT) risks.add("RSI_OVERBOUGHT");
        if (!Double.isNaN(rsi) && rsi < OVERSOLD) risks.add("RSI_OVERSOLD");

        double current = prices.get(0);
        double high20 = prices.subList(0, Math.min(20, prices.size())).stream()
            .mapToDouble(Double::doubleValue).max().orElse(current);
        if (high20 > 0 && (high20 - current) / high20 > MAX_DRAWDOWN_THRESHOLD) risks.add("DRAWDOWN");

        double stdDev = TechnicalIndicators.stdDev(prices, 20);
        double sma20 = TechnicalIndicators.sma(prices, 20);
        if (!Double.isNaN(stdDev) && !Double.isNaN(sma20) && sma20 > 0 && stdDev / sma20 > HIGH_CV) {
            risks.add("HIGH_VOLATILITY");
        }
        if (context.riskScore() > ELEVATED_SCORE) risks.add("ELEVATED_RISK_SCORE");
        return risks;
    }
}
