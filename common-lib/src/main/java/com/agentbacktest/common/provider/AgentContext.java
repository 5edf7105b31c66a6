package com.agentbacktest.common.provider;

import com.agentbacktest.common.model.AgentOpinion;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.model.RecentPerformance;
import com.agentbacktest.common.model.TradeAction;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything an agent may look at for one (symbol, date) decision cycle.
 * Grows phase by phase: later phases see the opinions of earlier ones.
 *
 * @param recentBars      bars before and including {@code snapshot}, oldest first
 * @param priorOpinions   opinions gathered by earlier phases of this cycle
 * @param provisionalAction / provisionalConviction  debate synthesis, HOLD/0 before phase 3
 * @param riskScore       composite risk score, 0 before phase 4
 * @param recentActions   actions of this symbol's latest decisions, oldest first
 * @param positionHeld    quantity currently held in {@code symbol}
 * @param performance     outcome of this symbol's latest closed positions
 */
public record AgentContext(
    String symbol,
    LocalDate date,
    MarketSnapshot snapshot,
    List<MarketSnapshot> recentBars,
    Map<AgentRole, AgentOpinion> priorOpinions,
    TradeAction provisionalAction,
    double provisionalConviction,
    double riskScore,
    List<TradeAction> recentActions,
    double positionHeld,
    RecentPerformance performance
) {

    public AgentContext {
        recentBars = List.copyOf(recentBars);
        priorOpinions = priorOpinions.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(priorOpinions));
        recentActions = List.copyOf(recentActions);
        performance = performance == null ? RecentPerformance.none() : performance;
    }

    public static AgentContext initial(MarketSnapshot snapshot, List<MarketSnapshot> recentBars,
                                       List<TradeAction> recentActions, double positionHeld) {
        return initial(snapshot, recentBars, recentActions, positionHeld, RecentPerformance.none());
    }

    public static AgentContext initial(MarketSnapshot snapshot, List<MarketSnapshot> recentBars,
                                       List<TradeAction> recentActions, double positionHeld,
                                       RecentPerformance performance) {
        return new AgentContext(snapshot.symbol(), snapshot.date(), snapshot, recentBars, Map.of(),
            TradeAction.HOLD, 0.0, 0.0, recentActions, positionHeld, performance);
    }

    public AgentContext withOpinions(Map<AgentRole, AgentOpinion> opinions) {
        Map<AgentRole, AgentOpinion> merged = new EnumMap<>(AgentRole.class);
        merged.putAll(priorOpinions);
        merged.putAll(opinions);
        return new AgentContext(symbol, date, snapshot, recentBars, merged,
            provisionalAction, provisionalConviction, riskScore, recentActions, positionHeld, performance);
    }

    public AgentContext withProvisional(TradeAction action, double conviction) {
        return new AgentContext(symbol, date, snapshot, recentBars, priorOpinions,
            action, conviction, riskScore, recentActions, positionHeld, performance);
    }

    public AgentContext withRiskScore(double score) {
        return new AgentContext(symbol, date, snapshot, recentBars, priorOpinions,
            provisionalAction, provisionalConviction, score, recentActions, positionHeld, performance);
    }

    public AgentOpinion opinion(AgentRole role) {
        return priorOpinions.get(role);
    }

    /**
     * Fields that determine an agent's answer, in a form suitable for
     * {@link com.agentbacktest.common.cache.CacheKey}. Timing data of prior opinions is
     * left out so replays of the same inputs produce the same key.
     */
    public Map<String, Object> cacheFields() {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("symbol", symbol);
        fields.put("date", date.toString());
        fields.put("snapshot", snapshot);
        fields.put("barCount", recentBars.size());
        Map<String, Object> opinions = new TreeMap<>();
        priorOpinions.forEach((role, op) -> opinions.put(role.name(),
            Map.of("payload", op.payload(), "confidence", op.confidence())));
        fields.put("opinions", opinions);
        fields.put("provisionalAction", provisionalAction.name());
        fields.put("provisionalConviction", provisionalConviction);
        fields.put("riskScore", riskScore);
        fields.put("recentActions", recentActions);
        fields.put("positionHeld", positionHeld);
        fields.put("performance", Map.of(
            "tradeCount", performance.tradeCount(),
            "winRate", performance.winRate(),
            "averageReturn", performance.averageReturn(),
            "recentPnl", performance.recentPnl()));
        return fields;
    }
}
