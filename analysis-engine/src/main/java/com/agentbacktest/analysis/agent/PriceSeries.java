package com.agentbacktest.analysis.agent;

import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.provider.AgentContext;

import java.util.ArrayList;
import java.util.List;

/** Newest-first views over the context's bar history, the order the indicators expect. */
final class PriceSeries {

    private PriceSeries() {}

    static List<Double> closes(AgentContext context) {
        List<MarketSnapshot> bars = context.recentBars();
        List<Double> out = new ArrayList<>(bars.size());
        for (int i = bars.size() - 1; i >= 0; i--) out.add(bars.get(i).close());
        return out;
    }

    static List<Double> volumes(AgentContext context) {
        List<MarketSnapshot> bars = context.recentBars();
        List<Double> out = new ArrayList<>(bars.size());
        for (int i = bars.size() - 1; i >= 0; i--) out.add((double) bars.get(i).volume());
        return out;
    }

    /** Snapshot indicator if present, else {@code fallback}. */
    static double indicatorOr(MarketSnapshot snapshot, String name, double fallback) {
        double v = snapshot.indicator(name);
        return Double.isNaN(v) ? fallback : v;
    }

    static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
