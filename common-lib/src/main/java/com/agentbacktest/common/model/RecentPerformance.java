package com.agentbacktest.common.model;

/**
 * How the latest closed positions of one symbol turned out.
 *
 * @param tradeCount    closed positions summarised
 * @param winRate       share of them closed with a positive P&amp;L, 0 when none
 * @param averageReturn mean of {@code exitPrice / entryPrice - 1}, 0 when none
 * @param recentPnl     summed realized P&amp;L
 */
public record RecentPerformance(
    int tradeCount,
    double winRate,
    double averageReturn,
    double recentPnl
) {

    public static RecentPerformance none() {
        return new RecentPerformance(0, 0.0, 0.0, 0.0);
    }
}
