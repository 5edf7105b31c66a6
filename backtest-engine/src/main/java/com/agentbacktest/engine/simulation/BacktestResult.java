package com.agentbacktest.engine.simulation;

import com.agentbacktest.common.cache.CacheStats;
import com.agentbacktest.engine.config.BacktestConfig;
import com.agentbacktest.engine.orchestrator.DecisionRecord;
import com.agentbacktest.engine.orchestrator.DecisionStatus;
import com.agentbacktest.engine.orchestrator.RiskSnapshot;
import com.agentbacktest.engine.position.ClosedPosition;
import com.agentbacktest.engine.position.PortfolioState;
import com.agentbacktest.engine.position.Transaction;

import java.time.Instant;
import java.util.List;

/**
 * Everything a run produced, in simulation order.
 *
 * @param cancelled true when the run stopped early on a cancellation request
 */
public record BacktestResult(
    String runId,
    BacktestConfig config,
    PortfolioState finalPortfolio,
    List<Transaction> transactions,
    List<DecisionRecord> decisions,
    List<RiskSnapshot> riskSnapshots,
    List<PortfolioState> portfolioHistory,
    List<ClosedPosition> closedPositions,
    CacheStats cacheStats,
    boolean cancelled,
    Instant startedAt,
    Instant finishedAt
) {

    public BacktestResult {
        transactions = List.copyOf(transactions);
        decisions = List.copyOf(decisions);
        riskSnapshots = List.copyOf(riskSnapshots);
        portfolioHistory = List.copyOf(portfolioHistory);
        closedPositions = List.copyOf(closedPositions);
    }

    public long count(DecisionStatus status) {
        return decisions.stream().filter(d -> d.status() == status).count();
    }
}
