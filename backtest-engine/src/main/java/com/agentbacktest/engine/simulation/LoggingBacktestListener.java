package com.agentbacktest.engine.simulation;

import com.agentbacktest.engine.orchestrator.DecisionStatus;
import com.agentbacktest.engine.position.PortfolioState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Logs a one-line summary of every finished run. */
@Component
public class LoggingBacktestListener implements BacktestListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingBacktestListener.class);

    @Override
    public void onComplete(BacktestResult result) {
        PortfolioState last = result.finalPortfolio();
        log.info("[Simulation] Run summary. runId={} cancelled={} finalValue={} totalReturn={} transactions={} "
                 + "executed={} rejected={} hold={} skipped={} cacheHitRate={}",
                 result.runId(), result.cancelled(),
                 String.format("%.2f", last.totalValue()),
                 String.format("%.4f", last.totalReturn()),
                 result.transactions().size(),
                 result.count(DecisionStatus.EXECUTED), result.count(DecisionStatus.REJECTED),
                 result.count(DecisionStatus.HOLD), result.count(DecisionStatus.SKIPPED),
                 String.format("%.3f", result.cacheStats().hitRate()));
    }
}
