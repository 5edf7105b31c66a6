package com.agentbacktest.engine.simulation;

import com.agentbacktest.common.cache.ResultCache;
import com.agentbacktest.common.exception.InvalidConfigurationException;
import com.agentbacktest.common.model.AgentOpinion;
import com.agentbacktest.common.model.TradingDecision;
import com.agentbacktest.common.provider.DecisionProvider;
import com.agentbacktest.common.provider.MarketDataProvider;
import com.agentbacktest.common.resilience.ResilientCaller;
import com.agentbacktest.common.risk.RiskAnalyzer;
import com.agentbacktest.engine.config.BacktestConfig;
import com.agentbacktest.engine.orchestrator.CancellationSignal;
import com.agentbacktest.engine.orchestrator.CycleResult;
import com.agentbacktest.engine.orchestrator.DecisionFlowLogger;
import com.agentbacktest.engine.orchestrator.DecisionOrchestrator;
import com.agentbacktest.engine.orchestrator.DecisionRecord;
import com.agentbacktest.engine.orchestrator.DecisionStatus;
import com.agentbacktest.engine.orchestrator.MarketMemory;
import com.agentbacktest.engine.orchestrator.OpinionParser;
import com.agentbacktest.engine.orchestrator.RiskSnapshot;
import com.agentbacktest.engine.persistence.AuditRecord;
import com.agentbacktest.engine.persistence.AuditStore;
import com.agentbacktest.engine.position.ExecutionResult;
import com.agentbacktest.engine.position.PortfolioState;
import com.agentbacktest.engine.position.PositionManager;
import com.agentbacktest.engine.position.Transaction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives a backtest over its trading calendar.
 *
 * <p>For every trading day: one decision cycle per symbol (in parallel up to
 * {@code symbolConcurrency}, results kept in symbol order), audit of every fill, marking
 * of open positions to the day's close, forced exits, a portfolio snapshot and an
 * invariant check. Cancellation is checked before each day and after its decision cycles.
 *
 * <p>Every run gets fresh state (portfolio, cache, circuit breakers, memory), so runs are
 * independent and deterministic for a deterministic provider. {@link #run} blocks until
 * the run ends.
 */
@Service
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    private final DecisionProvider        provider;
    private final MarketDataProvider      marketData;
    private final AuditStore              auditStore;
    private final DecisionFlowLogger      flowLogger;
    private final OpinionParser           parser;
    private final Clock                   clock;
    private final List<BacktestListener>  listeners;

    private volatile BacktestProgress progress = new BacktestProgress();

    public SimulationEngine(DecisionProvider provider,
                            MarketDataProvider marketData,
                            AuditStore auditStore,
                            DecisionFlowLogger flowLogger,
                            ObjectMapper objectMapper,
                            Clock clock,
                            List<BacktestListener> listeners) {
        this.provider   = provider;
        this.marketData = marketData;
        this.auditStore = auditStore;
        this.flowLogger = flowLogger;
        this.parser     = new OpinionParser(objectMapper);
        this.clock      = clock;
        this.listeners  = List.copyOf(listeners);
    }

    // ── Public API ─────────────────────────────────────────────────────────

    public BacktestResult run(BacktestConfig config) {
        return run(config, new CancellationSignal());
    }

    /**
     * @throws InvalidConfigurationException when {@code config} is invalid; nothing has
     *                                       been simulated in that case
     */
    public BacktestResult run(BacktestConfig config, CancellationSignal cancellation) {
        try {
            config.validate();
        } catch (InvalidConfigurationException e) {
            log.error("[Simulation] Invalid configuration, run aborted. error={}", e.getMessage());
            throw e;
        }

        String runId = UUID.randomUUID().toString();
        List<LocalDate> dates = TradingCalendar.tradingDays(config.startDate(), config.endDate());
        Instant startedAt = clock.instant();
        BacktestProgress runProgress = new BacktestProgress();
        runProgress.start(runId, dates.size(), startedAt);
        this.progress = runProgress;

        PositionManager positions = new PositionManager(config);
        ResultCache<AgentOpinion> cache = new ResultCache<>(config.cacheCapacity(), config.cacheTtl(), clock);
        MarketMemory memory = new MarketMemory(marketData, config.historyLookback(), config.decisionMemory());
        DecisionOrchestrator orchestrator = new DecisionOrchestrator(config, provider, marketData,
            new ResilientCaller(config.resilience(), clock), cache,
            new RiskAnalyzer(config.riskThresholds()), positions, memory, parser, flowLogger, clock);

        log.info("[Simulation] Run started. runId={} symbols={} from={} to={} tradingDays={} provider={}",
                 runId, config.symbols(), config.startDate(), config.endDate(), dates.size(),
                 provider.providerName());

        List<DecisionRecord> decisions = new ArrayList<>();
        List<RiskSnapshot> riskSnapshots = new ArrayList<>();
        LocalDate lastDate = config.startDate();
        boolean cancelled = false;

        try {
            for (LocalDate date : dates) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    log.info("[Simulation] Cancelled before date. runId={} date={}", runId, date);
                    break;
                }
                runProgress.advance(date);
                lastDate = date;

                List<CycleResult> cycles = Flux.fromIterable(config.symbols())
                    .flatMapSequential(symbol -> orchestrator.decide(symbol, date, cancellation),
                                       config.symbolConcurrency())
                    .collectList()
                    .block();

                for (CycleResult cycle : cycles) {
                    DecisionRecord record = cycle.record();
                    decisions.add(record);
                    runProgress.recordDecision(record.status());
                    if (cycle.risk() != null) riskSnapshots.add(cycle.risk());
                    if (record.transaction() != null) audit(record.decision(), record.transaction());
                }

                if (cancellation.isCancelled()) {
                    cancelled = true;
                    log.info("[Simulation] Cancelled during date. runId={} date={}", runId, date);
                    break;
                }

                settle(positions, date, decisions, runProgress);
                runProgress.dateDone();
            }
        } catch (RuntimeException e) {
            runProgress.failed(e.getMessage());
            log.error("[Simulation] Run failed. runId={} date={} error={}", runId, lastDate, e.getMessage(), e);
            throw e;
        }

        BacktestResult result = new BacktestResult(runId, config, positions.portfolioState(lastDate),
            positions.transactions().all(), decisions, riskSnapshots, positions.portfolioHistory().all(),
            positions.closedPositions().all(), cache.stats(), cancelled, startedAt, clock.instant());
        if (cancelled) {
            runProgress.cancelled();
        } else {
            runProgress.complete();
        }
        log.info("[Simulation] Run finished. runId={} cancelled={} decisions={} executed={} finalValue={}",
                 runId, cancelled, decisions.size(), result.count(DecisionStatus.EXECUTED),
                 result.finalPortfolio().totalValue());
        notifyListeners(result);
        return result;
    }

    /** Progress of the latest run started by this engine. */
    public BacktestProgress progress() {
        return progress;
    }

    // ── Internal helpers ───────────────────────────────────────────────────

    /** End-of-day valuation, exits, snapshot and invariant check. */
    private void settle(PositionManager positions, LocalDate date,
                        List<DecisionRecord> decisions, BacktestProgress runProgress) {
        for (String symbol : positions.heldSymbols()) {
            marketData.get(symbol, date).ifPresent(bar -> positions.markToMarket(symbol, bar.close()));
        }
        for (ExecutionResult exit : positions.checkExits(date)) {
            DecisionRecord record = DecisionRecord.of(exit);
            decisions.add(record);
            runProgress.recordDecision(record.status());
            if (exit.isFilled()) audit(exit.decision(), exit.transaction());
        }
        PortfolioState state = positions.recordSnapshot(date);
        positions.verifyInvariants();
        log.debug("[Simulation] Day settled. date={} cash={} totalValue={} positions={}",
                  date, state.cash(), state.totalValue(), state.positions().size());
    }

    private void audit(TradingDecision decision, Transaction transaction) {
        try {
            auditStore.save(decision.symbol(), new AuditRecord(decision, transaction, clock.instant()));
        } catch (RuntimeException e) {
            log.error("[Simulation] Audit save failed. symbol={} decisionId={} error={}",
                      decision.symbol(), decision.id(), e.getMessage(), e);
        }
    }

    private void notifyListeners(BacktestResult result) {
        for (BacktestListener listener : listeners) {
            try {
                listener.onComplete(result);
            } catch (RuntimeException e) {
                log.error("[Simulation] Listener failed. runId={} listener={} error={}",
                          result.runId(), listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
