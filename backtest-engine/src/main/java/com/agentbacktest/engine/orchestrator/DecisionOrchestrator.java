package com.agentbacktest.engine.orchestrator;

import com.agentbacktest.common.cache.CacheKey;
import com.agentbacktest.common.cache.ResultCache;
import com.agentbacktest.common.exception.MalformedOutputException;
import com.agentbacktest.common.model.AgentOpinion;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.model.OrderKind;
import com.agentbacktest.common.model.RiskAssessment;
import com.agentbacktest.common.model.RiskPerspective;
import com.agentbacktest.common.model.RiskStance;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.model.TradingDecision;
import com.agentbacktest.common.provider.AgentContext;
import com.agentbacktest.common.provider.DecisionProvider;
import com.agentbacktest.common.provider.MarketDataProvider;
import com.agentbacktest.common.resilience.ResilientCaller;
import com.agentbacktest.common.risk.EnhancedRiskMetrics;
import com.agentbacktest.common.risk.RiskAnalyzer;
import com.agentbacktest.common.trace.TraceContextUtil;
import com.agentbacktest.engine.config.BacktestConfig;
import com.agentbacktest.engine.position.ExecutionResult;
import com.agentbacktest.engine.position.PositionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the decision cycle of one (symbol, date) as a six-phase pipeline:
 *
 * <pre>
 *   DATA_COLLECTION        snapshot + recent bars from {@link MarketMemory}
 *   INDIVIDUAL_ANALYSIS    4 analysts in parallel
 *   COLLABORATIVE_ANALYSIS bull + bear in parallel → {@link DebateSynthesis}
 *   RISK_DISCUSSION        {@link RiskAnalyzer} + 3 risk debators in parallel → stance scores
 *   FINAL_DECISION         stance selection, sizing percentage, confidence, HOLD gates
 *   EXECUTION              {@link PositionManager#sizeAndExecute}
 * </pre>
 *
 * <p>Every opinion goes through {@link ResultCache} → {@link ResilientCaller} →
 * {@link DecisionProvider}. A role whose call fails for any reason contributes its
 * neutral low-confidence placeholder, so every cycle that has market data reaches
 * execution with a decision. Cancellation is honoured at phase boundaries.
 *
 * <p>One instance serves one run; it shares that run's position manager and memory.
 */
public class DecisionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DecisionOrchestrator.class);

    private final BacktestConfig           config;
    private final DecisionProvider         provider;
    private final MarketDataProvider       marketData;
    private final ResilientCaller          caller;
    private final ResultCache<AgentOpinion> cache;
    private final RiskAnalyzer             riskAnalyzer;
    private final PositionManager          positions;
    private final MarketMemory             memory;
    private final OpinionParser            parser;
    private final DecisionFlowLogger       flowLogger;
    private final Clock                    clock;

    public DecisionOrchestrator(BacktestConfig config,
                                DecisionProvider provider,
                                MarketDataProvider marketData,
                                ResilientCaller caller,
                                ResultCache<AgentOpinion> cache,
                                RiskAnalyzer riskAnalyzer,
                                PositionManager positions,
                                MarketMemory memory,
                                OpinionParser parser,
                                DecisionFlowLogger flowLogger,
                                Clock clock) {
        this.config       = config;
        this.provider     = provider;
        this.marketData   = marketData;
        this.caller       = caller;
        this.cache        = cache;
        this.riskAnalyzer = riskAnalyzer;
        this.positions    = positions;
        this.memory       = memory;
        this.parser       = parser;
        this.flowLogger   = flowLogger;
        this.clock        = clock;
    }

    /**
     * Runs one decision cycle. The returned Mono never errors: unavailable data yields a
     * SKIPPED record and cancellation a CANCELLED one.
     */
    public Mono<CycleResult> decide(String symbol, LocalDate date, CancellationSignal cancellation) {
        String decisionId = TraceContextUtil.decisionId(symbol, date);
        boolean verbose = config.debug();

        Mono<CycleResult> cycle = Mono.fromCallable(() -> marketData.get(symbol, date))
            .flatMap(found -> found
                .map(snapshot -> runPhases(decisionId, snapshot, cancellation, verbose))
                .orElseGet(() -> Mono.just(skipped(decisionId, symbol, date, "No market data"))))
            .onErrorResume(CycleCancelledException.class, e -> Mono.just(cancelled(decisionId, symbol, date, e)))
            .onErrorResume(e -> {
                log.error("[Orchestrator] Cycle failed, skipping. decisionId={} error={}", decisionId, e.getMessage(), e);
                return Mono.just(skipped(decisionId, symbol, date, "Cycle failed: " + e.getMessage()));
            })
            .doOnNext(result -> flowLogger.logSettled(result.record()));

        return TraceContextUtil.withCycle(cycle, symbol, date);
    }

    private Mono<CycleResult> runPhases(String decisionId, MarketSnapshot snapshot,
                                        CancellationSignal cancellation, boolean verbose) {
        List<MarketSnapshot> bars = memory.observe(snapshot);
        String symbol = snapshot.symbol();
        AgentContext initial = AgentContext.initial(snapshot, bars, memory.recentActions(symbol),
            positions.quantity(symbol), positions.recentPerformance(symbol, config.decisionMemory()));
        CycleState start = new CycleState(decisionId, snapshot, initial,
            new EnumMap<>(AgentRole.class), null, null, Map.of(), List.of(), null);
        flowLogger.logStage(DecisionFlowLogger.DATA_COLLECTED, symbol, snapshot.date(), verbose);
        checkpoint(cancellation, DecisionPhase.DATA_COLLECTION);

        return individualAnalysis(start)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.ANALYSTS_COMPLETED, verbose))
            .doOnNext(s -> checkpoint(cancellation, DecisionPhase.INDIVIDUAL_ANALYSIS))
            .flatMap(this::collaborativeAnalysis)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.DEBATE_SYNTHESIZED, verbose))
            .doOnNext(s -> checkpoint(cancellation, DecisionPhase.COLLABORATIVE_ANALYSIS))
            .flatMap(this::riskDiscussion)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.RISK_ASSESSED, verbose))
            .doOnNext(s -> checkpoint(cancellation, DecisionPhase.RISK_DISCUSSION))
            .map(this::finalDecision)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.DECISION_FINALIZED, verbose))
            .doOnNext(s -> checkpoint(cancellation, DecisionPhase.FINAL_DECISION))
            .map(this::execute);
    }

    // ── Phases ─────────────────────────────────────────────────────────────

    private Mono<CycleState> individualAnalysis(CycleState state) {
        return gather(AgentRole.analysts(), state.context())
            .map(opinions -> state.withOpinions(opinions, state.context().withOpinions(opinions)));
    }

    private Mono<CycleState> collaborativeAnalysis(CycleState state) {
        return gather(AgentRole.researchers(), state.context())
            .map(theses -> {
                DebateSynthesis debate = DebateSynthesis.of(
                    theses.get(AgentRole.BULL_RESEARCHER), theses.get(AgentRole.BEAR_RESEARCHER));
                detail("[Orchestrator] Debate synthesized. decisionId={} action={} signedScore={} conviction={}",
                       state.decisionId(), debate.action(), debate.signedScore(), debate.conviction());
                AgentContext next = state.context().withOpinions(theses)
                    .withProvisional(debate.action(), debate.conviction());
                return state.withOpinions(theses, next).withDebate(debate);
            });
    }

    private Mono<CycleState> riskDiscussion(CycleState state) {
        String symbol = state.snapshot().symbol();
        EnhancedRiskMetrics metrics = assessRisk(symbol, state.snapshot().date());
        AgentContext context = state.context().withRiskScore(metrics.riskScore());

        return gather(AgentRole.riskDebators(), context)
            .map(perspectives -> {
                Map<RiskStance, Double> scores = stanceScores(perspectives, metrics.riskScore());
                Set<String> keyRisks = new LinkedHashSet<>();
                for (AgentRole role : AgentRole.riskDebators()) {
                    keyRisks.addAll(perspectives.get(role).payloadAs(RiskPerspective.class).keyRisks());
                }
                detail("[Orchestrator] Risk assessed. decisionId={} riskScore={} adjustment={} scores={}",
                       state.decisionId(), metrics.riskScore(), metrics.positionSizeAdjustment(), scores);
                return state.withOpinions(perspectives, context.withOpinions(perspectives))
                    .withRisk(metrics, scores, List.copyOf(keyRisks));
            });
    }

    private CycleState finalDecision(CycleState state) {
        DebateSynthesis debate = state.debate();
        Map<RiskStance, Double> scores = state.stanceScores();
        RiskStance stance = selectStance(scores);
        RiskPerspective perspective = state.opinions().get(debatorFor(stance)).payloadAs(RiskPerspective.class);

        double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
        double agreement = total > 0.0 ? scores.getOrDefault(stance, 0.0) / total : 0.0;
        double confidence = clamp(debate.strongerConfidence() * 0.5 * (1.0 + agreement), 0.0, 1.0);
        double sizePct = clamp(config.basePositionSizePct() * perspective.positionSizeMultiplier(), 0.0, 1.0);

        TradeAction action = debate.action();
        String gate = null;
        if (action != TradeAction.HOLD && debate.conviction() < config.minConviction()) {
            gate = String.format("conviction %.3f below %.3f", debate.conviction(), config.minConviction());
        } else if (action != TradeAction.HOLD && confidence < config.minConfidence()) {
            gate = String.format("confidence %.3f below %.3f", confidence, config.minConfidence());
        }
        if (gate != null) action = TradeAction.HOLD;

        String rationale = String.format("debate=%s signedScore=%.3f stance=%s agreement=%.3f riskScore=%.1f",
            debate.action(), debate.signedScore(), stance, agreement, state.metrics().riskScore())
            + (gate != null ? " hold: " + gate : "");

        RiskAssessment assessment = new RiskAssessment(stance, scores, state.keyRisks(),
            state.metrics().riskScore(), state.metrics().positionSizeAdjustment());
        List<AgentOpinion> opinions = new ArrayList<>();
        for (AgentRole role : AgentRole.values()) {
            AgentOpinion opinion = state.opinions().get(role);
            if (opinion != null) opinions.add(opinion);
        }

        TradingDecision decision = new TradingDecision(state.decisionId(), state.snapshot().date(),
            state.snapshot().symbol(), action, 0.0, OrderKind.MARKET, confidence, rationale,
            sizePct, perspective.stopLossPct(), perspective.takeProfitPct(), assessment, opinions);
        detail("[Orchestrator] Decision finalized. decisionId={} action={} confidence={} stance={} sizePct={}",
               decision.id(), action, confidence, stance, sizePct);
        return state.withDecision(decision);
    }

    private CycleResult execute(CycleState state) {
        TradingDecision decision = state.decision();
        RiskSnapshot risk = new RiskSnapshot(decision.symbol(), decision.date(), state.metrics());
        memory.recordDecision(decision.symbol(), decision.action());
        if (decision.action() == TradeAction.HOLD) {
            return new CycleResult(DecisionRecord.hold(decision), risk);
        }
        ExecutionResult result = positions.sizeAndExecute(decision, state.snapshot().close());
        return new CycleResult(DecisionRecord.of(result), risk);
    }

    // ── Opinions ───────────────────────────────────────────────────────────

    /**
     * Collects one opinion per role, requested in parallel. The phase is bounded by the sum
     * of the per-call deadlines; a role that misses it gets its placeholder.
     */
    private Mono<Map<AgentRole, AgentOpinion>> gather(List<AgentRole> roles, AgentContext context) {
        Duration phaseDeadline = config.resilience().callDeadline().multipliedBy(roles.size());
        return Flux.fromIterable(roles)
            .flatMap(role -> opinionFor(role, context, phaseDeadline), roles.size())
            .collectMap(AgentOpinion::role, opinion -> opinion, () -> new EnumMap<>(AgentRole.class));
    }

    private Mono<AgentOpinion> opinionFor(AgentRole role, AgentContext context, Duration phaseDeadline) {
        return Mono.defer(() -> {
            String key = CacheKey.of(role, context.cacheFields());
            Optional<AgentOpinion> cached = cache.get(key);
            if (cached.isPresent()) {
                log.debug("[Orchestrator] Cache hit. role={} symbol={} date={}", role, context.symbol(), context.date());
                return Mono.just(cached.get());
            }
            long started = System.nanoTime();
            return caller.call(role, () -> provider.generate(role, context))
                .switchIfEmpty(Mono.error(() -> new MalformedOutputException(role, "Empty reply")))
                .map(reply -> parser.parse(role, reply, clock.instant(),
                    Duration.ofNanos(System.nanoTime() - started).toMillis()))
                .doOnNext(opinion -> cache.put(key, opinion));
        })
        .timeout(phaseDeadline)
        .onErrorResume(e -> Mono.just(placeholder(role, context, e)));
    }

    private AgentOpinion placeholder(AgentRole role, AgentContext context, Throwable cause) {
        if (cause instanceof MalformedOutputException) {
            log.warn("[Orchestrator] Malformed output, using neutral opinion. role={} symbol={} date={} detail={}",
                     role, context.symbol(), context.date(), cause.getMessage());
        } else {
            log.warn("[Orchestrator] Opinion unavailable, using neutral opinion. role={} symbol={} date={} error={}",
                     role, context.symbol(), context.date(), cause.toString());
        }
        return AgentOpinion.neutral(role, clock.instant(), cause.getClass().getSimpleName());
    }

    // ── Helpers ────────────────────────────────────────────────────────────

    /**
     * Held symbols' bars are read from the provider up to {@code date}: their memory may
     * not have observed {@code date} yet when their own cycle runs later the same day.
     */
    private EnhancedRiskMetrics assessRisk(String symbol, LocalDate date) {
        List<String> held = positions.heldSymbols();
        Map<String, List<MarketSnapshot>> histories = new LinkedHashMap<>();
        histories.put(symbol, memory.bars(symbol));
        for (String other : held) {
            histories.putIfAbsent(other, marketData.history(other, date, config.historyLookback()));
        }
        return riskAnalyzer.assess(symbol, histories, held, positions.largestPositionWeight());
    }

    /**
     * Debator score × confidence, tilted by the composite risk score: high risk
     * favours the conservative stance and penalises the aggressive one.
     */
    static Map<RiskStance, Double> stanceScores(Map<AgentRole, AgentOpinion> perspectives, double riskScore) {
        double tilt = clamp(riskScore, 0.0, 100.0) / 100.0;
        Map<RiskStance, Double> scores = new EnumMap<>(RiskStance.class);
        for (AgentRole role : AgentRole.riskDebators()) {
            AgentOpinion opinion = perspectives.get(role);
            double base = opinion.payloadAs(RiskPerspective.class).score() * opinion.confidence();
            double score = switch (role.stance()) {
                case AGGRESSIVE   -> base * (1.0 - tilt);
                case CONSERVATIVE -> base * (1.0 + tilt);
                case NEUTRAL      -> base;
            };
            scores.put(role.stance(), score);
        }
        return scores;
    }

    /** The stance with the strictly greatest score; any tie for first place goes to NEUTRAL. */
    static RiskStance selectStance(Map<RiskStance, Double> scores) {
        RiskStance best = RiskStance.NEUTRAL;
        double bestScore = Double.NEGATIVE_INFINITY;
        boolean tied = false;
        for (RiskStance stance : RiskStance.values()) {
            double score = scores.getOrDefault(stance, 0.0);
            if (score > bestScore) {
                best = stance;
                bestScore = score;
                tied = false;
            } else if (score == bestScore) {
                tied = true;
            }
        }
        return tied ? RiskStance.NEUTRAL : best;
    }

    private static AgentRole debatorFor(RiskStance stance) {
        return switch (stance) {
            case AGGRESSIVE   -> AgentRole.AGGRESSIVE_DEBATOR;
            case CONSERVATIVE -> AgentRole.CONSERVATIVE_DEBATOR;
            case NEUTRAL      -> AgentRole.NEUTRAL_DEBATOR;
        };
    }

    private static void checkpoint(CancellationSignal cancellation, DecisionPhase completed) {
        if (cancellation.isCancelled()) throw new CycleCancelledException(completed);
    }

    private void detail(String format, Object... args) {
        if (config.debug()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static CycleResult skipped(String decisionId, String symbol, LocalDate date, String reason) {
        TradingDecision hold = TradingDecision.hold(decisionId, date, symbol, reason);
        return new CycleResult(DecisionRecord.skipped(hold, reason), null);
    }

    private static CycleResult cancelled(String decisionId, String symbol, LocalDate date, CycleCancelledException e) {
        TradingDecision hold = TradingDecision.hold(decisionId, date, symbol, e.getMessage());
        return new CycleResult(DecisionRecord.cancelled(hold, e.getMessage()), null);
    }

    /** Immutable accumulator threaded through the phases. */
    private record CycleState(
        String decisionId,
        MarketSnapshot snapshot,
        AgentContext context,
        Map<AgentRole, AgentOpinion> opinions,
        DebateSynthesis debate,
        EnhancedRiskMetrics metrics,
        Map<RiskStance, Double> stanceScores,
        List<String> keyRisks,
        TradingDecision decision
    ) {

        CycleState withOpinions(Map<AgentRole, AgentOpinion> added, AgentContext nextContext) {
            Map<AgentRole, AgentOpinion> all = new EnumMap<>(AgentRole.class);
            all.putAll(opinions);
            all.putAll(added);
            return new CycleState(decisionId, snapshot, nextContext, all, debate, metrics,
                stanceScores, keyRisks, decision);
        }

        CycleState withDebate(DebateSynthesis synthesis) {
            return new CycleState(decisionId, snapshot, context, opinions, synthesis, metrics,
                stanceScores, keyRisks, decision);
        }

        CycleState withRisk(EnhancedRiskMetrics riskMetrics, Map<RiskStance, Double> scores, List<String> risks) {
            return new CycleState(decisionId, snapshot, context, opinions, debate, riskMetrics,
                scores, risks, decision);
        }

        CycleState withDecision(TradingDecision finalDecision) {
            return new CycleState(decisionId, snapshot, context, opinions, debate, metrics,
                stanceScores, keyRisks, finalDecision);
        }
    }
}
