package com.agentbacktest.engine.orchestrator;

import com.agentbacktest.common.cache.ResultCache;
import com.agentbacktest.common.exception.ProviderUnavailableException;
import com.agentbacktest.common.model.AgentOpinion;
import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.model.NewsReport;
import com.agentbacktest.common.model.OrderKind;
import com.agentbacktest.common.model.RecentPerformance;
import com.agentbacktest.common.model.RiskAssessment;
import com.agentbacktest.common.model.RiskStance;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.model.TradingDecision;
import com.agentbacktest.common.provider.AgentContext;
import com.agentbacktest.common.provider.DecisionProvider;
import com.agentbacktest.common.provider.ProviderReply;
import com.agentbacktest.common.resilience.ResilienceSettings;
import com.agentbacktest.common.resilience.ResilientCaller;
import com.agentbacktest.common.risk.RiskAnalyzer;
import com.agentbacktest.engine.config.BacktestConfig;
import com.agentbacktest.engine.position.PositionManager;
import com.agentbacktest.engine.position.RejectionReason;
import com.agentbacktest.engine.simulation.TradingCalendar;
import com.agentbacktest.engine.support.InMemoryMarketData;
import com.agentbacktest.engine.support.ScriptedDecisionProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DecisionOrchestratorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 2);
    private static final List<LocalDate> DAYS = TradingCalendar.tradingDays(START, START.plusDays(60));
    private static final LocalDate DAY = DAYS.get(30);
    private static final double EPS = 1e-6;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private BacktestConfig config;
    private InMemoryMarketData data;
    private ResultCache<AgentOpinion> cache;
    private PositionManager positions;

    @BeforeEach
    void setUp() {
        config = BacktestConfig.defaults(List.of("AAPL"), START, DAY)
            .resilience(new ResilienceSettings(1, Duration.ofMillis(1), Duration.ofMillis(4),
                5, Duration.ofSeconds(60), Duration.ofSeconds(2), Duration.ofSeconds(10)))
            .build();
        data = new InMemoryMarketData().withFlat("AAPL", START, DAYS.size(), 200.0);
        cache = new ResultCache<>(1_000, Duration.ofHours(1), clock);
        positions = new PositionManager(config);
    }

    private DecisionOrchestrator orchestrator(DecisionProvider provider) {
        return orchestrator(provider, positions);
    }

    private DecisionOrchestrator orchestrator(DecisionProvider provider, PositionManager pm) {
        return new DecisionOrchestrator(config, provider, data,
            new ResilientCaller(config.resilience(), clock), cache,
            new RiskAnalyzer(config.riskThresholds()), pm,
            new MarketMemory(data, config.historyLookback(), config.decisionMemory()),
            new OpinionParser(mapper), new DecisionFlowLogger(), clock);
    }

    private static AgentOpinion opinion(TradingDecision decision, AgentRole role) {
        return decision.opinions().stream().filter(o -> o.role() == role).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("full cycle")
    class FullCycle {

        @Test
        @DisplayName("confident BUY on a flat market executes 20% of the portfolio")
        void buyExecutes() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.directional(TradeAction.BUY, 0.9);

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            DecisionRecord record = result.record();
            assertEquals(DecisionStatus.EXECUTED, record.status());
            TradingDecision decision = record.decision();
            assertEquals(TradeAction.BUY, decision.action());
            assertEquals(RiskStance.NEUTRAL, decision.riskAssessment().stance());
            assertEquals(0.20, decision.positionSizePct(), EPS);
            assertEquals(0.675, decision.confidence(), EPS);
            assertEquals(9, decision.opinions().size());
            assertTrue(decision.opinions().stream().noneMatch(AgentOpinion::degraded));

            assertEquals(100.0, record.transaction().quantity(), EPS);
            assertEquals(79_960.0, positions.portfolioState(DAY).cash(), EPS);
            assertNotNull(result.risk());
            assertEquals(0.0, result.risk().metrics().riskScore(), EPS);
            assertEquals(9, provider.totalCalls());
        }

        @Test
        @DisplayName("weak debate conviction turns the decision into HOLD")
        void weakConvictionHolds() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.directional(TradeAction.BUY, 0.2);

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            assertEquals(DecisionStatus.HOLD, result.record().status());
            assertEquals(TradeAction.HOLD, result.record().decision().action());
            assertTrue(positions.transactions().isEmpty());
        }

        @Test
        @DisplayName("SELL without a position is recorded as rejected")
        void sellRejected() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.directional(TradeAction.SELL, 0.9);

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            assertEquals(DecisionStatus.REJECTED, result.record().status());
            assertEquals(RejectionReason.INSUFFICIENT_POSITION, result.record().rejectionReason());
        }

        @Test
        @DisplayName("missing market data skips the cycle without calling the provider")
        void noDataSkips() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.directional(TradeAction.BUY, 0.9);

            CycleResult result = orchestrator(provider).decide("MSFT", DAY, new CancellationSignal()).block();

            assertEquals(DecisionStatus.SKIPPED, result.record().status());
            assertNull(result.risk());
            assertEquals(0, provider.totalCalls());
        }

        @Test
        @DisplayName("earlier decisions of the symbol reach the agent context")
        void decisionMemory() {
            AtomicReference<AgentContext> seen = new AtomicReference<>();
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) -> {
                if (role == AgentRole.MARKET_ANALYST) seen.set(ctx);
                return ScriptedDecisionProvider.reply(
                    ScriptedDecisionProvider.payloadFor(role, TradeAction.BUY, 0.9), 0.9);
            });
            DecisionOrchestrator orchestrator = orchestrator(provider);

            orchestrator.decide("AAPL", DAY, new CancellationSignal()).block();
            orchestrator.decide("AAPL", DAYS.get(31), new CancellationSignal()).block();

            assertEquals(List.of(TradeAction.BUY), seen.get().recentActions());
            assertEquals(100.0, seen.get().positionHeld(), EPS);
            assertEquals(DAYS.get(31), seen.get().snapshot().date());
        }
    }

    @Nested
    @DisplayName("recent performance")
    class Performance {

        @Test
        @DisplayName("closed positions of the symbol reach the agent context and the cache key")
        void performanceInContext() {
            TradingDecision buy = new TradingDecision("seed-buy", DAYS.get(20), "AAPL", TradeAction.BUY, 10.0,
                OrderKind.MARKET, 0.9, "seed", 0.0, 0.10, 0.20, RiskAssessment.neutral(), List.of());
            TradingDecision sell = new TradingDecision("seed-sell", DAYS.get(25), "AAPL", TradeAction.SELL, 10.0,
                OrderKind.MARKET, 0.9, "seed", 0.0, 0.10, 0.20, RiskAssessment.neutral(), List.of());
            positions.executeTransaction(buy, 180.0);
            positions.executeTransaction(sell, 198.0);
            AtomicReference<AgentContext> seen = new AtomicReference<>();
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) -> {
                if (role == AgentRole.MARKET_ANALYST) seen.set(ctx);
                return ScriptedDecisionProvider.reply(
                    ScriptedDecisionProvider.payloadFor(role, TradeAction.HOLD, 0.9), 0.9);
            });

            orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            RecentPerformance performance = seen.get().performance();
            assertEquals(1, performance.tradeCount());
            assertEquals(1.0, performance.winRate(), EPS);
            assertEquals(0.10, performance.averageReturn(), EPS);
            assertTrue(performance.recentPnl() > 0.0);
            assertTrue(seen.get().cacheFields().containsKey("performance"));
            assertNotEquals(seen.get().cacheFields(),
                AgentContext.initial(seen.get().snapshot(), seen.get().recentBars(), seen.get().recentActions(),
                    seen.get().positionHeld()).cacheFields());
        }
    }

    @Nested
    @DisplayName("degradation")
    class Degradation {

        @Test
        @DisplayName("malformed content becomes a neutral placeholder and is not retried")
        void malformedIsNeutral() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) ->
                role == AgentRole.NEWS_ANALYST
                    ? new ProviderReply("{not json", 0.9, "broken")
                    : ScriptedDecisionProvider.reply(
                        ScriptedDecisionProvider.payloadFor(role, TradeAction.BUY, 0.9), 0.9));

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            AgentOpinion news = opinion(result.record().decision(), AgentRole.NEWS_ANALYST);
            assertTrue(news.degraded());
            assertEquals(AgentOpinion.NEUTRAL_CONFIDENCE, news.confidence(), EPS);
            assertEquals(NewsReport.neutral(), news.payload());
            assertEquals(1, provider.calls(AgentRole.NEWS_ANALYST));
            assertEquals(DecisionStatus.EXECUTED, result.record().status());
        }

        @Test
        @DisplayName("payload failing validation becomes a neutral placeholder")
        void invalidPayloadIsNeutral() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) ->
                role == AgentRole.SENTIMENT_ANALYST
                    ? new ProviderReply("{\"signal\":\"BUY\",\"sentimentScore\":3.5,\"mood\":\"euphoric\"}", 0.9, "")
                    : ScriptedDecisionProvider.reply(
                        ScriptedDecisionProvider.payloadFor(role, TradeAction.BUY, 0.9), 0.9));

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            assertTrue(opinion(result.record().decision(), AgentRole.SENTIMENT_ANALYST).degraded());
        }

        @Test
        @DisplayName("an empty reply degrades only that role and the cycle still completes")
        void emptyReplyIsNeutral() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) ->
                role == AgentRole.BULL_RESEARCHER
                    ? null
                    : ScriptedDecisionProvider.reply(
                        ScriptedDecisionProvider.payloadFor(role, TradeAction.BUY, 0.9), 0.9));

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            TradingDecision decision = result.record().decision();
            assertNotEquals(DecisionStatus.SKIPPED, result.record().status());
            assertEquals(DecisionStatus.HOLD, result.record().status());
            assertEquals(9, decision.opinions().size());
            assertTrue(opinion(decision, AgentRole.BULL_RESEARCHER).degraded());
            assertFalse(opinion(decision, AgentRole.MARKET_ANALYST).degraded());
            assertEquals(1, provider.calls(AgentRole.BULL_RESEARCHER));
            assertNotNull(result.risk());
        }

        @Test
        @DisplayName("a provider that always fails still yields a HOLD decision")
        void failingProviderHolds() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) -> {
                throw new ProviderUnavailableException(role, "down");
            });

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            TradingDecision decision = result.record().decision();
            assertEquals(DecisionStatus.HOLD, result.record().status());
            assertEquals(9, decision.opinions().size());
            assertTrue(decision.opinions().stream().allMatch(AgentOpinion::degraded));
            assertEquals(2, provider.calls(AgentRole.MARKET_ANALYST));
            assertTrue(positions.transactions().isEmpty());
        }
    }

    @Nested
    @DisplayName("portfolio risk")
    class PortfolioRisk {

        @Test
        @DisplayName("a held symbol is correlated on the decision date even before its own cycle ran")
        void heldSymbolReadUpToDecisionDate() {
            double[] closes = new double[DAYS.size()];
            for (int i = 0; i < closes.length; i++) {
                closes[i] = 100.0 + 6.0 * Math.sin(i * 1.1) + 2.0 * Math.cos(i * 0.4);
            }
            data = new InMemoryMarketData()
                .withCloses("AAA", START, closes)
                .withCloses("BBB", START, closes);
            DecisionOrchestrator orchestrator = orchestrator(ScriptedDecisionProvider.directional(TradeAction.BUY, 0.9));

            CycleResult bought = orchestrator.decide("BBB", DAYS.get(29), new CancellationSignal()).block();
            CycleResult result = orchestrator.decide("AAA", DAY, new CancellationSignal()).block();

            assertEquals(DecisionStatus.EXECUTED, bought.record().status());
            assertEquals(List.of("BBB"), positions.heldSymbols());
            assertEquals(2, result.risk().metrics().correlationRisk().assetCount());
            assertEquals(1.0, result.risk().metrics().correlationRisk().portfolioCorrelation(), 1e-9);
        }
    }

    @Nested
    @DisplayName("cache")
    class Cache {

        @Test
        @DisplayName("an identical cycle is answered from the cache without provider calls")
        void identicalCycleHitsCache() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.directional(TradeAction.BUY, 0.9);

            orchestrator(provider, new PositionManager(config)).decide("AAPL", DAY, new CancellationSignal()).block();
            int callsAfterFirst = provider.totalCalls();
            CycleResult second = orchestrator(provider, new PositionManager(config))
                .decide("AAPL", DAY, new CancellationSignal()).block();

            assertEquals(9, callsAfterFirst);
            assertEquals(9, provider.totalCalls());
            assertEquals(9, cache.stats().hits());
            assertEquals(DecisionStatus.EXECUTED, second.record().status());
        }

        @Test
        @DisplayName("placeholders are not cached")
        void placeholdersNotCached() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) -> {
                throw new ProviderUnavailableException(role, "down");
            });

            orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            assertEquals(0, cache.size());
        }
    }

    @Nested
    @DisplayName("stance selection")
    class StanceSelection {

        @Test
        @DisplayName("strictly greatest score wins")
        void greatestWins() {
            Map<RiskStance, Double> scores = Map.of(
                RiskStance.AGGRESSIVE, 0.6, RiskStance.NEUTRAL, 0.2, RiskStance.CONSERVATIVE, 0.5);
            assertEquals(RiskStance.AGGRESSIVE, DecisionOrchestrator.selectStance(scores));
        }

        @Test
        @DisplayName("tie for first place goes to NEUTRAL")
        void tieIsNeutral() {
            Map<RiskStance, Double> scores = Map.of(
                RiskStance.AGGRESSIVE, 0.5, RiskStance.NEUTRAL, 0.2, RiskStance.CONSERVATIVE, 0.5);
            assertEquals(RiskStance.NEUTRAL, DecisionOrchestrator.selectStance(scores));
            assertEquals(RiskStance.NEUTRAL, DecisionOrchestrator.selectStance(Map.of()));
        }

        @Test
        @DisplayName("risk score tilts scores toward the conservative stance")
        void riskTilt() {
            Map<AgentRole, AgentOpinion> perspectives = new EnumMap<>(AgentRole.class);
            for (AgentRole role : AgentRole.riskDebators()) {
                perspectives.put(role, new AgentOpinion(role, Instant.EPOCH,
                    ScriptedDecisionProvider.perspective(role.stance(), 0.5), 1.0, "", 0L, false));
            }

            Map<RiskStance, Double> scores = DecisionOrchestrator.stanceScores(perspectives, 50.0);

            assertEquals(0.25, scores.get(RiskStance.AGGRESSIVE), EPS);
            assertEquals(0.50, scores.get(RiskStance.NEUTRAL), EPS);
            assertEquals(0.75, scores.get(RiskStance.CONSERVATIVE), EPS);
        }

        @Test
        @DisplayName("tied aggressive and conservative debators yield a NEUTRAL assessment")
        void tieEndToEnd() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) -> switch (role) {
                case AGGRESSIVE_DEBATOR -> ScriptedDecisionProvider.reply(
                    ScriptedDecisionProvider.perspective(RiskStance.AGGRESSIVE, 0.6), 0.9);
                case CONSERVATIVE_DEBATOR -> ScriptedDecisionProvider.reply(
                    ScriptedDecisionProvider.perspective(RiskStance.CONSERVATIVE, 0.6), 0.9);
                case NEUTRAL_DEBATOR -> ScriptedDecisionProvider.reply(
                    ScriptedDecisionProvider.perspective(RiskStance.NEUTRAL, 0.2), 0.9);
                default -> ScriptedDecisionProvider.reply(
                    ScriptedDecisionProvider.payloadFor(role, TradeAction.BUY, 0.9), 0.9);
            });

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, new CancellationSignal()).block();

            assertEquals(RiskStance.NEUTRAL, result.record().decision().riskAssessment().stance());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("a cancelled signal stops the cycle before any agent is asked")
        void cancelledUpFront() {
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.directional(TradeAction.BUY, 0.9);
            CancellationSignal signal = new CancellationSignal();
            signal.cancel();

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, signal).block();

            assertEquals(DecisionStatus.CANCELLED, result.record().status());
            assertEquals(0, provider.totalCalls());
        }

        @Test
        @DisplayName("cancellation during a phase lets it finish and stops before execution")
        void cancelledMidCycle() {
            CancellationSignal signal = new CancellationSignal();
            ScriptedDecisionProvider provider = ScriptedDecisionProvider.of((role, ctx) -> {
                if (role == AgentRole.BULL_RESEARCHER) signal.cancel();
                return ScriptedDecisionProvider.reply(
                    ScriptedDecisionProvider.payloadFor(role, TradeAction.BUY, 0.9), 0.9);
            });

            CycleResult result = orchestrator(provider).decide("AAPL", DAY, signal).block();

            assertEquals(DecisionStatus.CANCELLED, result.record().status());
            assertEquals(1, provider.calls(AgentRole.BEAR_RESEARCHER));
            assertEquals(0, provider.calls(AgentRole.NEUTRAL_DEBATOR));
            assertTrue(positions.transactions().isEmpty());
        }
    }
}
