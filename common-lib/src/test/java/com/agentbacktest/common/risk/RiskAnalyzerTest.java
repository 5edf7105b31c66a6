package com.agentbacktest.common.risk;

import com.agentbacktest.common.model.MarketSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic checks of {@link RiskAnalyzer} formulas on hand-built series.
 */
class RiskAnalyzerTest {

    private final RiskAnalyzer analyzer = new RiskAnalyzer(RiskThresholds.defaults());

    /** Bars where each open equals the previous close unless a gap is injected. */
    private static List<MarketSnapshot> flatBars(int count, double price, Map<Integer, Double> gapsAt) {
        List<MarketSnapshot> bars = new ArrayList<>();
        LocalDate date = LocalDate.of(2024, 1, 1);
        double prevClose = price;
        for (int i = 0; i < count; i++) {
            double open = prevClose * (1.0 + gapsAt.getOrDefault(i, 0.0));
            double close = open;
            bars.add(MarketSnapshot.of("X", date.plusDays(i), open, open, open, close, 1_000));
            prevClose = close;
        }
        return bars;
    }

    /** Gap-free bars on consecutive days with irregular closes, identical for every symbol. */
    private static List<MarketSnapshot> wave(String symbol, int count) {
        List<MarketSnapshot> bars = new ArrayList<>();
        LocalDate date = LocalDate.of(2024, 1, 1);
        double prevClose = 100.0;
        for (int i = 0; i < count; i++) {
            double close = 100.0 + 5.0 * Math.sin(i * 1.3) + 3.0 * Math.cos(i * 0.7) + 0.1 * i;
            bars.add(MarketSnapshot.of(symbol, date.plusDays(i), prevClose,
                Math.max(prevClose, close), Math.min(prevClose, close), close, 1_000));
            prevClose = close;
        }
        return bars;
    }

    // ── gap risk ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("gap risk")
    class GapRiskTests {

        @Test
        @DisplayName("single 10% gap vs 2% threshold → frequency 1/gapDays, max 0.10")
        void singleGap() {
            List<MarketSnapshot> bars = flatBars(11, 100.0, Map.of(5, 0.10));
            GapRiskMetrics gap = analyzer.analyzeGapRisk(bars);

            int gapDays = bars.size() - 1;
            assertEquals(1.0 / gapDays, gap.gapFrequency(), 1e-12);
            assertEquals(0.10, gap.maxGapPct(), 1e-12);
            assertEquals(0.10, gap.averageGapPct(), 1e-12);
            assertEquals(0.05, gap.expectedSlippage(), 1e-12);
        }

        @Test
        @DisplayName("gaps at or below the threshold are not significant")
        void belowThreshold() {
            GapRiskMetrics gap = analyzer.analyzeGapRisk(flatBars(5, 50.0, Map.of(2, 0.015)));
            assertEquals(0.0, gap.gapFrequency());
            assertEquals(0.0, gap.averageGapPct());
            assertEquals(0.015, gap.maxGapPct(), 1e-12);
        }

        @Test
        @DisplayName("fewer than two bars → zeros")
        void tooShort() {
            assertEquals(GapRiskMetrics.NONE, analyzer.analyzeGapRisk(flatBars(1, 10.0, Map.of())));
            assertEquals(GapRiskMetrics.NONE, analyzer.analyzeGapRisk(List.of()));
        }
    }

    // ── correlation risk ───────────────────────────────────────────────────

    @Nested
    @DisplayName("correlation risk")
    class CorrelationTests {

        @Test
        @DisplayName("single asset → diversification ratio 1")
        void singleAsset() {
            CorrelationRiskMetrics corr = analyzer.analyzeCorrelationRisk(
                Map.of("A", List.of(0.01, -0.02, 0.03)));
            assertEquals(1.0, corr.diversificationRatio());
            assertEquals(0.0, corr.portfolioCorrelation());
        }

        @Test
        @DisplayName("perfectly correlated assets → ratio 1, correlation 1")
        void perfectlyCorrelated() {
            Map<String, List<Double>> returns = new LinkedHashMap<>();
            returns.put("A", List.of(0.01, -0.02, 0.03, 0.00, 0.015));
            returns.put("B", List.of(0.02, -0.04, 0.06, 0.00, 0.030));
            CorrelationRiskMetrics corr = analyzer.analyzeCorrelationRisk(returns);

            assertEquals(1.0, corr.portfolioCorrelation(), 1e-9);
            assertEquals(1.0, corr.maxPairCorrelation(), 1e-9);
            assertEquals(1.0, corr.correlationConcentration(), 1e-9);
            assertEquals(1.0, corr.diversificationRatio(), 1e-9);
        }

        @Test
        @DisplayName("two uncorrelated equal-variance assets → ratio √2/2")
        void uncorrelated() {
            Map<String, List<Double>> returns = new LinkedHashMap<>();
            returns.put("A", List.of(0.01, -0.01, 0.01, -0.01));
            returns.put("B", List.of(0.01, 0.01, -0.01, -0.01));
            CorrelationRiskMetrics corr = analyzer.analyzeCorrelationRisk(returns);

            assertEquals(0.0, corr.portfolioCorrelation(), 1e-12);
            assertEquals(Math.sqrt(2) / 2, corr.diversificationRatio(), 1e-9);
        }

        @Test
        @DisplayName("series ending on different dates are compared on their common dates")
        void alignedOnDates() {
            List<MarketSnapshot> a = wave("A", 25);
            List<MarketSnapshot> b = wave("B", 25).subList(0, 24);

            EnhancedRiskMetrics metrics = analyzer.assess("A", Map.of("A", a, "B", b), List.of("B"), 0.5);

            assertEquals(2, metrics.correlationRisk().assetCount());
            assertEquals(1.0, metrics.correlationRisk().portfolioCorrelation(), 1e-9);
            assertEquals(1.0, metrics.correlationRisk().maxPairCorrelation(), 1e-9);
        }

        @Test
        @DisplayName("alignedReturns keeps only dates present in every series")
        void alignedReturnsDropsUnsharedDates() {
            List<MarketSnapshot> a = wave("A", 10);
            List<MarketSnapshot> b = new ArrayList<>(wave("B", 10));
            b.remove(4);
            Map<String, List<MarketSnapshot>> bars = new LinkedHashMap<>();
            bars.put("A", a);
            bars.put("B", b);

            Map<String, List<Double>> returns = RiskAnalyzer.alignedReturns(bars, 100);

            assertEquals(8, returns.get("A").size());
            assertEquals(returns.get("A"), returns.get("B"));
            assertEquals(4, RiskAnalyzer.alignedReturns(bars, 5).get("B").size());
        }

        @Test
        @DisplayName("ratio stays within (0,1] for imperfectly correlated assets")
        void ratioBounded() {
            Map<String, List<Double>> returns = new LinkedHashMap<>();
            returns.put("A", List.of(0.01, -0.03, 0.02, 0.005, -0.01, 0.04));
            returns.put("B", List.of(-0.02, 0.01, 0.03, -0.01, 0.02, 0.00));
            returns.put("C", List.of(0.00, 0.02, -0.01, 0.03, -0.02, 0.01));
            double ratio = analyzer.analyzeCorrelationRisk(returns).diversificationRatio();
            assertTrue(ratio > 0 && ratio <= 1.0, "ratio=" + ratio);
        }
    }

    // ── sizing, VaR, score ─────────────────────────────────────────────────

    @Nested
    @DisplayName("position-size adjustment")
    class AdjustmentTests {

        @Test
        @DisplayName("no risk → 1.0")
        void noRisk() {
            assertEquals(1.0, analyzer.positionSizeAdjustment(GapRiskMetrics.NONE,
                CorrelationRiskMetrics.singleAsset(), 0), 1e-12);
        }

        @Test
        @DisplayName("gap slippage shrinks size but never below the gap floor")
        void gapFloor() {
            GapRiskMetrics huge = new GapRiskMetrics(0.5, 0.5, 1.0, 0.9);
            assertEquals(0.5, analyzer.positionSizeAdjustment(huge,
                CorrelationRiskMetrics.singleAsset(), 0), 1e-12);
        }

        @Test
        @DisplayName("correlation factor only applies when other positions are held")
        void correlationOnlyWithPositions() {
            CorrelationRiskMetrics corr = new CorrelationRiskMetrics(0.8, 0.8, 0.64, 1.0, 2);
            assertEquals(1.0, analyzer.positionSizeAdjustment(GapRiskMetrics.NONE, corr, 0), 1e-12);
            assertEquals(0.7, analyzer.positionSizeAdjustment(GapRiskMetrics.NONE, corr, 1), 1e-12);
        }

        @Test
        @DisplayName("diversification bonus is capped and the overall result floored")
        void bonusCappedAndFloored() {
            CorrelationRiskMetrics diversified = new CorrelationRiskMetrics(0.0, 0.0, 0.0, 0.5, 4);
            assertEquals(1.2, analyzer.positionSizeAdjustment(GapRiskMetrics.NONE, diversified, 3), 1e-12);

            RiskThresholds strict = new RiskThresholds(30, 60, 0.02, 0.5, 0.95, 1.0, 2.0, 0.5,
                0.1, 0.1, 1.2, 0.3, 70, 50, 0.05, 0.1, 0.7, 0.9, 0.9);
            RiskAnalyzer floored = new RiskAnalyzer(strict);
            CorrelationRiskMetrics correlated = new CorrelationRiskMetrics(1.0, 1.0, 1.0, 1.0, 2);
            GapRiskMetrics gappy = new GapRiskMetrics(0.5, 0.5, 1.0, 0.9);
            assertEquals(0.3, floored.positionSizeAdjustment(gappy, correlated, 1), 1e-12);
        }
    }

    @Test
    @DisplayName("VaR is the 5th percentile widened by the max gap")
    void adjustedVar() {
        List<Double> returns = new ArrayList<>();
        for (int i = 0; i <= 20; i++) returns.add(-0.10 + i * 0.01);  // -0.10 .. 0.10
        GapRiskMetrics gap = new GapRiskMetrics(0.10, 0.10, 0.05, 0.05);

        double var = analyzer.adjustedVar(returns, gap);
        assertEquals(-0.09 * 1.10, var, 1e-9);
        assertEquals(0.0, analyzer.adjustedVar(List.of(), gap));
    }

    @Test
    @DisplayName("risk score is clamped to [0,100] and sub-scores are capped")
    void riskScoreClamped() {
        GapRiskMetrics extreme = new GapRiskMetrics(1.0, 1.0, 1.0, 1.0);
        CorrelationRiskMetrics corr = new CorrelationRiskMetrics(1.0, 1.0, 1.0, 1.0, 3);
        assertEquals(100.0, analyzer.riskScore(extreme, corr, 1.0), 1e-9);
        assertEquals(30.0 + 30.0, analyzer.riskScore(extreme, corr, 0.0), 1e-9);
        assertEquals(0.0, analyzer.riskScore(GapRiskMetrics.NONE, CorrelationRiskMetrics.singleAsset(), 0.0));
    }

    @Test
    @DisplayName("recommendations fire on threshold crossings")
    void recommendations() {
        GapRiskMetrics gap = new GapRiskMetrics(0.08, 0.06, 0.2, 0.03);
        CorrelationRiskMetrics corr = new CorrelationRiskMetrics(0.8, 0.95, 0.9, 0.97, 2);
        List<String> advice = analyzer.recommendations(75.0, gap, corr);

        assertEquals("HIGH RISK: Consider reducing position sizes", advice.get(0));
        assertTrue(advice.contains("Large gaps detected (8.0%). Use limit orders and avoid market orders"));
        assertTrue(advice.contains("Frequent gaps (20.0% of days). Consider wider stop losses"));
        assertTrue(advice.contains("High portfolio correlation. Add uncorrelated assets"));
        assertTrue(advice.stream().anyMatch(a -> a.startsWith("Extremely high correlation")));
        assertTrue(advice.contains("Low diversification benefit. Spread risk across more assets"));

        assertTrue(analyzer.recommendations(10.0, GapRiskMetrics.NONE,
            CorrelationRiskMetrics.singleAsset()).isEmpty());
    }

    @Test
    @DisplayName("assess() combines gap, correlation and sizing for the candidate symbol")
    void assess() {
        List<MarketSnapshot> bars = flatBars(11, 100.0, Map.of(5, 0.10));
        EnhancedRiskMetrics metrics = analyzer.assess("X", Map.of("X", bars), List.of(), 0.0);

        assertEquals(0.10, metrics.gapRisk().maxGapPct(), 1e-12);
        assertEquals(1, metrics.correlationRisk().assetCount());
        assertEquals(1.0 - 0.05 * 2.0, metrics.positionSizeAdjustment(), 1e-12);
        assertTrue(metrics.riskScore() > 0 && metrics.riskScore() <= 100);
        assertTrue(metrics.recommendations().stream().anyMatch(r -> r.startsWith("Large gaps")));
    }
}
