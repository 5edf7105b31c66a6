package com.agentbacktest.common.risk;

import com.agentbacktest.common.model.MarketSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Gap risk, correlation risk, value-at-risk and position-size adjustment.
 *
 * <p>Stateless apart from its {@link RiskThresholds}; every method is a pure function of
 * its arguments. Price series are oldest-first.
 *
 * <h3>Position-size adjustment</h3>
 * <pre>
 *   gapFactor  = max(minGapFactor,         1 - expectedSlippage     × gapRiskSensitivity)
 *   corrFactor = max(minCorrelationFactor, 1 - portfolioCorrelation × correlationRiskSensitivity)
 *                (1.0 when no other position is held)
 *   divBonus   = min(maxDiversificationBonus, 1 / diversificationRatio)
 *   adjustment = max(minPositionAdjustment, gapFactor × corrFactor × divBonus)
 * </pre>
 *
 * <h3>Composite score (0–100)</h3>
 * <pre>
 *   gap   = min(30, maxGap × 100 + frequency × 50 + slippage × 100)
 *   corr  = min(30, portfolioCorr × 30 + maxPair × 20 + diversificationRatio × 10)   (2+ assets)
 *   conc  = concentration × 40
 * </pre>
 */
public final class RiskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalyzer.class);

    private final RiskThresholds thresholds;

    public RiskAnalyzer(RiskThresholds thresholds) {
        this.thresholds = thresholds.validate();
    }

    public RiskThresholds thresholds() {
        return thresholds;
    }

    // ── composite ──────────────────────────────────────────────────────────

    /**
     * Full assessment of adding to {@code symbol}.
     *
     * @param symbol                the symbol under decision
     * @param histories             recent bars per symbol, oldest first; must contain
     *                              {@code symbol} and every held symbol
     * @param heldSymbols           symbols currently held in the portfolio
     * @param positionConcentration weight of the largest position in the portfolio (0–1)
     */
    public EnhancedRiskMetrics assess(String symbol,
                                      Map<String, List<MarketSnapshot>> histories,
                                      List<String> heldSymbols,
                                      double positionConcentration) {
        List<MarketSnapshot> bars = histories.getOrDefault(symbol, List.of());
        List<MarketSnapshot> window = tail(bars, thresholds.lookbackDays() + 1);

        GapRiskMetrics gap = analyzeGapRisk(window);

        Map<String, List<MarketSnapshot>> portfolioBars = new LinkedHashMap<>();
        portfolioBars.put(symbol, bars);
        int others = 0;
        for (String held : heldSymbols) {
            if (held.equals(symbol)) continue;
            others++;
            portfolioBars.put(held, histories.getOrDefault(held, List.of()));
        }
        CorrelationRiskMetrics corr = analyzeCorrelationRisk(
            alignedReturns(portfolioBars, thresholds.correlationWindow() + 1));

        double var = adjustedVar(returns(window), gap);
        double adjustment = positionSizeAdjustment(gap, corr, others);
        double score = riskScore(gap, corr, positionConcentration);
        List<String> advice = recommendations(score, gap, corr);

        log.debug("[RiskAnalyzer] symbol={} maxGap={} gapFreq={} portfolioCorr={} divRatio={} "
                  + "var={} adjustment={} score={}",
                  symbol, gap.maxGapPct(), gap.gapFrequency(), corr.portfolioCorrelation(),
                  corr.diversificationRatio(), var, adjustment, score);
        return new EnhancedRiskMetrics(gap, corr, var, adjustment, score, advice);
    }

    // ── gap risk ───────────────────────────────────────────────────────────

    public GapRiskMetrics analyzeGapRisk(List<MarketSnapshot> bars) {
        if (bars == null || bars.size() < 2) return GapRiskMetrics.NONE;

        int observed = 0;
        int significant = 0;
        double maxGap = 0.0;
        double significantSum = 0.0;
        for (int i = 1; i < bars.size(); i++) {
            double prevClose = bars.get(i - 1).close();
            if (prevClose <= 0) continue;
            double gap = Math.abs(bars.get(i).open() - prevClose) / prevClose;
            observed++;
            maxGap = Math.max(maxGap, gap);
            if (gap > thresholds.gapThreshold()) {
                significant++;
                significantSum += gap;
            }
        }
        if (observed == 0) return GapRiskMetrics.NONE;

        double meanSignificant = significant > 0 ? significantSum / significant : 0.0;
        return new GapRiskMetrics(maxGap, meanSignificant, (double) significant / observed,
            meanSignificant * thresholds.slippageMultiplier());
    }

    // ── correlation risk ───────────────────────────────────────────────────

    /**
     * @param returnsBySymbol return series per asset, already aligned by date (see
     *                        {@link #alignedReturns}); unequal lengths are cut to the
     *                        shortest common tail
     */
    public CorrelationRiskMetrics analyzeCorrelationRisk(Map<String, List<Double>> returnsBySymbol) {
        int n = returnsBySymbol.size();
        if (n < 2) return CorrelationRiskMetrics.singleAsset();

        int length = returnsBySymbol.values().stream().mapToInt(List::size).min().orElse(0);
        if (length < 2) return new CorrelationRiskMetrics(0.0, 0.0, 0.0, 1.0, n);

        double[][] series = new double[n][];
        int idx = 0;
        for (List<Double> r : returnsBySymbol.values()) {
            series[idx++] = r.subList(r.size() - length, r.size()).stream()
                .mapToDouble(Double::doubleValue).toArray();
        }

        double[][] cov = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                cov[i][j] = covariance(series[i], series[j]);
                cov[j][i] = cov[i][j];
            }
        }

        double[][] corr = new double[n][n];
        List<Double> pairs = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            corr[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double denom = Math.sqrt(cov[i][i] * cov[j][j]);
                double c = denom > 0 ? clamp(cov[i][j] / denom, -1.0, 1.0) : 0.0;
                corr[i][j] = c;
                corr[j][i] = c;
                pairs.add(c);
            }
        }
        double mean = pairs.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double max = pairs.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double concentration = pairs.stream().mapToDouble(c -> c * c).sum() / pairs.size();

        // standardized returns: every asset has unit variance, so the average variance is 1
        double weight = 1.0 / n;
        double portfolioVar = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                portfolioVar += weight * weight * corr[i][j];
            }
        }
        double ratio = Math.sqrt(Math.max(portfolioVar, 0.0));
        if (!Double.isFinite(ratio) || ratio <= 0) ratio = 1.0;

        return new CorrelationRiskMetrics(mean, max, concentration, Math.min(ratio, 1.0), n);
    }

    // ── value at risk ──────────────────────────────────────────────────────

    /**
     * Historical VaR at the configured confidence, widened by {@code 1 + maxGap × varGapWeight}.
     * Empty series yield 0.
     */
    public double adjustedVar(List<Double> returns, GapRiskMetrics gap) {
        if (returns == null || returns.isEmpty()) return 0.0;
        double standard = percentile(returns, 1.0 - thresholds.varConfidence());
        return standard * (1.0 + gap.maxGapPct() * thresholds.varGapWeight());
    }

    // ── sizing and scoring ─────────────────────────────────────────────────

    public double positionSizeAdjustment(GapRiskMetrics gap, CorrelationRiskMetrics corr, int otherPositions) {
        double gapFactor = Math.max(thresholds.minGapFactor(),
            1.0 - gap.expectedSlippage() * thresholds.gapRiskSensitivity());

        double corrFactor = 1.0;
        if (otherPositions > 0) {
            corrFactor = Math.max(thresholds.minCorrelationFactor(),
                1.0 - corr.portfolioCorrelation() * thresholds.correlationRiskSensitivity());
        }

        double ratio = corr.diversificationRatio();
        double divBonus = ratio > 0 ? Math.min(thresholds.maxDiversificationBonus(), 1.0 / ratio) : 1.0;

        double adjustment = gapFactor * Math.min(corrFactor, 1.0) * divBonus;
        if (!Double.isFinite(adjustment)) return thresholds.minPositionAdjustment();
        return Math.max(thresholds.minPositionAdjustment(), adjustment);
    }

    public double riskScore(GapRiskMetrics gap, CorrelationRiskMetrics corr, double positionConcentration) {
        double gapScore = Math.min(RiskThresholds.GAP_SUBSCORE_CAP,
            gap.maxGapPct() * RiskThresholds.GAP_MAX_WEIGHT
                + gap.gapFrequency() * RiskThresholds.GAP_FREQUENCY_WEIGHT
                + gap.expectedSlippage() * RiskThresholds.GAP_SLIPPAGE_WEIGHT);

        double corrScore = 0.0;
        if (corr.assetCount() >= 2) {
            corrScore = Math.min(RiskThresholds.CORR_SUBSCORE_CAP,
                corr.portfolioCorrelation() * RiskThresholds.CORR_PORTFOLIO_WEIGHT
                    + corr.maxPairCorrelation() * RiskThresholds.CORR_MAX_PAIR_WEIGHT
                    + corr.diversificationRatio() * RiskThresholds.CORR_DIVERSIFICATION_WEIGHT);
        }

        double concScore = clamp(positionConcentration, 0.0, 1.0) * RiskThresholds.CONCENTRATION_WEIGHT;
        return clamp(gapScore + corrScore + concScore, 0.0, 100.0);
    }

    public List<String> recommendations(double riskScore, GapRiskMetrics gap, CorrelationRiskMetrics corr) {
        List<String> out = new ArrayList<>();
        if (riskScore > thresholds.highRiskScore()) {
            out.add("HIGH RISK: Consider reducing position sizes");
        } else if (riskScore > thresholds.moderateRiskScore()) {
            out.add("MODERATE RISK: Monitor positions closely");
        }
        if (gap.maxGapPct() > thresholds.largeGapThreshold()) {
            out.add(String.format("Large gaps detected (%.1f%%). Use limit orders and avoid market orders",
                gap.maxGapPct() * 100));
        }
        if (gap.gapFrequency() > thresholds.frequentGapThreshold()) {
            out.add(String.format("Frequent gaps (%.1f%% of days). Consider wider stop losses",
                gap.gapFrequency() * 100));
        }
        if (corr.assetCount() >= 2) {
            if (corr.portfolioCorrelation() > thresholds.highCorrelationThreshold()) {
                out.add("High portfolio correlation. Add uncorrelated assets");
            }
            if (corr.maxPairCorrelation() > thresholds.extremeCorrelationThreshold()) {
                out.add("Extremely high correlation between some positions. Consider closing redundant positions");
            }
            if (corr.diversificationRatio() > thresholds.lowDiversificationThreshold()) {
                out.add("Low diversification benefit. Spread risk across more assets");
            }
        }
        return out;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    /** Close-to-close simple returns of an oldest-first bar series. */
    public static List<Double> returns(List<MarketSnapshot> bars) {
        List<Double> out = new ArrayList<>();
        for (int i = 1; i < bars.size(); i++) {
            double prev = bars.get(i - 1).close();
            if (prev > 0) out.add(bars.get(i).close() / prev - 1.0);
        }
        return out;
    }

    /**
     * Close-to-close returns per symbol over the latest {@code maxBars} dates present in
     * every series, so that return {@code i} of each symbol covers the same two dates.
     */
    public static Map<String, List<Double>> alignedReturns(Map<String, List<MarketSnapshot>> barsBySymbol,
                                                           int maxBars) {
        Set<LocalDate> common = null;
        for (List<MarketSnapshot> series : barsBySymbol.values()) {
            Set<LocalDate> dates = new HashSet<>();
            for (MarketSnapshot bar : series) dates.add(bar.date());
            if (common == null) {
                common = new TreeSet<>(dates);
            } else {
                common.retainAll(dates);
            }
        }
        List<LocalDate> commonDates = common == null ? new ArrayList<>() : new ArrayList<>(common);
        List<LocalDate> window = tail(commonDates, maxBars);
        Set<LocalDate> included = new HashSet<>(window);

        Map<String, List<Double>> out = new LinkedHashMap<>();
        barsBySymbol.forEach((symbol, series) -> {
            List<MarketSnapshot> onCommonDates = new ArrayList<>(window.size());
            for (MarketSnapshot bar : series) {
                if (included.contains(bar.date())) onCommonDates.add(bar);
            }
            out.put(symbol, returns(onCommonDates));
        });
        return out;
    }

    /** Linear-interpolated percentile, {@code q} in [0,1]. */
    static double percentile(List<Double> values, double q) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        if (sorted.length == 1) return sorted[0];
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        double frac = pos - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * frac;
    }

    private static double covariance(double[] a, double[] b) {
        double meanA = Arrays.stream(a).average().orElse(0.0);
        double meanB = Arrays.stream(b).average().orElse(0.0);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (a[i] - meanA) * (b[i] - meanB);
        }
        return sum / (a.length - 1);
    }

    private static <T> List<T> tail(List<T> list, int n) {
        return list.size() <= n ? list : list.subList(list.size() - n, list.size());
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
