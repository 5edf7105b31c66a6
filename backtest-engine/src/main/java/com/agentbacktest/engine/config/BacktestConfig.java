package com.agentbacktest.engine.config;

import com.agentbacktest.common.exception.InvalidConfigurationException;
import com.agentbacktest.common.resilience.ResilienceSettings;
import com.agentbacktest.common.risk.RiskThresholds;
import lombok.Builder;

import java.time.Duration;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable input of one backtest run.
 *
 * <p>Obtain a pre-filled builder with {@link #defaults(List, LocalDate, LocalDate)} and
 * override what differs. {@link #validate()} runs before any run state is created.
 *
 * @param basePositionSizePct share of total portfolio value a neutral-stance BUY targets
 * @param minPositionPct      smallest BUY notional, as a share of total value
 * @param maxPositionPct      largest BUY notional, as a share of total value
 * @param minConfidence       decisions below this confidence become HOLD
 * @param minConviction       debate conviction below this becomes HOLD
 * @param maxHoldingDays      calendar days after which a position is force-closed
 * @param historyLookback     bars handed to the agents and the risk analyzer
 * @param decisionMemory      past decisions per symbol summarised into the agent context
 * @param transactionCapacity bound of the transaction and portfolio histories
 * @param symbolConcurrency   decision cycles of one date run in parallel up to this bound
 * @param debug               raises per-phase orchestrator logs from DEBUG to INFO
 */
@Builder(toBuilder = true)
public record BacktestConfig(
    List<String> symbols,
    LocalDate startDate,
    LocalDate endDate,
    double initialCapital,
    double commissionRate,
    double slippageRate,
    double basePositionSizePct,
    double minPositionPct,
    double maxPositionPct,
    double minConfidence,
    double minConviction,
    int maxHoldingDays,
    int historyLookback,
    int decisionMemory,
    int transactionCapacity,
    int cacheCapacity,
    Duration cacheTtl,
    int symbolConcurrency,
    RiskThresholds riskThresholds,
    ResilienceSettings resilience,
    boolean debug
) {

    public BacktestConfig {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    public static BacktestConfigBuilder defaults(List<String> symbols, LocalDate startDate, LocalDate endDate) {
        return BacktestConfig.builder()
            .symbols(symbols)
            .startDate(startDate)
            .endDate(endDate)
            .initialCapital(100_000.0)
            .commissionRate(0.001)
            .slippageRate(0.001)
            .basePositionSizePct(0.20)
            .minPositionPct(0.01)
            .maxPositionPct(0.90)
            .minConfidence(0.30)
            .minConviction(0.10)
            .maxHoldingDays(30)
            .historyLookback(60)
            .decisionMemory(20)
            .transactionCapacity(100_000)
            .cacheCapacity(1_000)
            .cacheTtl(Duration.ofHours(24))
            .symbolConcurrency(1)
            .riskThresholds(RiskThresholds.defaults())
            .resilience(ResilienceSettings.defaults())
            .debug(false);
    }

    /**
     * @throws InvalidConfigurationException on the first invalid field
     */
    public BacktestConfig validate() {
        if (symbols.isEmpty()) {
            throw new InvalidConfigurationException("At least one symbol is required");
        }
        Set<String> seen = new HashSet<>();
        for (String s : symbols) {
            if (s == null || s.isBlank()) throw new InvalidConfigurationException("Symbols must not be blank");
            if (!seen.add(s)) throw new InvalidConfigurationException("Duplicate symbol: " + s);
        }
        if (startDate == null || endDate == null) {
            throw new InvalidConfigurationException("Start and end date are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new InvalidConfigurationException("Invalid date range: " + startDate + " is after " + endDate);
        }
        if (!(initialCapital > 0.0) || Double.isInfinite(initialCapital)) {
            throw new InvalidConfigurationException("initialCapital must be positive, was " + initialCapital);
        }
        requireRate("commissionRate", commissionRate);
        requireRate("slippageRate", slippageRate);
        if (!(basePositionSizePct > 0.0 && basePositionSizePct <= 1.0)) {
            throw new InvalidConfigurationException("basePositionSizePct must be within (0,1], was " + basePositionSizePct);
        }
        if (!(minPositionPct > 0.0 && minPositionPct <= maxPositionPct && maxPositionPct <= 1.0)) {
            throw new InvalidConfigurationException("Position bounds must satisfy 0 < min <= max <= 1, were "
                + minPositionPct + " and " + maxPositionPct);
        }
        requireUnit("minConfidence", minConfidence);
        requireUnit("minConviction", minConviction);
        requirePositive("maxHoldingDays", maxHoldingDays);
        requirePositive("historyLookback", historyLookback);
        requirePositive("decisionMemory", decisionMemory);
        requirePositive("transactionCapacity", transactionCapacity);
        requirePositive("cacheCapacity", cacheCapacity);
        requirePositive("symbolConcurrency", symbolConcurrency);
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new InvalidConfigurationException("cacheTtl must be a positive duration");
        }
        if (riskThresholds == null || resilience == null) {
            throw new InvalidConfigurationException("Risk thresholds and resilience settings are required");
        }
        riskThresholds.validate();
        resilience.validate();
        return this;
    }

    private static void requireRate(String name, double value) {
        if (!(value >= 0.0 && value <= 0.1)) {
            throw new InvalidConfigurationException(name + " must be within [0,0.1], was " + value);
        }
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidConfigurationException(name + " must be within [0,1], was " + value);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(name + " must be positive, was " + value);
        }
    }
}
