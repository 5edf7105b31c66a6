package com.agentbacktest.engine.orchestrator;

import com.agentbacktest.common.risk.EnhancedRiskMetrics;

import java.time.LocalDate;

/** Raw risk metrics computed for one symbol during one decision cycle. */
public record RiskSnapshot(
    String symbol,
    LocalDate date,
    EnhancedRiskMetrics metrics
) {}
