package com.agentbacktest.engine.orchestrator;

/**
 * @param risk {@code null} when the cycle ended before the risk discussion
 */
public record CycleResult(
    DecisionRecord record,
    RiskSnapshot risk
) {}
