package com.agentbacktest.engine.orchestrator;

/** The phases of one decision cycle, in execution order. */
public enum DecisionPhase {
    DATA_COLLECTION,
    INDIVIDUAL_ANALYSIS,
    COLLABORATIVE_ANALYSIS,
    RISK_DISCUSSION,
    FINAL_DECISION,
    EXECUTION
}
