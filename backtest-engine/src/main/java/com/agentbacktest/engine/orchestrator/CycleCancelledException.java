package com.agentbacktest.engine.orchestrator;

/** Stops a decision cycle at a phase boundary once its run was cancelled. */
class CycleCancelledException extends RuntimeException {
    private final DecisionPhase completedPhase;

    CycleCancelledException(DecisionPhase completedPhase) {
        super("Cycle cancelled after " + completedPhase);
        this.completedPhase = completedPhase;
    }

    DecisionPhase getCompletedPhase() {
        return completedPhase;
    }
}
