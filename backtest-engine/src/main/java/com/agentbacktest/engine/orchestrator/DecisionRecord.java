package com.agentbacktest.engine.orchestrator;

import com.agentbacktest.common.model.TradingDecision;
import com.agentbacktest.engine.position.ExecutionResult;
import com.agentbacktest.engine.position.RejectionReason;
import com.agentbacktest.engine.position.Transaction;

/**
 * Audit trail entry of one decision cycle.
 *
 * @param transaction     the fill, only for {@link DecisionStatus#EXECUTED}
 * @param rejectionReason only for {@link DecisionStatus#REJECTED}
 */
public record DecisionRecord(
    TradingDecision decision,
    DecisionStatus status,
    Transaction transaction,
    RejectionReason rejectionReason,
    String note
) {

    public static DecisionRecord of(ExecutionResult result) {
        return result.isFilled()
            ? new DecisionRecord(result.decision(), DecisionStatus.EXECUTED, result.transaction(), null, result.message())
            : new DecisionRecord(result.decision(), DecisionStatus.REJECTED, null, result.rejectionReason(), result.message());
    }

    public static DecisionRecord hold(TradingDecision decision) {
        return new DecisionRecord(decision, DecisionStatus.HOLD, null, null, decision.rationale());
    }

    public static DecisionRecord skipped(TradingDecision decision, String note) {
        return new DecisionRecord(decision, DecisionStatus.SKIPPED, null, null, note);
    }

    public static DecisionRecord cancelled(TradingDecision decision, String note) {
        return new DecisionRecord(decision, DecisionStatus.CANCELLED, null, null, note);
    }

    public String symbol() {
        return decision.symbol();
    }
}
