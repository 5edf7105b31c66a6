package com.agentbacktest.engine.persistence;

import com.agentbacktest.common.model.TradingDecision;
import com.agentbacktest.engine.position.Transaction;

import java.time.Instant;

/** What is persisted for every executed transaction: the decision behind it and the fill. */
public record AuditRecord(
    TradingDecision decision,
    Transaction transaction,
    Instant storedAt
) {}
