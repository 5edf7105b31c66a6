package com.agentbacktest.engine.persistence;

/** Discards every record. Used when no audit directory is configured. */
public class NoOpAuditStore implements AuditStore {

    @Override
    public void save(String symbol, AuditRecord record) {
        // nothing to persist
    }
}
