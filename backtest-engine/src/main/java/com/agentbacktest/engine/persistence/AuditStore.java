package com.agentbacktest.engine.persistence;

/**
 * Append-only sink for executed decisions.
 */
public interface AuditStore {

    /**
     * @throws java.io.UncheckedIOException when the record could not be written
     */
    void save(String symbol, AuditRecord record);
}
