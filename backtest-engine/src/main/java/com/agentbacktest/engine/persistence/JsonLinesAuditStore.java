package com.agentbacktest.engine.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes one JSON document per line to {@code <directory>/<SYMBOL>.jsonl}.
 * Files are only ever appended to; writes are serialized.
 */
public class JsonLinesAuditStore implements AuditStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonLinesAuditStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper.copy()
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void save(String symbol, AuditRecord record) {
        Path file = fileFor(symbol);
        try {
            String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
            Files.createDirectories(directory);
            Files.writeString(file, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            log.debug("[Audit] Record saved. symbol={} decisionId={} file={}",
                      symbol, record.decision().id(), file);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit record is not serializable. symbol=" + symbol, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not append audit record to " + file, e);
        }
    }

    public Path fileFor(String symbol) {
        return directory.resolve(symbol + ".jsonl");
    }
}
