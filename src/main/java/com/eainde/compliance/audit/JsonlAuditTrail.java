package com.eainde.compliance.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends one JSON object per line to a file.
 */
@Slf4j
public class JsonlAuditTrail implements AuditTrail {

    private final Path path;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlAuditTrail(Path path) {
        this(path, defaultMapper());
    }

    public JsonlAuditTrail(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper;
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws UncheckedIOException when the record cannot be written
     */
    @Override
    public void append(AuditRecord record) {
        String line;
        try {
            line = mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize audit record " + record.questionId(), e);
        }

        lock.lock();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
            log.debug("Audited question {} ({})", record.questionId(), record.status());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to audit log " + path, e);
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        return path;
    }
}
