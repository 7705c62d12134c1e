package com.eainde.compliance.audit;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a JSON-lines audit log written by {@link JsonlAuditTrail}.
 *
 * Blank lines are skipped; malformed lines are skipped with a warning.
 */
@Slf4j
public class AuditLogReader {

    private final Path path;
    private final ObjectMapper mapper;

    public AuditLogReader(Path path) {
        this.path = path;
        this.mapper = JsonlAuditTrail.defaultMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * All readable entries in file order; empty when the file does not exist.
     */
    public List<AuditRecord> readAll() throws IOException {
        List<AuditRecord> records = new ArrayList<>();
        if (!Files.exists(path)) {
            return records;
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(mapper.readValue(line, AuditRecord.class));
                } catch (IOException e) {
                    log.warn("Skipping malformed audit line {} in {}: {}", lineNumber, path, e.getMessage());
                }
            }
        }
        return records;
    }

    public Optional<AuditRecord> last() throws IOException {
        return latest(readAll());
    }

    /** Most recent entry with the given status, compared case-insensitively. */
    public Optional<AuditRecord> last(String status) throws IOException {
        List<AuditRecord> matching = readAll().stream()
                .filter(r -> r.status() != null && r.status().equalsIgnoreCase(status))
                .toList();
        return latest(matching);
    }

    public AuditSummary summarize() throws IOException {
        return AuditSummary.of(readAll());
    }

    /** Latest timestamp wins; on a tie, or without timestamps, the later line wins. */
    private static Optional<AuditRecord> latest(List<AuditRecord> records) {
        AuditRecord latest = null;
        for (AuditRecord record : records) {
            if (latest == null || !isBefore(record.timestamp(), latest.timestamp())) {
                latest = record;
            }
        }
        return Optional.ofNullable(latest);
    }

    private static boolean isBefore(Instant candidate, Instant current) {
        return candidate != null && current != null && candidate.isBefore(current);
    }
}
