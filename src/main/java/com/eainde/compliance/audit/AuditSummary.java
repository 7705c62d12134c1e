package com.eainde.compliance.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Totals over an audit log.
 *
 * @param byStatus entry count per status, sorted by status name
 * @param first    earliest timestamp, null when the log is empty
 * @param last     latest timestamp, null when the log is empty
 */
public record AuditSummary(int total, Map<String, Integer> byStatus, int failures, Instant first, Instant last) {

    public static AuditSummary of(List<AuditRecord> records) {
        Map<String, Integer> byStatus = new TreeMap<>();
        int failures = 0;
        for (AuditRecord record : records) {
            byStatus.merge(record.status() == null ? "UNKNOWN_STATUS" : record.status(), 1, Integer::sum);
            if (record.isFailure()) {
                failures++;
            }
        }
        Instant first = records.stream().map(AuditRecord::timestamp).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null);
        Instant last = records.stream().map(AuditRecord::timestamp).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);
        return new AuditSummary(records.size(), Collections.unmodifiableMap(byStatus), failures, first, last);
    }
}
