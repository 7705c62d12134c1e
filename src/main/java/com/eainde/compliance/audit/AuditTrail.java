package com.eainde.compliance.audit;

/**
 * Sink for {@link AuditRecord}s. Implementations must be safe for concurrent appends.
 */
public interface AuditTrail {

    /** Discards every record; used when auditing is disabled. */
    AuditTrail NOOP = record -> {
    };

    void append(AuditRecord record);
}
