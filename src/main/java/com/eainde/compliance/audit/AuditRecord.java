package com.eainde.compliance.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * One answered (or failed) question, as written to the audit log.
 *
 * @param status       evidentiary status name (ANSWERABLE, UNKNOWN, INCONCLUSIVE)
 * @param evidence     rendered evidence lines the decision was based on
 * @param response     answer text; null when generation failed
 * @param modelInvoked whether the completion service was called
 * @param error        failure message when generation failed, else null
 */
public record AuditRecord(
        String questionId,
        Instant timestamp,
        String question,
        String status,
        List<String> templates,
        List<String> evidence,
        String response,
        boolean modelInvoked,
        String error
) {

    public AuditRecord {
        templates = templates == null ? List.of() : List.copyOf(templates);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @JsonIgnore
    public boolean isFailure() {
        return error != null;
    }
}
