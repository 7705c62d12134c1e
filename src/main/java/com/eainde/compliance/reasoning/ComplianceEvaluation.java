package com.eainde.compliance.reasoning;

/**
 * The model's compliance verdict for a transaction compared with the graph's recorded flag.
 *
 * @param groundTruth the graph's {@code is_compliant} value, null when absent or ambiguous
 * @param modelLabel  the model's {@code is_compliant}, null when the model was not called or its JSON was unusable
 * @param correct     null unless both labels are known
 */
public record ComplianceEvaluation(
        String transactionId,
        EvidenceStatus status,
        Boolean groundTruth,
        Boolean modelLabel,
        Boolean correct,
        String explanation,
        String rawResponse
) {
}
