package com.eainde.compliance.reasoning;

import com.eainde.compliance.query.Requirement;

import java.util.List;

/**
 * Outcome of {@link EvidencePolicy#assess}: the status plus what made it so.
 */
public record EvidenceAssessment(EvidenceStatus status, List<Requirement> missing, List<Conflict> conflicts) {

    public EvidenceAssessment {
        missing = List.copyOf(missing);
        conflicts = List.copyOf(conflicts);
    }

    public static EvidenceAssessment answerable() {
        return new EvidenceAssessment(EvidenceStatus.ANSWERABLE, List.of(), List.of());
    }

    public static EvidenceAssessment unknown(List<Requirement> missing) {
        return new EvidenceAssessment(EvidenceStatus.UNKNOWN, missing, List.of());
    }

    public static EvidenceAssessment inconclusive(List<Conflict> conflicts) {
        return new EvidenceAssessment(EvidenceStatus.INCONCLUSIVE, List.of(), conflicts);
    }

    public boolean isAnswerable() {
        return status == EvidenceStatus.ANSWERABLE;
    }
}
