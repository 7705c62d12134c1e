package com.eainde.compliance.reasoning;

import com.eainde.compliance.query.Requirement;
import com.eainde.compliance.retrieval.EvidenceItem;
import com.eainde.compliance.retrieval.RetrievalResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Classifies retrieved evidence before any model call.
 *
 * <ol>
 * <li>Completeness: no fact groups, or a requirement without evidence (or without a bound
 * subject), gives {@link EvidenceStatus#UNKNOWN}. This short-circuits.</li>
 * <li>Consistency: two or more distinct literal values for the same subject and predicate give
 * {@link EvidenceStatus#INCONCLUSIVE}. Entity-valued relations are links; a subject may hold
 * several and they never conflict.</li>
 * <li>Otherwise {@link EvidenceStatus#ANSWERABLE}.</li>
 * </ol>
 * The result depends only on the evidence set, not on the order it was retrieved in.
 */
public class EvidencePolicy {

    private static final Comparator<Requirement> REQUIREMENT_ORDER = Comparator
            .comparing(Requirement::variable)
            .thenComparing(Requirement::subject, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Requirement::predicate);

    public EvidenceAssessment assess(RetrievalResult retrieval) {
        if (retrieval.isEmpty()) {
            return EvidenceAssessment.unknown(List.of());
        }

        List<Requirement> missing = new ArrayList<>();
        for (Requirement requirement : retrieval.requirements()) {
            if (!requirement.isBound()
                    || retrieval.evidenceFor(requirement.subject(), requirement.predicate()).isEmpty()) {
                missing.add(requirement);
            }
        }
        if (!missing.isEmpty()) {
            missing.sort(REQUIREMENT_ORDER);
            return EvidenceAssessment.unknown(missing);
        }

        List<Conflict> conflicts = conflicts(retrieval.evidence());
        if (!conflicts.isEmpty()) {
            return EvidenceAssessment.inconclusive(conflicts);
        }
        return EvidenceAssessment.answerable();
    }

    /**
     * Literal-valued {@code (subject, predicate)} pairs with more than one distinct value,
     * sorted by subject then predicate.
     */
    List<Conflict> conflicts(List<EvidenceItem> evidence) {
        Map<String, Map<String, List<EvidenceItem>>> bySubject = new TreeMap<>();
        for (EvidenceItem item : evidence) {
            if (item.value().isEntity()) {
                continue;
            }
            bySubject.computeIfAbsent(item.subject(), s -> new TreeMap<>())
                    .computeIfAbsent(item.predicate(), p -> new ArrayList<>())
                    .add(item);
        }

        List<Conflict> conflicts = new ArrayList<>();
        bySubject.forEach((subject, byPredicate) -> byPredicate.forEach((predicate, items) -> {
            if (items.size() > 1) {
                List<EvidenceItem> values = new ArrayList<>(items);
                values.sort(Comparator.comparing(i -> i.value().toString()));
                conflicts.add(new Conflict(subject, predicate, values));
            }
        }));
        return conflicts;
    }
}
