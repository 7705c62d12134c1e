package com.eainde.compliance.reasoning;

import com.eainde.compliance.graph.Term;
import com.eainde.compliance.retrieval.EvidenceItem;

import java.util.List;

/**
 * Disagreeing values for one {@code (subject, predicate)}, each with its sources.
 */
public record Conflict(String subject, String predicate, List<EvidenceItem> values) {

    public Conflict {
        values = List.copyOf(values);
    }

    public List<Term> distinctValues() {
        return values.stream().map(EvidenceItem::value).toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(subject).append(' ').append(predicate).append(':');
        for (EvidenceItem item : values) {
            sb.append(' ').append(item.value()).append(" <- ").append(item.relationIds());
        }
        return sb.toString();
    }
}
