package com.eainde.compliance.retrieval;

import com.eainde.compliance.graph.Term;

import java.util.List;

/**
 * A deduplicated {@code (subject, predicate, value)} tuple with every distinct source that produced it.
 */
public record EvidenceItem(String subject, String predicate, Term value, List<FactSource> sources) {

    public EvidenceItem {
        sources = List.copyOf(sources);
    }

    public List<String> relationIds() {
        return sources.stream().map(FactSource::relationId).distinct().toList();
    }

    @Override
    public String toString() {
        return subject + " " + predicate + " " + value;
    }
}
