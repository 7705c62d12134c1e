package com.eainde.compliance.retrieval;

import com.eainde.compliance.graph.Fact;
import com.eainde.compliance.graph.Term;
import com.eainde.compliance.query.Requirement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered fact groups for one question plus the evidence deduplicated across them.
 *
 * An empty result means no template matched: absence of evidence, not a failure.
 */
public record RetrievalResult(String question, List<FactGroup> groups, List<EvidenceItem> evidence) {

    public RetrievalResult {
        groups = List.copyOf(groups);
        evidence = List.copyOf(evidence);
    }

    public static RetrievalResult empty(String question) {
        return new RetrievalResult(question, List.of(), List.of());
    }

    /**
     * Collapses identical {@code (subject, predicate, value)} tuples across groups, keeping every
     * distinct source. Items keep the order in which they were first seen.
     */
    public static RetrievalResult of(String question, List<FactGroup> groups) {
        Map<TupleKey, List<FactSource>> merged = new LinkedHashMap<>();
        for (FactGroup group : groups) {
            for (Fact fact : group.facts()) {
                FactSource source = new FactSource(group.templateName(), group.bindings(),
                        fact.sourceId(), fact.source().provenance());
                List<FactSource> sources = merged.computeIfAbsent(
                        new TupleKey(fact.subject(), fact.predicate(), fact.value()), k -> new ArrayList<>());
                if (!sources.contains(source)) {
                    sources.add(source);
                }
            }
        }
        List<EvidenceItem> evidence = new ArrayList<>(merged.size());
        merged.forEach((key, sources) ->
                evidence.add(new EvidenceItem(key.subject(), key.predicate(), key.value(), sources)));
        return new RetrievalResult(question, groups, evidence);
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public List<Requirement> requirements() {
        return groups.stream().flatMap(g -> g.requirements().stream()).distinct().toList();
    }

    public List<String> templateNames() {
        return groups.stream().map(FactGroup::templateName).distinct().toList();
    }

    public List<EvidenceItem> evidenceFor(String subject, String predicate) {
        return evidence.stream()
                .filter(e -> e.subject().equals(subject) && e.predicate().equals(predicate))
                .toList();
    }

    private record TupleKey(String subject, String predicate, Term value) {
    }
}
