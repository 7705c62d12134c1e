package com.eainde.compliance.query;

import com.eainde.compliance.graph.Fact;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattened output of one template run.
 *
 * An empty result is a valid answer ("no such data"), distinct from an unknown template.
 *
 * @param templateName template that produced the result
 * @param bindings     caller bindings used
 * @param facts        deduplicated facts in relation insertion order
 * @param subjects     subject ids bound to each select/requires key, in solution order
 * @param requirements resolved required predicates
 */
public record QueryResult(
        String templateName,
        Map<String, String> bindings,
        List<Fact> facts,
        Map<String, List<String>> subjects,
        List<Requirement> requirements
) {

    public QueryResult {
        bindings = Map.copyOf(bindings);
        facts = List.copyOf(facts);
        Map<String, List<String>> subjectsCopy = new LinkedHashMap<>();
        subjects.forEach((key, ids) -> subjectsCopy.put(key, List.copyOf(ids)));
        subjects = Collections.unmodifiableMap(subjectsCopy);
        requirements = List.copyOf(requirements);
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }

    /**
     * Facts grouped by subject, subjects in order of first appearance.
     */
    public Map<String, List<Fact>> factsBySubject() {
        Map<String, List<Fact>> grouped = new LinkedHashMap<>();
        for (Fact fact : facts) {
            grouped.computeIfAbsent(fact.subject(), s -> new ArrayList<>()).add(fact);
        }
        return grouped;
    }

    public List<Fact> factsFor(String subject, String predicate) {
        return facts.stream()
                .filter(f -> f.subject().equals(subject) && f.predicate().equals(predicate))
                .toList();
    }
}
