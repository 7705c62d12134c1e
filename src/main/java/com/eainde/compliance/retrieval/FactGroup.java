package com.eainde.compliance.retrieval;

import com.eainde.compliance.graph.Fact;
import com.eainde.compliance.query.QueryResult;
import com.eainde.compliance.query.Requirement;

import java.util.List;
import java.util.Map;

/**
 * Facts produced by one template run, tagged with the template and bindings for provenance.
 *
 * @param keywordHits how many template keywords the question hit; 0 on the structured path
 */
public record FactGroup(
        String templateName,
        Map<String, String> bindings,
        List<Fact> facts,
        List<Requirement> requirements,
        int keywordHits
) {

    public FactGroup {
        bindings = Map.copyOf(bindings);
        facts = List.copyOf(facts);
        requirements = List.copyOf(requirements);
    }

    public static FactGroup of(QueryResult result, int keywordHits) {
        return new FactGroup(result.templateName(), result.bindings(), result.facts(),
                result.requirements(), keywordHits);
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }
}
