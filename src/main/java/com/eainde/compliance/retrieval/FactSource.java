package com.eainde.compliance.retrieval;

import java.util.Map;

/**
 * Where one piece of evidence came from: the template run and the graph relation behind it.
 */
public record FactSource(String template, Map<String, String> bindings, String relationId, String provenance) {

    public FactSource {
        bindings = Map.copyOf(bindings);
    }

    @Override
    public String toString() {
        return template + bindings + " " + relationId + " (" + provenance + ")";
    }
}
