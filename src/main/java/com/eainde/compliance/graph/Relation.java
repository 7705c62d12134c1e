package com.eainde.compliance.graph;

import java.time.Instant;

/**
 * A directed, labeled edge {@code (subject, predicate, object)} where the object is
 * either another entity or a literal.
 *
 * <p>Relations are immutable and never deleted. Set identity is the triple itself;
 * {@code id}, {@code sequence}, {@code provenance} and {@code recordedAt} describe the
 * first insertion of that triple.</p>
 *
 * @param id         stable relation id ("r1", "r2", ...) used as a fact source
 * @param sequence   insertion order within the graph
 * @param subject    subject entity id
 * @param predicate  edge label or attribute name
 * @param object     entity reference or literal
 * @param provenance where the relation came from (e.g. "builder", "load:graph.nt", "update:analyst")
 * @param recordedAt insertion time
 */
public record Relation(
        String id,
        long sequence,
        String subject,
        String predicate,
        Term object,
        String provenance,
        Instant recordedAt
) {

    @Override
    public String toString() {
        return id + ": <" + subject + "> <" + predicate + "> " + object;
    }
}
