package com.eainde.compliance.graph;

/**
 * The externally visible unit of evidence: a resolved {@code (subject, predicate, value)}
 * tuple with the relation it was read from.
 *
 * <p>Facts are snapshots. Relations are immutable and never edited in place, so later
 * graph mutation cannot change a Fact that was already handed out.</p>
 */
public record Fact(String subject, String predicate, Term value, Relation source) {

    public static Fact of(Relation relation) {
        return new Fact(relation.subject(), relation.predicate(), relation.object(), relation);
    }

    public String sourceId() {
        return source.id();
    }

    @Override
    public String toString() {
        return subject + " " + predicate + " " + value;
    }
}
