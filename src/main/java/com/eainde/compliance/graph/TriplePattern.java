package com.eainde.compliance.graph;

/**
 * A {@code (subject, predicate, object)} pattern; {@code null} fields are wildcards.
 */
public record TriplePattern(String subject, String predicate, Term object) {

    public static final TriplePattern ANY = new TriplePattern(null, null, null);

    public static TriplePattern of(String subject, String predicate, Term object) {
        return new TriplePattern(subject, predicate, object);
    }

    public static TriplePattern subject(String subject) {
        return new TriplePattern(subject, null, null);
    }

    public static TriplePattern subjectPredicate(String subject, String predicate) {
        return new TriplePattern(subject, predicate, null);
    }

    public boolean matches(Relation relation) {
        return (subject == null || subject.equals(relation.subject()))
                && (predicate == null || predicate.equals(relation.predicate()))
                && (object == null || object.equals(relation.object()));
    }

    @Override
    public String toString() {
        return "(" + (subject == null ? "*" : subject)
                + ", " + (predicate == null ? "*" : predicate)
                + ", " + (object == null ? "*" : object) + ")";
    }
}
