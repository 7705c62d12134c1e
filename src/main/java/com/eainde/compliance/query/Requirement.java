package com.eainde.compliance.query;

/**
 * A predicate that must have evidence for a subject before a question can be answered.
 *
 * @param variable  the template variable or binding the subject came from ("?tx", "$client")
 * @param subject   the resolved subject id, or null when the variable bound nothing
 * @param predicate the required predicate
 */
public record Requirement(String variable, String subject, String predicate) {

    public boolean isBound() {
        return subject != null;
    }

    @Override
    public String toString() {
        return (subject != null ? subject : variable + "(unbound)") + "." + predicate;
    }
}
