package com.eainde.compliance.reasoning;

/**
 * Terminal evidentiary classification of a question. Only {@link #ANSWERABLE} reaches the model.
 */
public enum EvidenceStatus {
    /** Every required predicate has evidence and no literal values disagree. */
    ANSWERABLE,
    /** Some required predicate has no evidence. */
    UNKNOWN,
    /** Two or more values disagree for the same subject and predicate. */
    INCONCLUSIVE
}
