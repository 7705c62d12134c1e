package com.eainde.compliance.reasoning;

import com.eainde.compliance.query.Requirement;
import com.eainde.compliance.retrieval.EvidenceItem;

import java.util.List;

/**
 * Result of one question. UNKNOWN and INCONCLUSIVE are ordinary answers, not errors.
 *
 * @param evidence     facts the decision was based on
 * @param missing      requirements without evidence (UNKNOWN only)
 * @param conflicts    disagreeing values with their sources (INCONCLUSIVE only)
 * @param templates    templates that produced the evidence
 * @param modelInvoked whether the completion service was called
 */
public record Answer(
        String questionId,
        String question,
        EvidenceStatus status,
        String text,
        List<EvidenceItem> evidence,
        List<Requirement> missing,
        List<Conflict> conflicts,
        List<String> templates,
        boolean modelInvoked
) {

    public static final String UNKNOWN_TEXT =
            "Not available / unknown: the knowledge graph holds no evidence for the requested information.";
    public static final String INCONCLUSIVE_TEXT =
            "Inconclusive: the knowledge graph contains conflicting facts.";

    public Answer {
        evidence = List.copyOf(evidence);
        missing = List.copyOf(missing);
        conflicts = List.copyOf(conflicts);
        templates = List.copyOf(templates);
    }

    public static Answer unknown(String questionId, String question, List<EvidenceItem> evidence,
                                 List<Requirement> missing, List<String> templates) {
        return new Answer(questionId, question, EvidenceStatus.UNKNOWN, UNKNOWN_TEXT,
                evidence, missing, List.of(), templates, false);
    }

    public static Answer inconclusive(String questionId, String question, List<EvidenceItem> evidence,
                                      List<Conflict> conflicts, List<String> templates) {
        return new Answer(questionId, question, EvidenceStatus.INCONCLUSIVE, INCONCLUSIVE_TEXT,
                evidence, List.of(), conflicts, templates, false);
    }

    public static Answer answered(String questionId, String question, String text,
                                  List<EvidenceItem> evidence, List<String> templates) {
        return new Answer(questionId, question, EvidenceStatus.ANSWERABLE, text,
                evidence, List.of(), List.of(), templates, true);
    }
}
