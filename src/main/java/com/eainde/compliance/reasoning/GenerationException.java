package com.eainde.compliance.reasoning;

import java.util.List;

/**
 * Generation failed for an ANSWERABLE question.
 *
 * Carries the evidence block and the exact prompt so
 * {@link ReasoningController#retry(GenerationException)} can resend it without touching the graph.
 */
public class GenerationException extends RuntimeException {

    private final String questionId;
    private final String question;
    private final List<String> templates;
    private final transient EvidenceBlock evidence;
    private final String prompt;

    public GenerationException(String message, Throwable cause, String questionId, String question,
                               List<String> templates, EvidenceBlock evidence, String prompt) {
        super(message, cause);
        this.questionId = questionId;
        this.question = question;
        this.templates = List.copyOf(templates);
        this.evidence = evidence;
        this.prompt = prompt;
    }

    public String getQuestionId() {
        return questionId;
    }

    public String getQuestion() {
        return question;
    }

    public List<String> getTemplates() {
        return templates;
    }

    public EvidenceBlock getEvidence() {
        return evidence;
    }

    public String getPrompt() {
        return prompt;
    }
}
