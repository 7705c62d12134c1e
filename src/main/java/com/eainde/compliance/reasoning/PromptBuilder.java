package com.eainde.compliance.reasoning;

/**
 * Renders the evidence block and the question into the user prompt.
 */
public class PromptBuilder {

    static final String INSTRUCTIONS = "Answer strictly from the facts above. "
            + "If they do not contain the information needed, say that it is not available.";

    public String build(EvidenceBlock evidence, String question) {
        return build(evidence, question, null);
    }

    /**
     * @param responseInstructions extra output instructions (e.g. a JSON shape), may be null
     */
    public String build(EvidenceBlock evidence, String question, String responseInstructions) {
        String nl = "\n";
        StringBuilder prompt = new StringBuilder()
                .append(evidence.render()).append(nl).append(nl)
                .append("Question: ").append(question).append(nl).append(nl)
                .append(INSTRUCTIONS);
        if (responseInstructions != null && !responseInstructions.isBlank()) {
            prompt.append(nl).append(responseInstructions.strip());
        }
        return prompt.toString();
    }
}
