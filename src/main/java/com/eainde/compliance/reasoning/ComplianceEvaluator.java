package com.eainde.compliance.reasoning;

import com.eainde.compliance.graph.Fact;
import com.eainde.compliance.graph.KnowledgeGraph;
import com.eainde.compliance.graph.Term;
import com.eainde.compliance.graph.TriplePattern;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Asks the model for a JSON compliance decision on a transaction and scores it against the
 * graph's recorded {@code is_compliant} flag.
 *
 * The evidence is the {@code transaction-rules} template, which leaves the flag itself out of the prompt.
 */
@Slf4j
public class ComplianceEvaluator {

    public static final String TEMPLATE = "transaction-rules";
    public static final String BINDING = "tx";
    public static final String IS_COMPLIANT = "is_compliant";

    static final String JSON_INSTRUCTIONS = "Respond ONLY with a JSON object of the form "
            + "{\"is_compliant\": true or false, \"explanation\": \"<one or two sentences>\"}.";

    private final ReasoningController controller;
    private final KnowledgeGraph graph;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public ComplianceEvaluator(ReasoningController controller, KnowledgeGraph graph, Duration timeout) {
        this(controller, graph, new ObjectMapper(), timeout);
    }

    public ComplianceEvaluator(ReasoningController controller, KnowledgeGraph graph,
                               ObjectMapper mapper, Duration timeout) {
        this.controller = controller;
        this.graph = graph;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    public ComplianceEvaluation evaluate(String transactionId) {
        Boolean groundTruth = groundTruth(transactionId);
        String question = "Decide whether transaction " + transactionId + " is compliant based on the facts.";
        Answer answer = controller.ask(TEMPLATE, Map.of(BINDING, transactionId), question,
                JSON_INSTRUCTIONS, timeout);

        if (!answer.modelInvoked()) {
            log.info("Transaction {} not evaluated: evidence is {}", transactionId, answer.status());
            return new ComplianceEvaluation(transactionId, answer.status(), groundTruth,
                    null, null, null, answer.text());
        }

        Boolean modelLabel = null;
        String explanation = null;
        JsonNode decision = parse(answer.text());
        if (decision != null) {
            JsonNode label = decision.get(IS_COMPLIANT);
            if (label != null && label.isBoolean()) {
                modelLabel = label.booleanValue();
            }
            JsonNode text = decision.get("explanation");
            if (text != null && text.isTextual()) {
                explanation = text.asText();
            }
        }
        Boolean correct = groundTruth != null && modelLabel != null ? groundTruth.equals(modelLabel) : null;
        log.info("Transaction {} evaluated: truth={} model={} correct={}",
                transactionId, groundTruth, modelLabel, correct);
        return new ComplianceEvaluation(transactionId, answer.status(), groundTruth,
                modelLabel, correct, explanation, answer.text());
    }

    /**
     * Free-text explanation of whether a transaction is compliant, from the same evidence.
     */
    public Answer explain(String transactionId) {
        String question = "Based on the facts, explain whether transaction " + transactionId
                + " is compliant or non-compliant, and why.";
        return controller.ask(TEMPLATE, Map.of(BINDING, transactionId), question, null, timeout);
    }

    /** The single recorded boolean flag; null when absent or when values disagree. */
    Boolean groundTruth(String transactionId) {
        List<Boolean> values = graph.facts(TriplePattern.subjectPredicate(transactionId, IS_COMPLIANT)).stream()
                .map(Fact::value)
                .filter(v -> v.getType() == Term.Type.BOOLEAN)
                .map(v -> (Boolean) v.value())
                .distinct()
                .toList();
        return values.size() == 1 ? values.get(0) : null;
    }

    private JsonNode parse(String raw) {
        String json = stripFences(raw);
        try {
            JsonNode node = mapper.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.warn("Model response is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String stripFences(String raw) {
        String text = raw.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int closing = text.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                text = text.substring(firstNewline + 1, closing).strip();
            }
        }
        return text;
    }
}
