package com.eainde.compliance.reasoning;

import com.eainde.compliance.audit.AuditRecord;
import com.eainde.compliance.audit.AuditTrail;
import com.eainde.compliance.completion.CompletionService;
import com.eainde.compliance.completion.GenerationSettings;
import com.eainde.compliance.retrieval.EvidenceItem;
import com.eainde.compliance.retrieval.RetrievalResult;
import com.eainde.compliance.retrieval.Retriever;
import com.eainde.compliance.support.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers questions from knowledge-graph evidence only.
 *
 * <p>Each question is retrieved, classified by {@link EvidencePolicy} and, only when
 * {@link EvidenceStatus#ANSWERABLE}, sent to the {@link CompletionService} exactly once.
 * UNKNOWN and INCONCLUSIVE answers are fixed texts and never call the model.</p>
 *
 * <p>The completion call is the only blocking step. It runs on an MDC-propagating executor,
 * bounded by a timeout and cancelled when the timeout expires. Any generation failure surfaces
 * as a {@link GenerationException} holding the prompt for {@link #retry(GenerationException)}.
 * Query and graph exceptions propagate unchanged.</p>
 *
 * <p>Holds no per-question state; safe for concurrent use over a frozen graph.</p>
 */
@Slf4j
public class ReasoningController {

    public static final String QUESTION_ID = "questionId";

    private final Retriever retriever;
    private final EvidencePolicy policy;
    private final PromptBuilder promptBuilder;
    private final CompletionService completionService;
    private final GenerationSettings settings;
    private final MdcAwareExecutor executor;
    private final AuditTrail auditTrail;
    private final Clock clock;

    public ReasoningController(Retriever retriever, CompletionService completionService,
                               GenerationSettings settings, MdcAwareExecutor executor, AuditTrail auditTrail) {
        this(retriever, new EvidencePolicy(), new PromptBuilder(), completionService, settings, executor,
                auditTrail, Clock.systemUTC());
    }

    public ReasoningController(Retriever retriever, EvidencePolicy policy, PromptBuilder promptBuilder,
                               CompletionService completionService, GenerationSettings settings,
                               MdcAwareExecutor executor, AuditTrail auditTrail, Clock clock) {
        this.retriever = retriever;
        this.policy = policy;
        this.promptBuilder = promptBuilder;
        this.completionService = completionService;
        this.settings = settings;
        this.executor = executor;
        this.auditTrail = auditTrail == null ? AuditTrail.NOOP : auditTrail;
        this.clock = clock;
    }

    public Answer ask(String question) {
        return ask(question, settings.getTimeout());
    }

    public Answer ask(String question, Duration timeout) {
        String questionId = newQuestionId();
        MDC.put(QUESTION_ID, questionId);
        try {
            RetrievalResult retrieval = retriever.retrieve(question);
            return decide(questionId, question, retrieval, null, timeout);
        } finally {
            MDC.remove(QUESTION_ID);
        }
    }

    /**
     * Structured path: evidence comes from one named template, no question analysis.
     */
    public Answer ask(String templateName, Map<String, String> bindings, String question) {
        return ask(templateName, bindings, question, null, settings.getTimeout());
    }

    /**
     * @param responseInstructions extra output instructions appended to the prompt, may be null
     */
    public Answer ask(String templateName, Map<String, String> bindings, String question,
                      String responseInstructions, Duration timeout) {
        String questionId = newQuestionId();
        MDC.put(QUESTION_ID, questionId);
        try {
            RetrievalResult retrieval = retriever.retrieve(templateName, bindings);
            return decide(questionId, question, retrieval, responseInstructions, timeout);
        } finally {
            MDC.remove(QUESTION_ID);
        }
    }

    /**
     * Resends the preserved prompt of a failed generation. The graph is not queried again.
     */
    public Answer retry(GenerationException failure) {
        return retry(failure, settings.getTimeout());
    }

    public Answer retry(GenerationException failure, Duration timeout) {
        MDC.put(QUESTION_ID, failure.getQuestionId());
        try {
            log.info("Retrying generation for question {}", failure.getQuestionId());
            String text = generate(failure.getQuestionId(), failure.getQuestion(), failure.getTemplates(),
                    failure.getEvidence(), failure.getPrompt(), timeout);
            Answer answer = Answer.answered(failure.getQuestionId(), failure.getQuestion(), text,
                    failure.getEvidence().items(), failure.getTemplates());
            audit(answer, failure.getEvidence().lines());
            return answer;
        } finally {
            MDC.remove(QUESTION_ID);
        }
    }

    // =========================================================================
    //  Gate
    // =========================================================================

    private Answer decide(String questionId, String question, RetrievalResult retrieval,
                          String responseInstructions, Duration timeout) {
        EvidenceAssessment assessment = policy.assess(retrieval);
        List<EvidenceItem> evidence = retrieval.evidence();
        List<String> templates = retrieval.templateNames();
        EvidenceBlock block = EvidenceBlock.of(evidence);

        Answer answer;
        switch (assessment.status()) {
            case UNKNOWN -> {
                log.info("Question {} is UNKNOWN, missing {}", questionId, assessment.missing());
                answer = Answer.unknown(questionId, question, evidence, assessment.missing(), templates);
            }
            case INCONCLUSIVE -> {
                log.info("Question {} is INCONCLUSIVE, conflicts {}", questionId, assessment.conflicts());
                answer = Answer.inconclusive(questionId, question, evidence, assessment.conflicts(), templates);
            }
            default -> {
                String prompt = promptBuilder.build(block, question, responseInstructions);
                String text = generate(questionId, question, templates, block, prompt, timeout);
                log.info("Question {} is ANSWERABLE, answered from {} fact(s)", questionId, evidence.size());
                answer = Answer.answered(questionId, question, text, evidence, templates);
            }
        }
        audit(answer, block.lines());
        return answer;
    }

    private String generate(String questionId, String question, List<String> templates,
                            EvidenceBlock block, String prompt, Duration timeout) {
        Future<String> future = executor.submit(() ->
                completionService.generate(prompt, settings.getMaxOutputTokens(), settings.getTemperature()));
        try {
            String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                throw failure("malformed response: completion returned no text", null,
                        questionId, question, templates, block, prompt);
            }
            return text;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw failure("Completion timed out after " + timeout.toMillis() + "ms", e,
                    questionId, question, templates, block, prompt);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw failure("Interrupted while waiting for completion", e,
                    questionId, question, templates, block, prompt);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw failure("Completion failed: " + cause.getMessage(), cause,
                    questionId, question, templates, block, prompt);
        }
    }

    private GenerationException failure(String message, Throwable cause, String questionId, String question,
                                        List<String> templates, EvidenceBlock block, String prompt) {
        log.error("Generation failed for question {}: {}", questionId, message);
        GenerationException exception = new GenerationException(message, cause, questionId, question,
                templates, block, prompt);
        appendAudit(new AuditRecord(questionId, clock.instant(), question, EvidenceStatus.ANSWERABLE.name(),
                templates, block.lines(), null, true, message));
        return exception;
    }

    private void audit(Answer answer, List<String> evidenceLines) {
        appendAudit(new AuditRecord(answer.questionId(), clock.instant(), answer.question(),
                answer.status().name(), answer.templates(), evidenceLines, answer.text(),
                answer.modelInvoked(), null));
    }

    private void appendAudit(AuditRecord record) {
        try {
            auditTrail.append(record);
        } catch (Exception e) {
            // Audit failures never change the answer
            log.warn("Failed to audit question {}", record.questionId(), e);
        }
    }

    private static String newQuestionId() {
        return UUID.randomUUID().toString();
    }
}
