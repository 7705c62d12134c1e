package com.eainde.compliance.reasoning;

import com.eainde.compliance.audit.AuditRecord;
import com.eainde.compliance.audit.AuditTrail;
import com.eainde.compliance.completion.CompletionService;
import com.eainde.compliance.completion.GenerationSettings;
import com.eainde.compliance.completion.ServiceException;
import com.eainde.compliance.graph.Entity;
import com.eainde.compliance.graph.KnowledgeGraph;
import com.eainde.compliance.graph.Term;
import com.eainde.compliance.query.QueryEngine;
import com.eainde.compliance.query.QueryTemplateRegistry;
import com.eainde.compliance.query.Requirement;
import com.eainde.compliance.query.UnknownTemplateException;
import com.eainde.compliance.query.YamlQueryTemplateLoader;
import com.eainde.compliance.retrieval.EvidenceItem;
import com.eainde.compliance.retrieval.Retriever;
import com.eainde.compliance.support.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReasoningControllerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");
    private static final String QUESTION = "Is the client behind T1 verified, and how much was T1?";

    @Mock private CompletionService completion;

    private final List<AuditRecord> audited = new CopyOnWriteArrayList<>();
    private KnowledgeGraph graph;
    private QueryTemplateRegistry registry;
    private MdcAwareExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        graph = new KnowledgeGraph();
        registry = new QueryTemplateRegistry(
                new YamlQueryTemplateLoader().loadFromClasspath("/templates/scenario-templates.yml"));
        executor = new MdcAwareExecutor("completion-test");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.close();
        MDC.clear();
    }

    private ReasoningController controller() {
        return controller(audited::add);
    }

    private ReasoningController controller(AuditTrail auditTrail) {
        graph.freeze();
        return new ReasoningController(new Retriever(new QueryEngine(graph, registry)), new EvidencePolicy(),
                new PromptBuilder(), completion, GenerationSettings.defaults(), executor, auditTrail,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void verifiedClientWithTransaction() {
        graph.addEntity(Entity.CLIENT, "C1", Map.of("kyc_status", "verified"));
        graph.addEntity(Entity.TRANSACTION, "T1", Map.of("amount", 5000));
        graph.addRelation("T1", "client", Term.entity("C1"));
    }

    private Answer askScenario(ReasoningController controller) {
        return controller.ask("kyc-and-amount", Map.of("tx", "T1"), QUESTION);
    }

    // =========================================================================
    //  Gate
    // =========================================================================

    @Nested
    @DisplayName("Evidence gate")
    class Gate {

        @Test
        @DisplayName("ANSWERABLE: both facts reach the prompt and the model is called once")
        void answerable() {
            verifiedClientWithTransaction();
            when(completion.generate(anyString(), anyInt(), anyDouble()))
                    .thenReturn("The client is verified and T1 was 5000.");

            Answer answer = askScenario(controller());

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completion, times(1)).generate(prompt.capture(),
                    eq(GenerationSettings.DEFAULT_MAX_TOKENS), eq(GenerationSettings.DEFAULT_TEMPERATURE));
            assertThat(prompt.getValue())
                    .contains("- C1 kyc_status = verified [r1]")
                    .contains("- T1 amount = 5000 [r2]")
                    .contains("Question: " + QUESTION);

            assertThat(answer.status()).isEqualTo(EvidenceStatus.ANSWERABLE);
            assertThat(answer.text()).isEqualTo("The client is verified and T1 was 5000.");
            assertThat(answer.modelInvoked()).isTrue();
            assertThat(answer.templates()).containsExactly("kyc-and-amount");
            assertThat(answer.evidence()).hasSize(3);
        }

        @Test
        @DisplayName("UNKNOWN: fixed text and no model call")
        void unknown() {
            graph.addEntity(Entity.CLIENT, "C1");
            graph.addEntity(Entity.TRANSACTION, "T1", Map.of("amount", 5000));
            graph.addRelation("T1", "client", Term.entity("C1"));

            Answer answer = askScenario(controller());

            verify(completion, never()).generate(anyString(), anyInt(), anyDouble());
            assertThat(answer.status()).isEqualTo(EvidenceStatus.UNKNOWN);
            assertThat(answer.text()).isEqualTo(Answer.UNKNOWN_TEXT);
            assertThat(answer.modelInvoked()).isFalse();
            assertThat(answer.missing()).containsExactly(new Requirement("?client", "C1", "kyc_status"));
        }

        @Test
        @DisplayName("INCONCLUSIVE: both conflicting sources are reported and the model is not called")
        void inconclusive() {
            verifiedClientWithTransaction();
            graph.updateAttribute("C1", "kyc_status", "pending", "update:analyst");

            Answer answer = askScenario(controller());

            verify(completion, never()).generate(anyString(), anyInt(), anyDouble());
            assertThat(answer.status()).isEqualTo(EvidenceStatus.INCONCLUSIVE);
            assertThat(answer.text()).isEqualTo(Answer.INCONCLUSIVE_TEXT);
            assertThat(answer.conflicts()).singleElement().satisfies(conflict -> {
                assertThat(conflict.distinctValues())
                        .containsExactly(Term.literal("pending"), Term.literal("verified"));
                assertThat(conflict.values()).flatExtracting(EvidenceItem::relationIds).containsExactly("r4", "r1");
            });
        }

        @Test
        @DisplayName("free-text questions go through retrieval")
        void freeText() {
            verifiedClientWithTransaction();
            when(completion.generate(anyString(), anyInt(), anyDouble())).thenReturn("Yes.");

            Answer answer = controller().ask("What are the KYC status and amount for T1?");

            assertThat(answer.status()).isEqualTo(EvidenceStatus.ANSWERABLE);
            assertThat(answer.templates()).containsExactly("kyc-and-amount");
        }

        @Test
        @DisplayName("a question no template recognizes is UNKNOWN without a model call")
        void unrecognizedQuestion() {
            verifiedClientWithTransaction();

            Answer answer = controller().ask("What will the weather be tomorrow?");

            verify(completion, never()).generate(anyString(), anyInt(), anyDouble());
            assertThat(answer.status()).isEqualTo(EvidenceStatus.UNKNOWN);
            assertThat(answer.evidence()).isEmpty();
        }

        @Test
        @DisplayName("query misuse propagates and never reaches the model")
        void unknownTemplate() {
            verifiedClientWithTransaction();
            ReasoningController controller = controller();

            assertThatThrownBy(() -> controller.ask("no-such-template", Map.of(), "q"))
                    .isInstanceOf(UnknownTemplateException.class);
            verify(completion, never()).generate(anyString(), anyInt(), anyDouble());
        }
    }

    // =========================================================================
    //  Generation failures
    // =========================================================================

    @Nested
    @DisplayName("Generation failures")
    class Failures {

        @Test
        @DisplayName("a slow model call is cancelled and can be retried with the same prompt")
        void timeoutThenRetry() {
            verifiedClientWithTransaction();
            when(completion.generate(anyString(), anyInt(), anyDouble()))
                    .thenAnswer(invocation -> {
                        Thread.sleep(10_000);
                        return "too late";
                    })
                    .thenReturn("Verified, 5000.");
            ReasoningController controller = controller();

            GenerationException failure = catchThrowableOfType(
                    () -> controller.ask("kyc-and-amount", Map.of("tx", "T1"), QUESTION, null, Duration.ofMillis(200)),
                    GenerationException.class);

            assertThat(failure.getMessage()).contains("timed out");
            assertThat(failure.getPrompt()).contains("- C1 kyc_status = verified [r1]");
            assertThat(failure.getTemplates()).containsExactly("kyc-and-amount");

            Answer answer = controller.retry(failure);

            ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
            verify(completion, times(2)).generate(prompts.capture(), anyInt(), anyDouble());
            assertThat(prompts.getAllValues().get(1)).isEqualTo(prompts.getAllValues().get(0));
            assertThat(answer.status()).isEqualTo(EvidenceStatus.ANSWERABLE);
            assertThat(answer.questionId()).isEqualTo(failure.getQuestionId());
            assertThat(answer.text()).isEqualTo("Verified, 5000.");
        }

        @Test
        @DisplayName("a service error becomes a GenerationException carrying the cause")
        void serviceError() {
            verifiedClientWithTransaction();
            ServiceException cause = new ServiceException("rate limited");
            when(completion.generate(anyString(), anyInt(), anyDouble())).thenThrow(cause);

            GenerationException failure = catchThrowableOfType(() -> askScenario(controller()),
                    GenerationException.class);

            assertThat(failure).hasMessage("Completion failed: rate limited").hasCause(cause);
            assertThat(audited).singleElement().satisfies(record -> {
                assertThat(record.isFailure()).isTrue();
                assertThat(record.error()).isEqualTo("Completion failed: rate limited");
                assertThat(record.response()).isNull();
                assertThat(record.modelInvoked()).isTrue();
            });
        }

        @Test
        @DisplayName("a blank completion is a malformed response")
        void blankText() {
            verifiedClientWithTransaction();
            when(completion.generate(anyString(), anyInt(), anyDouble())).thenReturn("   ");

            assertThatThrownBy(() -> askScenario(controller()))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("malformed response");
        }
    }

    // =========================================================================
    //  Audit and context
    // =========================================================================

    @Nested
    @DisplayName("Audit and logging context")
    class AuditAndContext {

        @Test
        @DisplayName("every decision is audited, including those that never call the model")
        void auditsEveryDecision() {
            graph.addEntity(Entity.CLIENT, "C1");
            graph.addEntity(Entity.TRANSACTION, "T1", Map.of("amount", 5000));
            graph.addRelation("T1", "client", Term.entity("C1"));

            Answer answer = askScenario(controller());

            assertThat(audited).singleElement().satisfies(record -> {
                assertThat(record.questionId()).isEqualTo(answer.questionId());
                assertThat(record.timestamp()).isEqualTo(NOW);
                assertThat(record.status()).isEqualTo("UNKNOWN");
                assertThat(record.response()).isEqualTo(Answer.UNKNOWN_TEXT);
                assertThat(record.modelInvoked()).isFalse();
                assertThat(record.evidence()).containsExactly("- T1 amount = 5000 [r1]", "- T1 client = C1 [r2]");
            });
        }

        @Test
        @DisplayName("a failing audit trail does not change the answer")
        void auditFailureIsIgnored() {
            verifiedClientWithTransaction();
            when(completion.generate(anyString(), anyInt(), anyDouble())).thenReturn("Yes.");

            Answer answer = askScenario(controller(record -> {
                throw new IllegalStateException("disk full");
            }));

            assertThat(answer.status()).isEqualTo(EvidenceStatus.ANSWERABLE);
            assertThat(answer.text()).isEqualTo("Yes.");
        }

        @Test
        @DisplayName("the question id is visible to the completion call and cleared afterwards")
        void questionIdInMdc() {
            verifiedClientWithTransaction();
            AtomicReference<String> seen = new AtomicReference<>();
            when(completion.generate(anyString(), anyInt(), anyDouble())).thenAnswer(invocation -> {
                seen.set(MDC.get(ReasoningController.QUESTION_ID));
                return "Yes.";
            });

            Answer answer = askScenario(controller());

            assertThat(seen.get()).isNotNull().isEqualTo(answer.questionId());
            assertThat(MDC.get(ReasoningController.QUESTION_ID)).isNull();
        }
    }
}
