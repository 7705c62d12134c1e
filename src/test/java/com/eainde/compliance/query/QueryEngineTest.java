package com.eainde.compliance.query;

import com.eainde.compliance.domain.DemoDataset;
import com.eainde.compliance.graph.Entity;
import com.eainde.compliance.graph.Fact;
import com.eainde.compliance.graph.KnowledgeGraph;
import com.eainde.compliance.graph.Term;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class QueryEngineTest {

    private KnowledgeGraph graph;
    private QueryTemplateRegistry registry;
    private QueryEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        graph = new KnowledgeGraph();
        DemoDataset.seed(graph);
        graph.addEntity(Entity.CLIENT, "B", Map.of("name", "Client B", "kyc_status", "pending"));
        graph.freeze();
        registry = new QueryTemplateRegistry(new YamlQueryTemplateLoader().loadFromClasspath("/query-templates.yml"));
        engine = new QueryEngine(graph, registry);
    }

    // =========================================================================
    //  Misuse
    // =========================================================================

    @Nested
    @DisplayName("Misuse")
    class Misuse {

        @Test
        void unknownTemplate() {
            assertThatThrownBy(() -> engine.run("client-balance", Map.of("client", "A")))
                    .isInstanceOf(UnknownTemplateException.class)
                    .satisfies(e -> assertThat(((UnknownTemplateException) e).getTemplateName())
                            .isEqualTo("client-balance"));
        }

        @Test
        @DisplayName("absent or blank binding is rejected")
        void missingBinding() {
            assertThatThrownBy(() -> engine.run("client-profile", Map.of()))
                    .isInstanceOf(MissingBindingException.class)
                    .satisfies(e -> assertThat(((MissingBindingException) e).getBindingName()).isEqualTo("client"));
            assertThatThrownBy(() -> engine.run("client-profile", Map.of("client", "  ")))
                    .isInstanceOf(MissingBindingException.class);
            assertThatThrownBy(() -> engine.run("client-profile", null))
                    .isInstanceOf(MissingBindingException.class);
        }
    }

    // =========================================================================
    //  Joins
    // =========================================================================

    @Nested
    @DisplayName("Composite queries")
    class Joins {

        @Test
        @DisplayName("client -> accounts -> transactions binds every transaction and fetches its attributes")
        void clientTransactions() {
            QueryResult result = engine.run("client-transactions", Map.of("client", "A"));

            assertThat(result.subjects().get("?tx")).containsExactly("T001", "T002", "T003");
            assertThat(result.factsBySubject().keySet()).containsExactly("A", "T001", "A1", "T002", "T003", "A2");
            assertThat(result.factsFor("T002", "amount")).extracting(Fact::value)
                    .containsExactly(Term.literal(15000));
            assertThat(result.factsFor("T001", "is_compliant")).isEmpty();
            assertThat(result.requirements()).hasSize(9).allMatch(Requirement::isBound);
        }

        @Test
        @DisplayName("facts are deduplicated and ordered by insertion")
        void orderedAndDistinct() {
            QueryResult result = engine.run("client-transactions", Map.of("client", "A"));

            List<Long> sequences = result.facts().stream().map(f -> f.source().sequence()).toList();
            assertThat(sequences).isSorted().doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("a client without accounts yields no facts and unbound requirements")
        void innerJoinProducesNothing() {
            QueryResult result = engine.run("client-transactions", Map.of("client", "B"));

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.subjects().get("?tx")).isEmpty();
            assertThat(result.requirements())
                    .extracting(Requirement::variable, Requirement::subject, Requirement::predicate)
                    .containsExactly(
                            tuple("?tx", null, "amount"),
                            tuple("?tx", null, "currency"),
                            tuple("?tx", null, "date"));
        }

        @Test
        @DisplayName("a later pattern filters earlier solutions on shared variables")
        void sharedVariableFilters() {
            registry.register(QueryTemplate.of("usd-transactions", "USD transactions of a client")
                    .entityBinding("client", "Client")
                    .pattern("$client", "hasAccount", "?account")
                    .pattern("?account", "hasTransaction", "?tx")
                    .pattern("?tx", "currency", "USD")
                    .select("?tx", "amount")
                    .build());

            QueryResult result = engine.run("usd-transactions", Map.of("client", "A"));

            assertThat(result.subjects().get("?tx")).containsExactly("T001", "T002");
            assertThat(result.facts()).noneMatch(f -> f.subject().equals("T003"));
        }

        @Test
        @DisplayName("a literal binding selects rules by type")
        void literalBinding() {
            QueryResult result = engine.run("rules-for-transaction-type", Map.of("type", "wire_transfer"));

            assertThat(result.subjects().get("?rule")).containsExactly("KYC", "AML_THRESHOLD");
            assertThat(result.factsFor("KYC", "status")).hasSize(1);

            QueryResult none = engine.run("rules-for-transaction-type", Map.of("type", "cash_deposit"));
            assertThat(none.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("transaction-rules collects every rule link without multiplying rows")
        void multiValuedLinks() {
            QueryResult result = engine.run("transaction-rules", Map.of("tx", "T002"));

            assertThat(result.subjects().get("?rule")).containsExactly("KYC", "AML_THRESHOLD");
            assertThat(result.factsFor("T002", "isCompliantWith")).extracting(Fact::value)
                    .containsExactly(Term.entity("KYC"), Term.entity("AML_THRESHOLD"));
            assertThat(result.factsFor("T002", "amount")).hasSize(1);
            assertThat(result.factsFor("T002", "is_compliant")).isEmpty();
        }

        @Test
        @DisplayName("a predicate variable binds the predicate name")
        void predicateVariable() {
            registry.register(QueryTemplate.of("everything-about", "All relations of an entity")
                    .entityBinding("e", "Account")
                    .pattern("$e", "?p", "?o")
                    .build());

            QueryResult result = engine.run("everything-about", Map.of("e", "A1"));

            assertThat(result.facts()).extracting(Fact::predicate)
                    .containsExactly("account_type", "status", "hasTransaction", "hasTransaction");
        }

        @Test
        @DisplayName("a variable bound to a literal cannot be used as a subject")
        void literalInSubjectPosition() {
            registry.register(QueryTemplate.of("currency-of-currency", "nonsense join")
                    .entityBinding("tx", "Transaction")
                    .pattern("$tx", "currency", "?c")
                    .pattern("?c", "*", "*")
                    .build());

            assertThat(engine.run("currency-of-currency", Map.of("tx", "T001")).isEmpty()).isTrue();
        }
    }

    // =========================================================================
    //  Selects
    // =========================================================================

    @Nested
    @DisplayName("Single-entity templates")
    class Selects {

        @Test
        void clientProfile() {
            QueryResult result = engine.run("client-profile", Map.of("client", "A"));

            assertThat(result.facts()).extracting(Fact::predicate)
                    .containsExactly("name", "risk_level", "kyc_status");
            assertThat(result.requirements()).containsExactly(new Requirement("$client", "A", "kyc_status"));
        }

        @Test
        @DisplayName("an unknown entity id is an empty result with a bound requirement")
        void unknownEntity() {
            QueryResult result = engine.run("client-profile", Map.of("client", "Z"));

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.requirements()).containsExactly(new Requirement("$client", "Z", "kyc_status"));
        }

        @Test
        @DisplayName("bindings are trimmed")
        void trimmedBinding() {
            QueryResult result = engine.run("rule-status", Map.of("rule", " KYC "));

            assertThat(result.bindings()).containsEntry("rule", "KYC");
            assertThat(result.factsFor("KYC", "status")).hasSize(1);
        }
    }

    // =========================================================================
    //  Typed literal bindings
    // =========================================================================

    @Nested
    @DisplayName("Typed literal bindings")
    class TypedLiterals {

        @BeforeEach
        void registerTemplates() {
            registry.register(QueryTemplate.of("transactions-by-compliance", "Transactions by compliance flag")
                    .literalBinding("flag", "is_compliant")
                    .pattern("?tx", "is_compliant", "$flag")
                    .select("?tx", "amount")
                    .requires("?tx", "amount")
                    .build());
            registry.register(QueryTemplate.of("transactions-by-amount", "Transactions of an exact amount")
                    .literalBinding("amount", "amount")
                    .pattern("?tx", "amount", "$amount")
                    .select("?tx", "currency")
                    .build());
        }

        @Test
        @DisplayName("a boolean binding matches the stored boolean value")
        void booleanBinding() {
            QueryResult result = engine.run("transactions-by-compliance", Map.of("flag", "false"));

            assertThat(result.subjects().get("?tx")).containsExactly("T002");
            assertThat(result.factsFor("T002", "is_compliant")).extracting(Fact::value)
                    .containsExactly(Term.literal(false));
            assertThat(result.requirements()).containsExactly(new Requirement("?tx", "T002", "amount"));
        }

        @Test
        @DisplayName("a decimal binding matches by value, not by spelling")
        void decimalBinding() {
            assertThat(engine.run("transactions-by-amount", Map.of("amount", "15000")).subjects().get("?tx"))
                    .containsExactly("T002");
            assertThat(engine.run("transactions-by-amount", Map.of("amount", "9500.00")).subjects().get("?tx"))
                    .containsExactly("T001");
        }

        @Test
        @DisplayName("text that is no stored value of the predicate matches nothing")
        void unmatchedText() {
            QueryResult result = engine.run("transactions-by-amount", Map.of("amount", "lots"));

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.subjects().get("?tx")).isEmpty();
        }
    }
}
