package com.eainde.compliance.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlQueryTemplateLoaderTest {

    private final YamlQueryTemplateLoader loader = new YamlQueryTemplateLoader();

    @Test
    @DisplayName("loads the shipped templates in file order")
    void shippedTemplates() throws IOException {
        List<QueryTemplate> templates = loader.loadFromClasspath("/query-templates.yml");

        assertThat(templates).extracting(QueryTemplate::getName).containsExactly(
                "client-profile",
                "client-risk-level",
                "client-transactions",
                "transaction-compliance",
                "transaction-rules",
                "rules-for-transaction-type",
                "rule-status");

        QueryTemplate transactions = templates.get(2);
        assertThat(transactions.getPatterns()).containsExactly(
                PatternSpec.of("$client", "hasAccount", "?account"),
                PatternSpec.of("?account", "hasTransaction", "?tx"));
        assertThat(transactions.getRequires()).containsEntry("?tx", List.of("amount", "currency", "date"));

        QueryTemplate byType = templates.get(5);
        assertThat(byType.getBindings()).containsExactly(
                new QueryTemplate.Binding("type", null, "applies_to_type"));
    }

    @Test
    @DisplayName("loads a test fixture with optional sections left out")
    void fixture() throws IOException {
        List<QueryTemplate> templates = loader.loadFromClasspath("/templates/scenario-templates.yml");

        assertThat(templates).hasSize(2);
        assertThat(templates.get(1).getPatterns()).isEmpty();
        assertThat(templates.get(1).getKeywords()).isEmpty();
    }

    @Test
    void rejectsShortPatternRow() {
        String yaml = """
                templates:
                  - name: broken
                    bindings:
                      - { name: client, kind: Client }
                    patterns:
                      - ["$client", "hasAccount"]
                """;

        assertThatThrownBy(() -> loader.load(stream(yaml)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly 3 tokens");
    }

    @Test
    void missingResource() {
        assertThatThrownBy(() -> loader.loadFromClasspath("/nope.yml"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("/nope.yml");
    }

    private static InputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
