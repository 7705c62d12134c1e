package com.eainde.compliance.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Declarative, named query over the knowledge graph.
 *
 * A template is data, not code: adding one needs no change to {@link QueryEngine}.
 *
 * <pre>
 * // Transactions of a client, reached through its accounts
 * QueryTemplate.of("client-transactions", "Transactions for a client")
 *         .entityBinding("client", "Client")
 *         .pattern("$client", "hasAccount", "?account")
 *         .pattern("?account", "hasTransaction", "?tx")
 *         .select("?tx", "amount", "currency", "date", "status")
 *         .requires("?tx", "amount", "currency", "date")
 *         .keywords("transaction", "transactions", "payments")
 *         .build();
 * </pre>
 *
 * <ul>
 * <li>{@code patterns} are inner-joined in order on shared variables.</li>
 * <li>{@code select} fetches predicates for every subject bound to a variable or binding
 * (no predicates = every outgoing relation). Missing values simply yield no fact.</li>
 * <li>{@code requires} lists the predicates that must have evidence before the question may
 * reach the language model.</li>
 * </ul>
 */
public class QueryTemplate {

    /**
     * A named parameter. Exactly one of {@code kind} (the value is an entity id of that kind)
     * or {@code valuesOf} (the value is an existing literal of that predicate) is set.
     */
    public record Binding(String name, String kind, String valuesOf) {

        public boolean isEntity() {
            return kind != null;
        }
    }

    private final String name;
    private final String description;
    private final List<Binding> bindings;
    private final List<PatternSpec> patterns;
    private final Map<String, List<String>> select;
    private final Map<String, List<String>> requires;
    private final List<String> keywords;

    private QueryTemplate(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.bindings = List.copyOf(builder.bindings);
        this.patterns = List.copyOf(builder.patterns);
        this.select = copyOf(builder.select);
        this.requires = copyOf(builder.requires);
        this.keywords = List.copyOf(builder.keywords);
    }

    public static Builder of(String name, String description) {
        return new Builder(name, description);
    }

    // === Getters ===

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<Binding> getBindings() { return bindings; }
    public List<PatternSpec> getPatterns() { return patterns; }
    public Map<String, List<String>> getSelect() { return select; }
    public Map<String, List<String>> getRequires() { return requires; }
    public List<String> getKeywords() { return keywords; }

    public List<String> getBindingNames() {
        return bindings.stream().map(Binding::name).toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        sb.append(" [").append(String.join(",", getBindingNames())).append("]");
        sb.append(" patterns=").append(patterns.size());
        if (!requires.isEmpty()) sb.append(" requires=").append(requires);
        return sb.toString();
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((key, predicates) -> copy.put(key, List.copyOf(predicates)));
        return Collections.unmodifiableMap(copy);
    }

    // ==========================================================================
    //  Builder
    // ==========================================================================

    public static class Builder {
        private final String name;
        private final String description;
        private final List<Binding> bindings = new ArrayList<>();
        private final List<PatternSpec> patterns = new ArrayList<>();
        private final Map<String, List<String>> select = new LinkedHashMap<>();
        private final Map<String, List<String>> requires = new LinkedHashMap<>();
        private final List<String> keywords = new ArrayList<>();

        private Builder(String name, String description) {
            this.name = name;
            this.description = description;
        }

        /** A binding whose value is the id of an entity of {@code kind}. */
        public Builder entityBinding(String bindingName, String kind) {
            this.bindings.add(new Binding(bindingName, kind, null));
            return this;
        }

        /** A binding whose value is an existing literal of {@code predicate}. */
        public Builder literalBinding(String bindingName, String predicate) {
            this.bindings.add(new Binding(bindingName, null, predicate));
            return this;
        }

        public Builder binding(Binding binding) {
            this.bindings.add(binding);
            return this;
        }

        public Builder pattern(String subject, String predicate, String object) {
            this.patterns.add(PatternSpec.of(subject, predicate, object));
            return this;
        }

        /** Predicates to fetch for each subject bound to {@code key}; none = all. */
        public Builder select(String key, String... predicates) {
            return select(key, List.of(predicates));
        }

        public Builder select(String key, List<String> predicates) {
            this.select.computeIfAbsent(key, k -> new ArrayList<>()).addAll(predicates);
            return this;
        }

        public Builder requires(String key, String... predicates) {
            return requires(key, List.of(predicates));
        }

        public Builder requires(String key, List<String> predicates) {
            this.requires.computeIfAbsent(key, k -> new ArrayList<>()).addAll(predicates);
            return this;
        }

        /** Question cues used by the retriever; matched case-insensitively. */
        public Builder keywords(String... keywords) {
            return keywords(List.of(keywords));
        }

        public Builder keywords(List<String> keywords) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    this.keywords.add(keyword.strip().toLowerCase(Locale.ROOT));
                }
            }
            return this;
        }

        // --- Build ---

        public QueryTemplate build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Template name is required");
            }

            Set<String> bindingNames = new HashSet<>();
            for (Binding binding : bindings) {
                if (binding.name() == null || binding.name().isBlank()) {
                    throw new IllegalArgumentException("Binding name is required in template: " + name);
                }
                if ((binding.kind() == null) == (binding.valuesOf() == null)) {
                    throw new IllegalArgumentException("Binding '" + binding.name() + "' of template " + name
                            + " must declare exactly one of [kind, valuesOf]");
                }
                if (!bindingNames.add(binding.name())) {
                    throw new IllegalArgumentException("Duplicate binding '" + binding.name() + "' in template: " + name);
                }
            }

            Set<String> variables = new HashSet<>();
            for (PatternSpec pattern : patterns) {
                for (String reference : pattern.bindingReferences()) {
                    if (!bindingNames.contains(reference)) {
                        throw new IllegalArgumentException("Pattern " + pattern + " of template " + name
                                + " references undeclared binding $" + reference);
                    }
                }
                variables.addAll(pattern.variables());
            }

            checkKeys("select", select, bindingNames, variables);
            checkKeys("requires", requires, bindingNames, variables);
            requires.forEach((key, predicates) -> {
                if (predicates.isEmpty()) {
                    throw new IllegalArgumentException("requires." + key + " of template " + name + " lists no predicates");
                }
            });
            return new QueryTemplate(this);
        }

        private void checkKeys(String section, Map<String, List<String>> entries,
                               Set<String> bindingNames, Set<String> variables) {
            for (String key : entries.keySet()) {
                boolean known = PatternSpec.isBinding(key)
                        ? bindingNames.contains(PatternSpec.nameOf(key))
                        : variables.contains(key);
                if (!known) {
                    throw new IllegalArgumentException(section + " key '" + key + "' of template " + name
                            + " is neither a declared $binding nor a ?variable introduced by a pattern");
                }
            }
        }
    }
}
