package com.eainde.compliance.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads query templates from YAML.
 *
 * <pre>
 * templates:
 *   - name: client-profile
 *     description: KYC profile of a client
 *     keywords: ["kyc", "verified"]
 *     bindings:
 *       - { name: client, kind: Client }
 *     patterns: []
 *     select:
 *       "$client": [kyc_status, risk_level, name]
 *     requires:
 *       "$client": [kyc_status]
 * </pre>
 *
 * Pattern rows are three-element lists {@code ["$client", "hasAccount", "?account"]}.
 * Quote tokens starting with {@code ?}, {@code $} or {@code *}: they are YAML indicators.
 */
public final class YamlQueryTemplateLoader {

    // DTOs mirroring YAML
    public record YTemplates(List<YTemplate> templates) {}
    public record YTemplate(
            String name,
            String description,
            List<String> keywords,
            List<YBinding> bindings,
            List<List<String>> patterns,
            Map<String, List<String>> select,
            Map<String, List<String>> requires
    ) {}
    public record YBinding(String name, String kind, String valuesOf) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public List<QueryTemplate> loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public List<QueryTemplate> load(InputStream in) throws IOException {
        YTemplates document = mapper.readValue(in, YTemplates.class);
        List<QueryTemplate> result = new ArrayList<>();
        for (YTemplate y : Optional.ofNullable(document.templates()).orElse(List.of())) {
            result.add(toTemplate(y));
        }
        return result;
    }

    private QueryTemplate toTemplate(YTemplate y) {
        QueryTemplate.Builder builder = QueryTemplate.of(y.name(), y.description());
        Optional.ofNullable(y.keywords()).ifPresent(builder::keywords);
        for (YBinding b : Optional.ofNullable(y.bindings()).orElse(List.of())) {
            builder.binding(new QueryTemplate.Binding(b.name(), b.kind(), b.valuesOf()));
        }
        for (List<String> row : Optional.ofNullable(y.patterns()).orElse(List.of())) {
            if (row == null || row.size() != 3) {
                throw new IllegalArgumentException("Template '" + y.name()
                        + "': each pattern must have exactly 3 tokens, got " + row);
            }
            builder.pattern(row.get(0), row.get(1), row.get(2));
        }
        Optional.ofNullable(y.select()).orElse(Map.of())
                .forEach((key, predicates) -> builder.select(key, Optional.ofNullable(predicates).orElse(List.of())));
        Optional.ofNullable(y.requires()).orElse(Map.of())
                .forEach((key, predicates) -> builder.requires(key, Optional.ofNullable(predicates).orElse(List.of())));
        return builder.build();
    }
}
