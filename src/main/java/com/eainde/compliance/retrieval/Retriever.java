package com.eainde.compliance.retrieval;

import com.eainde.compliance.graph.Entity;
import com.eainde.compliance.graph.Fact;
import com.eainde.compliance.graph.KnowledgeGraph;
import com.eainde.compliance.graph.TriplePattern;
import com.eainde.compliance.query.QueryEngine;
import com.eainde.compliance.query.QueryResult;
import com.eainde.compliance.query.QueryTemplate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a free-form question to template runs and aggregates their facts.
 *
 * <ol>
 * <li>Extract mentions: tokens equal to an entity id (case-sensitive), case-insensitive
 * occurrences of an entity's {@code name}, and for literal bindings the existing values of
 * the bound predicate.</li>
 * <li>Select templates with at least one keyword hit whose bindings can all be filled.
 * Every combination of candidate values is run, mentions in question order, up to
 * {@value #MAX_COMBINATIONS} per template.</li>
 * <li>Rank groups by keyword hits, ties broken by registry order, and deduplicate facts.</li>
 * </ol>
 */
@Slf4j
public class Retriever {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_\\-]+");
    private static final String NAME = "name";
    static final int MAX_COMBINATIONS = 16;

    private static final Map<String, Pattern> PHRASES = new ConcurrentHashMap<>();

    private final QueryEngine engine;

    public Retriever(QueryEngine engine) {
        this.engine = engine;
    }

    public RetrievalResult retrieve(String question) {
        if (question == null || question.isBlank()) {
            return RetrievalResult.empty(question);
        }
        List<EntityMention> mentions = extractMentions(question);
        log.debug("Mentions in question: {}", mentions);

        List<Candidate> candidates = new ArrayList<>();
        List<QueryTemplate> templates = engine.getRegistry().all();
        for (int order = 0; order < templates.size(); order++) {
            QueryTemplate template = templates.get(order);
            int hits = keywordHits(template, question);
            if (hits == 0) {
                continue;
            }
            List<Map<String, String>> combinations = bindingCombinations(template, question, mentions);
            if (combinations.isEmpty()) {
                log.debug("Template {} matched {} keyword(s) but its bindings cannot be filled",
                        template.getName(), hits);
                continue;
            }
            candidates.add(new Candidate(template, hits, order, combinations));
        }

        candidates.sort(Comparator.comparingInt(Candidate::hits).reversed()
                .thenComparingInt(Candidate::order));

        List<FactGroup> groups = new ArrayList<>();
        for (Candidate candidate : candidates) {
            for (Map<String, String> bindings : candidate.combinations()) {
                QueryResult result = engine.run(candidate.template().getName(), bindings);
                groups.add(FactGroup.of(result, candidate.hits()));
            }
        }
        RetrievalResult result = RetrievalResult.of(question, groups);
        log.debug("Retrieved {} group(s) from templates {} with {} evidence item(s)",
                groups.size(), result.templateNames(), result.evidence().size());
        return result;
    }

    /**
     * Structured path: runs one template with caller-supplied bindings, no text analysis.
     */
    public RetrievalResult retrieve(String templateName, Map<String, String> bindings) {
        QueryResult result = engine.run(templateName, bindings);
        return RetrievalResult.of(null, List.of(FactGroup.of(result, 0)));
    }

    /**
     * Entity mentions in question order, one per entity (its earliest occurrence).
     */
    public List<EntityMention> extractMentions(String question) {
        KnowledgeGraph graph = engine.getGraph();
        Map<String, EntityMention> byEntity = new LinkedHashMap<>();

        Matcher tokens = TOKEN.matcher(question);
        while (tokens.find()) {
            String token = tokens.group();
            Optional<Entity> entity = graph.entity(token);
            if (entity.isPresent()) {
                keepEarliest(byEntity, new EntityMention(token, entity.get().kind(), token, tokens.start()));
            }
        }

        for (Fact name : graph.facts(TriplePattern.of(null, NAME, null))) {
            if (name.value().isEntity()) {
                continue;
            }
            int position = indexOfPhrase(question, name.value().getLexical());
            if (position >= 0) {
                graph.entity(name.subject()).ifPresent(entity -> keepEarliest(byEntity,
                        new EntityMention(entity.id(), entity.kind(), name.value().getLexical(), position)));
            }
        }

        List<EntityMention> mentions = new ArrayList<>(byEntity.values());
        mentions.sort(Comparator.comparingInt(EntityMention::position));
        return mentions;
    }

    // =========================================================================
    //  Template selection
    // =========================================================================

    private int keywordHits(QueryTemplate template, String question) {
        int hits = 0;
        for (String keyword : template.getKeywords()) {
            if (indexOfPhrase(question, keyword) >= 0) {
                hits++;
            }
        }
        return hits;
    }

    private List<Map<String, String>> bindingCombinations(QueryTemplate template, String question,
                                                          List<EntityMention> mentions) {
        List<Map<String, String>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (QueryTemplate.Binding binding : template.getBindings()) {
            List<String> values = binding.isEntity()
                    ? entityValues(binding.kind(), mentions)
                    : literalValues(binding.valuesOf(), question);
            if (values.isEmpty()) {
                return List.of();
            }
            List<Map<String, String>> next = new ArrayList<>();
            fill:
            for (Map<String, String> partial : combinations) {
                for (String value : values) {
                    if (next.size() == MAX_COMBINATIONS) {
                        log.warn("Template {}: more than {} binding combinations, running the first {}",
                                template.getName(), MAX_COMBINATIONS, MAX_COMBINATIONS);
                        break fill;
                    }
                    Map<String, String> extended = new LinkedHashMap<>(partial);
                    extended.put(binding.name(), value);
                    next.add(extended);
                }
            }
            combinations = next;
        }
        return combinations;
    }

    private List<String> entityValues(String kind, List<EntityMention> mentions) {
        return mentions.stream()
                .filter(m -> m.kind().equals(kind))
                .map(EntityMention::entityId)
                .toList();
    }

    /**
     * Existing literal values of {@code predicate} that occur in the question, in question order.
     * {@code wire_transfer} also matches "wire transfer".
     */
    private List<String> literalValues(String predicate, String question) {
        Set<String> distinct = new LinkedHashSet<>();
        for (Fact fact : engine.getGraph().facts(TriplePattern.of(null, predicate, null))) {
            if (fact.value().isLiteral()) {
                distinct.add(fact.value().getLexical());
            }
        }
        List<ValueMention> found = new ArrayList<>();
        for (String value : distinct) {
            int position = indexOfPhrase(question, value);
            if (position < 0 && value.contains("_")) {
                position = indexOfPhrase(question, value.replace('_', ' '));
            }
            if (position >= 0) {
                found.add(new ValueMention(value, position));
            }
        }
        found.sort(Comparator.comparingInt(ValueMention::position));
        return found.stream().map(ValueMention::value).toList();
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    /** Case-insensitive whole word/phrase search; -1 when absent. */
    static int indexOfPhrase(String text, String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return -1;
        }
        Pattern pattern = PHRASES.computeIfAbsent(phrase.strip(), p -> Pattern.compile(
                "(?<![\\p{L}\\p{N}_])" + Pattern.quote(p) + "(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.start() : -1;
    }

    private static void keepEarliest(Map<String, EntityMention> byEntity, EntityMention mention) {
        byEntity.merge(mention.entityId(), mention,
                (existing, candidate) -> candidate.position() < existing.position() ? candidate : existing);
    }

    private record Candidate(QueryTemplate template, int hits, int order, List<Map<String, String>> combinations) {
    }

    private record ValueMention(String value, int position) {
    }
}
