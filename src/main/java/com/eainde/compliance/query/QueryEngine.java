package com.eainde.compliance.query;

import com.eainde.compliance.graph.Fact;
import com.eainde.compliance.graph.KnowledgeGraph;
import com.eainde.compliance.graph.Relation;
import com.eainde.compliance.graph.Term;
import com.eainde.compliance.graph.TriplePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs named {@link QueryTemplate}s against a {@link KnowledgeGraph}.
 *
 * <h3>Execution</h3>
 * <ol>
 * <li>Resolve the template and check every declared binding is present.</li>
 * <li>Run the patterns as sequential {@code match} calls. Each step substitutes what is already
 * bound and inner-joins on shared variables; a solution that finds no match is dropped.</li>
 * <li>Collect the relations of surviving solutions, then fetch the {@code select} predicates of
 * every bound subject.</li>
 * <li>Resolve {@code requires} into concrete {@link Requirement}s.</li>
 * </ol>
 * The engine never mutates the graph and keeps no state between runs.
 */
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final KnowledgeGraph graph;
    private final QueryTemplateRegistry registry;

    public QueryEngine(KnowledgeGraph graph, QueryTemplateRegistry registry) {
        this.graph = graph;
        this.registry = registry;
    }

    public KnowledgeGraph getGraph() {
        return graph;
    }

    public QueryTemplateRegistry getRegistry() {
        return registry;
    }

    /**
     * @throws UnknownTemplateException template not registered
     * @throws MissingBindingException  a declared binding is absent or blank
     */
    public QueryResult run(String templateName, Map<String, String> bindings) {
        QueryTemplate template = registry.get(templateName);
        Map<String, String> resolved = checkBindings(template, bindings);

        List<Solution> solutions = join(template, resolved);
        boolean joined = template.getPatterns().isEmpty() || !solutions.isEmpty();

        Map<String, List<String>> subjects = new LinkedHashMap<>();
        for (String key : focusKeys(template)) {
            subjects.put(key, joined ? subjectsOf(key, resolved, solutions) : List.of());
        }

        Map<String, Relation> collected = new HashMap<>();
        if (joined) {
            for (Solution solution : solutions) {
                solution.relations().forEach(r -> collected.putIfAbsent(r.id(), r));
            }
            template.getSelect().forEach((key, predicates) -> {
                for (String subject : subjects.get(key)) {
                    fetch(subject, predicates).forEach(r -> collected.putIfAbsent(r.id(), r));
                }
            });
        }

        List<Fact> facts = collected.values().stream()
                .sorted(Comparator.comparingLong(Relation::sequence))
                .map(Fact::of)
                .toList();

        List<Requirement> requirements = new ArrayList<>();
        template.getRequires().forEach((key, predicates) -> {
            List<String> bound = PatternSpec.isBinding(key) && subjects.get(key).isEmpty()
                    ? List.of(resolved.get(PatternSpec.nameOf(key)))
                    : subjects.get(key);
            for (String predicate : predicates) {
                if (bound.isEmpty()) {
                    requirements.add(new Requirement(key, null, predicate));
                }
                for (String subject : bound) {
                    requirements.add(new Requirement(key, subject, predicate));
                }
            }
        });

        log.debug("Template {} {} → {} solutions, {} facts, {} requirements",
                templateName, resolved, solutions.size(), facts.size(), requirements.size());
        return new QueryResult(templateName, resolved, facts, subjects, requirements);
    }

    // =========================================================================
    //  Join
    // =========================================================================

    private List<Solution> join(QueryTemplate template, Map<String, String> bindings) {
        List<Solution> solutions = List.of(Solution.EMPTY);
        for (PatternSpec pattern : template.getPatterns()) {
            List<Solution> next = new ArrayList<>();
            for (Solution solution : solutions) {
                TriplePattern resolved = resolve(pattern, solution, bindings);
                if (resolved == null) {
                    continue;
                }
                for (Relation relation : graph.match(resolved)) {
                    Solution extended = solution.extend(pattern, relation);
                    if (extended != null) {
                        next.add(extended);
                    }
                }
            }
            solutions = next;
            if (solutions.isEmpty()) {
                log.debug("Template {}: pattern {} matched nothing, inner join is empty",
                        template.getName(), pattern);
                break;
            }
        }
        return solutions;
    }

    /**
     * Substitutes bindings, constants and already-bound variables. Returns null when a
     * variable bound to a literal lands in subject position (nothing can match).
     */
    private TriplePattern resolve(PatternSpec pattern, Solution solution, Map<String, String> bindings) {
        String subject;
        String s = pattern.subject();
        if (PatternSpec.isBinding(s)) {
            subject = bindings.get(PatternSpec.nameOf(s));
        } else if (PatternSpec.isVariable(s)) {
            Term bound = solution.get(s);
            if (bound != null && !bound.isEntity()) {
                return null;
            }
            subject = bound != null ? bound.getLexical() : null;
        } else {
            subject = PatternSpec.isWildcard(s) ? null : s;
        }

        String predicate;
        String p = pattern.predicate();
        if (PatternSpec.isBinding(p)) {
            predicate = bindings.get(PatternSpec.nameOf(p));
        } else if (PatternSpec.isVariable(p)) {
            Term bound = solution.get(p);
            predicate = bound != null ? bound.getLexical() : null;
        } else {
            predicate = PatternSpec.isWildcard(p) ? null : p;
        }

        Term object;
        String o = pattern.object();
        if (PatternSpec.isBinding(o)) {
            object = objectTerm(bindings.get(PatternSpec.nameOf(o)), predicate);
        } else if (PatternSpec.isVariable(o)) {
            object = solution.get(o);
        } else {
            object = PatternSpec.isWildcard(o) ? null : objectTerm(o, predicate);
        }
        return TriplePattern.of(subject, predicate, object);
    }

    /**
     * An id of a known entity is a link. Otherwise, with a known predicate, the text resolves to
     * the stored literal of that predicate with the same value, so {@code "false"} finds a
     * BOOLEAN and {@code "9500.00"} a DECIMAL. Anything else is a string literal.
     */
    private Term objectTerm(String value, String predicate) {
        if (graph.contains(value)) {
            return Term.entity(value);
        }
        if (predicate != null) {
            for (Relation relation : graph.match(TriplePattern.of(null, predicate, null))) {
                Term stored = relation.object();
                if (stored.isLiteral() && sameValue(stored, value)) {
                    return stored;
                }
            }
        }
        return Term.literal(value);
    }

    private static boolean sameValue(Term stored, String text) {
        if (stored.getLexical().equals(text)) {
            return true;
        }
        if (stored.getType() == Term.Type.STRING) {
            return false;
        }
        try {
            return stored.equals(Term.parse(stored.getType(), text));
        } catch (IllegalArgumentException e) {
            // text is not a lexical form of this type
            return false;
        }
    }

    private List<Relation> fetch(String subject, List<String> predicates) {
        if (predicates.isEmpty()) {
            return graph.stream(TriplePattern.subject(subject)).toList();
        }
        List<Relation> fetched = new ArrayList<>();
        for (String predicate : predicates) {
            graph.match(TriplePattern.subjectPredicate(subject, predicate)).forEach(fetched::add);
        }
        return fetched;
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private Map<String, String> checkBindings(QueryTemplate template, Map<String, String> bindings) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String name : template.getBindingNames()) {
            String value = bindings != null ? bindings.get(name) : null;
            if (value == null || value.isBlank()) {
                throw new MissingBindingException(template.getName(), name);
            }
            resolved.put(name, value.strip());
        }
        return resolved;
    }

    private Set<String> focusKeys(QueryTemplate template) {
        Set<String> keys = new LinkedHashSet<>(template.getSelect().keySet());
        keys.addAll(template.getRequires().keySet());
        return keys;
    }

    private List<String> subjectsOf(String key, Map<String, String> bindings, List<Solution> solutions) {
        if (PatternSpec.isBinding(key)) {
            String id = bindings.get(PatternSpec.nameOf(key));
            return graph.contains(id) ? List.of(id) : List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (Solution solution : solutions) {
            Term term = solution.get(key);
            if (term != null && term.isEntity()) {
                ids.add(term.getLexical());
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * One partial join row: variable assignments plus the relations that produced them.
     */
    private record Solution(Map<String, Term> variables, List<Relation> relations) {

        static final Solution EMPTY = new Solution(Map.of(), List.of());

        Term get(String variable) {
            return variables.get(variable);
        }

        /**
         * Binds the pattern's unbound variables from {@code relation}; null if a variable
         * repeated inside the pattern would need two different values.
         */
        Solution extend(PatternSpec pattern, Relation relation) {
            Map<String, Term> next = new HashMap<>(variables);
            if (!bind(next, pattern.subject(), Term.entity(relation.subject()))
                    || !bind(next, pattern.predicate(), Term.literal(relation.predicate()))
                    || !bind(next, pattern.object(), relation.object())) {
                return null;
            }
            List<Relation> path = new ArrayList<>(relations);
            path.add(relation);
            return new Solution(next, path);
        }

        private static boolean bind(Map<String, Term> assignments, String token, Term value) {
            if (!PatternSpec.isVariable(token)) {
                return true;
            }
            Term existing = assignments.putIfAbsent(token, value);
            return existing == null || existing.equals(value);
        }
    }
}
