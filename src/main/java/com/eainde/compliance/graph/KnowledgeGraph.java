package com.eainde.compliance.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * In-memory, file-persistable store of typed entities and relations.
 *
 * <h3>Lifecycle: build-then-freeze</h3>
 * <ol>
 * <li>Construct once per session, then populate with {@link #addEntity}, {@link #addRelation},
 * {@link #updateAttribute} or {@link #load}.</li>
 * <li>Call {@link #freeze()} before concurrent read traffic starts. Every mutator then throws
 * {@link IllegalStateException}.</li>
 * <li>Read with {@link #match}/{@link #facts} from any number of threads.</li>
 * </ol>
 * Mutation is not synchronized: before freezing, the caller must serialize writers and keep
 * readers away.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>Entity ids are unique; re-adding an id with another kind fails.</li>
 * <li>No dangling edges: the subject and any entity-valued object must exist.</li>
 * <li>Relations form a set of triples and are append-only; nothing is deleted or edited.</li>
 * </ul>
 */
public class KnowledgeGraph {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraph.class);

    public static final String DEFAULT_PROVENANCE = "api";

    private final Clock clock;

    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final List<Relation> relations = new ArrayList<>();
    private final Map<TripleKey, Relation> tripleIndex = new HashMap<>();
    private final Map<String, List<Relation>> bySubject = new HashMap<>();

    private long nextSequence = 1;
    private volatile boolean frozen;

    public KnowledgeGraph() {
        this(Clock.systemUTC());
    }

    public KnowledgeGraph(Clock clock) {
        this.clock = clock;
    }

    // =========================================================================
    //  Mutation
    // =========================================================================

    /**
     * Adds an entity together with its attributes, stored as literal relations.
     *
     * <p>Re-adding an existing id with the same kind merges attributes: identical values are
     * ignored, a different value for an existing attribute is rejected.</p>
     *
     * @throws DuplicateEntityException    id exists with a different kind
     * @throws AttributeOverwriteException an attribute would be silently overwritten
     */
    public Entity addEntity(String kind, String id, Map<String, ?> attributes) {
        checkMutable();
        Entity existing = entities.get(id);
        if (existing != null && !existing.kind().equals(kind)) {
            throw new DuplicateEntityException(id, existing.kind(), kind);
        }

        Map<String, Term> terms = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((name, value) -> terms.put(name, Term.literal(value)));
        }
        terms.forEach((name, term) -> {
            if (term.isEntity()) {
                throw new IllegalArgumentException(
                        "Attribute '" + name + "' of " + id + " is an entity reference; use addRelation");
            }
        });

        // A rejected call leaves no partial entity behind.
        if (existing != null) {
            terms.forEach((name, term) -> checkNoOverwrite(id, name, term));
        }

        Entity entity = existing;
        if (entity == null) {
            entity = new Entity(id, kind, clock.instant());
            entities.put(id, entity);
            log.debug("Added entity {} ({})", id, kind);
        }
        for (Map.Entry<String, Term> attribute : terms.entrySet()) {
            append(id, attribute.getKey(), attribute.getValue(), DEFAULT_PROVENANCE);
        }
        return entity;
    }

    public Entity addEntity(String kind, String id) {
        return addEntity(kind, id, Map.of());
    }

    public Relation addRelation(String subjectId, String predicate, Term object) {
        return addRelation(subjectId, predicate, object, DEFAULT_PROVENANCE);
    }

    /**
     * Adds a relation. Adding a triple that is already present is a no-op that returns the
     * existing relation.
     *
     * @throws UnknownEntityException subject (or entity-valued object) is not in the graph
     */
    public Relation addRelation(String subjectId, String predicate, Term object, String provenance) {
        checkMutable();
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("Relation predicate is required");
        }
        if (object == null) {
            throw new IllegalArgumentException("Relation object is required");
        }
        if (!entities.containsKey(subjectId)) {
            throw new UnknownEntityException(subjectId);
        }
        if (object.isEntity() && !entities.containsKey(object.getLexical())) {
            throw new UnknownEntityException(object.getLexical());
        }
        return append(subjectId, predicate, object, provenance);
    }

    /**
     * Records a new value for an attribute. The previous value stays in the graph; the
     * correction is a new relation carrying {@code provenance}.
     */
    public Relation updateAttribute(String entityId, String attribute, Object value, String provenance) {
        if (provenance == null || provenance.isBlank()) {
            throw new IllegalArgumentException("An attribute update requires provenance");
        }
        Term term = Term.literal(value);
        if (term.isEntity()) {
            throw new IllegalArgumentException("Attribute values must be literals: " + attribute);
        }
        return addRelation(entityId, attribute, term, provenance);
    }

    /**
     * Ends the build phase. Afterwards the graph is read-only and safe for concurrent readers.
     */
    public void freeze() {
        if (!frozen) {
            frozen = true;
            log.info("Knowledge graph frozen with {} entities and {} relations",
                    entities.size(), relations.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    // =========================================================================
    //  Queries
    // =========================================================================

    /**
     * Lazily matches a pattern. Each {@code iterator()} restarts the scan; results follow
     * insertion order and are bounded by the relation count at the time iteration starts.
     */
    public Iterable<Relation> match(TriplePattern pattern) {
        TriplePattern effective = pattern != null ? pattern : TriplePattern.ANY;
        return () -> {
            List<Relation> source = effective.subject() != null
                    ? bySubject.getOrDefault(effective.subject(), List.of())
                    : relations;
            return new MatchIterator(source, source.size(), effective);
        };
    }

    public Stream<Relation> stream(TriplePattern pattern) {
        return StreamSupport.stream(match(pattern).spliterator(), false);
    }

    /**
     * Matching relations as immutable fact snapshots.
     */
    public List<Fact> facts(TriplePattern pattern) {
        return stream(pattern).map(Fact::of).toList();
    }

    public Optional<Entity> entity(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public boolean contains(String id) {
        return id != null && entities.containsKey(id);
    }

    public List<Entity> entities() {
        return List.copyOf(entities.values());
    }

    public List<Entity> entities(String kind) {
        return entities.values().stream()
                .filter(e -> e.kind().equals(kind))
                .toList();
    }

    public List<Relation> relations() {
        return Collections.unmodifiableList(new ArrayList<>(relations));
    }

    public int entityCount() {
        return entities.size();
    }

    public int relationCount() {
        return relations.size();
    }

    // =========================================================================
    //  Persistence
    // =========================================================================

    /**
     * Merges a persisted triple file into this graph. Idempotent.
     */
    public void load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            load(reader, "load:" + path.getFileName());
        }
        log.info("Loaded knowledge graph from {}: {} entities, {} relations",
                path, entities.size(), relations.size());
    }

    public void load(Reader reader, String provenance) throws IOException {
        checkMutable();
        new TripleCodec().read(reader, this, provenance);
    }

    public void dump(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            dump(writer);
        }
        log.info("Dumped knowledge graph to {}", path);
    }

    public void dump(Writer writer) throws IOException {
        new TripleCodec().write(this, writer);
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private Relation append(String subject, String predicate, Term object, String provenance) {
        TripleKey key = new TripleKey(subject, predicate, object);
        Relation existing = tripleIndex.get(key);
        if (existing != null) {
            return existing;
        }
        long sequence = nextSequence++;
        Relation relation = new Relation("r" + sequence, sequence, subject, predicate, object,
                provenance != null ? provenance : DEFAULT_PROVENANCE, clock.instant());
        relations.add(relation);
        tripleIndex.put(key, relation);
        bySubject.computeIfAbsent(subject, s -> new ArrayList<>()).add(relation);
        return relation;
    }

    private void checkNoOverwrite(String entityId, String attribute, Term requested) {
        Term conflicting = null;
        for (Relation relation : match(TriplePattern.subjectPredicate(entityId, attribute))) {
            if (relation.object().equals(requested)) {
                return;
            }
            conflicting = relation.object();
        }
        if (conflicting != null) {
            throw new AttributeOverwriteException(entityId, attribute, conflicting, requested);
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Knowledge graph is frozen; mutation is no longer allowed");
        }
    }

    private record TripleKey(String subject, String predicate, Term object) {}

    private static final class MatchIterator implements Iterator<Relation> {

        private final List<Relation> source;
        private final int bound;
        private final TriplePattern pattern;
        private int index;
        private Relation next;

        private MatchIterator(List<Relation> source, int bound, TriplePattern pattern) {
            this.source = source;
            this.bound = bound;
            this.pattern = pattern;
        }

        @Override
        public boolean hasNext() {
            while (next == null && index < bound) {
                Relation candidate = source.get(index++);
                if (pattern.matches(candidate)) {
                    next = candidate;
                }
            }
            return next != null;
        }

        @Override
        public Relation next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Relation result = next;
            next = null;
            return result;
        }
    }
}
