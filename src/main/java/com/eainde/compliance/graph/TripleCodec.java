package com.eainde.compliance.graph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Line-oriented, human-diffable triple encoding of a {@link KnowledgeGraph}.
 *
 * <pre>
 * # comment
 * &lt;C1&gt; a &lt;Client&gt; .
 * &lt;C1&gt; &lt;kyc_status&gt; "verified" .
 * &lt;T1&gt; &lt;amount&gt; "5000"^^decimal .
 * &lt;T1&gt; &lt;client&gt; &lt;C1&gt; .
 * </pre>
 *
 * Entity declarations are written before relations, both in insertion order. Reading is
 * two-pass (declarations, then relations), so hand-edited files may be in any order.
 * Inside {@code <...>} and {@code "..."} a backslash escapes {@code \ " > n r t}.
 */
public class TripleCodec {

    private static final String KIND_PREDICATE = "a";

    // =========================================================================
    //  Write
    // =========================================================================

    public void write(KnowledgeGraph graph, Writer writer) throws IOException {
        writer.write("# knowledge graph: " + graph.entityCount() + " entities, "
                + graph.relationCount() + " relations\n");
        for (Entity entity : graph.entities()) {
            writer.write(iri(entity.id()) + " " + KIND_PREDICATE + " " + iri(entity.kind()) + " .\n");
        }
        for (Relation relation : graph.relations()) {
            writer.write(iri(relation.subject()) + " " + iri(relation.predicate()) + " "
                    + encode(relation.object()) + " .\n");
        }
        writer.flush();
    }

    static String encode(Term term) {
        switch (term.getType()) {
            case ENTITY:
                return iri(term.getLexical());
            case STRING:
                return quoted(term.getLexical());
            default:
                return quoted(term.getLexical()) + "^^" + term.getType().name().toLowerCase(Locale.ROOT);
        }
    }

    private static String iri(String value) {
        return "<" + escape(value) + ">";
    }

    private static String quoted(String value) {
        return "\"" + escape(value) + "\"";
    }

    private static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 4);
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"':  sb.append("\\\""); break;
                case '>':  sb.append("\\>"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:   sb.append(c);
            }
        }
        return sb.toString();
    }

    // =========================================================================
    //  Read
    // =========================================================================

    /**
     * Merges the encoded triples into {@code graph}. Re-reading the same input is a no-op.
     *
     * @throws GraphFormatException on a malformed line or a relation to an undeclared entity
     */
    public void read(Reader reader, KnowledgeGraph graph, String provenance) throws IOException {
        List<Statement> declarations = new ArrayList<>();
        List<Statement> triples = new ArrayList<>();

        BufferedReader lines = reader instanceof BufferedReader
                ? (BufferedReader) reader : new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Statement statement;
            try {
                statement = new LineParser(trimmed, lineNumber).parse();
            } catch (IllegalArgumentException e) {
                throw new GraphFormatException(lineNumber, e.getMessage(), e);
            }
            if (statement.subject().isBlank()) {
                throw new GraphFormatException(lineNumber, "subject must not be blank");
            }
            if (statement.declaration()) {
                declarations.add(statement);
            } else {
                triples.add(statement);
            }
        }

        validate(declarations, triples, graph);
        for (Statement declaration : declarations) {
            graph.addEntity(declaration.object().getLexical(), declaration.subject());
        }
        for (Statement triple : triples) {
            graph.addRelation(triple.subject(), triple.predicate(), triple.object(), provenance);
        }
    }

    /**
     * Checks the whole input against the graph before anything is merged, so a rejected
     * load leaves the graph untouched.
     */
    private static void validate(List<Statement> declarations, List<Statement> triples, KnowledgeGraph graph) {
        Map<String, String> kinds = new HashMap<>();
        for (Statement declaration : declarations) {
            String id = declaration.subject();
            String kind = declaration.object().getLexical();
            String known = kinds.get(id);
            if (known == null) {
                known = graph.entity(id).map(Entity::kind).orElse(null);
            }
            if (known != null && !known.equals(kind)) {
                throw new GraphFormatException(declaration.lineNumber(),
                        "entity '" + id + "' declared as " + kind + " but is already a " + known,
                        new DuplicateEntityException(id, known, kind));
            }
            kinds.put(id, kind);
        }
        for (Statement triple : triples) {
            if (triple.predicate().isBlank()) {
                throw new GraphFormatException(triple.lineNumber(), "predicate must not be blank");
            }
            requireDeclared(triple, triple.subject(), kinds, graph);
            if (triple.object().isEntity()) {
                requireDeclared(triple, triple.object().getLexical(), kinds, graph);
            }
        }
    }

    private static void requireDeclared(Statement triple, String id, Map<String, String> kinds, KnowledgeGraph graph) {
        if (!kinds.containsKey(id) && !graph.contains(id)) {
            throw new GraphFormatException(triple.lineNumber(),
                    "relation references undeclared entity '" + id + "'", new UnknownEntityException(id));
        }
    }

    private record Statement(int lineNumber, String subject, String predicate, Term object, boolean declaration) {}

    /**
     * Parses one non-comment line: {@code <s> (a | <p>) (<o> | "lit"[^^type]) .}
     */
    private static final class LineParser {

        private final String line;
        private final int lineNumber;
        private int pos;

        private LineParser(String line, int lineNumber) {
            this.line = line;
            this.lineNumber = lineNumber;
        }

        Statement parse() {
            String subject = readDelimited('<', '>');
            skipSpaces();

            boolean declaration;
            String predicate;
            if (line.startsWith(KIND_PREDICATE + " ", pos)) {
                declaration = true;
                predicate = KIND_PREDICATE;
                pos += KIND_PREDICATE.length();
            } else {
                declaration = false;
                predicate = readDelimited('<', '>');
            }
            skipSpaces();

            Term object;
            if (peek() == '<') {
                object = Term.entity(readDelimited('<', '>'));
            } else if (peek() == '"') {
                String lexical = readDelimited('"', '"');
                object = line.startsWith("^^", pos) ? typedLiteral(lexical) : Term.literal(lexical);
            } else {
                throw error("expected <entity> or \"literal\" as object");
            }
            if (declaration && !object.isEntity()) {
                throw error("entity kind must be written as <Kind>");
            }

            skipSpaces();
            if (peek() != '.') {
                throw error("expected '.' at end of statement");
            }
            pos++;
            skipSpaces();
            if (pos < line.length()) {
                throw error("unexpected trailing content");
            }
            return new Statement(lineNumber, subject, predicate, object, declaration);
        }

        private Term typedLiteral(String lexical) {
            pos += 2;
            int start = pos;
            while (pos < line.length() && Character.isLetter(line.charAt(pos))) {
                pos++;
            }
            String typeName = line.substring(start, pos).toUpperCase(Locale.ROOT);
            try {
                Term.Type type = Term.Type.valueOf(typeName);
                if (type == Term.Type.ENTITY) {
                    throw error("entity is not a literal type");
                }
                return Term.parse(type, lexical);
            } catch (IllegalArgumentException e) {
                throw new GraphFormatException(lineNumber, "bad typed literal \"" + lexical + "\"^^" + typeName, e);
            }
        }

        private String readDelimited(char open, char close) {
            if (peek() != open) {
                throw error("expected '" + open + "' at column " + (pos + 1));
            }
            pos++;
            StringBuilder sb = new StringBuilder();
            while (pos < line.length()) {
                char c = line.charAt(pos++);
                if (c == '\\') {
                    if (pos >= line.length()) {
                        throw error("dangling escape");
                    }
                    char escaped = line.charAt(pos++);
                    switch (escaped) {
                        case 'n': sb.append('\n'); break;
                        case 'r': sb.append('\r'); break;
                        case 't': sb.append('\t'); break;
                        default:  sb.append(escaped);
                    }
                } else if (c == close) {
                    return sb.toString();
                } else {
                    sb.append(c);
                }
            }
            throw error("unterminated " + open + "..." + close);
        }

        private char peek() {
            return pos < line.length() ? line.charAt(pos) : '\0';
        }

        private void skipSpaces() {
            while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
        }

        private GraphFormatException error(String message) {
            return new GraphFormatException(lineNumber, message);
        }
    }
}
