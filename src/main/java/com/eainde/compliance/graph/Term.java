package com.eainde.compliance.graph;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * The object position of a relation: either a reference to another entity or a typed literal.
 *
 * <p>Literals are stored in a canonical lexical form so that equality is value equality:
 * {@code Term.literal(5000)} equals {@code Term.literal(new BigDecimal("5000.00"))}.</p>
 *
 * <pre>
 * Term.entity("C1")                         // link to entity C1
 * Term.literal("verified")                  // STRING
 * Term.literal(new BigDecimal("9500.00"))   // DECIMAL, lexical "9500"
 * Term.literal(LocalDate.of(2024, 5, 10))   // DATE, lexical "2024-05-10"
 * Term.literal(true)                        // BOOLEAN
 * </pre>
 */
public final class Term {

    public enum Type {
        ENTITY,
        STRING,
        DECIMAL,
        DATE,
        BOOLEAN
    }

    private final Type type;
    private final String lexical;

    private Term(Type type, String lexical) {
        this.type = type;
        this.lexical = lexical;
    }

    // === Factories ===

    public static Term entity(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Entity reference requires a non-blank id");
        }
        return new Term(Type.ENTITY, entityId);
    }

    /**
     * Wraps a scalar Java value. Supported: String, any Number, LocalDate, Boolean.
     */
    public static Term literal(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Literal value must not be null");
        }
        if (value instanceof Term) {
            return (Term) value;
        }
        if (value instanceof String) {
            return new Term(Type.STRING, (String) value);
        }
        if (value instanceof Boolean) {
            return new Term(Type.BOOLEAN, value.toString());
        }
        if (value instanceof LocalDate) {
            return new Term(Type.DATE, value.toString());
        }
        if (value instanceof BigDecimal) {
            return new Term(Type.DECIMAL, canonicalDecimal((BigDecimal) value));
        }
        if (value instanceof Number) {
            return new Term(Type.DECIMAL, canonicalDecimal(new BigDecimal(value.toString())));
        }
        throw new IllegalArgumentException(
                "Unsupported literal type " + value.getClass().getName() + " (expected String, Number, LocalDate or Boolean)");
    }

    /**
     * Rebuilds a term from its persisted lexical form, validating it against the type.
     */
    public static Term parse(Type type, String lexical) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lexical, "lexical");
        try {
            switch (type) {
                case ENTITY:
                    return entity(lexical);
                case STRING:
                    return new Term(Type.STRING, lexical);
                case DECIMAL:
                    return literal(new BigDecimal(lexical));
                case DATE:
                    return literal(LocalDate.parse(lexical));
                case BOOLEAN:
                    if (!"true".equals(lexical) && !"false".equals(lexical)) {
                        throw new IllegalArgumentException("Not a boolean: " + lexical);
                    }
                    return literal(Boolean.valueOf(lexical));
                default:
                    throw new IllegalArgumentException("Unhandled term type: " + type);
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + type + " literal: " + lexical, e);
        }
    }

    private static String canonicalDecimal(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    // === Accessors ===

    public Type getType() { return type; }
    public String getLexical() { return lexical; }
    public boolean isEntity() { return type == Type.ENTITY; }
    public boolean isLiteral() { return type != Type.ENTITY; }

    /**
     * The typed Java value: entity id (String), String, BigDecimal, LocalDate or Boolean.
     */
    public Object value() {
        switch (type) {
            case DECIMAL:
                return new BigDecimal(lexical);
            case DATE:
                return LocalDate.parse(lexical);
            case BOOLEAN:
                return Boolean.valueOf(lexical);
            default:
                return lexical;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Term)) return false;
        Term other = (Term) o;
        return type == other.type && lexical.equals(other.lexical);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexical);
    }

    @Override
    public String toString() {
        switch (type) {
            case ENTITY:
                return "<" + lexical + ">";
            case STRING:
                return "\"" + lexical + "\"";
            default:
                return lexical;
        }
    }
}
