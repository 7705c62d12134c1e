package com.eainde.compliance.query;

import java.util.ArrayList;
import java.util.List;

/**
 * One triple pattern of a template, written as three tokens.
 *
 * <ul>
 * <li>{@code $name}: a caller binding</li>
 * <li>{@code ?name}: a variable, bound by the first pattern that mentions it and joined after that</li>
 * <li>{@code *}: wildcard</li>
 * <li>anything else: a constant</li>
 * </ul>
 */
public record PatternSpec(String subject, String predicate, String object) {

    public static final String WILDCARD = "*";

    public PatternSpec {
        if (isBlank(subject) || isBlank(predicate) || isBlank(object)) {
            throw new IllegalArgumentException("Pattern tokens must not be blank: " + subject + " " + predicate + " " + object);
        }
    }

    public static PatternSpec of(String subject, String predicate, String object) {
        return new PatternSpec(subject, predicate, object);
    }

    public static boolean isBinding(String token) {
        return token.length() > 1 && token.startsWith("$");
    }

    public static boolean isVariable(String token) {
        return token.length() > 1 && token.startsWith("?");
    }

    public static boolean isWildcard(String token) {
        return WILDCARD.equals(token);
    }

    public static String nameOf(String token) {
        return token.substring(1);
    }

    public List<String> tokens() {
        return List.of(subject, predicate, object);
    }

    public List<String> variables() {
        List<String> variables = new ArrayList<>();
        for (String token : tokens()) {
            if (isVariable(token)) variables.add(token);
        }
        return variables;
    }

    public List<String> bindingReferences() {
        List<String> references = new ArrayList<>();
        for (String token : tokens()) {
            if (isBinding(token)) references.add(nameOf(token));
        }
        return references;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return "(" + subject + " " + predicate + " " + object + ")";
    }
}
