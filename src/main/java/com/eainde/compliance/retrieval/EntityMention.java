package com.eainde.compliance.retrieval;

/**
 * An entity the question refers to, either by id or by its {@code name} attribute.
 *
 * @param entityId resolved entity id
 * @param kind     entity kind
 * @param text     the question text that matched
 * @param position character offset of the match in the question
 */
public record EntityMention(String entityId, String kind, String text, int position) {
}
