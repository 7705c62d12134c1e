package com.eainde.compliance.graph;

/**
 * Thrown when {@code addEntity} would silently replace an existing attribute value.
 * Use {@link KnowledgeGraph#updateAttribute} to record a correction with provenance.
 */
public class AttributeOverwriteException extends KnowledgeGraphException {

    public AttributeOverwriteException(String entityId, String attribute, Term existing, Term requested) {
        super("Attribute '" + attribute + "' of entity '" + entityId + "' already holds " + existing
                + "; refusing to overwrite with " + requested + " (use updateAttribute)");
    }
}
