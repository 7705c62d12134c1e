package com.eainde.compliance.graph;

/**
 * Thrown when a relation references an entity id that is not in the graph.
 */
public class UnknownEntityException extends KnowledgeGraphException {

    private final String entityId;

    public UnknownEntityException(String entityId) {
        super("Unknown entity: " + entityId);
        this.entityId = entityId;
    }

    public String getEntityId() { return entityId; }
}
