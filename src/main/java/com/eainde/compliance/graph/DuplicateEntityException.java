package com.eainde.compliance.graph;

/**
 * Thrown when an entity id is re-used with a different kind.
 */
public class DuplicateEntityException extends KnowledgeGraphException {

    private final String entityId;
    private final String existingKind;
    private final String requestedKind;

    public DuplicateEntityException(String entityId, String existingKind, String requestedKind) {
        super("Entity '" + entityId + "' already exists as " + existingKind + ", cannot re-add as " + requestedKind);
        this.entityId = entityId;
        this.existingKind = existingKind;
        this.requestedKind = requestedKind;
    }

    public String getEntityId() { return entityId; }
    public String getExistingKind() { return existingKind; }
    public String getRequestedKind() { return requestedKind; }
}
