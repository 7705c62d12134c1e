package com.eainde.compliance.graph;

/**
 * Base type for graph integrity violations. These indicate a construction bug and are not recovered.
 */
public class KnowledgeGraphException extends RuntimeException {

    public KnowledgeGraphException(String message) {
        super(message);
    }

    public KnowledgeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
