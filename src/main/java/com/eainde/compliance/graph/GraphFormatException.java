package com.eainde.compliance.graph;

/**
 * Thrown when a persisted triple file cannot be parsed.
 */
public class GraphFormatException extends KnowledgeGraphException {

    private final int lineNumber;

    public GraphFormatException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public GraphFormatException(int lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() { return lineNumber; }
}
