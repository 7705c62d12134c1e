package com.eainde.compliance.query;

/**
 * Base type for query misuse. Surfaced to the caller, never retried.
 */
public class QueryException extends RuntimeException {

    public QueryException(String message) {
        super(message);
    }
}
