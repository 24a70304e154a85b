package com.promptvector.search.exception;

/**
 * Wraps failures of external collaborators (embedding provider, analytics sink).
 */
public class InternalVectorSearchException extends VectorSearchException {

    public InternalVectorSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
