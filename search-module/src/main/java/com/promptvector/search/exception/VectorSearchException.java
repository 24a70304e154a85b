package com.promptvector.search.exception;

/**
 * Base class of all errors raised by the vector search engine.
 */
public class VectorSearchException extends RuntimeException {

    public VectorSearchException(String message) {
        super(message);
    }

    public VectorSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
