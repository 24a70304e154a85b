package com.promptvector.search.exception;

/**
 * Invalid caller input: bad query, bad dimension, impossible cluster count.
 */
public class ValidationException extends VectorSearchException {

    public ValidationException(String message) {
        super(message);
    }
}
