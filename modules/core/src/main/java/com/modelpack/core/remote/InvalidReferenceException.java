package com.modelpack.core.remote;

/**
 * A model reference that cannot be parsed. Never retried.
 */
public class InvalidReferenceException extends IllegalArgumentException {

    public InvalidReferenceException(String message) {
        super(message);
    }

    public InvalidReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
