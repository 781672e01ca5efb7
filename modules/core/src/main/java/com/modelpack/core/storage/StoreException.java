package com.modelpack.core.storage;

/**
 * Wraps checked I/O exceptions from content store operations.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
