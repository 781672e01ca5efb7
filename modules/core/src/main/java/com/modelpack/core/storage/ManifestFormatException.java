package com.modelpack.core.storage;

/**
 * A manifest or index could not be parsed. Never retried.
 */
public class ManifestFormatException extends RuntimeException {

    public ManifestFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
