package com.modelpack.core.build;

/**
 * The build was asked to package something it cannot: a missing file, a directory, a
 * pattern that matches nothing. Never retried.
 */
public class BuildInputException extends RuntimeException {

    public BuildInputException(String message) {
        super(message);
    }

    public BuildInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
