package com.modelpack.core.storage;

import com.modelpack.util.Digest;

/**
 * Content did not hash to the digest it was announced with. Never retried.
 */
public class DigestMismatchException extends RuntimeException {

    private final Digest expected;
    private final Digest actual;

    public DigestMismatchException(String subject, Digest expected, Digest actual) {
        super("Digest mismatch for " + subject + ": expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public Digest expected() {
        return expected;
    }

    public Digest actual() {
        return actual;
    }
}
