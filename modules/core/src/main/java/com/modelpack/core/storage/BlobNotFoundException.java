package com.modelpack.core.storage;

import com.modelpack.util.Digest;

/**
 * Thrown when a read or mount targets a blob that does not exist.
 */
public class BlobNotFoundException extends StoreException {

    private final String repository;
    private final Digest digest;

    public BlobNotFoundException(String repository, Digest digest) {
        super("Blob not found: repository=" + repository + " digest=" + digest);
        this.repository = repository;
        this.digest = digest;
    }

    public String repository() {
        return repository;
    }

    public Digest digest() {
        return digest;
    }
}
