package com.modelpack.core.storage;

/**
 * Thrown when a tag or digest does not resolve to a manifest in the repository index.
 */
public class ManifestNotFoundException extends StoreException {

    private final String repository;
    private final String reference;

    public ManifestNotFoundException(String repository, String reference) {
        super("Manifest not found: repository=" + repository + " reference=" + reference);
        this.repository = repository;
        this.reference = reference;
    }

    public String repository() {
        return repository;
    }

    public String reference() {
        return reference;
    }
}
