package com.modelpack.core.remote;

import com.modelpack.types.Descriptor;
import com.modelpack.util.Digest;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;

/**
 * One repository on a remote OCI registry.
 *
 * <p>Failures surface as {@link RemoteRegistryException}; absence is reported through the
 * return value, never as an exception.
 */
public interface RemoteRegistry {

    Reference reference();

    boolean blobExists(Digest digest);

    /** Uploads {@code content}, which must hash to {@code descriptor}'s digest. */
    void pushBlob(Descriptor descriptor, InputStream content);

    /** Streams the blob into {@code out}. */
    void pullBlob(Descriptor descriptor, OutputStream out);

    /** Manifest for a tag or digest, or empty if the registry does not have it. */
    Optional<RemoteManifest> pullManifest(String reference);

    default boolean manifestExists(String reference) {
        return pullManifest(reference).isPresent();
    }

    /**
     * Stores {@code manifest} under {@code reference} (a tag or its own digest) and returns
     * the digest the registry addresses it by.
     */
    Digest pushManifest(byte[] manifest, String reference);
}
