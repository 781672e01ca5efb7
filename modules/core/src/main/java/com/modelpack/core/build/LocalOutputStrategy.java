package com.modelpack.core.build;

import com.modelpack.core.storage.BlobInfo;
import com.modelpack.core.storage.ContentStore;
import com.modelpack.core.storage.DigestMismatchException;
import com.modelpack.types.Annotations;
import com.modelpack.types.Descriptor;
import com.modelpack.util.Digest;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Writes blobs into the local content store under one repository.
 * The store deduplicates by digest, so nothing is checked up front.
 */
public class LocalOutputStrategy implements OutputStrategy {

    private final ContentStore store;
    private final String repository;
    private final String tag;

    public LocalOutputStrategy(ContentStore store, String repository, String tag) {
        this.store = store;
        this.repository = repository;
        this.tag = tag;
    }

    @Override
    public Descriptor outputLayer(String mediaType, String layerPath, Digest digest, long size,
                                  InputStream content, BuildHooks hooks) {
        Descriptor descriptor = Descriptor.of(mediaType, digest, size, Map.of(Annotations.FILEPATH, layerPath));
        return pushBlob(layerPath, descriptor, content, hooks);
    }

    @Override
    public Descriptor outputConfig(String mediaType, Digest digest, long size, InputStream content, BuildHooks hooks) {
        return pushBlob(digest.toString(), new Descriptor(mediaType, digest, size), content, hooks);
    }

    @Override
    public Descriptor outputManifest(String mediaType, Digest digest, long size, InputStream content, BuildHooks hooks) {
        String name = digest.toString();
        try {
            byte[] manifest = hooks.onStart(name, size, content).readAllBytes();
            Descriptor stored = store.pushManifest(repository, tag, manifest).await().indefinitely();
            if (!stored.parsedDigest().equals(digest)) {
                throw new DigestMismatchException("manifest " + repository + ":" + tag, digest, stored.parsedDigest());
            }
            Descriptor descriptor = new Descriptor(mediaType, digest, size);
            hooks.onComplete(name, descriptor);
            return descriptor;
        } catch (IOException e) {
            hooks.onError(name, e);
            throw new UncheckedIOException("Failed to read manifest " + name, e);
        } catch (RuntimeException e) {
            hooks.onError(name, e);
            throw e;
        }
    }

    private Descriptor pushBlob(String name, Descriptor descriptor, InputStream content, BuildHooks hooks) {
        try {
            InputStream observed = hooks.onStart(name, descriptor.size(), content);
            BlobInfo stored = store.pushBlob(repository, descriptor.parsedDigest(), observed).await().indefinitely();
            if (stored.size() != descriptor.size()) {
                throw new DigestMismatchException(name + " (stored " + stored.size() + " bytes, expected " + descriptor.size() + ")",
                        descriptor.parsedDigest(), stored.digest());
            }
            hooks.onComplete(name, descriptor);
            return descriptor;
        } catch (RuntimeException e) {
            hooks.onError(name, e);
            throw e;
        }
    }
}
