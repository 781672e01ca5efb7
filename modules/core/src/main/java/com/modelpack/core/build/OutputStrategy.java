package com.modelpack.core.build;

import com.modelpack.types.Descriptor;
import com.modelpack.util.Digest;

import java.io.InputStream;

/**
 * Where built blobs go. Digest and size are always known before the bytes are handed over.
 *
 * <p>Implementations report failures through {@link BuildHooks#onError} before rethrowing.
 * They do not close {@code content}.
 */
public interface OutputStrategy {

    /** Stores a layer; the returned descriptor carries the filepath annotation. */
    Descriptor outputLayer(String mediaType, String layerPath, Digest digest, long size,
                           InputStream content, BuildHooks hooks);

    Descriptor outputConfig(String mediaType, Digest digest, long size, InputStream content, BuildHooks hooks);

    /** Stores the manifest and binds the run's tag to it. */
    Descriptor outputManifest(String mediaType, Digest digest, long size, InputStream content, BuildHooks hooks);
}
