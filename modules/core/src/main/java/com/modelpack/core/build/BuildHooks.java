package com.modelpack.core.build;

import com.modelpack.types.Descriptor;

import java.io.InputStream;

/**
 * Progress callbacks for one blob transfer. Hooks observe bytes; they never change them.
 *
 * <p>{@code name} is the layer path for layers and the digest for config and manifest blobs.
 */
public interface BuildHooks {

    BuildHooks NONE = new BuildHooks() {
    };

    /** Called before the transfer; may wrap {@code stream} to observe progress. */
    default InputStream onStart(String name, long size, InputStream stream) {
        return stream;
    }

    default void onError(String name, Throwable error) {
    }

    default void onComplete(String name, Descriptor descriptor) {
    }
}
