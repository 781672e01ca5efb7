package com.modelpack.core.artifact;

import com.modelpack.core.remote.Reference;
import com.modelpack.types.Descriptor;

import java.util.List;

/**
 * Descriptors produced by one build, layers in manifest order.
 */
public record BuildResult(Reference reference, Descriptor manifest, Descriptor config, List<Descriptor> layers) {

    public BuildResult {
        layers = List.copyOf(layers);
    }
}
