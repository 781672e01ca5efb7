package com.modelpack.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * OCI image manifest carrying a model artifact.
 */
@JsonPropertyOrder({"schemaVersion", "mediaType", "artifactType", "config", "layers", "annotations"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Manifest(
        int schemaVersion,
        String mediaType,
        String artifactType,
        Descriptor config,
        List<Descriptor> layers,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> annotations
) {
    public static final int SCHEMA_VERSION = 2;

    public Manifest {
        layers = layers == null ? List.of() : List.copyOf(layers);
        annotations = annotations == null ? Map.of() : Collections.unmodifiableSortedMap(new TreeMap<>(annotations));
    }

    public static Manifest forModel(Descriptor config, List<Descriptor> layers, Map<String, String> annotations) {
        return new Manifest(SCHEMA_VERSION, MediaTypes.OCI_MANIFEST, MediaTypes.MODEL_ARTIFACT,
                config.withoutAnnotations(), layers, annotations);
    }

    /** Sum of config and layer sizes, without the manifest itself. */
    public long contentSize() {
        long total = config == null ? 0 : config.size();
        for (Descriptor layer : layers) {
            total += layer.size();
        }
        return total;
    }
}
