package com.modelpack.types;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code index.json} of an OCI image layout: every manifest stored in a repository.
 * Tagged entries carry {@link Annotations#REF_NAME}.
 */
@JsonPropertyOrder({"schemaVersion", "mediaType", "manifests"})
public record Index(int schemaVersion, String mediaType, List<Descriptor> manifests) {

    public Index {
        manifests = manifests == null ? List.of() : List.copyOf(manifests);
    }

    public static Index empty() {
        return new Index(Manifest.SCHEMA_VERSION, MediaTypes.OCI_INDEX, List.of());
    }

    public Optional<Descriptor> findByTag(String tag) {
        return manifests.stream()
                .filter(d -> tag.equals(d.annotations().get(Annotations.REF_NAME)))
                .findFirst();
    }

    public List<Descriptor> findByDigest(String digest) {
        return manifests.stream().filter(d -> d.digest().equals(digest)).toList();
    }

    public List<String> tags() {
        return manifests.stream()
                .map(d -> d.annotations().get(Annotations.REF_NAME))
                .filter(Objects::nonNull)
                .sorted()
                .toList();
    }

    /**
     * Binds {@code tag} to {@code manifest}, dropping whatever the tag pointed at before and
     * any untagged entry for the same digest.
     */
    public Index withTag(Descriptor manifest, String tag) {
        List<Descriptor> next = new ArrayList<>();
        for (Descriptor d : manifests) {
            String ref = d.annotations().get(Annotations.REF_NAME);
            if (tag.equals(ref)) continue;
            if (ref == null && d.digest().equals(manifest.digest())) continue;
            next.add(d);
        }
        next.add(manifest.withoutAnnotations().withAnnotations(Map.of(Annotations.REF_NAME, tag)));
        return new Index(schemaVersion, mediaType, next);
    }

    /**
     * Records an untagged manifest, unless some entry already references its digest.
     */
    public Index withManifest(Descriptor manifest) {
        if (!findByDigest(manifest.digest()).isEmpty()) return this;
        List<Descriptor> next = new ArrayList<>(manifests);
        next.add(manifest.withoutAnnotations());
        return new Index(schemaVersion, mediaType, next);
    }

    /** Drops the entry bound to {@code tag}. The manifest object itself is left for GC. */
    public Index withoutTag(String tag) {
        List<Descriptor> next = manifests.stream()
                .filter(d -> !tag.equals(d.annotations().get(Annotations.REF_NAME)))
                .toList();
        return new Index(schemaVersion, mediaType, next);
    }

    /** Removes every entry for {@code digest}, tagged or not. */
    public Index withoutDigest(String digest) {
        List<Descriptor> next = manifests.stream().filter(d -> !d.digest().equals(digest)).toList();
        return new Index(schemaVersion, mediaType, next);
    }
}
