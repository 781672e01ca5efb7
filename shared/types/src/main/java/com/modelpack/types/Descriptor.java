package com.modelpack.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.modelpack.util.Digest;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Content-addressed reference to a blob.
 *
 * <p>Annotations are copied into a sorted, unmodifiable map so that descriptors serialize
 * identically no matter how they were assembled.
 */
@JsonPropertyOrder({"mediaType", "digest", "size", "annotations"})
public record Descriptor(
        String mediaType,
        String digest,
        long size,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> annotations
) {
    public Descriptor {
        Objects.requireNonNull(mediaType, "mediaType cannot be null");
        Objects.requireNonNull(digest, "digest cannot be null");
        Digest.parse(digest);
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        SortedMap<String, String> sorted = annotations == null ? new TreeMap<>() : new TreeMap<>(annotations);
        annotations = Collections.unmodifiableSortedMap(sorted);
    }

    public Descriptor(String mediaType, Digest digest, long size) {
        this(mediaType, digest.toString(), size, Map.of());
    }

    public static Descriptor of(String mediaType, Digest digest, long size, Map<String, String> annotations) {
        return new Descriptor(mediaType, digest.toString(), size, annotations);
    }

    @JsonIgnore
    public Digest parsedDigest() {
        return Digest.parse(digest);
    }

    /** Returns a copy with {@code extra} merged over the existing annotations. */
    public Descriptor withAnnotations(Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) return this;
        Map<String, String> merged = new TreeMap<>(annotations);
        merged.putAll(extra);
        return new Descriptor(mediaType, digest, size, merged);
    }

    /** Returns a copy without annotations, as referenced from a manifest's config field. */
    public Descriptor withoutAnnotations() {
        return annotations.isEmpty() ? this : new Descriptor(mediaType, digest, size, Map.of());
    }

    @JsonIgnore
    public String filepath() {
        return annotations.get(Annotations.FILEPATH);
    }
}
