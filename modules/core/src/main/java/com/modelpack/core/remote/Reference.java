package com.modelpack.core.remote;

import com.google.cloud.tools.jib.api.ImageReference;
import com.google.cloud.tools.jib.api.InvalidImageReferenceException;
import com.modelpack.util.Digest;

import java.util.Optional;

/**
 * A fully qualified model reference: {@code registry/namespace/name[:tag|@digest]}.
 *
 * <p>The registry host is mandatory so that local repository names are the same strings
 * used to reach the remote. Without a tag or digest the tag is {@value #DEFAULT_TAG}.
 */
public final class Reference {

    public static final String DEFAULT_TAG = "latest";

    private final ImageReference image;
    private final String host;
    private final String tag;
    private final Digest digest;

    private Reference(ImageReference image, String host, String tag, Digest digest) {
        this.image = image;
        this.host = host;
        this.tag = tag;
        this.digest = digest;
    }

    public static Reference parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidReferenceException("Reference cannot be empty");
        }
        int slash = value.indexOf('/');
        String host = slash > 0 ? value.substring(0, slash) : "";
        if (!looksLikeHost(host)) {
            throw new InvalidReferenceException("Reference must start with a registry host: " + value);
        }

        ImageReference image;
        try {
            image = ImageReference.parse(value);
        } catch (InvalidImageReferenceException e) {
            throw new InvalidReferenceException("Invalid reference: " + value, e);
        }

        Digest digest = null;
        if (image.getDigest().isPresent()) {
            if (!Digest.isDigest(image.getDigest().get())) {
                throw new InvalidReferenceException("Unsupported digest in reference: " + value);
            }
            digest = Digest.parse(image.getDigest().get());
        }
        String tag = digest != null ? null : image.getTag().orElse(DEFAULT_TAG);
        return new Reference(image, host, tag, digest);
    }

    private static boolean looksLikeHost(String segment) {
        return segment.contains(".") || segment.contains(":") || segment.equals("localhost");
    }

    /** Host as written, e.g. {@code localhost:5000}. */
    public String host() {
        return host;
    }

    /** Registry endpoint for the distribution API. */
    public String registry() {
        return image.getRegistry();
    }

    /** Repository path inside the registry, e.g. {@code team/llama}. */
    public String path() {
        return image.getRepository();
    }

    /** Local repository name: host plus path. */
    public String repository() {
        return host + "/" + image.getRepository();
    }

    public Optional<String> tag() {
        return Optional.ofNullable(tag);
    }

    public Optional<Digest> digest() {
        return Optional.ofNullable(digest);
    }

    /** Tag or digest string, whichever this reference carries. */
    public String reference() {
        return digest != null ? digest.toString() : tag;
    }

    public ImageReference imageReference() {
        return image;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Reference other && toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return repository() + (digest != null ? "@" + digest : ":" + tag);
    }
}
