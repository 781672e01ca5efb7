package com.modelpack.util;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Content digest in OCI form ({@code algorithm:hex}).
 * Immutable value object that can be used as a map key.
 *
 * <p>Only SHA-256 digests are produced, and only SHA-256 digests are accepted on parse:
 * the content store is laid out by {@code blobs/sha256/<hex>}.
 */
public record Digest(String algorithm, String hex) {
    public static final String SHA256 = "sha256";

    private static final int SHA256_HEX_LENGTH = 64;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public Digest {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(hex, "hex cannot be null");
        if (!SHA256.equals(algorithm)) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm);
        }
        if (hex.length() != SHA256_HEX_LENGTH) {
            throw new IllegalArgumentException(
                    "sha256 hex must be 64 characters, got: " + hex.length());
        }
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                throw new IllegalArgumentException("Invalid lowercase hex in digest: " + hex);
            }
        }
    }

    /**
     * Parses {@code sha256:<64 hex chars>}.
     */
    public static Digest parse(String value) {
        Objects.requireNonNull(value, "digest string cannot be null");
        int colon = value.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Invalid digest format: " + value);
        }
        return new Digest(value.substring(0, colon), value.substring(colon + 1));
    }

    public static Digest sha256(byte[] raw) {
        return new Digest(SHA256, HEX_FORMAT.formatHex(raw));
    }

    /** True when {@code value} parses as a digest; used to tell digests from tags. */
    public static boolean isDigest(String value) {
        if (value == null || value.indexOf(':') <= 0) return false;
        try {
            parse(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return algorithm + ":" + hex;
    }
}
