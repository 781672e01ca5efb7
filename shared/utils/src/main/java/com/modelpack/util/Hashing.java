package com.modelpack.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.security.MessageDigest;

/**
 * SHA-256 helpers on top of commons-codec.
 */
public final class Hashing {

    private static final int BUFFER_SIZE = 64 * 1024;

    private Hashing() {}

    /** Digest and length of a fully consumed stream. */
    public record Result(Digest digest, long size) {}

    public static Digest sha256(byte[] data) {
        return Digest.sha256(DigestUtils.sha256(data));
    }

    /**
     * Consumes {@code in} to EOF and returns its digest and length.
     * The stream is not closed.
     */
    public static Result sha256(InputStream in) throws IOException {
        MessageDigest md = DigestUtils.getSha256Digest();
        byte[] buf = new byte[BUFFER_SIZE];
        long total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            md.update(buf, 0, n);
            total += n;
        }
        return new Result(Digest.sha256(md.digest()), total);
    }

    /** Unchecked variant for use inside lambdas. */
    public static Result sha256Unchecked(InputStream in) {
        try {
            return sha256(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash stream", e);
        }
    }
}
