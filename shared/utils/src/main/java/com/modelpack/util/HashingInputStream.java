package com.modelpack.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;

/**
 * Computes SHA-256 and byte count of everything read through it.
 * {@link #result()} is only meaningful after the wrapped stream reached EOF.
 */
public class HashingInputStream extends FilterInputStream {

    private final MessageDigest md = DigestUtils.getSha256Digest();
    private long count;

    public HashingInputStream(InputStream in) {
        super(in);
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b != -1) {
            md.update((byte) b);
            count++;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = super.read(b, off, len);
        if (n > 0) {
            md.update(b, off, n);
            count += n;
        }
        return n;
    }

    @Override
    public long skip(long n) {
        throw new UnsupportedOperationException("skip would bypass the digest");
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    public long count() {
        return count;
    }

    public Hashing.Result result() {
        return new Hashing.Result(Digest.sha256(md.digest()), count);
    }
}
