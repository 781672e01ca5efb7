package com.modelpack.core.process;

import com.modelpack.core.build.BuildInputException;
import com.modelpack.core.cache.CacheException;
import com.modelpack.core.remote.RemoteRegistryException;
import com.modelpack.core.storage.BlobNotFoundException;
import com.modelpack.core.storage.DigestMismatchException;
import com.modelpack.core.storage.ManifestFormatException;
import com.modelpack.core.storage.ManifestNotFoundException;
import com.modelpack.core.storage.StoreException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies build failures into transient ones, which are worth another attempt, and the
 * rest.
 */
public final class Failures {

    private Failures() {}

    public static boolean isRetryable(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof BuildInputException
                || t instanceof IllegalArgumentException
                || t instanceof DigestMismatchException
                || t instanceof ManifestFormatException
                || t instanceof BlobNotFoundException
                || t instanceof ManifestNotFoundException
                || t instanceof CancellationException
                || t instanceof InterruptedException
                || t instanceof InterruptedIOException) {
            return false;
        }
        if (t instanceof UncheckedIOException unchecked) {
            return !(unchecked.getCause() instanceof InterruptedIOException);
        }
        return t instanceof IOException
                || t instanceof TimeoutException
                || t instanceof StoreException
                || t instanceof RemoteRegistryException
                || t instanceof CacheException;
    }

    /** Strips executor and future wrappers. */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** Rethrows {@code error} unchecked, wrapping checked exceptions. */
    public static RuntimeException propagate(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof RuntimeException runtime) return runtime;
        if (t instanceof Error err) throw err;
        if (t instanceof IOException io) return new UncheckedIOException(io);
        return new CompletionException(t);
    }
}
