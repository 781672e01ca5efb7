package com.modelpack.util.stream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Splits one input stream into two independently drained branches.
 *
 * <p>A single copier thread reads the source and writes each chunk into two
 * {@link BoundedPipe}s. A branch whose reader closes early is dropped and the copier keeps
 * feeding the other one, so an unread branch never stalls the copy. {@link #abort(Throwable)}
 * fails both branches; consumers call it when their side fails so the peer stops too.
 */
public final class StreamTee {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final InputStream source;
    private final BoundedPipe first;
    private final BoundedPipe second;
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicReference<Throwable> copyFailure = new AtomicReference<>();

    private StreamTee(InputStream source, int capacityChunks) {
        this.source = source;
        this.first = new BoundedPipe(capacityChunks);
        this.second = new BoundedPipe(capacityChunks);
    }

    /**
     * Starts the copier thread. The tee owns {@code source} and closes it when the copy ends.
     */
    public static StreamTee start(InputStream source, String name) {
        return start(source, name, BoundedPipe.DEFAULT_CHUNKS);
    }

    public static StreamTee start(InputStream source, String name, int capacityChunks) {
        StreamTee tee = new StreamTee(source, capacityChunks);
        Thread copier = new Thread(tee::copy, "tee-" + name);
        copier.setDaemon(true);
        copier.start();
        return tee;
    }

    public InputStream first() {
        return first.source();
    }

    public InputStream second() {
        return second.source();
    }

    /** Fails both branches with {@code cause}. */
    public void abort(Throwable cause) {
        copyFailure.compareAndSet(null, cause);
        first.fail(cause);
        second.fail(cause);
    }

    /** Waits for the copier to finish; returns the failure that stopped it, if any. */
    public Throwable awaitCopy() throws InterruptedException {
        done.await();
        return copyFailure.get();
    }

    private void copy() {
        List<BoundedPipe> live = new ArrayList<>(List.of(first, second));
        byte[] buf = new byte[BUFFER_SIZE];
        try (InputStream in = source) {
            int n;
            while (!live.isEmpty() && (n = in.read(buf)) != -1) {
                for (var it = live.iterator(); it.hasNext(); ) {
                    BoundedPipe pipe = it.next();
                    try {
                        pipe.sink().write(buf, 0, n);
                    } catch (BoundedPipe.PipeClosedException e) {
                        it.remove();
                    }
                }
            }
            for (BoundedPipe pipe : live) {
                closeQuietly(pipe.sink());
            }
        } catch (IOException | RuntimeException e) {
            abort(e);
        } finally {
            done.countDown();
        }
    }

    private static void closeQuietly(OutputStream out) {
        try {
            out.close();
        } catch (BoundedPipe.PipeClosedException e) {
            // reader left after the last chunk; nothing more to deliver
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
