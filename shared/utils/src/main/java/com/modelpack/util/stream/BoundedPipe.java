package com.modelpack.util.stream;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-producer, single-consumer byte pipe backed by a bounded queue of chunks.
 *
 * <p>Unlike {@link java.io.PipedInputStream} it is not tied to the liveness of the threads
 * that touch it, so pooled threads can sit on either end. Closing the source before EOF
 * makes further writes fail with {@link PipeClosedException}; {@link #fail(Throwable)}
 * surfaces an error on both ends.
 */
public final class BoundedPipe {

    public static final int DEFAULT_CHUNKS = 16;

    private static final byte[] EOF = new byte[0];
    private static final long POLL_MILLIS = 50;

    private final BlockingQueue<byte[]> queue;
    private final Sink sink = new Sink();
    private final Source source = new Source();
    private volatile Throwable failure;
    private volatile boolean sourceClosed;

    public BoundedPipe() {
        this(DEFAULT_CHUNKS);
    }

    public BoundedPipe(int capacityChunks) {
        if (capacityChunks < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacityChunks);
        }
        this.queue = new ArrayBlockingQueue<>(capacityChunks);
    }

    /** Write side. Closing it signals EOF to the reader. */
    public OutputStream sink() {
        return sink;
    }

    /** Read side. Closing it before EOF abandons the pipe. */
    public InputStream source() {
        return source;
    }

    /** Fails both ends; pending and future reads and writes throw. */
    public void fail(Throwable cause) {
        if (failure == null) {
            failure = cause;
        }
        queue.clear();
    }

    public boolean isSourceClosed() {
        return sourceClosed;
    }

    private IOException failureAsIOException() {
        Throwable f = failure;
        if (f instanceof IOException io) {
            return new IOException(io.getMessage(), io);
        }
        return new IOException("Pipe failed: " + f.getMessage(), f);
    }

    private final class Sink extends OutputStream {
        private boolean closed;

        @Override
        public void write(int b) throws IOException {
            write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (closed) throw new IOException("Pipe sink already closed");
            if (len == 0) return;
            byte[] chunk = new byte[len];
            System.arraycopy(b, off, chunk, 0, len);
            enqueue(chunk);
        }

        @Override
        public void close() throws IOException {
            if (closed) return;
            closed = true;
            if (sourceClosed || failure != null) return;
            enqueue(EOF);
        }

        private void enqueue(byte[] chunk) throws IOException {
            try {
                while (!queue.offer(chunk, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    checkWritable();
                }
                checkWritable();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while writing to pipe");
            }
        }

        private void checkWritable() throws IOException {
            if (failure != null) throw failureAsIOException();
            if (sourceClosed) throw new PipeClosedException();
        }
    }

    private final class Source extends InputStream {
        private byte[] current;
        private int pos;
        private boolean eof;

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n == -1 ? -1 : one[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) return 0;
            if (sourceClosed) throw new IOException("Pipe source closed");
            if (!fill()) return -1;
            int n = Math.min(len, current.length - pos);
            System.arraycopy(current, pos, b, off, n);
            pos += n;
            return n;
        }

        private boolean fill() throws IOException {
            if (eof) return false;
            while (current == null || pos >= current.length) {
                if (failure != null) throw failureAsIOException();
                byte[] next;
                try {
                    next = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted while reading from pipe");
                }
                if (next == null) continue;
                if (next == EOF) {
                    eof = true;
                    return false;
                }
                current = next;
                pos = 0;
            }
            return true;
        }

        @Override
        public void close() {
            sourceClosed = true;
            queue.clear();
        }
    }

    /** Thrown to a writer whose reader went away before EOF. */
    public static final class PipeClosedException extends IOException {
        public PipeClosedException() {
            super("Pipe source closed before EOF");
        }
    }
}
