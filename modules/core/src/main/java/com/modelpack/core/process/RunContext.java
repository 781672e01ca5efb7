package com.modelpack.core.process;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation state shared by every task of one top-level operation.
 *
 * <p>The first failure reported through {@link #fail(Throwable)} wins and cancels the run;
 * later failures are ignored. Cancel listeners run once, on the thread that cancels.
 */
public class RunContext {

    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    /** @throws CancellationException once the run is cancelled */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Run cancelled");
        }
    }

    /** Records {@code error} if it is the first failure, then cancels the run. */
    public void fail(Throwable error) {
        failure.compareAndSet(null, error);
        cancel();
    }

    public void cancel() {
        synchronized (this) {
            if (cancelled) return;
            cancelled = true;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    /** Registers a listener; runs it immediately if the run is already cancelled. */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled) {
            listener.run();
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    public Throwable failure() {
        return failure.get();
    }
}
