package com.modelpack.core.artifact;

import com.modelpack.core.process.Failures;
import com.modelpack.core.process.RunContext;
import com.modelpack.types.Descriptor;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one action per layer on a bounded pool of daemon threads. The first failure cancels
 * the layers not yet started and is rethrown once the pool drained.
 */
final class LayerPool {

    private static final Logger log = Logger.getLogger(LayerPool.class);

    private LayerPool() {}

    static void forEach(String operation, List<Descriptor> layers, int concurrency, RunContext ctx,
                        Consumer<Descriptor> action) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, concurrency), runnable -> {
            Thread thread = new Thread(runnable, operation + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (Descriptor layer : layers) {
            pool.execute(() -> {
                if (ctx.isCancelled()) return;
                try {
                    action.accept(layer);
                } catch (RuntimeException e) {
                    log.errorf(e, "Failed to %s %s", operation, layer.filepath());
                    ctx.fail(e);
                }
            });
        }
        pool.shutdown();
        try {
            while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.debugf("Still running %s over %d layers", operation, layers.size());
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during " + operation, e);
        }
        if (ctx.failure() != null) {
            throw Failures.propagate(ctx.failure());
        }
    }
}
