package com.modelpack.core.process;

import com.modelpack.core.build.Builder;
import com.modelpack.types.ArtifactCategory;
import com.modelpack.types.Descriptor;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds every file of one artifact category on a fixed-width pool.
 *
 * <p>Each file is built under the {@link RetryPolicy}. The first unrecoverable failure
 * cancels the shared {@link RunContext}, which interrupts the pool; it is rethrown once every
 * task has finished. Descriptors come back sorted by filepath annotation, whatever order the
 * tasks completed in.
 */
public class Processor {

    private static final Logger log = Logger.getLogger(Processor.class);

    private final ArtifactCategory category;
    private final String mediaType;
    private final RetryPolicy retry;

    public Processor(ArtifactCategory category, boolean raw, RetryPolicy retry) {
        this.category = category;
        this.mediaType = category.mediaType(raw);
        this.retry = retry;
    }

    public ArtifactCategory category() {
        return category;
    }

    public String mediaType() {
        return mediaType;
    }

    public List<Descriptor> process(Builder builder, Path workDir, List<String> patterns,
                                    ProcessOptions options, RunContext ctx) {
        List<Path> paths = FileMatcher.match(workDir, patterns);
        if (paths.isEmpty()) {
            return List.of();
        }
        log.infof("Building %d %s file(s) with concurrency %d", paths.size(), category.label(), options.concurrency());

        ConcurrentLinkedQueue<Descriptor> results = new ConcurrentLinkedQueue<>();
        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(options.concurrency(), paths.size()), threads(category.label()));
        Runnable interruptPool = pool::shutdownNow;
        ctx.onCancel(interruptPool);
        try {
            for (Path path : paths) {
                pool.execute(() -> buildOne(builder, workDir, path, options, ctx, results));
            }
        } finally {
            pool.shutdown();
            awaitQuietly(pool);
            ctx.removeListener(interruptPool);
        }

        if (ctx.failure() != null) {
            throw Failures.propagate(ctx.failure());
        }
        ctx.throwIfCancelled();

        List<Descriptor> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparing(Descriptor::filepath, Comparator.nullsLast(Comparator.naturalOrder())));
        return sorted;
    }

    private void buildOne(Builder builder, Path workDir, Path path, ProcessOptions options, RunContext ctx,
                          ConcurrentLinkedQueue<Descriptor> results) {
        if (ctx.isCancelled()) {
            return;
        }
        try {
            Descriptor descriptor = retry.run(path.toString(), ctx,
                    () -> builder.buildLayer(mediaType, workDir, path, null, options.hooks()));
            results.add(descriptor);
        } catch (RuntimeException | Error e) {
            if (ctx.isCancelled()) {
                log.debugf("Build of %s stopped by cancellation: %s", path, e.getMessage());
            } else {
                log.errorf(e, "Failed to build %s", path);
            }
            ctx.fail(e);
        }
    }

    private static void awaitQuietly(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.MINUTES)) break;
            } catch (InterruptedException e) {
                interrupted = true;
                pool.shutdownNow();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threads(String label) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "build-" + label + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
