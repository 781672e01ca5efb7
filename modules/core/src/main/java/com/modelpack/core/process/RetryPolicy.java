package com.modelpack.core.process;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Exponential backoff retry for one unit of build work.
 *
 * <p>Backoff doubles from {@code initialBackoff} up to {@code maxBackoff}, without jitter.
 * Only {@link Failures#isRetryable retryable} failures are retried, and never once the run
 * is cancelled.
 *
 * @param attempts total attempts, including the first
 */
public record RetryPolicy(int attempts, Duration initialBackoff, Duration maxBackoff) {

    private static final Logger log = Logger.getLogger(RetryPolicy.class);

    public static final int DEFAULT_ATTEMPTS = 4;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(10);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(20);

    public RetryPolicy {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1: " + attempts);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_ATTEMPTS, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    public <T> T run(String name, RunContext ctx, Supplier<T> action) {
        AtomicInteger attempt = new AtomicInteger();
        Uni<T> once = Uni.createFrom().item(() -> {
            ctx.throwIfCancelled();
            attempt.incrementAndGet();
            return action.get();
        });
        if (attempts == 1) {
            return once.await().indefinitely();
        }
        return once
                .onFailure(e -> !ctx.isCancelled() && Failures.isRetryable(e))
                .invoke(e -> {
                    if (attempt.get() < attempts) {
                        log.warnf("Attempt %d of %d for %s failed, retrying: %s",
                                attempt.get(), attempts, name, e.getMessage());
                    }
                })
                .onFailure(e -> !ctx.isCancelled() && Failures.isRetryable(e))
                .retry()
                .withBackOff(initialBackoff, maxBackoff)
                .withJitter(0)
                .atMost(attempts - 1)
                .onFailure(RetryPolicy::isExhausted).transform(Throwable::getCause)
                .await().indefinitely();
    }

    /** Mutiny reports a spent backoff budget as an IllegalStateException around the last failure. */
    private static boolean isExhausted(Throwable error) {
        return error instanceof IllegalStateException
                && error.getCause() != null
                && error.getMessage() != null
                && error.getMessage().startsWith("Retries exhausted");
    }
}
