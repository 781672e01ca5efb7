package com.modelpack.core.process;

import com.modelpack.core.build.BuildInputException;
import com.modelpack.core.storage.DigestMismatchException;
import com.modelpack.core.storage.StoreException;
import com.modelpack.util.Hashing;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    private static final RetryPolicy FAST = new RetryPolicy(4, Duration.ofMillis(1), Duration.ofMillis(2));

    @Test
    void shouldSucceedOnLastAttempt() {
        AtomicInteger calls = new AtomicInteger();

        String result = FAST.run("model.bin", new RunContext(), () -> {
            if (calls.incrementAndGet() < 4) {
                throw new StoreException("disk busy");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(4);
    }

    @Test
    void shouldGiveUpAfterAllAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> FAST.run("model.bin", new RunContext(), () -> {
            calls.incrementAndGet();
            throw new UncheckedIOException(new IOException("connection reset"));
        })).isInstanceOf(UncheckedIOException.class);
        assertThat(calls).hasValue(4);
    }

    @Test
    void shouldNotRetryInputErrors() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> FAST.run("model.bin", new RunContext(), () -> {
            calls.incrementAndGet();
            throw new BuildInputException("missing");
        })).isInstanceOf(BuildInputException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldNotRetryIntegrityErrors() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> FAST.run("model.bin", new RunContext(), () -> {
            calls.incrementAndGet();
            throw new DigestMismatchException("blob", Hashing.sha256(new byte[]{1}), Hashing.sha256(new byte[]{2}));
        })).isInstanceOf(DigestMismatchException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldStopRetryingOnceCancelled() {
        RunContext ctx = new RunContext();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> FAST.run("model.bin", ctx, () -> {
            calls.incrementAndGet();
            ctx.cancel();
            throw new StoreException("disk busy");
        })).isInstanceOf(StoreException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldNotStartWhenAlreadyCancelled() {
        RunContext ctx = new RunContext();
        ctx.cancel();

        assertThatThrownBy(() -> FAST.run("model.bin", ctx, () -> "never"))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void shouldRunOnceWithoutRetries() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryPolicy.none().run("model.bin", new RunContext(), () -> {
            calls.incrementAndGet();
            throw new StoreException("disk busy");
        })).isInstanceOf(StoreException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldRejectZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldUseDocumentedDefaults() {
        assertThat(RetryPolicy.defaults())
                .isEqualTo(new RetryPolicy(4, Duration.ofSeconds(10), Duration.ofSeconds(20)));
    }
}
