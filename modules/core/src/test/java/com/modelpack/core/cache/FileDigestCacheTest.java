package com.modelpack.core.cache;

import com.modelpack.types.MediaTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class FileDigestCacheTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Instant MTIME = Instant.parse("2024-04-30T08:00:00Z");
    private static final String DIGEST = "sha256:" + "0f".repeat(32);

    @TempDir
    Path root;

    @TempDir
    Path models;

    private MutableClock clock;
    private FileDigestCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        cache = FileDigestCache.at(root, Duration.ofHours(24), Duration.ofMillis(500), clock);
    }

    private CacheItem item(Path path) {
        return new CacheItem(path.toString(), MediaTypes.WEIGHT, MTIME, 1024, DIGEST, clock.instant());
    }

    @Test
    void shouldMissOnEmptyCache() {
        assertThat(cache.get(models.resolve("model.bin"))).isEmpty();
    }

    @Test
    void shouldReturnStoredItemByAbsolutePath() {
        Path file = models.resolve("model.bin");
        cache.put(item(file));

        assertThat(cache.get(file)).hasValueSatisfying(found -> {
            assertThat(found.digest()).isEqualTo(DIGEST);
            assertThat(found.matches(1024, MTIME, MediaTypes.WEIGHT)).isTrue();
        });
        assertThat(cache.get(models.resolve("sub/../model.bin"))).isPresent();
    }

    @Test
    void shouldPersistAcrossInstances() {
        Path file = models.resolve("model.bin");
        cache.put(item(file));

        FileDigestCache reopened = FileDigestCache.at(root, Duration.ofHours(24), Duration.ofMillis(500), clock);

        assertThat(reopened.get(file)).isPresent();
        assertThat(root.resolve(FileDigestCache.CACHE_FILE)).exists();
    }

    @Test
    void shouldExpireItemsAfterTtl() {
        Path file = models.resolve("model.bin");
        cache.put(item(file));

        clock.advance(Duration.ofHours(23));
        assertThat(cache.get(file)).isPresent();

        clock.advance(Duration.ofHours(2));
        assertThat(cache.get(file)).isEmpty();
    }

    @Test
    void shouldPruneExpiredItemsOnWrite() throws IOException {
        Path old = models.resolve("old.bin");
        cache.put(item(old));
        clock.advance(Duration.ofHours(25));

        cache.put(item(models.resolve("new.bin")));

        String json = Files.readString(root.resolve(FileDigestCache.CACHE_FILE));
        assertThat(json).contains("new.bin").doesNotContain("old.bin");
    }

    @Test
    void shouldOnlyMatchUnchangedFiles() {
        CacheItem stored = item(models.resolve("model.bin"));

        assertThat(stored.matches(1024, MTIME, MediaTypes.WEIGHT)).isTrue();
        assertThat(stored.matches(1025, MTIME, MediaTypes.WEIGHT)).isFalse();
        assertThat(stored.matches(1024, MTIME.plusSeconds(1), MediaTypes.WEIGHT)).isFalse();
        assertThat(stored.matches(1024, MTIME, MediaTypes.WEIGHT_RAW)).isFalse();
    }

    @Test
    void shouldDiscardCorruptCacheFile() throws IOException {
        Files.writeString(root.resolve(FileDigestCache.CACHE_FILE), "[{not json");
        Path file = models.resolve("model.bin");

        assertThat(cache.get(file)).isEmpty();
        cache.put(item(file));
        assertThat(cache.get(file)).isPresent();
    }

    @Test
    void shouldWriteSnakeCaseJson() throws IOException {
        cache.put(item(models.resolve("model.bin")));

        String json = Files.readString(root.resolve(FileDigestCache.CACHE_FILE));
        assertThat(json).contains("\"media_type\"", "\"mod_time\"", "\"created_at\"");
    }

    @Test
    void shouldTimeOutWhileAnotherProcessHoldsTheLock() throws Exception {
        Path lockFile = root.resolve(FileDigestCache.CACHE_FILE + FileDigestCache.LOCK_SUFFIX);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> {
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                locked.countDown();
                release.await(10, TimeUnit.SECONDS);
            } catch (IOException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> cache.get(models.resolve("model.bin")))
                    .isInstanceOf(CacheLockTimeoutException.class);
        } finally {
            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        }
        assertThat(cache.get(models.resolve("model.bin"))).isEmpty();
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public Instant instant() {
            return now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
