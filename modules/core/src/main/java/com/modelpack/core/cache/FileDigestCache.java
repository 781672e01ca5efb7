package com.modelpack.core.cache;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.modelpack.types.OciJson;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Digest cache kept as one JSON array in {@code <root>/modelpack-cache.json}.
 *
 * <p>Every read and write holds an exclusive lock on the sibling {@code .lock} file, so
 * separate processes sharing the root see consistent contents. The lock is polled every
 * {@value #LOCK_RETRY_MILLIS}ms until the configured timeout. Threads of this process
 * serialize on an in-memory lock first, since the JVM refuses overlapping file locks.
 */
@ApplicationScoped
public class FileDigestCache implements DigestCache {

    private static final Logger log = Logger.getLogger(FileDigestCache.class);

    static final String CACHE_FILE = "modelpack-cache.json";
    static final String LOCK_SUFFIX = ".lock";
    static final long LOCK_RETRY_MILLIS = 100;

    private static final TypeReference<List<CacheItem>> ITEMS = new TypeReference<>() {};
    private static final ConcurrentHashMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    @ConfigProperty(name = "modelpack.cache.root")
    String root;

    @ConfigProperty(name = "modelpack.cache.ttl", defaultValue = "PT24H")
    Duration ttl;

    @ConfigProperty(name = "modelpack.cache.lock-timeout", defaultValue = "PT30S")
    Duration lockTimeout;

    Clock clock = Clock.systemUTC();

    /** Cache outside a CDI container. */
    public static FileDigestCache at(Path root, Duration ttl, Duration lockTimeout, Clock clock) {
        FileDigestCache cache = new FileDigestCache();
        cache.root = root.toString();
        cache.ttl = ttl;
        cache.lockTimeout = lockTimeout;
        cache.clock = clock;
        return cache;
    }

    Path cacheFile() {
        return Path.of(root).resolve(CACHE_FILE);
    }

    Path lockFile() {
        return Path.of(root).resolve(CACHE_FILE + LOCK_SUFFIX);
    }

    @Override
    public Optional<CacheItem> get(Path path) {
        String key = path.toAbsolutePath().normalize().toString();
        return withLock(items -> {
            CacheItem item = items.get(key);
            if (item == null) {
                return Optional.empty();
            }
            if (item.expired(clock.instant(), ttl)) {
                log.debugf("Cache item for %s expired", key);
                return Optional.empty();
            }
            return Optional.of(item);
        }, false);
    }

    @Override
    public void put(CacheItem item) {
        String key = Path.of(item.path()).toAbsolutePath().normalize().toString();
        CacheItem normalized = new CacheItem(key, item.mediaType(), item.modTime(), item.size(),
                item.digest(), item.createdAt() != null ? item.createdAt() : clock.instant());
        withLock(items -> {
            items.put(key, normalized);
            Instant now = clock.instant();
            int before = items.size();
            items.values().removeIf(i -> i.expired(now, ttl));
            if (items.size() < before) {
                log.debugf("Pruned %d expired cache items", before - items.size());
            }
            return null;
        }, true);
    }

    private <T> T withLock(Function<Map<String, CacheItem>, T> action, boolean write) {
        Path lockPath = lockFile();
        ReentrantLock processLock = PROCESS_LOCKS.computeIfAbsent(lockPath, p -> new ReentrantLock());
        long deadline = System.nanoTime() + lockTimeout.toNanos();

        try {
            if (!processLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CacheLockTimeoutException(lockPath, lockTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException("Interrupted waiting for cache lock " + lockPath, e);
        }

        try {
            Files.createDirectories(lockPath.getParent());
            try (FileChannel channel = FileChannel.open(lockPath,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = acquire(channel, lockPath, deadline)) {
                Map<String, CacheItem> items = load();
                T result = action.apply(items);
                if (write) {
                    store(items);
                }
                return result;
            }
        } catch (IOException e) {
            throw new CacheException("Cache I/O failed under " + root, e);
        } finally {
            processLock.unlock();
        }
    }

    private FileLock acquire(FileChannel channel, Path lockPath, long deadline) throws IOException {
        while (true) {
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                lock = null;
            }
            if (lock != null) {
                return lock;
            }
            if (System.nanoTime() >= deadline) {
                throw new CacheLockTimeoutException(lockPath, lockTimeout);
            }
            try {
                Thread.sleep(LOCK_RETRY_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CacheException("Interrupted waiting for cache lock " + lockPath, e);
            }
        }
    }

    private Map<String, CacheItem> load() throws IOException {
        Path file = cacheFile();
        Map<String, CacheItem> items = new LinkedHashMap<>();
        if (!Files.exists(file) || Files.size(file) == 0) {
            return items;
        }
        List<CacheItem> list;
        try {
            list = OciJson.mapper().readValue(file.toFile(), ITEMS);
        } catch (JacksonException e) {
            log.warnf("Discarding unreadable cache file %s: %s", file, e.getOriginalMessage());
            return items;
        }
        for (CacheItem item : list) {
            items.put(item.path(), item);
        }
        return items;
    }

    private void store(Map<String, CacheItem> items) throws IOException {
        List<CacheItem> sorted = new ArrayList<>(items.values());
        sorted.sort(Comparator.comparing(CacheItem::path));

        Path file = cacheFile();
        Path temp = Files.createTempFile(file.getParent(), CACHE_FILE, ".tmp");
        try {
            Files.write(temp, OciJson.toBytes(sorted));
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
