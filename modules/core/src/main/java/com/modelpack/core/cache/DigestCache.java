package com.modelpack.core.cache;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-file digest memo shared by every build on this machine.
 *
 * <p>Both operations may throw {@link CacheException}; callers treat that as a miss.
 */
public interface DigestCache {

    /** The item for {@code path}, or empty when absent or past its TTL. */
    Optional<CacheItem> get(Path path);

    /** Upserts {@code item} and drops every expired item. */
    void put(CacheItem item);
}
