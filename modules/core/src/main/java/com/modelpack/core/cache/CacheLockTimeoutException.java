package com.modelpack.core.cache;

import java.nio.file.Path;
import java.time.Duration;

/**
 * The cache lock file stayed locked for the whole retry budget.
 */
public class CacheLockTimeoutException extends CacheException {

    public CacheLockTimeoutException(Path lockFile, Duration waited) {
        super("Timed out after " + waited.toMillis() + "ms waiting for cache lock " + lockFile);
    }
}
