package com.modelpack.core.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Digest recorded for one file, keyed by its absolute path.
 */
@JsonPropertyOrder({"path", "media_type", "mod_time", "size", "digest", "created_at"})
public record CacheItem(
        String path,
        @JsonProperty("media_type") String mediaType,
        @JsonProperty("mod_time") Instant modTime,
        long size,
        String digest,
        @JsonProperty("created_at") Instant createdAt
) {
    public CacheItem {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(digest, "digest cannot be null");
    }

    public boolean expired(Instant now, Duration ttl) {
        return createdAt == null || createdAt.plus(ttl).isBefore(now);
    }

    /** A hit is only reusable while the file looks exactly as it did when hashed. */
    public boolean matches(long currentSize, Instant currentModTime, String currentMediaType) {
        return size == currentSize
                && Objects.equals(modTime, currentModTime)
                && Objects.equals(mediaType, currentMediaType);
    }
}
