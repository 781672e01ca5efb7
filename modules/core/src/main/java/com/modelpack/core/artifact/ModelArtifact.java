package com.modelpack.core.artifact;

import java.time.Instant;

/**
 * One tagged model in the local store.
 *
 * @param size      manifest, config and layer bytes together
 * @param createdAt creation time from the model config, when it has one
 */
public record ModelArtifact(String repository, String tag, String digest, long size, Instant createdAt) {
}
