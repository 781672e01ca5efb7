package com.modelpack.types;

import java.time.Instant;

/**
 * Model facts supplied by the build spec. Every field is optional.
 *
 * <p>{@code createdAt} is never filled in from the clock: leaving it empty keeps config and
 * manifest digests reproducible.
 */
public record ModelMetadata(
        String name,
        String architecture,
        String family,
        String format,
        String paramSize,
        String precision,
        String quantization,
        String sourceUrl,
        String revision,
        Instant createdAt
) {
    public static ModelMetadata empty() {
        return new ModelMetadata(null, null, null, null, null, null, null, null, null, null);
    }
}
