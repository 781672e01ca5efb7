package com.modelpack.core.artifact;

import java.time.Instant;
import java.util.List;

/**
 * Model facts read back from a stored manifest and its config.
 *
 * @param id     config digest
 * @param digest manifest digest
 */
public record InspectedModelArtifact(
        String id,
        String digest,
        String architecture,
        Instant createdAt,
        String family,
        String format,
        String name,
        String paramSize,
        String precision,
        String quantization,
        List<Layer> layers
) {
    public record Layer(String mediaType, String digest, long size, String filepath) {
    }
}
