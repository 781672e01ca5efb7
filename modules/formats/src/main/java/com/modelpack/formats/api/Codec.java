package com.modelpack.formats.api;

import com.modelpack.types.Descriptor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Converts a single file to the byte representation stored in a layer, and back.
 *
 * <p>Encoding must be deterministic: encoding an unchanged file twice yields identical bytes,
 * which is what lets the builder hash one encoding and upload another.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface Codec {

    CodecType type();

    /**
     * Opens an encoded stream of {@code file}, recorded under {@code layerPath}.
     *
     * @param file      file to encode
     * @param layerPath {@code /}-separated path the file takes inside the artifact
     * @return stream the caller must close; closing early releases any producer
     */
    InputStream encode(Path file, String layerPath) throws IOException;

    /** Encodes {@code file} under its path relative to {@code workDir}. */
    default InputStream encode(Path file, Path workDir) throws IOException {
        return encode(file, layerPath(workDir, file));
    }

    static String layerPath(Path workDir, Path file) {
        return workDir.toAbsolutePath().normalize()
                .relativize(file.toAbsolutePath().normalize())
                .toString()
                .replace('\\', '/');
    }

    /**
     * Restores a layer into {@code outputDir}.
     *
     * @param input        encoded layer bytes; not closed by this method
     * @param outputDir    extraction root
     * @param relativePath path recorded in the layer's filepath annotation
     * @param descriptor   the layer descriptor, for metadata annotations
     */
    void decode(InputStream input, Path outputDir, String relativePath, Descriptor descriptor) throws IOException;
}
