package com.modelpack.formats.codecs;

import com.modelpack.formats.api.Codec;
import com.modelpack.formats.api.CodecType;
import com.modelpack.formats.fs.FileMetadataReader;
import com.modelpack.types.Annotations;
import com.modelpack.types.Descriptor;
import com.modelpack.types.FileMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Passthrough codec: layer bytes are the file bytes.
 * Path and attributes travel in annotations instead of an archive header.
 */
@ApplicationScoped
public class RawCodec implements Codec {

    private static final Logger log = Logger.getLogger(RawCodec.class);

    @Override
    public CodecType type() {
        return CodecType.RAW;
    }

    @Override
    public InputStream encode(Path file, String layerPath) throws IOException {
        return Files.newInputStream(file);
    }

    @Override
    public void decode(InputStream input, Path outputDir, String relativePath, Descriptor descriptor) throws IOException {
        Path target = SafePaths.resolveInside(outputDir, relativePath);
        Files.createDirectories(target.getParent());
        Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);

        String metadataJson = descriptor == null ? null : descriptor.annotations().get(Annotations.FILE_METADATA);
        if (metadataJson != null) {
            FileMetadataReader.apply(target, FileMetadata.fromJson(metadataJson));
        }
        log.debugf("Decoded raw layer to %s", target);
    }
}
