package com.modelpack.core.build.interceptor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.modelpack.formats.api.CodecType;
import com.modelpack.types.Annotations;
import com.modelpack.types.MediaTypes;
import com.modelpack.types.OciJson;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.zip.CRC32C;

/**
 * Computes CRC32C checksums over fixed-size chunks of every file in a layer, for lazy-loading
 * image formats that verify chunks as they fetch them.
 *
 * <p>Output goes to {@link Annotations#CHUNK_CRCS} as
 * {@code {"files":[{"file_path":"...","chunk_crcs":"0x1a2b,0x3c4d"}]}}. An empty file has the
 * single checksum {@code 0x0}.
 */
public class ChunkChecksumInterceptor implements Interceptor {

    public static final int DEFAULT_CHUNK_SIZE = 4 * 1024 * 1024;
    public static final int BULK_CHUNK_SIZE = 64 * 1024 * 1024;

    private static final int BUFFER_SIZE = 64 * 1024;

    @JsonPropertyOrder({"files"})
    record FileCrcList(List<FileCrcs> files) {
    }

    @JsonPropertyOrder({"file_path", "chunk_crcs"})
    record FileCrcs(@JsonProperty("file_path") String filePath, @JsonProperty("chunk_crcs") String chunkCrcs) {
    }

    private final int defaultChunkSize;
    private final int bulkChunkSize;

    public ChunkChecksumInterceptor() {
        this(DEFAULT_CHUNK_SIZE, BULK_CHUNK_SIZE);
    }

    public ChunkChecksumInterceptor(int defaultChunkSize, int bulkChunkSize) {
        this.defaultChunkSize = defaultChunkSize;
        this.bulkChunkSize = bulkChunkSize;
    }

    int chunkSize(String mediaType) {
        return MediaTypes.WEIGHT.equals(mediaType) || MediaTypes.DATASET.equals(mediaType)
                ? bulkChunkSize
                : defaultChunkSize;
    }

    @Override
    public Map<String, String> intercept(String mediaType, String layerPath, CodecType codecType, InputStream content)
            throws IOException {
        int chunkSize = chunkSize(mediaType);
        List<FileCrcs> files = new ArrayList<>();

        if (codecType == CodecType.TAR) {
            TarArchiveInputStream tar = new TarArchiveInputStream(content);
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (entry.isFile()) {
                    files.add(new FileCrcs(entry.getName(), format(checksums(tar, chunkSize))));
                }
            }
        } else {
            files.add(new FileCrcs(layerPath, format(checksums(content, chunkSize))));
        }
        return Map.of(Annotations.CHUNK_CRCS, OciJson.toString(new FileCrcList(files)));
    }

    static List<Long> checksums(InputStream in, int chunkSize) throws IOException {
        List<Long> result = new ArrayList<>();
        byte[] buf = new byte[Math.min(BUFFER_SIZE, chunkSize)];
        while (true) {
            CRC32C crc = new CRC32C();
            int inChunk = 0;
            while (inChunk < chunkSize) {
                int n = in.read(buf, 0, Math.min(buf.length, chunkSize - inChunk));
                if (n == -1) break;
                crc.update(buf, 0, n);
                inChunk += n;
            }
            if (inChunk == 0) {
                if (result.isEmpty()) {
                    result.add(0L);
                }
                return result;
            }
            result.add(crc.getValue());
            if (inChunk < chunkSize) {
                return result;
            }
        }
    }

    static String format(List<Long> crcs) {
        StringJoiner joined = new StringJoiner(",");
        for (long crc : crcs) {
            joined.add("0x" + Long.toHexString(crc));
        }
        return joined.toString();
    }
}
