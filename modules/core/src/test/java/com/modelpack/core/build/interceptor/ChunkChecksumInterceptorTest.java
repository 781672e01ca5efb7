package com.modelpack.core.build.interceptor;

import com.modelpack.formats.api.CodecType;
import com.modelpack.formats.codecs.TarCodec;
import com.modelpack.types.Annotations;
import com.modelpack.types.MediaTypes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ChunkChecksumInterceptorTest {

    // CRC32C check value of "123456789"
    private static final long CHECK = 0xe3069283L;

    @TempDir
    Path workDir;

    private static InputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldChecksumWholeInputInOneChunk() throws IOException {
        assertThat(ChunkChecksumInterceptor.checksums(stream("123456789"), 1024)).containsExactly(CHECK);
    }

    @Test
    void shouldSplitIntoFixedSizeChunks() throws IOException {
        List<Long> crcs = ChunkChecksumInterceptor.checksums(stream("123456789".repeat(3)), 9);

        assertThat(crcs).containsExactly(CHECK, CHECK, CHECK);
    }

    @Test
    void shouldKeepShortTrailingChunk() throws IOException {
        assertThat(ChunkChecksumInterceptor.checksums(stream("1234567891"), 9)).hasSize(2).startsWith(CHECK);
    }

    @Test
    void shouldReportZeroForEmptyInput() throws IOException {
        List<Long> crcs = ChunkChecksumInterceptor.checksums(InputStream.nullInputStream(), 16);

        assertThat(ChunkChecksumInterceptor.format(crcs)).isEqualTo("0x0");
    }

    @Test
    void shouldFormatAsHexList() {
        assertThat(ChunkChecksumInterceptor.format(List.of(CHECK, 0x1aL))).isEqualTo("0xe3069283,0x1a");
    }

    @Test
    void shouldUseBulkChunksForWeightAndDatasetArchives() {
        ChunkChecksumInterceptor interceptor = new ChunkChecksumInterceptor();

        assertThat(interceptor.chunkSize(MediaTypes.WEIGHT)).isEqualTo(ChunkChecksumInterceptor.BULK_CHUNK_SIZE);
        assertThat(interceptor.chunkSize(MediaTypes.DATASET)).isEqualTo(ChunkChecksumInterceptor.BULK_CHUNK_SIZE);
        assertThat(interceptor.chunkSize(MediaTypes.WEIGHT_RAW)).isEqualTo(ChunkChecksumInterceptor.DEFAULT_CHUNK_SIZE);
        assertThat(interceptor.chunkSize(MediaTypes.CODE)).isEqualTo(ChunkChecksumInterceptor.DEFAULT_CHUNK_SIZE);
    }

    @Test
    void shouldAnnotateRawLayerUnderItsPath() throws IOException {
        Map<String, String> annotations = new ChunkChecksumInterceptor(9, 9)
                .intercept(MediaTypes.WEIGHT_RAW, "model.bin", CodecType.RAW, stream("123456789"));

        assertThat(annotations).containsOnlyKeys(Annotations.CHUNK_CRCS);
        assertThat(annotations.get(Annotations.CHUNK_CRCS))
                .isEqualTo("{\"files\":[{\"file_path\":\"model.bin\",\"chunk_crcs\":\"0xe3069283\"}]}");
    }

    @Test
    void shouldChecksumFileInsideTarLayer() throws IOException {
        Path file = workDir.resolve("weights/model.bin");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "123456789123456789");

        Map<String, String> annotations;
        try (InputStream tar = new TarCodec().encode(file, workDir)) {
            annotations = new ChunkChecksumInterceptor(1024, 9)
                    .intercept(MediaTypes.WEIGHT, "weights/model.bin", CodecType.TAR, tar);
        }

        assertThat(annotations.get(Annotations.CHUNK_CRCS))
                .isEqualTo("{\"files\":[{\"file_path\":\"weights/model.bin\",\"chunk_crcs\":\"0xe3069283,0xe3069283\"}]}");
    }
}
