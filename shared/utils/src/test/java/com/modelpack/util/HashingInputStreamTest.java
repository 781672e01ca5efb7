package com.modelpack.util;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class HashingInputStreamTest {

    @Test
    void shouldMatchDirectHashAfterEof() throws IOException {
        byte[] data = "hello model layers".repeat(5000).getBytes(StandardCharsets.UTF_8);

        try (HashingInputStream in = new HashingInputStream(new ByteArrayInputStream(data))) {
            in.transferTo(OutputStream.nullOutputStream());

            assertThat(in.count()).isEqualTo(data.length);
            assertThat(in.result().digest()).isEqualTo(Hashing.sha256(data));
        }
    }

    @Test
    void shouldCountSingleByteReads() throws IOException {
        try (HashingInputStream in = new HashingInputStream(new ByteArrayInputStream(new byte[]{1, 2, 3}))) {
            while (in.read() != -1) {
                // drain
            }
            assertThat(in.result().size()).isEqualTo(3);
        }
    }

    @Test
    void shouldRefuseSkip() {
        HashingInputStream in = new HashingInputStream(new ByteArrayInputStream(new byte[8]));
        assertThatThrownBy(() -> in.skip(4)).isInstanceOf(UnsupportedOperationException.class);
    }
}
