package com.modelpack.formats.registry;

import com.modelpack.formats.api.CodecType;
import com.modelpack.formats.api.UnsupportedMediaTypeException;
import com.modelpack.types.MediaTypes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CodecRegistryTest {

    private final CodecRegistry registry = CodecRegistry.standard();

    @Test
    void shouldSelectBySuffix() {
        assertThat(registry.forMediaType(MediaTypes.WEIGHT).type()).isEqualTo(CodecType.TAR);
        assertThat(registry.forMediaType(MediaTypes.WEIGHT_RAW).type()).isEqualTo(CodecType.RAW);
        assertThat(registry.forMediaType(MediaTypes.DOC).type()).isEqualTo(CodecType.TAR);
    }

    @Test
    void shouldRejectUnknownSuffix() {
        assertThatThrownBy(() -> registry.forMediaType("application/vnd.cnai.model.weight.v1.tar+gzip"))
                .isInstanceOf(UnsupportedMediaTypeException.class)
                .hasMessageContaining("tar+gzip");
    }
}
