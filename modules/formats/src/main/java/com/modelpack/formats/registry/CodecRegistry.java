package com.modelpack.formats.registry;

import com.modelpack.formats.api.Codec;
import com.modelpack.formats.api.CodecType;
import com.modelpack.formats.codecs.RawCodec;
import com.modelpack.formats.codecs.TarCodec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.util.List;
import java.util.stream.StreamSupport;

/**
 * Selects the codec for a layer media type.
 * All {@link Codec} beans are discovered via CDI.
 */
@ApplicationScoped
public class CodecRegistry {

    @Inject
    Instance<Codec> codecs;

    private List<Codec> fixed;

    /** Registry over the built-in codecs, for use outside a CDI container. */
    public static CodecRegistry standard() {
        CodecRegistry registry = new CodecRegistry();
        registry.fixed = List.of(new RawCodec(), new TarCodec());
        return registry;
    }

    /**
     * @throws com.modelpack.formats.api.UnsupportedMediaTypeException for unknown suffixes
     */
    public Codec forMediaType(String mediaType) {
        return forType(CodecType.fromMediaType(mediaType));
    }

    public Codec forType(CodecType type) {
        Iterable<Codec> available = fixed != null ? fixed : codecs;
        return StreamSupport.stream(available.spliterator(), false)
                .filter(c -> c.type() == type)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No codec registered for " + type));
    }
}
