package com.modelpack.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * The config blob of a model artifact ({@link MediaTypes#MODEL_CONFIG}).
 */
@JsonPropertyOrder({"descriptor", "modelfs", "config"})
public record ModelConfig(
        ModelDescriptor descriptor,
        ModelFs modelfs,
        Properties config
) {

    /** Provenance of the model. */
    @JsonPropertyOrder({"createdAt", "family", "name", "sourceURL", "revision"})
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ModelDescriptor(
            Instant createdAt,
            String family,
            String name,
            @JsonProperty("sourceURL") String sourceUrl,
            String revision
    ) {}

    /** Layer digests in manifest order. */
    @JsonPropertyOrder({"type", "diffIds"})
    public record ModelFs(String type, List<String> diffIds) {
        public static final String LAYERS = "layers";

        public ModelFs {
            diffIds = diffIds == null ? List.of() : List.copyOf(diffIds);
        }
    }

    @JsonPropertyOrder({"architecture", "format", "paramSize", "precision", "quantization"})
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Properties(
            String architecture,
            String format,
            String paramSize,
            String precision,
            String quantization
    ) {}

    public static ModelConfig of(ModelMetadata metadata, List<Descriptor> layers) {
        return new ModelConfig(
                new ModelDescriptor(metadata.createdAt(), metadata.family(), metadata.name(),
                        metadata.sourceUrl(), metadata.revision()),
                new ModelFs(ModelFs.LAYERS, layers.stream().map(Descriptor::digest).toList()),
                new Properties(metadata.architecture(), metadata.format(), metadata.paramSize(),
                        metadata.precision(), metadata.quantization()));
    }

    /** Model facts carried by this document, for rebuilding it over another layer list. */
    public ModelMetadata metadata() {
        ModelDescriptor d = descriptor != null ? descriptor : new ModelDescriptor(null, null, null, null, null);
        Properties p = config != null ? config : new Properties(null, null, null, null, null);
        return new ModelMetadata(d.name(), p.architecture(), d.family(), p.format(), p.paramSize(),
                p.precision(), p.quantization(), d.sourceUrl(), d.revision(), d.createdAt());
    }

    /** Digests of the model layers, in manifest order. */
    public List<String> diffIds() {
        return modelfs == null ? List.of() : modelfs.diffIds();
    }
}
