package com.modelpack.core.remote;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.tools.jib.image.json.ManifestTemplate;
import com.modelpack.types.Manifest;
import com.modelpack.types.MediaTypes;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Jib manifest template that carries a model manifest as an untyped JSON tree.
 *
 * <p>Jib's own OCI template drops {@code artifactType} and descriptor annotations, so the
 * tree is passed through untouched. Compact manifests written by this tool serialize back
 * to the same bytes and therefore keep their digest.
 */
public class ArtifactManifestTemplate implements ManifestTemplate {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonNode node;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ArtifactManifestTemplate(JsonNode node) {
        this.node = node;
    }

    public static ArtifactManifestTemplate of(byte[] manifest) {
        try {
            return new ArtifactManifestTemplate(MAPPER.readTree(manifest));
        } catch (IOException e) {
            throw new UncheckedIOException("Manifest is not JSON", e);
        }
    }

    @JsonValue
    public JsonNode node() {
        return node;
    }

    @Override
    public int getSchemaVersion() {
        return node.path("schemaVersion").asInt(Manifest.SCHEMA_VERSION);
    }

    @Override
    public String getManifestMediaType() {
        return node.path("mediaType").asText(MediaTypes.OCI_MANIFEST);
    }

    public byte[] toBytes() {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize manifest", e);
        }
    }
}
