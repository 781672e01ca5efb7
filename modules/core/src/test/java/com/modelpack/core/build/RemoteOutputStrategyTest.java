package com.modelpack.core.build;

import com.modelpack.core.remote.InMemoryRemoteRegistry;
import com.modelpack.core.remote.Reference;
import com.modelpack.core.remote.RemoteRegistryException;
import com.modelpack.types.Descriptor;
import com.modelpack.types.Manifest;
import com.modelpack.types.MediaTypes;
import com.modelpack.types.OciJson;
import com.modelpack.util.Digest;
import com.modelpack.util.Hashing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class RemoteOutputStrategyTest {

    private InMemoryRemoteRegistry remote;
    private RemoteOutputStrategy strategy;
    private List<String> events;
    private BuildHooks hooks;

    @BeforeEach
    void setUp() {
        remote = new InMemoryRemoteRegistry(Reference.parse("registry.example.com/team/llama:v1"));
        strategy = new RemoteOutputStrategy(remote, "v1");
        events = new CopyOnWriteArrayList<>();
        hooks = new BuildHooks() {
            @Override
            public InputStream onStart(String name, long size, InputStream stream) {
                events.add("start:" + name);
                return stream;
            }

            @Override
            public void onError(String name, Throwable error) {
                events.add("error:" + name);
            }

            @Override
            public void onComplete(String name, Descriptor descriptor) {
                events.add("complete:" + name);
            }
        };
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldUploadMissingLayer() {
        byte[] content = bytes("weights");
        Digest digest = Hashing.sha256(content);

        Descriptor layer = strategy.outputLayer(MediaTypes.WEIGHT, "model.bin", digest, content.length,
                new ByteArrayInputStream(content), hooks);

        assertThat(layer.filepath()).isEqualTo("model.bin");
        assertThat(remote.blobUploads()).containsExactly(digest);
        assertThat(events).containsExactly("start:model.bin", "complete:model.bin");
    }

    @Test
    void shouldSkipLayerTheRegistryAlreadyHas() {
        byte[] content = bytes("weights");
        remote.seedBlob(content);

        strategy.outputLayer(MediaTypes.WEIGHT, "model.bin", Hashing.sha256(content), content.length,
                new ByteArrayInputStream(content), hooks);

        assertThat(remote.blobUploads()).isEmpty();
        assertThat(events).endsWith("complete:model.bin");
    }

    @Test
    void shouldReportUploadFailureBeforeRethrowing() {
        byte[] content = bytes("weights");
        Digest wrong = Hashing.sha256(bytes("other"));

        assertThatThrownBy(() -> strategy.outputLayer(MediaTypes.WEIGHT, "model.bin", wrong, content.length,
                new ByteArrayInputStream(content), hooks))
                .isInstanceOf(RemoteRegistryException.class);
        assertThat(events).containsExactly("start:model.bin", "error:model.bin");
    }

    @Test
    void shouldPushManifestByDigestThenTag() {
        byte[] config = bytes("{}");
        Manifest manifest = Manifest.forModel(
                new Descriptor(MediaTypes.MODEL_CONFIG, Hashing.sha256(config), config.length), List.of(), Map.of());
        byte[] manifestBytes = OciJson.toBytes(manifest);
        Digest digest = Hashing.sha256(manifestBytes);

        Descriptor pushed = strategy.outputManifest(MediaTypes.OCI_MANIFEST, digest, manifestBytes.length,
                new ByteArrayInputStream(manifestBytes), hooks);

        assertThat(pushed.parsedDigest()).isEqualTo(digest);
        assertThat(remote.manifestUploads()).containsExactly(digest.toString(), "v1");
        assertThat(remote.pullManifest("v1")).hasValueSatisfying(m -> assertThat(m.digest()).isEqualTo(digest));
    }

    @Test
    void shouldOnlyRetagExistingManifest() {
        byte[] manifestBytes = OciJson.toBytes(Manifest.forModel(
                new Descriptor(MediaTypes.MODEL_CONFIG, Hashing.sha256(bytes("{}")), 2), List.of(), Map.of()));
        Digest digest = Hashing.sha256(manifestBytes);
        remote.pushManifest(manifestBytes, digest.toString());

        strategy.outputManifest(MediaTypes.OCI_MANIFEST, digest, manifestBytes.length,
                new ByteArrayInputStream(manifestBytes), hooks);

        assertThat(remote.manifestUploads()).containsExactly(digest.toString(), "v1");
    }
}
