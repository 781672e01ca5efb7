package com.modelpack.core.build;

import com.modelpack.core.build.interceptor.ChunkChecksumInterceptor;
import com.modelpack.core.cache.CacheItem;
import com.modelpack.core.cache.DigestCache;
import com.modelpack.core.cache.FileDigestCache;
import com.modelpack.core.storage.ManifestContent;
import com.modelpack.core.storage.OciLayoutContentStore;
import com.modelpack.formats.registry.CodecRegistry;
import com.modelpack.types.Annotations;
import com.modelpack.types.Descriptor;
import com.modelpack.types.FileMetadata;
import com.modelpack.types.Manifest;
import com.modelpack.types.MediaTypes;
import com.modelpack.types.ModelConfig;
import com.modelpack.types.ModelMetadata;
import com.modelpack.types.OciJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class BuilderTest {

    private static final String REPO = "localhost/llama";
    private static final Instant MTIME = Instant.parse("2024-05-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-02T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path workDir;

    @TempDir
    Path storeRoot;

    @TempDir
    Path cacheRoot;

    private OciLayoutContentStore store;
    private FileDigestCache cache;

    @BeforeEach
    void setUp() {
        store = OciLayoutContentStore.at(storeRoot);
        cache = FileDigestCache.at(cacheRoot, Duration.ofHours(24), Duration.ofSeconds(5), CLOCK);
    }

    private Builder builder(DigestCache digestCache, OutputStrategy strategy) {
        return new Builder(CodecRegistry.standard(), digestCache, strategy, null, CLOCK);
    }

    private Builder localBuilder() {
        return builder(cache, new LocalOutputStrategy(store, REPO, "v1"));
    }

    private Path writeFile(String relative, String content) throws IOException {
        Path file = workDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(MTIME));
        return file;
    }

    @Test
    void shouldBuildLayerWithFilepathAndMetadata() throws IOException {
        Path file = writeFile("weights/model.bin", "weights");

        Descriptor layer = localBuilder().buildLayer(MediaTypes.WEIGHT, workDir, file, null, BuildHooks.NONE);

        assertThat(layer.mediaType()).isEqualTo(MediaTypes.WEIGHT);
        assertThat(layer.filepath()).isEqualTo("weights/model.bin");
        FileMetadata metadata = FileMetadata.fromJson(layer.annotations().get(Annotations.FILE_METADATA));
        assertThat(metadata.name()).isEqualTo("model.bin");
        assertThat(metadata.size()).isEqualTo(7);
        assertThat(metadata.modTime()).isEqualTo(MTIME);
        assertThat(store.statBlob(REPO, layer.parsedDigest()).await().indefinitely())
                .hasValueSatisfying(b -> assertThat(b.size()).isEqualTo(layer.size()));
    }

    @Test
    void shouldProduceIdenticalDigestsForUnchangedFile() throws IOException {
        Path file = writeFile("config.json", "{\"hidden\":4096}");

        Descriptor first = builder(null, new LocalOutputStrategy(store, REPO, "v1"))
                .buildLayer(MediaTypes.WEIGHT_CONFIG, workDir, file, null, BuildHooks.NONE);
        Descriptor second = builder(null, new LocalOutputStrategy(store, REPO, "v1"))
                .buildLayer(MediaTypes.WEIGHT_CONFIG, workDir, file, null, BuildHooks.NONE);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldStoreRawLayerVerbatim() throws IOException {
        Path file = writeFile("model.bin", "raw weights");

        Descriptor layer = localBuilder().buildLayer(MediaTypes.WEIGHT_RAW, workDir, file, null, BuildHooks.NONE);

        assertThat(layer.size()).isEqualTo(11);
        try (InputStream in = store.pullBlob(REPO, layer.parsedDigest()).await().indefinitely()) {
            assertThat(new String(in.readAllBytes())).isEqualTo("raw weights");
        }
    }

    @Test
    void shouldRecordRawWeightDigestInCache() throws IOException {
        Path file = writeFile("model.bin", "weights");

        Descriptor layer = localBuilder().buildLayer(MediaTypes.WEIGHT_RAW, workDir, file, null, BuildHooks.NONE);

        assertThat(cache.get(file)).hasValueSatisfying(item -> {
            assertThat(item.digest()).isEqualTo(layer.digest());
            assertThat(item.mediaType()).isEqualTo(MediaTypes.WEIGHT_RAW);
            assertThat(item.modTime()).isEqualTo(MTIME);
            assertThat(item.createdAt()).isEqualTo(CLOCK.instant());
        });
    }

    @Test
    void shouldReuseCachedDigestForUnchangedRawWeight() throws IOException {
        Path file = writeFile("model.bin", "weights-A");
        Descriptor first = localBuilder().buildLayer(MediaTypes.WEIGHT_RAW, workDir, file, null, BuildHooks.NONE);

        // same size and mtime: only a cache hit can still report the first digest
        writeFile("model.bin", "weights-B");
        Descriptor second = localBuilder().buildLayer(MediaTypes.WEIGHT_RAW, workDir, file, null, BuildHooks.NONE);

        assertThat(second.digest()).isEqualTo(first.digest());
    }

    @Test
    void shouldRehashWhenRawWeightChanged() throws IOException {
        Path file = writeFile("model.bin", "weights-A");
        Descriptor first = localBuilder().buildLayer(MediaTypes.WEIGHT_RAW, workDir, file, null, BuildHooks.NONE);

        Files.writeString(file, "weights-B");
        Files.setLastModifiedTime(file, FileTime.from(MTIME.plusSeconds(60)));
        Descriptor second = localBuilder().buildLayer(MediaTypes.WEIGHT_RAW, workDir, file, null, BuildHooks.NONE);

        assertThat(second.digest()).isNotEqualTo(first.digest());
    }

    @Test
    void shouldNotCacheTarLayers() throws IOException {
        Path code = writeFile("train.py", "print('hi')");
        Path weights = writeFile("model.bin", "weights");

        localBuilder().buildLayer(MediaTypes.CODE, workDir, code, null, BuildHooks.NONE);
        localBuilder().buildLayer(MediaTypes.WEIGHT, workDir, weights, null, BuildHooks.NONE);

        assertThat(cache.get(code)).isEmpty();
        assertThat(cache.get(weights)).isEmpty();
    }

    @Test
    void shouldRehashTarWeightAfterModeChange(@TempDir Path otherStore) throws IOException {
        Path file = writeFile("model.bin", "weights");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r--r--"));
        Descriptor first = localBuilder().buildLayer(MediaTypes.WEIGHT, workDir, file, null, BuildHooks.NONE);

        // chmod leaves size and mtime alone
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwx------"));
        Descriptor second = builder(cache, new LocalOutputStrategy(OciLayoutContentStore.at(otherStore), REPO, "v1"))
                .buildLayer(MediaTypes.WEIGHT, workDir, file, null, BuildHooks.NONE);

        assertThat(second.digest()).isNotEqualTo(first.digest());
        FileMetadata metadata = FileMetadata.fromJson(second.annotations().get(Annotations.FILE_METADATA));
        assertThat(metadata.mode() & 0777).isEqualTo(0700);
    }

    @Test
    void shouldRehashTarWeightBuiltFromAnotherWorkDir(@TempDir Path otherStore) throws IOException {
        Path file = writeFile("sub/model.bin", "weights");
        Descriptor first = localBuilder().buildLayer(MediaTypes.WEIGHT, workDir, file, null, BuildHooks.NONE);

        Descriptor second = builder(cache, new LocalOutputStrategy(OciLayoutContentStore.at(otherStore), REPO, "v1"))
                .buildLayer(MediaTypes.WEIGHT, workDir.resolve("sub"), file, null, BuildHooks.NONE);

        assertThat(first.filepath()).isEqualTo("sub/model.bin");
        assertThat(second.filepath()).isEqualTo("model.bin");
        assertThat(second.digest()).isNotEqualTo(first.digest());
    }

    @Test
    void shouldCacheEveryRawLayer() throws IOException {
        Path file = writeFile("train.py", "print('hi')");

        localBuilder().buildLayer(MediaTypes.CODE_RAW, workDir, file, null, BuildHooks.NONE);

        assertThat(cache.get(file)).isPresent();
    }

    @Test
    void shouldTreatCacheFailuresAsMiss() throws IOException {
        Path file = writeFile("model.bin", "weights");
        DigestCache broken = new DigestCache() {
            @Override
            public Optional<CacheItem> get(Path path) {
                throw new IllegalStateException("cache unavailable");
            }

            @Override
            public void put(CacheItem item) {
                throw new IllegalStateException("cache unavailable");
            }
        };

        Descriptor layer = builder(broken, new LocalOutputStrategy(store, REPO, "v1"))
                .buildLayer(MediaTypes.WEIGHT, workDir, file, null, BuildHooks.NONE);

        assertThat(store.statBlob(REPO, layer.parsedDigest()).await().indefinitely()).isPresent();
    }

    @Test
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> localBuilder()
                .buildLayer(MediaTypes.WEIGHT, workDir, workDir.resolve("absent.bin"), null, BuildHooks.NONE))
                .isInstanceOf(BuildInputException.class)
                .hasMessageContaining("absent.bin");
    }

    @Test
    void shouldRejectDirectory() throws IOException {
        Path dir = Files.createDirectories(workDir.resolve("shards"));

        assertThatThrownBy(() -> localBuilder().buildLayer(MediaTypes.WEIGHT, workDir, dir, null, BuildHooks.NONE))
                .isInstanceOf(BuildInputException.class)
                .hasMessage(dir + " is a directory and not supported yet");
    }

    @Test
    void shouldRejectFileOutsideWorkDir(@TempDir Path elsewhere) throws IOException {
        Path outside = Files.writeString(elsewhere.resolve("model.bin"), "weights");

        assertThatThrownBy(() -> localBuilder().buildLayer(MediaTypes.WEIGHT, workDir, outside, null, BuildHooks.NONE))
                .isInstanceOf(BuildInputException.class)
                .hasMessageContaining("outside of work directory");
    }

    @Test
    void shouldRecordDestinationPathInsteadOfRelativePath(@TempDir Path elsewhere) throws IOException {
        Path outside = Files.writeString(elsewhere.resolve("model.bin"), "weights");

        Descriptor layer = localBuilder()
                .buildLayer(MediaTypes.WEIGHT, workDir, outside, "weights/model.bin", BuildHooks.NONE);

        assertThat(layer.filepath()).isEqualTo("weights/model.bin");
        assertThat(cache.get(outside)).isEmpty();
    }

    @Test
    void shouldMergeInterceptorAnnotations() throws IOException {
        Path file = writeFile("model.bin", "123456789");
        Builder builder = new Builder(CodecRegistry.standard(), null,
                new LocalOutputStrategy(store, REPO, "v1"), new ChunkChecksumInterceptor(), CLOCK);

        Descriptor layer = builder.buildLayer(MediaTypes.WEIGHT_RAW, workDir, file, null, BuildHooks.NONE);

        assertThat(layer.annotations()).containsKeys(Annotations.FILEPATH, Annotations.FILE_METADATA, Annotations.CHUNK_CRCS);
        assertThat(layer.annotations().get(Annotations.CHUNK_CRCS)).contains("0xe3069283");
        assertThat(store.statBlob(REPO, layer.parsedDigest()).await().indefinitely()).isPresent();
    }

    @Test
    void shouldReportProgressThroughHooks() throws IOException {
        Path file = writeFile("README.md", "# llama");
        List<String> events = new CopyOnWriteArrayList<>();
        BuildHooks hooks = new BuildHooks() {
            @Override
            public InputStream onStart(String name, long size, InputStream stream) {
                events.add("start:" + name + ":" + size);
                return stream;
            }

            @Override
            public void onComplete(String name, Descriptor descriptor) {
                events.add("complete:" + name);
            }
        };

        Descriptor layer = localBuilder().buildLayer(MediaTypes.DOC, workDir, file, null, hooks);

        assertThat(events).containsExactly("start:README.md:" + layer.size(), "complete:README.md");
    }

    @Test
    void shouldBuildConfigAndTaggedManifest() throws IOException {
        Path file = writeFile("model.bin", "weights");
        Builder builder = localBuilder();
        Descriptor layer = builder.buildLayer(MediaTypes.WEIGHT, workDir, file, null, BuildHooks.NONE);
        ModelMetadata metadata = new ModelMetadata("llama", "transformer", "llama3", "safetensors",
                "8b", "bf16", null, null, null, null);

        Descriptor config = builder.buildConfig(metadata, List.of(layer), BuildHooks.NONE);
        Descriptor manifest = builder.buildManifest(List.of(layer), config, Map.of(), BuildHooks.NONE);

        assertThat(config.mediaType()).isEqualTo(MediaTypes.MODEL_CONFIG);
        ManifestContent stored = store.pullManifest(REPO, "v1").await().indefinitely();
        assertThat(stored.descriptor().digest()).isEqualTo(manifest.digest());
        Manifest parsed = stored.parse();
        assertThat(parsed.artifactType()).isEqualTo(MediaTypes.MODEL_ARTIFACT);
        assertThat(parsed.config()).isEqualTo(config);
        assertThat(parsed.layers()).containsExactly(layer);

        try (InputStream in = store.pullBlob(REPO, config.parsedDigest()).await().indefinitely()) {
            ModelConfig document = OciJson.fromBytes(in.readAllBytes(), ModelConfig.class);
            assertThat(document.descriptor().name()).isEqualTo("llama");
            assertThat(document.descriptor().createdAt()).isNull();
            assertThat(document.config().paramSize()).isEqualTo("8b");
            assertThat(document.modelfs().diffIds()).containsExactly(layer.digest());
        }
    }

    @Test
    void shouldProduceSameManifestDigestForSameInputs() throws IOException {
        Path file = writeFile("model.bin", "weights");

        Descriptor first = buildAll(file, "localhost/a");
        Descriptor second = buildAll(file, "localhost/b");

        assertThat(second.digest()).isEqualTo(first.digest());
    }

    private Descriptor buildAll(Path file, String repository) {
        Builder builder = builder(null, new LocalOutputStrategy(store, repository, "v1"));
        Descriptor layer = builder.buildLayer(MediaTypes.WEIGHT, workDir, file, null, BuildHooks.NONE);
        Descriptor config = builder.buildConfig(ModelMetadata.empty(), List.of(layer), BuildHooks.NONE);
        return builder.buildManifest(List.of(layer), config, Map.of(), BuildHooks.NONE);
    }
}
