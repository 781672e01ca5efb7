package com.modelpack.core.artifact;

import com.modelpack.core.gc.GcReport;
import com.modelpack.core.process.RunContext;
import com.modelpack.core.remote.InvalidReferenceException;
import com.modelpack.core.remote.Reference;
import com.modelpack.core.storage.ContentStore;
import com.modelpack.core.storage.DigestMismatchException;
import com.modelpack.core.storage.ManifestContent;
import com.modelpack.core.storage.ManifestFormatException;
import com.modelpack.formats.api.Codec;
import com.modelpack.formats.registry.CodecRegistry;
import com.modelpack.types.Annotations;
import com.modelpack.types.Descriptor;
import com.modelpack.types.Index;
import com.modelpack.types.Manifest;
import com.modelpack.types.ModelConfig;
import com.modelpack.types.OciJson;
import com.modelpack.util.Digest;
import com.modelpack.util.HashingInputStream;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lifecycle operations on models in the local content store.
 */
@ApplicationScoped
public class ArtifactService {

    private static final Logger log = Logger.getLogger(ArtifactService.class);

    private static final Comparator<ModelArtifact> NEWEST_FIRST =
            Comparator.comparing(ModelArtifact::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(ModelArtifact::repository)
                    .thenComparing(ModelArtifact::tag);

    @Inject
    ContentStore store;

    @Inject
    CodecRegistry codecs;

    /** Service outside a CDI container. */
    public static ArtifactService create(ContentStore store, CodecRegistry codecs) {
        ArtifactService service = new ArtifactService();
        service.store = store;
        service.codecs = codecs;
        return service;
    }

    /** Every tag of every repository, newest first. Unreadable entries are skipped. */
    public List<ModelArtifact> list() {
        List<ModelArtifact> artifacts = new ArrayList<>();
        List<String> repositories = store.listRepositories().collect().asList().await().indefinitely();
        for (String repository : repositories) {
            Index index = store.getIndex(repository).await().indefinitely();
            for (Descriptor entry : index.manifests()) {
                String tag = entry.annotations().get(Annotations.REF_NAME);
                if (tag == null) continue;
                try {
                    ManifestContent content = store.pullManifest(repository, entry.digest()).await().indefinitely();
                    Manifest manifest = content.parse();
                    artifacts.add(new ModelArtifact(repository, tag, entry.digest(),
                            content.bytes().length + manifest.contentSize(), createdAt(repository, manifest)));
                } catch (RuntimeException e) {
                    log.warnf("Skipping %s:%s: %s", repository, tag, e.getMessage());
                }
            }
        }
        artifacts.sort(NEWEST_FIRST);
        return artifacts;
    }

    public InspectedModelArtifact inspect(String target) {
        Reference reference = Reference.parse(target);
        ManifestContent content = store.pullManifest(reference.repository(), reference.reference())
                .await().indefinitely();
        Manifest manifest = content.parse();
        ModelConfig config = readConfig(reference.repository(), manifest);

        List<InspectedModelArtifact.Layer> layers = manifest.layers().stream()
                .map(l -> new InspectedModelArtifact.Layer(l.mediaType(), l.digest(), l.size(), l.filepath()))
                .toList();
        ModelConfig.ModelDescriptor descriptor = config.descriptor();
        ModelConfig.Properties properties = config.config();
        return new InspectedModelArtifact(
                manifest.config().digest(),
                content.descriptor().digest(),
                properties == null ? null : properties.architecture(),
                descriptor == null ? null : descriptor.createdAt(),
                descriptor == null ? null : descriptor.family(),
                properties == null ? null : properties.format(),
                descriptor == null ? null : descriptor.name(),
                properties == null ? null : properties.paramSize(),
                properties == null ? null : properties.precision(),
                properties == null ? null : properties.quantization(),
                layers);
    }

    /** Untags a tag reference, or deletes the manifest of a digest reference with all its tags. */
    public void remove(String target) {
        Reference reference = Reference.parse(target);
        store.deleteManifest(reference.repository(), reference.reference()).await().indefinitely();
    }

    /**
     * Makes {@code source}'s manifest available as {@code target}, mounting its blobs into the
     * target repository first.
     */
    public Descriptor tag(String source, String target) {
        Reference from = Reference.parse(source);
        Reference to = Reference.parse(target);
        if (to.tag().isEmpty()) {
            throw new InvalidReferenceException("Tag target must carry a tag: " + target);
        }

        ManifestContent content = store.pullManifest(from.repository(), from.reference()).await().indefinitely();
        Manifest manifest = content.parse();
        if (!from.repository().equals(to.repository())) {
            store.mountBlob(from.repository(), to.repository(), manifest.config()).await().indefinitely();
            for (Descriptor layer : manifest.layers()) {
                store.mountBlob(from.repository(), to.repository(), layer).await().indefinitely();
            }
        }
        Descriptor tagged = store.pushManifest(to.repository(), to.tag().get(), content.bytes()).await().indefinitely();
        log.infof("Tagged %s as %s", from, to);
        return tagged;
    }

    /**
     * Restores every layer of {@code target} under {@code outputDir}. Layers are decoded with
     * bounded concurrency; the first failure stops the rest and is rethrown.
     */
    public void extract(String target, Path outputDir, int concurrency) {
        Reference reference = Reference.parse(target);
        String repository = reference.repository();
        Manifest manifest = store.pullManifest(repository, reference.reference()).await().indefinitely().parse();
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + outputDir, e);
        }

        LayerPool.forEach("extract", manifest.layers(), concurrency, new RunContext(),
                layer -> extractLayer(repository, layer, outputDir));
        log.infof("Extracted %d layers of %s to %s", manifest.layers().size(), target, outputDir);
    }

    private void extractLayer(String repository, Descriptor layer, Path outputDir) {
        try (InputStream blob = store.pullBlob(repository, layer.parsedDigest()).await().indefinitely()) {
            decodeVerified(codecs, blob, layer, outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to extract layer " + layer.digest(), e);
        }
    }

    /**
     * Decodes {@code blob} as {@code layer} into {@code outputDir}, reading it to the end.
     *
     * @throws DigestMismatchException if the bytes read do not hash to the layer digest
     */
    static void decodeVerified(CodecRegistry codecs, InputStream blob, Descriptor layer, Path outputDir)
            throws IOException {
        Codec codec = codecs.forMediaType(layer.mediaType());
        try (HashingInputStream hashing = new HashingInputStream(blob)) {
            codec.decode(hashing, outputDir, layer.filepath(), layer);
            hashing.transferTo(OutputStream.nullOutputStream());
            Digest actual = hashing.result().digest();
            if (!actual.equals(layer.parsedDigest())) {
                throw new DigestMismatchException("layer " + layer.filepath(), layer.parsedDigest(), actual);
            }
        }
    }

    public GcReport prune() {
        return store.performGc().await().indefinitely();
    }

    private ModelConfig readConfig(String repository, Manifest manifest) {
        Descriptor config = manifest.config();
        if (config == null) {
            throw new ManifestFormatException("Manifest in " + repository + " has no config", null);
        }
        try (InputStream in = store.pullBlob(repository, config.parsedDigest()).await().indefinitely()) {
            return OciJson.fromBytes(in.readAllBytes(), ModelConfig.class);
        } catch (IOException e) {
            throw new ManifestFormatException("Failed to read model config " + config.digest(), e);
        }
    }

    private Instant createdAt(String repository, Manifest manifest) {
        String created = manifest.annotations().get(Annotations.CREATED);
        if (created != null) {
            return Instant.parse(created);
        }
        ModelConfig config = readConfig(repository, manifest);
        return config.descriptor() == null ? null : config.descriptor().createdAt();
    }
}
