package com.modelpack.core.artifact;

import com.modelpack.core.build.BuildInputException;
import com.modelpack.core.build.Builder;
import com.modelpack.core.build.LocalOutputStrategy;
import com.modelpack.core.build.OutputStrategy;
import com.modelpack.core.build.RemoteOutputStrategy;
import com.modelpack.core.build.interceptor.ChunkChecksumInterceptor;
import com.modelpack.core.cache.DigestCache;
import com.modelpack.core.process.ProcessOptions;
import com.modelpack.core.process.Processor;
import com.modelpack.core.process.RetryPolicy;
import com.modelpack.core.process.RunContext;
import com.modelpack.core.remote.InvalidReferenceException;
import com.modelpack.core.remote.Reference;
import com.modelpack.core.remote.RemoteRegistryFactory;
import com.modelpack.core.remote.RemoteManifest;
import com.modelpack.core.remote.RemoteRegistry;
import com.modelpack.core.storage.ManifestContent;
import com.modelpack.core.storage.ManifestFormatException;
import com.modelpack.core.storage.ManifestNotFoundException;
import com.modelpack.formats.api.Codec;
import com.modelpack.types.Manifest;
import com.modelpack.types.ModelConfig;
import com.modelpack.types.OciJson;
import com.modelpack.core.storage.ContentStore;
import com.modelpack.formats.registry.CodecRegistry;
import com.modelpack.types.Annotations;
import com.modelpack.types.ArtifactCategory;
import com.modelpack.types.BuildSpec;
import com.modelpack.types.Descriptor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Packages a work directory into a model artifact.
 *
 * <p>Categories are processed in declaration order (config, weight, code, doc, dataset), so
 * manifest layers are grouped by category and sorted by path inside each group. The
 * manifest is written last; a failed build never moves the tag.
 */
@ApplicationScoped
public class BuildService {

    private static final Logger log = Logger.getLogger(BuildService.class);

    @Inject
    CodecRegistry codecs;

    @Inject
    DigestCache cache;

    @Inject
    ContentStore store;

    @Inject
    RemoteRegistryFactory remotes;

    @Inject
    RetryPolicy retry;

    @ConfigProperty(name = "modelpack.build.concurrency", defaultValue = "1")
    int defaultConcurrency;

    Clock clock = Clock.systemUTC();

    private static final Comparator<Descriptor> LAYER_ORDER = Comparator
            .comparingInt((Descriptor l) -> categoryRank(l.mediaType()))
            .thenComparing(l -> l.filepath() == null ? "" : l.filepath());

    private static int categoryRank(String mediaType) {
        ArtifactCategory category = ArtifactCategory.ofMediaType(mediaType);
        return category == null ? Integer.MAX_VALUE : category.ordinal();
    }

    /** Service outside a CDI container. */
    public static BuildService create(CodecRegistry codecs, DigestCache cache, ContentStore store,
                                      RemoteRegistryFactory remotes, RetryPolicy retry, Clock clock) {
        BuildService service = new BuildService();
        service.codecs = codecs;
        service.cache = cache;
        service.store = store;
        service.remotes = remotes;
        service.retry = retry;
        service.defaultConcurrency = 1;
        service.clock = clock;
        return service;
    }

    public BuildResult build(BuildSpec spec, Path workDir, String target, BuildOptions options) {
        Reference reference = Reference.parse(target);
        if (reference.tag().isEmpty()) {
            throw new InvalidReferenceException("Build target must carry a tag: " + target);
        }
        if (!Files.isDirectory(workDir)) {
            throw new BuildInputException("Work directory " + workDir + " does not exist");
        }
        String tag = reference.tag().get();

        OutputStrategy strategy = options.output() == BuildOptions.Output.REMOTE
                ? new RemoteOutputStrategy(remotes.open(reference, RemoteRegistryFactory.Access.PUSH), tag)
                : new LocalOutputStrategy(store, reference.repository(), tag);
        Builder builder = new Builder(codecs, cache, strategy,
                options.interceptor() ? new ChunkChecksumInterceptor() : null, clock);

        int concurrency = options.concurrency() > 0 ? options.concurrency() : defaultConcurrency;
        ProcessOptions processOptions = new ProcessOptions(concurrency, options.hooks());
        RunContext ctx = new RunContext();

        log.infof("Building %s from %s (%s output)", reference, workDir, options.output());
        List<Descriptor> layers = new ArrayList<>();
        for (ArtifactCategory category : ArtifactCategory.values()) {
            Processor processor = new Processor(category, options.raw(), retry);
            layers.addAll(processor.process(builder, workDir, spec.patterns(category), processOptions, ctx));
        }

        Descriptor config = retry.run("config", ctx,
                () -> builder.buildConfig(spec, layers, options.hooks()));

        Map<String, String> annotations = new TreeMap<>();
        if (spec.metadata().createdAt() != null) {
            annotations.put(Annotations.CREATED, spec.metadata().createdAt().toString());
        }
        Descriptor manifest = retry.run("manifest", ctx,
                () -> builder.buildManifest(layers, config, annotations, options.hooks()));

        log.infof("Built %s as %s with %d layers", reference, manifest.digest(), layers.size());
        return new BuildResult(reference, manifest, config, layers);
    }

    /**
     * Adds {@code file} to the model {@code source} as one more {@code category} layer and
     * writes the result as {@code target}. A layer already recorded under the same path is
     * replaced only with {@link AttachOptions#force()}. With {@link AttachOptions#config()} the
     * file is a model config document that replaces the current one and the layers stay as
     * they are.
     *
     * <p>The source is read from the store the output goes to: the local store, or the target's
     * registry for remote output. Layers keep the build order: by category, then by path.
     *
     * @throws BuildInputException if the path is taken and {@code force} is not set
     */
    public BuildResult attach(String source, String target, ArtifactCategory category, Path workDir, Path file,
                              AttachOptions options) {
        Reference from = Reference.parse(source);
        Reference to = Reference.parse(target);
        if (to.tag().isEmpty()) {
            throw new InvalidReferenceException("Attach target must carry a tag: " + target);
        }
        BuildOptions build = options.build();
        boolean remoteOutput = build.output() == BuildOptions.Output.REMOTE;
        if (remoteOutput && !from.repository().equals(to.repository())) {
            throw new InvalidReferenceException("Remote attach cannot change repository: " + source + " -> " + target);
        }

        RemoteRegistry remote = remoteOutput ? remotes.open(to, RemoteRegistryFactory.Access.PUSH) : null;
        OutputStrategy strategy = remoteOutput
                ? new RemoteOutputStrategy(remote, to.tag().get())
                : new LocalOutputStrategy(store, to.repository(), to.tag().get());
        Builder builder = new Builder(codecs, cache, strategy,
                build.interceptor() ? new ChunkChecksumInterceptor() : null, clock);
        RunContext ctx = new RunContext();

        ManifestContent content = remoteOutput ? remoteManifest(remote, from) : localManifest(from);
        Manifest manifest = content.parse();
        ModelConfig sourceConfig = readConfig(remote, from, manifest.config());
        log.infof("Attaching %s to %s as %s", file, from, to);

        List<Descriptor> layers = new ArrayList<>(manifest.layers());
        ModelConfig document;
        if (options.config()) {
            document = parseConfig(file);
        } else {
            String destPath = options.destinationDir() == null ? null
                    : trimSlashes(options.destinationDir()) + "/" + file.getFileName();
            String layerPath = destPath != null ? destPath : Codec.layerPath(workDir, file);
            Descriptor existing = layers.stream()
                    .filter(l -> layerPath.equals(l.filepath()))
                    .findFirst().orElse(null);
            if (existing != null) {
                if (!options.force()) {
                    throw new BuildInputException("File " + layerPath + " already exists in " + from
                            + ", use force to overwrite it");
                }
                layers.remove(existing);
                log.debugf("Replacing layer %s (%s)", layerPath, existing.digest());
            }

            String mediaType = category.mediaType(build.raw());
            Descriptor added = retry.run(layerPath, ctx,
                    () -> builder.buildLayer(mediaType, workDir, file, destPath, build.hooks()));
            layers.add(added);
            layers.sort(LAYER_ORDER);

            List<String> diffIds = layers.stream().map(Descriptor::digest).toList();
            if (diffIds.equals(sourceConfig.diffIds()) && from.equals(to)) {
                log.infof("%s already holds %s, nothing to attach", from, layerPath);
                return new BuildResult(to, content.descriptor(), manifest.config(), layers);
            }
            document = ModelConfig.of(sourceConfig.metadata(), layers);
        }

        if (!remoteOutput && !from.repository().equals(to.repository())) {
            for (Descriptor layer : layers) {
                if (store.statBlob(to.repository(), layer.parsedDigest()).await().indefinitely().isEmpty()) {
                    store.mountBlob(from.repository(), to.repository(), layer).await().indefinitely();
                }
            }
        }

        ModelConfig configDocument = document;
        Descriptor config = retry.run("config", ctx, () -> builder.buildConfig(configDocument, build.hooks()));
        Descriptor result = retry.run("manifest", ctx,
                () -> builder.buildManifest(layers, config, manifest.annotations(), build.hooks()));
        log.infof("Attached %s to %s as %s", file.getFileName(), to, result.digest());
        return new BuildResult(to, result, config, layers);
    }

    private ManifestContent localManifest(Reference reference) {
        return store.pullManifest(reference.repository(), reference.reference()).await().indefinitely();
    }

    private ManifestContent remoteManifest(RemoteRegistry remote, Reference reference) {
        RemoteManifest pulled = remote.pullManifest(reference.reference())
                .orElseThrow(() -> new ManifestNotFoundException(reference.repository(), reference.reference()));
        return new ManifestContent(new Descriptor(pulled.mediaType(), pulled.digest(), pulled.bytes().length),
                pulled.bytes());
    }

    private ModelConfig readConfig(RemoteRegistry remote, Reference reference, Descriptor config) {
        if (config == null) {
            throw new ManifestFormatException("Manifest of " + reference + " has no config", null);
        }
        try {
            byte[] bytes;
            if (remote != null) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                remote.pullBlob(config, out);
                bytes = out.toByteArray();
            } else {
                try (InputStream in = store.pullBlob(reference.repository(), config.parsedDigest()).await().indefinitely()) {
                    bytes = in.readAllBytes();
                }
            }
            return OciJson.fromBytes(bytes, ModelConfig.class);
        } catch (IOException e) {
            throw new ManifestFormatException("Failed to read model config " + config.digest(), e);
        }
    }

    private static ModelConfig parseConfig(Path file) {
        try {
            return OciJson.fromBytes(Files.readAllBytes(file), ModelConfig.class);
        } catch (NoSuchFileException e) {
            throw new BuildInputException("File not found: " + file);
        } catch (IOException e) {
            throw new BuildInputException("Failed to read model config " + file + ": " + e.getMessage());
        }
    }

    private static String trimSlashes(String dir) {
        String trimmed = dir.replace('\\', '/');
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
