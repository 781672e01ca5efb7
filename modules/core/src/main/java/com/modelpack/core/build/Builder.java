package com.modelpack.core.build;

import com.modelpack.core.build.interceptor.Interceptor;
import com.modelpack.core.cache.CacheItem;
import com.modelpack.core.cache.DigestCache;
import com.modelpack.formats.api.Codec;
import com.modelpack.formats.fs.FileMetadataReader;
import com.modelpack.formats.registry.CodecRegistry;
import com.modelpack.types.Annotations;
import com.modelpack.types.BuildSpec;
import com.modelpack.types.Descriptor;
import com.modelpack.types.FileMetadata;
import com.modelpack.types.Manifest;
import com.modelpack.types.MediaTypes;
import com.modelpack.types.ModelConfig;
import com.modelpack.types.ModelMetadata;
import com.modelpack.types.OciJson;
import com.modelpack.util.Digest;
import com.modelpack.util.Hashing;
import com.modelpack.util.stream.StreamTee;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * Turns files into layer descriptors, and layers into config and manifest blobs.
 *
 * <p>A layer is encoded twice: once to learn its digest and size (skipped on a digest cache
 * hit), and once more to stream it to the {@link OutputStrategy}. Nothing is held in memory.
 * One builder serves one run; it is safe to call {@link #buildLayer} from several threads.
 */
public class Builder {

    private static final Logger log = Logger.getLogger(Builder.class);

    private final CodecRegistry codecs;
    private final DigestCache cache;
    private final OutputStrategy strategy;
    private final Interceptor interceptor;
    private final Clock clock;

    /**
     * @param cache       digest cache, or {@code null} to always hash
     * @param interceptor side-channel consumer, or {@code null}
     */
    public Builder(CodecRegistry codecs, DigestCache cache, OutputStrategy strategy, Interceptor interceptor, Clock clock) {
        this.codecs = codecs;
        this.cache = cache;
        this.strategy = strategy;
        this.interceptor = interceptor;
        this.clock = clock;
    }

    /**
     * Builds one layer.
     *
     * @param destPath layer path to record instead of the path relative to {@code workDir},
     *                 or {@code null}
     * @throws BuildInputException for missing files, directories and files outside
     *                             {@code workDir}
     */
    public Descriptor buildLayer(String mediaType, Path workDir, Path path, String destPath, BuildHooks hooks) {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            throw new BuildInputException("File not found: " + path);
        }
        if (Files.isDirectory(path)) {
            throw new BuildInputException(path + " is a directory and not supported yet");
        }
        if (!Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
            throw new BuildInputException(path + " is not a regular file");
        }

        String relPath = Codec.layerPath(workDir, path);
        if (destPath == null && (relPath.equals("..") || relPath.startsWith("../"))) {
            throw new BuildInputException(path + " is outside of work directory " + workDir);
        }
        String layerPath = destPath != null ? destPath : relPath;
        Codec codec = codecs.forMediaType(mediaType);

        try {
            FileMetadata metadata = FileMetadataReader.read(path);
            // tar bytes also carry the layer path and file mode, which the cache key does not
            boolean cacheable = cache != null && MediaTypes.isRaw(mediaType);

            Hashing.Result hashed = cacheable ? cached(path, mediaType, metadata).orElse(null) : null;
            if (hashed == null) {
                log.debugf("Hashing %s", layerPath);
                try (InputStream encoded = codec.encode(path, layerPath)) {
                    hashed = Hashing.sha256(encoded);
                }
                if (cacheable) {
                    record(path, mediaType, metadata, hashed);
                }
            } else {
                log.infof("Reusing cached digest %s for %s", hashed.digest(), layerPath);
            }

            Map<String, String> extra = new HashMap<>();
            Descriptor descriptor;
            if (interceptor == null) {
                try (InputStream encoded = codec.encode(path, layerPath)) {
                    descriptor = strategy.outputLayer(mediaType, layerPath, hashed.digest(), hashed.size(), encoded, hooks);
                }
            } else {
                descriptor = outputIntercepted(codec, mediaType, path, layerPath, hashed, hooks, extra);
            }

            extra.put(Annotations.FILE_METADATA, metadata.toJson());
            log.debugf("Built layer %s -> %s", layerPath, descriptor.digest());
            return descriptor.withAnnotations(extra);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build layer " + layerPath, e);
        }
    }

    private Descriptor outputIntercepted(Codec codec, String mediaType, Path path, String layerPath,
                                         Hashing.Result hashed, BuildHooks hooks,
                                         Map<String, String> extra) throws IOException {
        StreamTee tee = StreamTee.start(codec.encode(path, layerPath), layerPath);
        FutureTask<Map<String, String>> side = new FutureTask<>(() -> {
            try (InputStream in = tee.second()) {
                return interceptor.intercept(mediaType, layerPath, codec.type(), in);
            }
        });
        Thread thread = new Thread(side, "interceptor-" + layerPath);
        thread.setDaemon(true);
        thread.start();

        Descriptor descriptor;
        try (InputStream main = tee.first()) {
            descriptor = strategy.outputLayer(mediaType, layerPath, hashed.digest(), hashed.size(), main, hooks);
        } catch (IOException | RuntimeException e) {
            tee.abort(e);
            side.cancel(true);
            throw e;
        }

        try {
            extra.putAll(side.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tee.abort(e);
            throw new InterruptedIOException("Interrupted waiting for interceptor of " + layerPath);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) throw io;
            if (cause instanceof RuntimeException re) throw re;
            throw new IOException("Interceptor failed for " + layerPath, cause);
        }
        return descriptor;
    }

    private Optional<Hashing.Result> cached(Path path, String mediaType, FileMetadata metadata) {
        try {
            Optional<CacheItem> item = cache.get(path);
            if (item.isPresent() && item.get().matches(metadata.size(), metadata.modTime(), mediaType)) {
                return Optional.of(new Hashing.Result(Digest.parse(item.get().digest()), item.get().size()));
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warnf("Digest cache lookup failed for %s, hashing instead: %s", path, e.getMessage());
            return Optional.empty();
        }
    }

    private void record(Path path, String mediaType, FileMetadata metadata, Hashing.Result hashed) {
        try {
            cache.put(new CacheItem(path.toAbsolutePath().toString(), mediaType, metadata.modTime(),
                    metadata.size(), hashed.digest().toString(), clock.instant()));
        } catch (RuntimeException e) {
            log.warnf("Failed to record digest of %s in cache: %s", path, e.getMessage());
        }
    }

    public Descriptor buildConfig(BuildSpec spec, List<Descriptor> layers, BuildHooks hooks) {
        return buildConfig(spec.metadata(), layers, hooks);
    }

    /** Serializes the model config document and outputs it. */
    public Descriptor buildConfig(ModelMetadata metadata, List<Descriptor> layers, BuildHooks hooks) {
        return buildConfig(ModelConfig.of(metadata, layers), hooks);
    }

    /** Outputs {@code document} as it is. */
    public Descriptor buildConfig(ModelConfig document, BuildHooks hooks) {
        byte[] config = OciJson.toBytes(document);
        Digest digest = Hashing.sha256(config);
        log.debugf("Built config %s (%d bytes)", digest, config.length);
        return strategy.outputConfig(MediaTypes.MODEL_CONFIG, digest, config.length,
                new ByteArrayInputStream(config), hooks);
    }

    /** Assembles the manifest, outputs it and binds the run's tag. */
    public Descriptor buildManifest(List<Descriptor> layers, Descriptor config, Map<String, String> annotations,
                                    BuildHooks hooks) {
        Manifest manifest = Manifest.forModel(config, layers, annotations);
        byte[] bytes = OciJson.toBytes(manifest);
        Digest digest = Hashing.sha256(bytes);
        log.debugf("Built manifest %s with %d layers", digest, layers.size());
        return strategy.outputManifest(manifest.mediaType(), digest, bytes.length,
                new ByteArrayInputStream(bytes), hooks);
    }
}
