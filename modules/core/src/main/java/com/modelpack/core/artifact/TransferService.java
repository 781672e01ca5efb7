package com.modelpack.core.artifact;

import com.modelpack.core.build.BuildHooks;
import com.modelpack.core.process.Failures;
import com.modelpack.core.process.RetryPolicy;
import com.modelpack.core.process.RunContext;
import com.modelpack.core.remote.Reference;
import com.modelpack.core.remote.RemoteManifest;
import com.modelpack.core.remote.RemoteRegistry;
import com.modelpack.core.remote.RemoteRegistryFactory;
import com.modelpack.core.storage.ContentStore;
import com.modelpack.core.storage.DigestMismatchException;
import com.modelpack.core.storage.ManifestContent;
import com.modelpack.core.storage.ManifestNotFoundException;
import com.modelpack.formats.registry.CodecRegistry;
import com.modelpack.types.Descriptor;
import com.modelpack.types.Manifest;
import com.modelpack.util.Digest;
import com.modelpack.util.stream.BoundedPipe;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves models between the local content store and remote registries.
 *
 * <p>Blobs go first and the manifest last, so a reader never sees a tag whose blobs are
 * missing. Each blob transfer runs under the build retry policy.
 */
@ApplicationScoped
public class TransferService {

    private static final Logger log = Logger.getLogger(TransferService.class);

    @Inject
    ContentStore store;

    @Inject
    CodecRegistry codecs;

    @Inject
    RemoteRegistryFactory remotes;

    @Inject
    RetryPolicy retry;

    /** Service outside a CDI container. */
    public static TransferService create(ContentStore store, CodecRegistry codecs, RemoteRegistryFactory remotes,
                                         RetryPolicy retry) {
        TransferService service = new TransferService();
        service.store = store;
        service.codecs = codecs;
        service.remotes = remotes;
        service.retry = retry;
        return service;
    }

    /**
     * Uploads a local model. Blobs the registry already has are not transferred.
     *
     * @return descriptor of the pushed manifest
     */
    public Descriptor push(String target, BuildHooks hooks) {
        Reference reference = Reference.parse(target);
        String repository = reference.repository();
        ManifestContent content = store.pullManifest(repository, reference.reference()).await().indefinitely();
        Manifest manifest = content.parse();
        RemoteRegistry remote = remotes.open(reference, RemoteRegistryFactory.Access.PUSH);
        RunContext ctx = new RunContext();

        for (Descriptor blob : blobs(manifest)) {
            String name = blobName(blob);
            retry.run("push " + name, ctx, () -> {
                pushBlob(remote, repository, name, blob, hooks);
                return blob;
            });
        }

        Descriptor descriptor = content.descriptor();
        String digest = descriptor.digest();
        retry.run("push manifest " + digest, ctx, () -> {
            try {
                if (!remote.manifestExists(digest)) {
                    Digest pushed = remote.pushManifest(content.bytes(), digest);
                    if (!pushed.toString().equals(digest)) {
                        throw new DigestMismatchException("manifest pushed to " + reference, descriptor.parsedDigest(), pushed);
                    }
                }
                reference.tag().ifPresent(tag -> remote.pushManifest(content.bytes(), tag));
                hooks.onComplete(digest, descriptor);
                return descriptor;
            } catch (RuntimeException e) {
                hooks.onError(digest, e);
                throw e;
            }
        });
        log.infof("Pushed %s (%s)", reference, digest);
        return descriptor;
    }

    /**
     * Downloads a remote model into the local store. Blobs already stored locally are skipped;
     * everything else is verified on commit.
     *
     * @throws ManifestNotFoundException if the registry does not have {@code target}
     */
    public Descriptor pull(String target, BuildHooks hooks) {
        Reference reference = Reference.parse(target);
        String repository = reference.repository();
        RemoteRegistry remote = remotes.open(reference, RemoteRegistryFactory.Access.PULL);
        RunContext ctx = new RunContext();

        RemoteManifest remoteManifest = retry.run("pull manifest " + reference.reference(), ctx,
                () -> remote.pullManifest(reference.reference()))
                .orElseThrow(() -> new ManifestNotFoundException(repository, reference.reference()));
        Manifest manifest = ManifestContent.parse(remoteManifest.bytes(), remoteManifest.digest().toString());

        for (Descriptor blob : blobs(manifest)) {
            String name = blobName(blob);
            if (store.statBlob(repository, blob.parsedDigest()).await().indefinitely().isPresent()) {
                log.debugf("Blob %s already stored in %s", blob.digest(), repository);
                hooks.onComplete(name, blob);
                continue;
            }
            retry.run("pull " + name, ctx, () -> {
                pullBlob(remote, repository, name, blob, hooks);
                return blob;
            });
        }

        // registries may serve a non-compact form; the local copy is addressed by what is stored
        Digest local = remoteManifest.digest();
        reference.digest().filter(served -> !served.equals(local)).ifPresent(served ->
                log.warnf("Manifest %s@%s stored as %s", repository, served, local));
        String localRef = reference.tag().orElse(local.toString());
        Descriptor stored = store.pushManifest(repository, localRef, remoteManifest.bytes())
                .await().indefinitely();
        log.infof("Pulled %s (%s)", reference, stored.digest());
        return stored;
    }

    /**
     * Downloads only the layers of remote {@code target} whose filepath matches one of the glob
     * {@code patterns} and decodes them under {@code outputDir}. The local store is not touched.
     * A {@code *} does not cross {@code /}.
     *
     * @return the fetched layers in manifest order
     * @throws IllegalArgumentException if no layer matches
     */
    public List<Descriptor> fetch(String target, List<String> patterns, Path outputDir, int concurrency,
                                  BuildHooks hooks) {
        Reference reference = Reference.parse(target);
        RemoteRegistry remote = remotes.open(reference, RemoteRegistryFactory.Access.PULL);
        RunContext ctx = new RunContext();

        RemoteManifest remoteManifest = retry.run("pull manifest " + reference.reference(), ctx,
                () -> remote.pullManifest(reference.reference()))
                .orElseThrow(() -> new ManifestNotFoundException(reference.repository(), reference.reference()));
        Manifest manifest = ManifestContent.parse(remoteManifest.bytes(), remoteManifest.digest().toString());

        List<PathMatcher> matchers = patterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        List<Descriptor> layers = manifest.layers().stream()
                .filter(layer -> layer.filepath() != null)
                .filter(layer -> matchers.stream().anyMatch(m -> m.matches(Path.of(layer.filepath()))))
                .toList();
        if (layers.isEmpty()) {
            throw new IllegalArgumentException("No layers of " + target + " match " + patterns);
        }
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + outputDir, e);
        }

        LayerPool.forEach("fetch", layers, concurrency, ctx, layer ->
                retry.run("fetch " + layer.filepath(), ctx, () -> {
                    fetchLayer(remote, layer, outputDir, hooks);
                    return layer;
                }));
        log.infof("Fetched %d of %d layers of %s to %s", layers.size(), manifest.layers().size(), reference, outputDir);
        return layers;
    }

    private void pushBlob(RemoteRegistry remote, String repository, String name, Descriptor blob, BuildHooks hooks) {
        try {
            if (remote.blobExists(blob.parsedDigest())) {
                log.debugf("Blob %s already in %s, skipping upload", blob.digest(), remote.reference().repository());
                hooks.onComplete(name, blob);
                return;
            }
            try (InputStream in = store.pullBlob(repository, blob.parsedDigest()).await().indefinitely()) {
                remote.pushBlob(blob, hooks.onStart(name, blob.size(), in));
            }
            hooks.onComplete(name, blob);
        } catch (IOException e) {
            hooks.onError(name, e);
            throw new UncheckedIOException("Failed to read blob " + blob.digest(), e);
        } catch (RuntimeException e) {
            hooks.onError(name, e);
            throw e;
        }
    }

    private void pullBlob(RemoteRegistry remote, String repository, String name, Descriptor blob, BuildHooks hooks) {
        BoundedPipe pipe = new BoundedPipe();
        Thread producer = download(remote, blob, pipe, "pull-" + name);
        try (InputStream source = pipe.source()) {
            store.pushBlob(repository, blob.parsedDigest(), hooks.onStart(name, blob.size(), source))
                    .await().indefinitely();
            hooks.onComplete(name, blob);
        } catch (IOException e) {
            hooks.onError(name, e);
            throw new UncheckedIOException("Failed to pull blob " + blob.digest(), e);
        } catch (RuntimeException e) {
            hooks.onError(name, e);
            throw e;
        } finally {
            join(producer);
        }
    }

    private void fetchLayer(RemoteRegistry remote, Descriptor layer, Path outputDir, BuildHooks hooks) {
        String name = blobName(layer);
        BoundedPipe pipe = new BoundedPipe();
        Thread producer = download(remote, layer, pipe, "fetch-" + name);
        try (InputStream source = pipe.source()) {
            ArtifactService.decodeVerified(codecs, hooks.onStart(name, layer.size(), source), layer, outputDir);
            hooks.onComplete(name, layer);
        } catch (IOException e) {
            hooks.onError(name, e);
            throw new UncheckedIOException("Failed to fetch layer " + layer.digest(), e);
        } catch (RuntimeException e) {
            hooks.onError(name, e);
            throw e;
        } finally {
            join(producer);
        }
    }

    /** Streams {@code blob} from the registry into {@code pipe} on a daemon thread. */
    private static Thread download(RemoteRegistry remote, Descriptor blob, BoundedPipe pipe, String threadName) {
        Thread producer = new Thread(() -> {
            try (OutputStream sink = pipe.sink()) {
                remote.pullBlob(blob, sink);
            } catch (IOException | RuntimeException e) {
                pipe.fail(e);
            }
        }, threadName);
        producer.setDaemon(true);
        producer.start();
        return producer;
    }

    private static void join(Thread producer) {
        try {
            producer.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw Failures.propagate(e);
        }
    }

    private static List<Descriptor> blobs(Manifest manifest) {
        List<Descriptor> blobs = new ArrayList<>(manifest.layers());
        if (manifest.config() != null) {
            blobs.add(manifest.config());
        }
        return blobs;
    }

    private static String blobName(Descriptor blob) {
        String filepath = blob.filepath();
        return filepath != null ? filepath : blob.digest();
    }
}
