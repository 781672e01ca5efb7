package com.modelpack.core.storage;

import com.modelpack.core.gc.GarbageCollector;
import com.modelpack.core.gc.GcReport;
import com.modelpack.types.Descriptor;
import com.modelpack.types.Index;
import com.modelpack.types.Manifest;
import com.modelpack.types.MediaTypes;
import com.modelpack.types.OciJson;
import com.modelpack.util.Digest;
import com.modelpack.util.Hashing;
import com.modelpack.util.HashingInputStream;
import com.fasterxml.jackson.core.JacksonException;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Filesystem content store: one OCI image layout per repository.
 *
 * <p>Layout: {@code {root}/{repository}/oci-layout}, {@code index.json} and
 * {@code blobs/sha256/{hex}}; uploads are staged in {@code {repository}/.uploads} and
 * renamed into place, so concurrent commits of one digest converge on identical bytes.
 * Index updates are serialized per repository within this process.
 */
@ApplicationScoped
public class OciLayoutContentStore implements ContentStore {

    private static final Logger log = Logger.getLogger(OciLayoutContentStore.class);

    static final String INDEX_FILE = "index.json";
    static final String LAYOUT_FILE = "oci-layout";
    static final String UPLOADS_DIR = ".uploads";
    private static final byte[] LAYOUT_CONTENT = "{\"imageLayoutVersion\":\"1.0.0\"}".getBytes(StandardCharsets.UTF_8);

    @ConfigProperty(name = "modelpack.storage.root")
    String root;

    private final ConcurrentHashMap<String, ReentrantLock> indexLocks = new ConcurrentHashMap<>();

    /** Store over {@code root}, for use outside a CDI container. */
    public static OciLayoutContentStore at(Path root) {
        OciLayoutContentStore store = new OciLayoutContentStore();
        store.root = root.toString();
        return store;
    }

    public Path rootPath() {
        return Path.of(root);
    }

    private Path repoDir(String repository) {
        return Path.of(root).resolve(RepositoryNames.validate(repository));
    }

    private Path blobPath(String repository, Digest digest) {
        return repoDir(repository).resolve("blobs").resolve(digest.algorithm()).resolve(digest.hex());
    }

    // -- manifests ---------------------------------------------------------------------------

    @Override
    public Uni<ManifestContent> pullManifest(String repository, String reference) {
        return Uni.createFrom().item(() -> {
            Descriptor descriptor = resolve(repository, reference)
                    .orElseThrow(() -> new ManifestNotFoundException(repository, reference));
            Path path = blobPath(repository, descriptor.parsedDigest());
            try {
                return new ManifestContent(descriptor, Files.readAllBytes(path));
            } catch (NoSuchFileException e) {
                throw new ManifestNotFoundException(repository, reference);
            } catch (IOException e) {
                throw new StoreException("Failed to read manifest " + repository + ":" + reference, e);
            }
        });
    }

    @Override
    public Uni<Descriptor> pushManifest(String repository, String reference, byte[] manifest) {
        return Uni.createFrom().item(() -> {
            Manifest parsed = ManifestContent.parse(manifest, repository + ":" + reference);
            Digest digest = Hashing.sha256(manifest);
            if (Digest.isDigest(reference) && !Digest.parse(reference).equals(digest)) {
                throw new DigestMismatchException("manifest " + repository, Digest.parse(reference), digest);
            }

            commitBlob(repository, digest, new ByteArrayInputStream(manifest));
            String mediaType = parsed.mediaType() != null ? parsed.mediaType() : MediaTypes.OCI_MANIFEST;
            Descriptor descriptor = new Descriptor(mediaType, digest, manifest.length);

            updateIndex(repository, index -> Digest.isDigest(reference)
                    ? index.withManifest(descriptor)
                    : index.withTag(descriptor, reference));
            log.debugf("Stored manifest %s in %s as %s", digest, repository, reference);
            return descriptor;
        });
    }

    @Override
    public Uni<Optional<Descriptor>> statManifest(String repository, String reference) {
        return Uni.createFrom().item(() -> resolve(repository, reference)
                .filter(d -> Files.exists(blobPath(repository, d.parsedDigest()))));
    }

    @Override
    public Uni<Void> deleteManifest(String repository, String reference) {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (resolve(repository, reference).isEmpty()) {
                throw new ManifestNotFoundException(repository, reference);
            }
            if (Digest.isDigest(reference)) {
                updateIndex(repository, index -> index.withoutDigest(reference));
                try {
                    Files.deleteIfExists(blobPath(repository, Digest.parse(reference)));
                } catch (IOException e) {
                    throw new StoreException("Failed to delete manifest " + repository + "@" + reference, e);
                }
                log.infof("Deleted manifest %s@%s", repository, reference);
            } else {
                updateIndex(repository, index -> index.withoutTag(reference));
                log.infof("Untagged %s:%s", repository, reference);
            }
        });
    }

    @Override
    public Uni<Index> getIndex(String repository) {
        return Uni.createFrom().item(() -> readIndex(repository));
    }

    private Optional<Descriptor> resolve(String repository, String reference) {
        Index index = readIndex(repository);
        if (Digest.isDigest(reference)) {
            return index.findByDigest(reference).stream().findFirst().map(Descriptor::withoutAnnotations);
        }
        return index.findByTag(reference).map(Descriptor::withoutAnnotations);
    }

    private Index readIndex(String repository) {
        Path path = repoDir(repository).resolve(INDEX_FILE);
        if (!Files.exists(path)) {
            return Index.empty();
        }
        try {
            return OciJson.fromBytes(Files.readAllBytes(path), Index.class);
        } catch (JacksonException e) {
            throw new ManifestFormatException("Failed to parse index of " + repository, e);
        } catch (IOException e) {
            throw new StoreException("Failed to read index of " + repository, e);
        }
    }

    private void updateIndex(String repository, UnaryOperator<Index> change) {
        ReentrantLock lock = indexLocks.computeIfAbsent(repository, r -> new ReentrantLock());
        lock.lock();
        try {
            Index next = change.apply(readIndex(repository));
            Path dir = repoDir(repository);
            ensureLayout(dir);
            writeAtomically(dir, dir.resolve(INDEX_FILE), OciJson.toBytes(next));
        } catch (IOException e) {
            throw new StoreException("Failed to update index of " + repository, e);
        } finally {
            lock.unlock();
        }
    }

    // -- blobs -------------------------------------------------------------------------------

    @Override
    public Uni<InputStream> pullBlob(String repository, Digest digest) {
        return Uni.createFrom().item(() -> {
            Path path = blobPath(repository, digest);
            try {
                return Files.newInputStream(path);
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(repository, digest);
            } catch (IOException e) {
                throw new StoreException("Failed to open blob " + digest, e);
            }
        });
    }

    @Override
    public Uni<BlobInfo> pushBlob(String repository, Digest expected, InputStream content) {
        return Uni.createFrom().item(() -> commitBlob(repository, expected, content));
    }

    private BlobInfo commitBlob(String repository, Digest expected, InputStream content) {
        try {
            if (expected != null) {
                Path existing = blobPath(repository, expected);
                if (Files.exists(existing)) {
                    log.debugf("Blob %s already present in %s", expected, repository);
                    return new BlobInfo(expected, Files.size(existing));
                }
            }

            Path dir = repoDir(repository);
            ensureLayout(dir);
            Path uploads = Files.createDirectories(dir.resolve(UPLOADS_DIR));
            Path staged = Files.createTempFile(uploads, "upload-", ".tmp");
            try {
                HashingInputStream hashing = new HashingInputStream(content);
                try (OutputStream out = Files.newOutputStream(staged)) {
                    hashing.transferTo(out);
                }
                Hashing.Result result = hashing.result();
                if (expected != null && !expected.equals(result.digest())) {
                    throw new DigestMismatchException("blob in " + repository, expected, result.digest());
                }

                Path target = blobPath(repository, result.digest());
                Files.createDirectories(target.getParent());
                moveIntoPlace(staged, target);
                log.debugf("Committed blob %s (%d bytes) to %s", result.digest(), result.size(), repository);
                return new BlobInfo(result.digest(), result.size());
            } finally {
                Files.deleteIfExists(staged);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to write blob to " + repository, e);
        }
    }

    private static void moveIntoPlace(Path staged, Path target) throws IOException {
        try {
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileAlreadyExistsException e) {
            // another writer committed the same digest first
            log.debugf("Blob %s committed concurrently", target.getFileName());
        } catch (AtomicMoveNotSupportedException e) {
            try {
                Files.move(staged, target);
            } catch (FileAlreadyExistsException raced) {
                log.debugf("Blob %s committed concurrently", target.getFileName());
            }
        }
    }

    @Override
    public Uni<Void> mountBlob(String fromRepository, String toRepository, Descriptor descriptor) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Digest digest = descriptor.parsedDigest();
            if (Files.exists(blobPath(toRepository, digest))) {
                return;
            }
            Path source = blobPath(fromRepository, digest);
            if (!Files.exists(source)) {
                throw new BlobNotFoundException(fromRepository, digest);
            }
            try (InputStream in = Files.newInputStream(source)) {
                BlobInfo mounted = commitBlob(toRepository, digest, in);
                if (mounted.size() != descriptor.size()) {
                    throw new StoreException("Size mismatch mounting " + digest + ": expected "
                            + descriptor.size() + ", got " + mounted.size());
                }
            } catch (IOException e) {
                throw new StoreException("Failed to mount blob " + digest + " into " + toRepository, e);
            }
            log.debugf("Mounted blob %s from %s into %s", digest, fromRepository, toRepository);
        });
    }

    @Override
    public Uni<Optional<BlobInfo>> statBlob(String repository, Digest digest) {
        return Uni.createFrom().item(() -> {
            Path path = blobPath(repository, digest);
            try {
                return Optional.of(new BlobInfo(digest, Files.size(path)));
            } catch (NoSuchFileException e) {
                return Optional.<BlobInfo>empty();
            } catch (IOException e) {
                throw new StoreException("Failed to stat blob " + digest, e);
            }
        });
    }

    // -- listing -----------------------------------------------------------------------------

    @Override
    public Multi<String> listRepositories() {
        return Multi.createFrom().items(() -> {
            Path rootPath = Path.of(root);
            if (!Files.isDirectory(rootPath)) {
                return Stream.<String>empty();
            }
            try (Stream<Path> walk = Files.walk(rootPath)) {
                List<String> repositories = walk
                        .filter(p -> p.getFileName().toString().equals(LAYOUT_FILE))
                        .map(p -> rootPath.relativize(p.getParent()).toString().replace('\\', '/'))
                        .sorted()
                        .toList();
                return repositories.stream();
            } catch (IOException e) {
                throw new StoreException("Failed to list repositories", e);
            }
        });
    }

    @Override
    public Multi<String> listTags(String repository) {
        return Multi.createFrom().items(() -> readIndex(repository).tags().stream());
    }

    @Override
    public Multi<Digest> listBlobs(String repository) {
        return Multi.createFrom().items(() -> {
            Path dir = repoDir(repository).resolve("blobs").resolve(Digest.SHA256);
            if (!Files.isDirectory(dir)) {
                return Stream.<Digest>empty();
            }
            List<Digest> digests = new ArrayList<>();
            try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
                for (Path file : files) {
                    String value = Digest.SHA256 + ":" + file.getFileName();
                    if (Digest.isDigest(value)) {
                        digests.add(Digest.parse(value));
                    }
                }
            } catch (IOException e) {
                throw new StoreException("Failed to list blobs of " + repository, e);
            }
            digests.sort(Comparator.comparing(Digest::toString));
            return digests.stream();
        });
    }

    // -- cleanup -----------------------------------------------------------------------------

    @Override
    public Uni<Void> cleanupRepo(String repository, Collection<Digest> blobs, boolean removeRepository) {
        return Uni.createFrom().voidItem().invoke(() -> {
            try {
                for (Digest digest : blobs) {
                    if (Files.deleteIfExists(blobPath(repository, digest))) {
                        log.debugf("Deleted blob %s from %s", digest, repository);
                    }
                }
                if (removeRepository) {
                    deleteTree(repoDir(repository));
                    pruneEmptyParents(repoDir(repository).getParent(), Path.of(root));
                    indexLocks.remove(repository);
                    log.infof("Removed repository %s", repository);
                }
            } catch (IOException e) {
                throw new StoreException("Failed to clean up repository " + repository, e);
            }
        });
    }

    @Override
    public Uni<GcReport> performGc() {
        return Uni.createFrom().item(() -> new GarbageCollector(this).collect());
    }

    // -- filesystem helpers ------------------------------------------------------------------

    private static void ensureLayout(Path dir) throws IOException {
        Path layout = dir.resolve(LAYOUT_FILE);
        if (Files.exists(layout)) return;
        Files.createDirectories(dir);
        writeAtomically(dir, layout, LAYOUT_CONTENT);
    }

    private static void writeAtomically(Path dir, Path target, byte[] content) throws IOException {
        Path uploads = Files.createDirectories(dir.resolve(UPLOADS_DIR));
        Path staged = Files.createTempFile(uploads, target.getFileName().toString(), ".tmp");
        try {
            Files.write(staged, content);
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    private static void deleteTree(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void pruneEmptyParents(Path dir, Path stop) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(stop) && Files.isDirectory(current)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }
}
