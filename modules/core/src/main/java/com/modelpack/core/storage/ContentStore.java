package com.modelpack.core.storage;

import com.modelpack.core.gc.GcReport;
import com.modelpack.types.Descriptor;
import com.modelpack.types.Index;
import com.modelpack.util.Digest;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import java.io.InputStream;
import java.util.Collection;
import java.util.Optional;

/**
 * Content-addressed persistence for blobs and manifests, organised in repositories.
 *
 * <p>Blobs are write-once and verified on commit. Manifests are blobs that are also listed in
 * the repository index; tags are the only mutable pointers. Implementations must let two
 * writers race on the same digest and converge.
 */
public interface ContentStore {

    /**
     * Resolves a tag or digest and reads the manifest.
     *
     * @throws ManifestNotFoundException if the reference is not in the index
     * @throws StoreException            on I/O errors
     */
    Uni<ManifestContent> pullManifest(String repository, String reference);

    /**
     * Stores a manifest and records it in the index. A tag reference binds the tag; a digest
     * reference must match the content.
     *
     * @throws ManifestFormatException  if {@code manifest} is not a manifest
     * @throws DigestMismatchException  if a digest reference disagrees with the content
     * @throws StoreException           on I/O errors
     */
    Uni<Descriptor> pushManifest(String repository, String reference, byte[] manifest);

    /**
     * Opens a blob for reading; the caller closes the stream.
     *
     * @throws BlobNotFoundException if the blob does not exist
     */
    Uni<InputStream> pullBlob(String repository, Digest digest);

    /**
     * Commits a blob. With an {@code expected} digest the content is verified and an already
     * present blob short-circuits without reading {@code content}; without one the digest and
     * size are computed while streaming.
     *
     * @param expected may be null
     * @throws DigestMismatchException if the content does not hash to {@code expected}
     * @throws StoreException          on I/O errors
     */
    Uni<BlobInfo> pushBlob(String repository, Digest expected, InputStream content);

    /**
     * Makes a blob of {@code fromRepository} available in {@code toRepository} without the
     * caller re-uploading it.
     *
     * @throws BlobNotFoundException   if the source blob does not exist
     * @throws DigestMismatchException if the source content disagrees with the descriptor
     */
    Uni<Void> mountBlob(String fromRepository, String toRepository, Descriptor descriptor);

    Uni<Optional<BlobInfo>> statBlob(String repository, Digest digest);

    Uni<Optional<Descriptor>> statManifest(String repository, String reference);

    Multi<String> listRepositories();

    /** Tags of the repository, sorted; empty for unknown repositories. */
    Multi<String> listTags(String repository);

    Multi<Digest> listBlobs(String repository);

    /**
     * Deletes by reference: a tag is unbound, a digest removes the manifest object and every
     * index entry for it.
     *
     * @throws ManifestNotFoundException if nothing matches
     */
    Uni<Void> deleteManifest(String repository, String reference);

    /** The repository index; empty for repositories without one. */
    Uni<Index> getIndex(String repository);

    /**
     * Deletes the given blobs and, only when {@code removeRepository} is set, the whole
     * repository.
     */
    Uni<Void> cleanupRepo(String repository, Collection<Digest> blobs, boolean removeRepository);

    /** Mark-and-sweep over every repository. */
    Uni<GcReport> performGc();
}
