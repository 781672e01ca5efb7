package com.modelpack.types;

/**
 * Annotation keys written by the builder and the content store.
 */
public final class Annotations {

    /** Path of the packaged file relative to the work directory. */
    public static final String FILEPATH = "org.cnai.model.filepath";

    /** JSON-encoded {@link FileMetadata} of the packaged file. */
    public static final String FILE_METADATA = "org.cnai.model.file.metadata+json";

    /** Per-chunk CRC32C checksums produced by the chunk checksum interceptor. */
    public static final String CHUNK_CRCS = "org.cnai.nydus.crcs";

    /** Manifest creation time, RFC 3339. */
    public static final String CREATED = "org.cnai.model.created";

    /** Tag name carried by index entries of the OCI image layout. */
    public static final String REF_NAME = "org.opencontainers.image.ref.name";

    private Annotations() {}
}
