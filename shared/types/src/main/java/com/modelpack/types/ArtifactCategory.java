package com.modelpack.types;

/**
 * Categories of files in a model artifact, declared in manifest layer order.
 *
 * <p>Weight files are the large ones: their digests are cached across builds and their
 * interceptor chunks are bigger.
 */
public enum ArtifactCategory {
    CONFIG("config", MediaTypes.WEIGHT_CONFIG, MediaTypes.WEIGHT_CONFIG_RAW, false),
    WEIGHT("weight", MediaTypes.WEIGHT, MediaTypes.WEIGHT_RAW, true),
    CODE("code", MediaTypes.CODE, MediaTypes.CODE_RAW, false),
    DOC("doc", MediaTypes.DOC, MediaTypes.DOC_RAW, false),
    DATASET("dataset", MediaTypes.DATASET, MediaTypes.DATASET_RAW, true);

    private final String label;
    private final String tarMediaType;
    private final String rawMediaType;
    private final boolean bulk;

    ArtifactCategory(String label, String tarMediaType, String rawMediaType, boolean bulk) {
        this.label = label;
        this.tarMediaType = tarMediaType;
        this.rawMediaType = rawMediaType;
        this.bulk = bulk;
    }

    public String label() {
        return label;
    }

    public String mediaType(boolean raw) {
        return raw ? rawMediaType : tarMediaType;
    }

    /** Weight and dataset files: large, usually unchanged between builds. */
    public boolean bulk() {
        return bulk;
    }

    /** Category owning {@code mediaType}, or {@code null} for config and manifest types. */
    public static ArtifactCategory ofMediaType(String mediaType) {
        for (ArtifactCategory c : values()) {
            if (c.tarMediaType.equals(mediaType) || c.rawMediaType.equals(mediaType)) return c;
        }
        return null;
    }

    /** True for the weight media types, whose digests the builder caches. */
    public static boolean isWeight(String mediaType) {
        return ofMediaType(mediaType) == WEIGHT;
    }
}
