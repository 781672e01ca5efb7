package com.modelpack.types;

/**
 * Media types of model artifacts and the OCI documents that carry them.
 */
public final class MediaTypes {

    public static final String OCI_MANIFEST = "application/vnd.oci.image.manifest.v1+json";
    public static final String OCI_INDEX = "application/vnd.oci.image.index.v1+json";

    public static final String MODEL_ARTIFACT = "application/vnd.cnai.model.manifest.v1+json";
    public static final String MODEL_CONFIG = "application/vnd.cnai.model.config.v1+json";

    public static final String WEIGHT_CONFIG = "application/vnd.cnai.model.weight.config.v1.tar";
    public static final String WEIGHT_CONFIG_RAW = "application/vnd.cnai.model.weight.config.v1.raw";
    public static final String WEIGHT = "application/vnd.cnai.model.weight.v1.tar";
    public static final String WEIGHT_RAW = "application/vnd.cnai.model.weight.v1.raw";
    public static final String CODE = "application/vnd.cnai.model.code.v1.tar";
    public static final String CODE_RAW = "application/vnd.cnai.model.code.v1.raw";
    public static final String DOC = "application/vnd.cnai.model.doc.v1.tar";
    public static final String DOC_RAW = "application/vnd.cnai.model.doc.v1.raw";
    public static final String DATASET = "application/vnd.cnai.model.dataset.v1.tar";
    public static final String DATASET_RAW = "application/vnd.cnai.model.dataset.v1.raw";

    public static final String TAR_SUFFIX = ".tar";
    public static final String RAW_SUFFIX = ".raw";

    private MediaTypes() {}

    public static boolean isRaw(String mediaType) {
        return mediaType != null && mediaType.endsWith(RAW_SUFFIX);
    }

    public static boolean isTar(String mediaType) {
        return mediaType != null && mediaType.endsWith(TAR_SUFFIX);
    }
}
