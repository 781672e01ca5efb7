package com.modelpack.formats.api;

import com.modelpack.types.MediaTypes;

/**
 * How a file is turned into layer bytes.
 */
public enum CodecType {
    /** The file's bytes, verbatim. */
    RAW("raw"),
    /** A single-entry tar carrying the relative path, mode and mtime. */
    TAR("tar");

    private final String label;

    CodecType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Derives the codec type from the media type suffix.
     *
     * @throws UnsupportedMediaTypeException if the suffix is neither {@code .tar} nor {@code .raw}
     */
    public static CodecType fromMediaType(String mediaType) {
        if (MediaTypes.isTar(mediaType)) return TAR;
        if (MediaTypes.isRaw(mediaType)) return RAW;
        throw new UnsupportedMediaTypeException(mediaType);
    }
}
