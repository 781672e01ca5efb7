package com.modelpack.formats.api;

/**
 * Thrown when no codec exists for a media type. An input error: never retried.
 */
public class UnsupportedMediaTypeException extends IllegalArgumentException {

    private final String mediaType;

    public UnsupportedMediaTypeException(String mediaType) {
        super("Unsupported media type: " + mediaType);
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }
}
