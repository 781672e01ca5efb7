package com.modelpack.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;

/**
 * File attributes captured at build time and carried in {@link Annotations#FILE_METADATA}.
 *
 * @param mode     permission bits only
 * @param typeflag tar typeflag, see {@link EntryType}
 */
@JsonPropertyOrder({"name", "mode", "uid", "gid", "size", "mtime", "typeflag"})
public record FileMetadata(
        String name,
        int mode,
        int uid,
        int gid,
        long size,
        @JsonProperty("mtime") Instant modTime,
        int typeflag
) {
    public String toJson() {
        return OciJson.toString(this);
    }

    public static FileMetadata fromJson(String json) {
        try {
            return OciJson.mapper().readValue(json, FileMetadata.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid file metadata annotation", e);
        }
    }
}
