package com.modelpack.core.storage;

import com.modelpack.types.Descriptor;
import com.modelpack.types.Manifest;
import com.modelpack.types.OciJson;

import java.io.IOException;

/**
 * Raw manifest bytes together with the descriptor that addresses them.
 */
public record ManifestContent(Descriptor descriptor, byte[] bytes) {

    /**
     * @throws ManifestFormatException if the bytes are not a manifest
     */
    public Manifest parse() {
        return parse(bytes, descriptor.digest());
    }

    public static Manifest parse(byte[] bytes, String subject) {
        try {
            return OciJson.fromBytes(bytes, Manifest.class);
        } catch (IOException e) {
            throw new ManifestFormatException("Failed to parse manifest " + subject, e);
        }
    }
}
