package com.modelpack.core.remote;

import com.modelpack.util.Digest;

/**
 * Manifest bytes as served by a registry, with the digest they hash to.
 */
public record RemoteManifest(Digest digest, String mediaType, byte[] bytes) {
}
