package com.modelpack.core.storage;

import com.modelpack.util.Digest;

/**
 * Digest and size of a committed blob.
 */
public record BlobInfo(Digest digest, long size) {}
