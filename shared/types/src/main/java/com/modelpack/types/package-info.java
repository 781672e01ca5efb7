/**
 * Value types shared across all modelpack modules: OCI descriptors, manifests and indexes,
 * the model config document, media types and annotation keys.
 *
 * <p>All JSON goes through {@link com.modelpack.types.OciJson} so that serialized bytes, and
 * therefore digests, are stable. {@link com.modelpack.util.Digest} lives in
 * {@code shared/utils}.
 */
package com.modelpack.types;
