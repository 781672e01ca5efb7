/**
 * Shared utilities for all modelpack modules.
 *
 * <p>Contains {@link com.modelpack.util.Digest} (OCI {@code sha256:<hex>} digests), SHA-256
 * helpers, and the {@link com.modelpack.util.stream stream layer} (bounded pipes and the
 * two-way tee used by the layer builder). No framework dependencies beyond commons-codec.
 */
package com.modelpack.util;
