package com.modelpack.core.build.interceptor;

import com.modelpack.formats.api.CodecType;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Side-channel consumer of a layer's encoded bytes.
 *
 * <p>Runs on its own thread while the layer is written; the returned annotations are merged
 * into the layer descriptor once both have finished. Implementations may stop reading early.
 */
public interface Interceptor {

    Map<String, String> intercept(String mediaType, String layerPath, CodecType codecType, InputStream content)
            throws IOException;
}
