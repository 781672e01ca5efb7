package com.modelpack.core.artifact;

import com.modelpack.core.build.BuildHooks;

/**
 * How a build runs.
 *
 * @param output      where blobs go
 * @param raw         use the {@code .raw} media types instead of single-file tars
 * @param interceptor compute per-chunk checksums into each layer's annotations
 * @param concurrency files built in parallel per category; {@code 0} uses the configured default
 * @param hooks       progress observer
 */
public record BuildOptions(Output output, boolean raw, boolean interceptor, int concurrency, BuildHooks hooks) {

    public enum Output { LOCAL, REMOTE }

    public BuildOptions {
        output = output == null ? Output.LOCAL : output;
        hooks = hooks == null ? BuildHooks.NONE : hooks;
    }

    public static BuildOptions defaults() {
        return new BuildOptions(Output.LOCAL, false, false, 0, BuildHooks.NONE);
    }

    public BuildOptions withOutput(Output value) {
        return new BuildOptions(value, raw, interceptor, concurrency, hooks);
    }

    public BuildOptions withRaw(boolean value) {
        return new BuildOptions(output, value, interceptor, concurrency, hooks);
    }

    public BuildOptions withInterceptor(boolean value) {
        return new BuildOptions(output, raw, value, concurrency, hooks);
    }

    public BuildOptions withConcurrency(int value) {
        return new BuildOptions(output, raw, interceptor, value, hooks);
    }

    public BuildOptions withHooks(BuildHooks value) {
        return new BuildOptions(output, raw, interceptor, concurrency, value);
    }
}
