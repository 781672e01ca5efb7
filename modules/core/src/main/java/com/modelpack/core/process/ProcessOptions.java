package com.modelpack.core.process;

import com.modelpack.core.build.BuildHooks;

/**
 * Per-run processor settings.
 *
 * @param concurrency worker pool width; values below 1 mean sequential
 * @param hooks       progress observer, never {@code null}
 */
public record ProcessOptions(int concurrency, BuildHooks hooks) {

    public ProcessOptions {
        concurrency = Math.max(1, concurrency);
        hooks = hooks == null ? BuildHooks.NONE : hooks;
    }

    public static ProcessOptions defaults() {
        return new ProcessOptions(1, BuildHooks.NONE);
    }
}
