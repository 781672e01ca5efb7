package com.modelpack.core.artifact;

/**
 * How an attach runs.
 *
 * @param build          output, media type flavour, interceptor and hooks for the new blobs
 * @param destinationDir directory to record the file under instead of its path in the work
 *                       directory, or {@code null}
 * @param force          replace a layer already recorded under the same path
 * @param config         the file is a model config document that replaces the current one
 */
public record AttachOptions(BuildOptions build, String destinationDir, boolean force, boolean config) {

    public AttachOptions {
        build = build == null ? BuildOptions.defaults() : build;
    }

    public static AttachOptions defaults() {
        return new AttachOptions(BuildOptions.defaults(), null, false, false);
    }

    public AttachOptions withBuild(BuildOptions value) {
        return new AttachOptions(value, destinationDir, force, config);
    }

    public AttachOptions withDestinationDir(String value) {
        return new AttachOptions(build, value, force, config);
    }

    public AttachOptions withForce(boolean value) {
        return new AttachOptions(build, destinationDir, value, config);
    }

    public AttachOptions withConfig(boolean value) {
        return new AttachOptions(build, destinationDir, force, value);
    }
}
