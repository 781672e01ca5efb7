package com.modelpack.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * What to package: file patterns per category, relative to the work directory, plus model
 * metadata. Produced by the Modelfile parser; patterns may contain glob wildcards.
 */
public record BuildSpec(Map<ArtifactCategory, List<String>> patterns, ModelMetadata metadata) {

    public BuildSpec {
        EnumMap<ArtifactCategory, List<String>> copy = new EnumMap<>(ArtifactCategory.class);
        if (patterns != null) {
            patterns.forEach((category, list) -> copy.put(category, List.copyOf(new LinkedHashSet<>(list))));
        }
        patterns = Collections.unmodifiableMap(copy);
        metadata = metadata == null ? ModelMetadata.empty() : metadata;
    }

    public List<String> patterns(ArtifactCategory category) {
        return patterns.getOrDefault(category, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<ArtifactCategory, List<String>> patterns = new EnumMap<>(ArtifactCategory.class);
        private ModelMetadata metadata = ModelMetadata.empty();

        public Builder add(ArtifactCategory category, String... paths) {
            patterns.computeIfAbsent(category, c -> new ArrayList<>()).addAll(List.of(paths));
            return this;
        }

        public Builder metadata(ModelMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public BuildSpec build() {
            return new BuildSpec(patterns, metadata);
        }
    }
}
