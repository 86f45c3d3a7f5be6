package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.Specification;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from project paths to specifications.
 *
 * <p>
 * Exact paths win over glob patterns; among globs the first registered match
 * wins. The registry is built once and shared read-only by all scan workers.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpecificationRegistry implements SpecificationProvider {

    private final Map<String, Specification> exact;
    private final List<GlobEntry> globs;

    private SpecificationRegistry(Builder builder) {
        this.exact = Collections.unmodifiableMap(new LinkedHashMap<>(builder.exact));
        this.globs = Collections.unmodifiableList(new ArrayList<>(builder.globs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SpecificationRegistry empty() {
        return builder().build();
    }

    @Override
    public Optional<Specification> specificationFor(String filePath) {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Specification spec = exact.get(filePath);
        if (spec != null) {
            return Optional.of(spec);
        }
        Path path = Path.of(filePath);
        for (GlobEntry entry : globs) {
            if (entry.matcher.matches(path)) {
                return Optional.of(entry.specification);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return exact.size() + globs.size();
    }

    static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0
                || pattern.indexOf('{') >= 0 || pattern.indexOf('[') >= 0;
    }

    private static final class GlobEntry {
        private final PathMatcher matcher;
        private final Specification specification;

        private GlobEntry(String pattern, Specification specification) {
            this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            this.specification = specification;
        }
    }

    /**
     * Fluent builder for {@link SpecificationRegistry}.
     */
    public static class Builder {
        private final Map<String, Specification> exact = new LinkedHashMap<>();
        private final List<GlobEntry> globs = new ArrayList<>();

        /**
         * @param pathOrGlob    exact project-relative path or glob pattern
         * @param specification specification governing matching files
         * @return this builder
         */
        public Builder register(String pathOrGlob, Specification specification) {
            Objects.requireNonNull(pathOrGlob, "pathOrGlob must not be null");
            Objects.requireNonNull(specification, "specification must not be null");
            if (isGlob(pathOrGlob)) {
                globs.add(new GlobEntry(pathOrGlob, specification));
            } else {
                exact.put(pathOrGlob, specification);
            }
            return this;
        }

        public SpecificationRegistry build() {
            return new SpecificationRegistry(this);
        }
    }
}
