package com.driftsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized, read-only description of what part of a codebase should look
 * like.
 *
 * <p>
 * Specifications are produced by an external loader and shared, read-only,
 * between concurrent scans. Element order is preserved and element ids are
 * unique.
 * </p>
 *
 * @since 1.0.0
 */
public final class Specification {

    private final String name;
    private final String sourceRef;
    private final String revision;
    private final List<ExpectedElement> elements;

    /**
     * @param name      specification name
     * @param sourceRef where the specification came from (file, URL)
     * @param revision  revision or content hash of the source; may be {@code null}
     * @param elements  expected elements in declaration order
     * @throws IllegalArgumentException if element ids are not unique
     */
    public Specification(String name, String sourceRef, String revision, List<ExpectedElement> elements) {
        this.name = Objects.requireNonNull(name, "Specification name must not be null");
        this.sourceRef = Objects.requireNonNull(sourceRef, "Specification sourceRef must not be null");
        this.revision = revision;
        Objects.requireNonNull(elements, "Specification elements must not be null");

        Set<String> seen = new HashSet<>();
        for (ExpectedElement element : elements) {
            if (!seen.add(element.getId())) {
                throw new IllegalArgumentException(
                        "Duplicate element id '" + element.getId() + "' in specification '" + name + "'");
            }
        }
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public String getName() {
        return name;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public String getRevision() {
        return revision;
    }

    public List<ExpectedElement> getElements() {
        return elements;
    }

    public Optional<ExpectedElement> findElement(String id) {
        return elements.stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    /**
     * @return stable reference used in reports and fingerprints
     */
    public String reference() {
        return name + "@" + sourceRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Specification that))
            return false;
        return name.equals(that.name)
                && sourceRef.equals(that.sourceRef)
                && Objects.equals(revision, that.revision)
                && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sourceRef, revision, elements);
    }

    @Override
    public String toString() {
        return "Specification{name='" + name + "', sourceRef='" + sourceRef
                + "', revision='" + revision + "', elements=" + elements.size() + '}';
    }
}
