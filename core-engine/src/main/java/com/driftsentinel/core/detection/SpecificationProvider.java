package com.driftsentinel.core.detection;

import com.driftsentinel.core.error.SpecLoadException;
import com.driftsentinel.core.model.Specification;

import java.util.Optional;

/**
 * Supplies the normalized {@link Specification} governing a project file.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SpecificationProvider {

    /**
     * @param filePath project-relative path using {@code /} separators
     * @return the governing specification, or empty if none is declared
     * @throws SpecLoadException if a specification is declared but cannot be
     *                           obtained
     */
    Optional<Specification> specificationFor(String filePath);
}
