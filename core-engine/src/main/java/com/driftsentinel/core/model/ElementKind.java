package com.driftsentinel.core.model;

/**
 * What an {@link ExpectedElement} describes.
 *
 * @since 1.0.0
 */
public enum ElementKind {
    /** A function, method, class or endpoint; the signature is its declaration. */
    SYMBOL,
    /** A third-party dependency; the signature is its declared version. */
    DEPENDENCY
}
