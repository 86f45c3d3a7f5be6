package com.driftsentinel.core.model;

/**
 * Kinds of deviation between code and a specification.
 *
 * @since 1.0.0
 */
public enum DriftType {
    /** An expected element has no implementation. */
    MISSING_IMPLEMENTATION,
    /** The implementation exists but its signature differs (arity or types). */
    SIGNATURE_MISMATCH,
    /** Signature matches but the observed behaviour hash differs. */
    BEHAVIOR_DEVIATION,
    /** Documentation changed while the code did not follow. */
    DOCUMENTATION_STALE,
    /** A declared dependency version differs from the one in use. */
    DEPENDENCY_DRIFT,
    /** A previously stable public signature was removed or changed incompatibly. */
    API_BREAKING_CHANGE
}
