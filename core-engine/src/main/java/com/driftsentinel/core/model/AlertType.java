package com.driftsentinel.core.model;

/**
 * Category of an {@link Alert}.
 *
 * @since 1.0.0
 */
public enum AlertType {
    /** Code drifted away from its specification. */
    DRIFT,
    /** A stable public API was broken. */
    API_BREAKING,
    /** A file repeatedly failed to scan. */
    SCAN_FAILURE
}
