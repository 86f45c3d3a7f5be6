package com.driftsentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Alert severity levels, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * @param other severity to compare against
     * @return {@code true} if this severity is the same as or above {@code other}
     */
    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parse a severity name case-insensitively.
     *
     * @param value severity name, e.g. {@code "warning"}
     * @return the severity
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AlertSeverity parse(String value) {
        Objects.requireNonNull(value, "Severity must not be null");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alert severity: '" + value
                    + "'. Supported: info, warning, error, critical", e);
        }
    }
}
