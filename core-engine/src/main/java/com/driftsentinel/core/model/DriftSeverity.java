package com.driftsentinel.core.model;

/**
 * Severity of a single {@link DriftItem}, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum DriftSeverity {
    LOW(2, AlertSeverity.INFO),
    MEDIUM(3, AlertSeverity.WARNING),
    HIGH(4, AlertSeverity.ERROR),
    CRITICAL(5, AlertSeverity.CRITICAL);

    private final int priority;
    private final AlertSeverity alertSeverity;

    DriftSeverity(int priority, AlertSeverity alertSeverity) {
        this.priority = priority;
        this.alertSeverity = alertSeverity;
    }

    /**
     * @return suggestion priority (1 to 5) derived from this severity
     */
    public int toPriority() {
        return priority;
    }

    /**
     * @return the alert severity raised for drift of this severity
     */
    public AlertSeverity toAlertSeverity() {
        return alertSeverity;
    }
}
