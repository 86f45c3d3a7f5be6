package com.driftsentinel.core.error;

/**
 * Thrown when an operation references an alert id the store does not know.
 */
public class AlertNotFoundException extends DriftSentinelException {

    private static final long serialVersionUID = 1L;

    private final String alertId;

    public AlertNotFoundException(String alertId) {
        super(ErrorCode.ALERT_NOT_FOUND, "Alert not found: " + alertId);
        this.alertId = alertId;
    }

    public String getAlertId() {
        return alertId;
    }
}
