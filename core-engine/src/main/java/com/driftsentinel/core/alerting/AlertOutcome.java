package com.driftsentinel.core.alerting;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DeliveryResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of {@link AlertSystem#createAlert(AlertEvent)}.
 *
 * <p>
 * {@link Status#SUPPRESSED} means the occurrence was folded into an open alert
 * inside its suppression window and nothing was delivered.
 * {@link Status#REDELIVERED} means an open alert was delivered again because
 * the window had expired; the alert id is unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertOutcome {

    public enum Status {
        CREATED,
        REDELIVERED,
        SUPPRESSED
    }

    private final Status status;
    private final Alert alert;
    private final Map<String, DeliveryResult> deliveries;

    AlertOutcome(Status status, Alert alert, Map<String, DeliveryResult> deliveries) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.deliveries = Collections.unmodifiableMap(new LinkedHashMap<>(deliveries));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuppressed() {
        return status == Status.SUPPRESSED;
    }

    /**
     * @return snapshot of the alert after this occurrence was recorded
     */
    public Alert getAlert() {
        return alert;
    }

    /**
     * @return per-channel results of this occurrence's delivery; empty when
     *         suppressed, rate limited or no channel is subscribed
     */
    public Map<String, DeliveryResult> getDeliveries() {
        return deliveries;
    }

    @Override
    public String toString() {
        return "AlertOutcome{status=" + status + ", alertId='" + alert.getId() + "', deliveries="
                + deliveries.keySet() + '}';
    }
}
