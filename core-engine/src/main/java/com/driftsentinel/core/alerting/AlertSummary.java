package com.driftsentinel.core.alerting;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts over the alert store, as returned by
 * {@link AlertSystem#summary()}.
 *
 * @since 1.0.0
 */
public final class AlertSummary {

    private final int total;
    private final int open;
    private final int resolved;
    private final Map<AlertSeverity, Integer> bySeverity;
    private final Map<AlertType, Integer> byType;
    private final long totalOccurrences;

    private AlertSummary(int total, int open, Map<AlertSeverity, Integer> bySeverity,
            Map<AlertType, Integer> byType, long totalOccurrences) {
        this.total = total;
        this.open = open;
        this.resolved = total - open;
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
        this.byType = Collections.unmodifiableMap(byType);
        this.totalOccurrences = totalOccurrences;
    }

    static AlertSummary of(Collection<Alert> alerts) {
        int open = 0;
        long occurrences = 0;
        Map<AlertSeverity, Integer> bySeverity = new EnumMap<>(AlertSeverity.class);
        Map<AlertType, Integer> byType = new EnumMap<>(AlertType.class);
        for (Alert alert : alerts) {
            if (!alert.isResolved()) {
                open++;
            }
            occurrences += alert.getOccurrenceCount();
            bySeverity.merge(alert.getSeverity(), 1, Integer::sum);
            byType.merge(alert.getType(), 1, Integer::sum);
        }
        return new AlertSummary(alerts.size(), open, bySeverity, byType, occurrences);
    }

    public int getTotal() {
        return total;
    }

    public int getOpen() {
        return open;
    }

    public int getResolved() {
        return resolved;
    }

    public Map<AlertSeverity, Integer> getBySeverity() {
        return bySeverity;
    }

    public Map<AlertType, Integer> getByType() {
        return byType;
    }

    public long getTotalOccurrences() {
        return totalOccurrences;
    }

    @Override
    public String toString() {
        return "AlertSummary{total=" + total + ", open=" + open + ", resolved=" + resolved
                + ", bySeverity=" + bySeverity + ", byType=" + byType
                + ", totalOccurrences=" + totalOccurrences + '}';
    }
}
