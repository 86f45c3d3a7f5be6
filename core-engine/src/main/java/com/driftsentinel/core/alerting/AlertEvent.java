package com.driftsentinel.core.alerting;

import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.DriftItem;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.DriftSeverity;
import com.driftsentinel.core.model.DriftType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A detection result offered to {@link AlertSystem#createAlert(AlertEvent)}.
 *
 * <p>
 * Drift reports become one event per drift type, so that all items of one
 * type in one file share a fingerprint and are suppressed together.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertEvent {

    /** Context keys written for drift alerts and read back by the realignment engine. */
    public static final String CTX_ELEMENTS = "elements";
    public static final String CTX_DRIFT_SEVERITY = "driftSeverity";
    public static final String CTX_DESCRIPTION = "description";
    public static final String CTX_EXPECTED = "expected";
    public static final String CTX_ACTUAL = "actual";
    public static final String CTX_LINE = "lineNumber";
    public static final String CTX_CONFIDENCE = "confidence";
    public static final String CTX_ITEM_COUNT = "itemCount";
    public static final String CTX_ATTEMPTS = "attempts";
    public static final String CTX_ERROR = "error";

    private final AlertType type;
    private final AlertSeverity severity;
    private final String title;
    private final String message;
    private final String filePath;
    private final String specReference;
    private final DriftType driftType;
    private final Map<String, String> context;

    private AlertEvent(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.title = builder.title != null ? builder.title : builder.type.name();
        this.message = builder.message;
        this.filePath = builder.filePath;
        this.specReference = builder.specReference;
        this.driftType = builder.driftType;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Split a report into one event per drift type, in {@link DriftType}
     * declaration order.
     *
     * @param report drift report; an empty report yields no events
     * @return events for every drift type present
     */
    public static List<AlertEvent> fromReport(DriftReport report) {
        Map<DriftType, List<DriftItem>> byType = new EnumMap<>(DriftType.class);
        for (DriftItem item : report.getItems()) {
            byType.computeIfAbsent(item.getDriftType(), t -> new ArrayList<>()).add(item);
        }
        List<AlertEvent> events = new ArrayList<>(byType.size());
        for (Map.Entry<DriftType, List<DriftItem>> entry : byType.entrySet()) {
            events.add(forDrift(report, entry.getKey(), entry.getValue()));
        }
        return events;
    }

    private static AlertEvent forDrift(DriftReport report, DriftType driftType, List<DriftItem> items) {
        DriftItem worst = items.stream()
                .max(Comparator.comparing(DriftItem::getSeverity)
                        .thenComparingDouble(DriftItem::getConfidence))
                .orElseThrow();
        DriftSeverity severity = worst.getSeverity();

        Map<String, String> context = new LinkedHashMap<>();
        context.put(CTX_ELEMENTS, items.stream().map(DriftItem::getElementId).collect(Collectors.joining(",")));
        context.put(CTX_DRIFT_SEVERITY, severity.name());
        context.put(CTX_ITEM_COUNT, String.valueOf(items.size()));
        context.put(CTX_DESCRIPTION, worst.getDescription());
        context.put(CTX_CONFIDENCE, String.valueOf(worst.getConfidence()));
        if (worst.getExpected() != null) {
            context.put(CTX_EXPECTED, worst.getExpected());
        }
        if (worst.getActual() != null) {
            context.put(CTX_ACTUAL, worst.getActual());
        }
        if (worst.getLineNumber() != null) {
            context.put(CTX_LINE, String.valueOf(worst.getLineNumber()));
        }

        String message = items.size() == 1
                ? worst.getDescription()
                : items.size() + " elements affected; worst: " + worst.getDescription();

        return builder()
                .type(driftType == DriftType.API_BREAKING_CHANGE ? AlertType.API_BREAKING : AlertType.DRIFT)
                .severity(severity.toAlertSeverity())
                .title(driftType.name() + " in " + report.getFilePath())
                .message(message)
                .filePath(report.getFilePath())
                .specReference(report.getSpecReference())
                .driftType(driftType)
                .context(context)
                .build();
    }

    /**
     * @param filePath file that could not be scanned
     * @param attempts number of failed attempts
     * @param error    last failure message
     * @return an ERROR-severity scan failure event
     */
    public static AlertEvent scanFailure(String filePath, int attempts, String error) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(CTX_ATTEMPTS, String.valueOf(attempts));
        context.put(CTX_ERROR, Objects.toString(error, "unknown"));
        return builder()
                .type(AlertType.SCAN_FAILURE)
                .severity(AlertSeverity.ERROR)
                .title("Scan failed for " + filePath)
                .message("Giving up after " + attempts + " attempt(s): " + error)
                .filePath(filePath)
                .context(context)
                .build();
    }

    public String fingerprint() {
        return AlertFingerprint.of(type, filePath, specReference, driftType);
    }

    public AlertType getType() {
        return type;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public String getFilePath() {
        return filePath;
    }

    public String getSpecReference() {
        return specReference;
    }

    public DriftType getDriftType() {
        return driftType;
    }

    public Map<String, String> getContext() {
        return context;
    }

    /**
     * Fluent builder for {@link AlertEvent}.
     */
    public static class Builder {
        private AlertType type;
        private AlertSeverity severity;
        private String title;
        private String message;
        private String filePath;
        private String specReference;
        private DriftType driftType;
        private Map<String, String> context = new LinkedHashMap<>();

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder specReference(String specReference) {
            this.specReference = specReference;
            return this;
        }

        public Builder driftType(DriftType driftType) {
            this.driftType = driftType;
            return this;
        }

        public Builder context(Map<String, String> context) {
            this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
            return this;
        }

        public AlertEvent build() {
            return new AlertEvent(this);
        }
    }

    @Override
    public String toString() {
        return "AlertEvent{type=" + type + ", severity=" + severity + ", filePath='" + filePath
                + "', driftType=" + driftType + '}';
    }
}
