package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted, de-duplicated notification about detected drift.
 *
 * <p>
 * Serialized to JSON by the alert store and by the file and webhook channels.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code createdAt}, {@code type},
 * {@code severity} and a non-blank {@code fingerprint} are required; omitting
 * them throws at build time.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are <strong>not</strong> thread-safe. The alert system only mutates
 * the stored instance while holding its store lock and hands channels an
 * independent {@link #copy()}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Alert {

    private String id;

    private Instant createdAt;

    private AlertType type;

    private AlertSeverity severity;

    private String title;

    private String message;

    /** Free-form key/value context, e.g. element id and drift details. */
    private Map<String, String> context = new LinkedHashMap<>();

    /** Stable de-duplication key (type + file + spec + drift type). */
    private String fingerprint;

    private String filePath;

    private String specReference;

    private DriftType driftType;

    /** Number of times this fingerprint has occurred while the alert was open. */
    private int occurrenceCount = 1;

    private Instant lastOccurrenceAt;

    /** Last time the alert was handed to its channels; {@code null} if never. */
    private Instant lastDeliveredAt;

    private int deliveryCount;

    private boolean resolved;

    private Instant resolvedAt;

    private String resolutionNote;

    /** Latest delivery outcome per channel name. */
    private Map<String, DeliveryResult> deliveryLog = new LinkedHashMap<>();

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        if (builder.fingerprint == null || builder.fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint must not be null or blank");
        }
        this.fingerprint = builder.fingerprint;
        this.title = builder.title;
        this.message = builder.message;
        this.context = builder.context != null ? new LinkedHashMap<>(builder.context) : new LinkedHashMap<>();
        this.filePath = builder.filePath;
        this.specReference = builder.specReference;
        this.driftType = builder.driftType;
        this.lastOccurrenceAt = builder.createdAt;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private Instant createdAt;
        private AlertType type;
        private AlertSeverity severity;
        private String title;
        private String message;
        private Map<String, String> context;
        private String fingerprint;
        private String filePath;
        private String specReference;
        private DriftType driftType;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

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

        public Builder context(Map<String, String> context) {
            this.context = context;
            return this;
        }

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
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

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Record another occurrence of this alert's fingerprint.
     *
     * @param at occurrence time
     */
    public void recordOccurrence(Instant at) {
        occurrenceCount++;
        lastOccurrenceAt = at;
    }

    /**
     * Record that the alert was handed to its channels.
     *
     * @param at      delivery time
     * @param results per-channel outcomes
     */
    public void recordDelivery(Instant at, Map<String, DeliveryResult> results) {
        lastDeliveredAt = at;
        deliveryCount++;
        deliveryLog.putAll(results);
    }

    /**
     * Mark resolved. Has no effect if the alert is already resolved.
     *
     * @param at   resolution time
     * @param note operator note; may be {@code null}
     * @return {@code true} if this call changed the state
     */
    public boolean resolve(Instant at, String note) {
        if (resolved) {
            return false;
        }
        resolved = true;
        resolvedAt = at;
        resolutionNote = note;
        return true;
    }

    /**
     * @return an independent deep copy, safe to hand to other threads
     */
    public Alert copy() {
        Alert copy = new Alert();
        copy.id = id;
        copy.createdAt = createdAt;
        copy.type = type;
        copy.severity = severity;
        copy.title = title;
        copy.message = message;
        copy.context = new LinkedHashMap<>(context);
        copy.fingerprint = fingerprint;
        copy.filePath = filePath;
        copy.specReference = specReference;
        copy.driftType = driftType;
        copy.occurrenceCount = occurrenceCount;
        copy.lastOccurrenceAt = lastOccurrenceAt;
        copy.lastDeliveredAt = lastDeliveredAt;
        copy.deliveryCount = deliveryCount;
        copy.resolved = resolved;
        copy.resolvedAt = resolvedAt;
        copy.resolutionNote = resolutionNote;
        copy.deliveryLog = new LinkedHashMap<>(deliveryLog);
        return copy;
    }

    /**
     * @return one-line text rendering used by the log and console channels
     */
    @JsonIgnore
    public String formatText() {
        StringBuilder sb = new StringBuilder()
                .append('[').append(severity).append("] ")
                .append(title != null ? title : type.name());
        if (message != null && !message.isBlank()) {
            sb.append(" - ").append(message);
        }
        if (filePath != null) {
            sb.append(" (").append(filePath).append(')');
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public AlertType getType() {
        return type;
    }

    public void setType(AlertType type) {
        this.type = type;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public void setSeverity(AlertSeverity severity) {
        this.severity = severity;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * @return unmodifiable view of the context map
     */
    public Map<String, String> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public void setContext(Map<String, String> context) {
        this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public String getSpecReference() {
        return specReference;
    }

    public void setSpecReference(String specReference) {
        this.specReference = specReference;
    }

    public DriftType getDriftType() {
        return driftType;
    }

    public void setDriftType(DriftType driftType) {
        this.driftType = driftType;
    }

    public int getOccurrenceCount() {
        return occurrenceCount;
    }

    public void setOccurrenceCount(int occurrenceCount) {
        this.occurrenceCount = occurrenceCount;
    }

    public Instant getLastOccurrenceAt() {
        return lastOccurrenceAt;
    }

    public void setLastOccurrenceAt(Instant lastOccurrenceAt) {
        this.lastOccurrenceAt = lastOccurrenceAt;
    }

    public Instant getLastDeliveredAt() {
        return lastDeliveredAt;
    }

    public void setLastDeliveredAt(Instant lastDeliveredAt) {
        this.lastDeliveredAt = lastDeliveredAt;
    }

    public int getDeliveryCount() {
        return deliveryCount;
    }

    public void setDeliveryCount(int deliveryCount) {
        this.deliveryCount = deliveryCount;
    }

    public boolean isResolved() {
        return resolved;
    }

    public void setResolved(boolean resolved) {
        this.resolved = resolved;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public String getResolutionNote() {
        return resolutionNote;
    }

    public void setResolutionNote(String resolutionNote) {
        this.resolutionNote = resolutionNote;
    }

    /**
     * @return unmodifiable view of the per-channel delivery log
     */
    public Map<String, DeliveryResult> getDeliveryLog() {
        return Collections.unmodifiableMap(deliveryLog);
    }

    public void setDeliveryLog(Map<String, DeliveryResult> deliveryLog) {
        this.deliveryLog = deliveryLog != null ? new LinkedHashMap<>(deliveryLog) : new LinkedHashMap<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", title='" + title + '\'' +
                ", occurrenceCount=" + occurrenceCount +
                ", resolved=" + resolved +
                '}';
    }
}
