package com.driftsentinel.core.model;

import java.util.Objects;

/**
 * One detected deviation, always tied to exactly one specification element.
 *
 * <p>
 * Use the {@link Builder}; {@code driftType}, {@code severity},
 * {@code elementId} and {@code description} are required and
 * {@code confidence} must be within [0, 1].
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftItem {

    private final DriftType driftType;
    private final DriftSeverity severity;
    private final String elementId;
    private final String description;
    private final double confidence;
    private final String expected;
    private final String actual;
    private final Integer lineNumber;

    private DriftItem(Builder builder) {
        this.driftType = Objects.requireNonNull(builder.driftType, "driftType must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.elementId = Objects.requireNonNull(builder.elementId, "elementId must not be null");
        this.description = Objects.requireNonNull(builder.description, "description must not be null");
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException(
                    "confidence must be in [0, 1], got: " + builder.confidence);
        }
        this.confidence = builder.confidence;
        this.expected = builder.expected;
        this.actual = builder.actual;
        this.lineNumber = builder.lineNumber;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DriftItem}.
     */
    public static class Builder {
        private DriftType driftType;
        private DriftSeverity severity;
        private String elementId;
        private String description;
        private double confidence = 1.0;
        private String expected;
        private String actual;
        private Integer lineNumber;

        public Builder driftType(DriftType driftType) {
            this.driftType = driftType;
            return this;
        }

        public Builder severity(DriftSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder elementId(String elementId) {
            this.elementId = elementId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder expected(String expected) {
            this.expected = expected;
            return this;
        }

        public Builder actual(String actual) {
            this.actual = actual;
            return this;
        }

        public Builder lineNumber(Integer lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public DriftItem build() {
            return new DriftItem(this);
        }
    }

    public DriftType getDriftType() {
        return driftType;
    }

    public DriftSeverity getSeverity() {
        return severity;
    }

    public String getElementId() {
        return elementId;
    }

    public String getDescription() {
        return description;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    public Integer getLineNumber() {
        return lineNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriftItem that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && driftType == that.driftType
                && severity == that.severity
                && elementId.equals(that.elementId)
                && description.equals(that.description)
                && Objects.equals(expected, that.expected)
                && Objects.equals(actual, that.actual)
                && Objects.equals(lineNumber, that.lineNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(driftType, severity, elementId, description, confidence,
                expected, actual, lineNumber);
    }

    @Override
    public String toString() {
        return "DriftItem{" +
                "driftType=" + driftType +
                ", severity=" + severity +
                ", elementId='" + elementId + '\'' +
                ", confidence=" + confidence +
                ", description='" + description + '\'' +
                '}';
    }
}
