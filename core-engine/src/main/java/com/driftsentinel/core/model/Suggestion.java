package com.driftsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A ranked corrective action for detected drift.
 *
 * <p>
 * Suggestions are generated on demand and never persisted by the core.
 * {@code priority} and {@code effort} are in [1, 5], {@code confidence} in
 * [0, 1]; the builder rejects anything else.
 * </p>
 *
 * @since 1.0.0
 */
public final class Suggestion {

    private final SuggestionCategory category;
    private final String title;
    private final String description;
    private final int priority;
    private final int effort;
    private final double confidence;
    private final String filePath;
    private final Integer lineNumber;
    private final String codeSnippet;
    private final List<String> steps;
    private final SuggestionSource source;
    private final DriftType driftType;

    private Suggestion(Builder builder) {
        this.category = Objects.requireNonNull(builder.category, "category must not be null");
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.description = builder.description != null ? builder.description : "";
        this.priority = requireRange(builder.priority, "priority");
        this.effort = requireRange(builder.effort, "effort");
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + builder.confidence);
        }
        this.confidence = builder.confidence;
        this.filePath = builder.filePath;
        this.lineNumber = builder.lineNumber;
        this.codeSnippet = builder.codeSnippet;
        this.steps = Collections.unmodifiableList(new ArrayList<>(builder.steps));
        this.source = builder.source != null ? builder.source : SuggestionSource.RULE;
        this.driftType = builder.driftType;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Suggestion}.
     */
    public static class Builder {
        private SuggestionCategory category;
        private String title;
        private String description;
        private int priority = 3;
        private int effort = 3;
        private double confidence = 0.5;
        private String filePath;
        private Integer lineNumber;
        private String codeSnippet;
        private List<String> steps = new ArrayList<>();
        private SuggestionSource source;
        private DriftType driftType;

        public Builder category(SuggestionCategory category) {
            this.category = category;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder effort(int effort) {
            this.effort = effort;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder lineNumber(Integer lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder codeSnippet(String codeSnippet) {
            this.codeSnippet = codeSnippet;
            return this;
        }

        public Builder steps(List<String> steps) {
            this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>();
            return this;
        }

        public Builder source(SuggestionSource source) {
            this.source = source;
            return this;
        }

        public Builder driftType(DriftType driftType) {
            this.driftType = driftType;
            return this;
        }

        public Suggestion build() {
            return new Suggestion(this);
        }
    }

    /**
     * @return a builder pre-populated with this suggestion's values
     */
    public Builder toBuilder() {
        return new Builder()
                .category(category)
                .title(title)
                .description(description)
                .priority(priority)
                .effort(effort)
                .confidence(confidence)
                .filePath(filePath)
                .lineNumber(lineNumber)
                .codeSnippet(codeSnippet)
                .steps(steps)
                .source(source)
                .driftType(driftType);
    }

    public SuggestionCategory getCategory() {
        return category;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public int getPriority() {
        return priority;
    }

    public int getEffort() {
        return effort;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getFilePath() {
        return filePath;
    }

    public Integer getLineNumber() {
        return lineNumber;
    }

    public String getCodeSnippet() {
        return codeSnippet;
    }

    public List<String> getSteps() {
        return steps;
    }

    public SuggestionSource getSource() {
        return source;
    }

    public DriftType getDriftType() {
        return driftType;
    }

    private static int requireRange(int value, String name) {
        if (value < 1 || value > 5) {
            throw new IllegalArgumentException(name + " must be in [1, 5], got: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Suggestion that))
            return false;
        return priority == that.priority
                && effort == that.effort
                && Double.compare(confidence, that.confidence) == 0
                && category == that.category
                && title.equals(that.title)
                && description.equals(that.description)
                && Objects.equals(filePath, that.filePath)
                && Objects.equals(lineNumber, that.lineNumber)
                && Objects.equals(codeSnippet, that.codeSnippet)
                && steps.equals(that.steps)
                && source == that.source
                && driftType == that.driftType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, title, description, priority, effort, confidence,
                filePath, lineNumber, codeSnippet, steps, source, driftType);
    }

    @Override
    public String toString() {
        return "Suggestion{" +
                "category=" + category +
                ", title='" + title + '\'' +
                ", priority=" + priority +
                ", effort=" + effort +
                ", confidence=" + confidence +
                ", source=" + source +
                '}';
    }
}
