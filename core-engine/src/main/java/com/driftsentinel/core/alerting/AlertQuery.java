package com.driftsentinel.core.alerting;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;

/**
 * Filter for {@link AlertSystem#list(AlertQuery)}. Unset criteria match
 * everything.
 *
 * @since 1.0.0
 */
public final class AlertQuery {

    private static final AlertQuery ALL = builder().build();

    private final Boolean resolved;
    private final AlertSeverity minSeverity;
    private final AlertType type;
    private final String filePath;

    private AlertQuery(Builder builder) {
        this.resolved = builder.resolved;
        this.minSeverity = builder.minSeverity;
        this.type = builder.type;
        this.filePath = builder.filePath;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AlertQuery all() {
        return ALL;
    }

    public static AlertQuery open() {
        return builder().resolved(false).build();
    }

    public boolean matches(Alert alert) {
        if (resolved != null && alert.isResolved() != resolved) {
            return false;
        }
        if (minSeverity != null && !alert.getSeverity().isAtLeast(minSeverity)) {
            return false;
        }
        if (type != null && alert.getType() != type) {
            return false;
        }
        return filePath == null || filePath.equals(alert.getFilePath());
    }

    public Boolean getResolved() {
        return resolved;
    }

    public AlertSeverity getMinSeverity() {
        return minSeverity;
    }

    public AlertType getType() {
        return type;
    }

    public String getFilePath() {
        return filePath;
    }

    public static class Builder {
        private Boolean resolved;
        private AlertSeverity minSeverity;
        private AlertType type;
        private String filePath;

        public Builder resolved(Boolean resolved) {
            this.resolved = resolved;
            return this;
        }

        public Builder minSeverity(AlertSeverity minSeverity) {
            this.minSeverity = minSeverity;
            return this;
        }

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public AlertQuery build() {
            return new AlertQuery(this);
        }
    }

    @Override
    public String toString() {
        return "AlertQuery{resolved=" + resolved + ", minSeverity=" + minSeverity + ", type=" + type
                + ", filePath='" + filePath + "'}";
    }
}
