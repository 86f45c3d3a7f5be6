package com.driftsentinel.core.config;

import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Routes alerts of given types and at or above a minimum severity to a set of
 * channels, and declares how long repeated occurrences stay suppressed.
 *
 * <pre>
 * rules:
 *   - name: breaking-to-webhook
 *     types: [api_breaking]
 *     minSeverity: warning
 *     channels: [webhook, log]
 *     suppressionWindowSeconds: 600
 * </pre>
 *
 * <p>
 * An empty {@code types} list matches every alert type.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRule {

    private String name;

    private List<String> types = new ArrayList<>();

    private String minSeverity = "info";

    private List<String> channels = new ArrayList<>();

    private long suppressionWindowSeconds = 300;

    /**
     * @param type     alert type
     * @param severity alert severity
     * @return {@code true} if this rule subscribes its channels to the alert
     */
    public boolean matches(AlertType type, AlertSeverity severity) {
        if (!severity.isAtLeast(minimumSeverity())) {
            return false;
        }
        if (types.isEmpty()) {
            return true;
        }
        for (String t : types) {
            if (t.trim().toUpperCase(Locale.ROOT).equals(type.name())) {
                return true;
            }
        }
        return false;
    }

    public AlertSeverity minimumSeverity() {
        return AlertSeverity.parse(minSeverity);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the rule is incomplete or names an
     *                               unknown type or severity
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Alert rule 'name' is required");
        }
        if (channels == null || channels.isEmpty()) {
            errors.add("Alert rule '" + name + "' requires at least one channel");
        }
        if (suppressionWindowSeconds < 0) {
            errors.add("Alert rule '" + name + "' requires 'suppressionWindowSeconds' >= 0");
        }
        try {
            AlertSeverity.parse(minSeverity);
        } catch (RuntimeException e) {
            errors.add("Alert rule '" + name + "': " + e.getMessage());
        }
        for (String t : types) {
            try {
                AlertType.valueOf(t.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                errors.add("Alert rule '" + name + "' has unknown type: '" + t
                        + "'. Supported: drift, api_breaking, scan_failure");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AlertRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getTypes() {
        return Collections.unmodifiableList(types);
    }

    public void setTypes(List<String> types) {
        this.types = types != null ? new ArrayList<>(types) : new ArrayList<>();
    }

    public String getMinSeverity() {
        return minSeverity;
    }

    public void setMinSeverity(String minSeverity) {
        this.minSeverity = minSeverity;
    }

    public List<String> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public void setChannels(List<String> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public long getSuppressionWindowSeconds() {
        return suppressionWindowSeconds;
    }

    public void setSuppressionWindowSeconds(long suppressionWindowSeconds) {
        this.suppressionWindowSeconds = suppressionWindowSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "name='" + name + '\'' +
                ", types=" + types +
                ", minSeverity='" + minSeverity + '\'' +
                ", channels=" + channels +
                ", suppressionWindowSeconds=" + suppressionWindowSeconds +
                '}';
    }
}
