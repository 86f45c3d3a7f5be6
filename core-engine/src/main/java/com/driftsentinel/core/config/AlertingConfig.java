package com.driftsentinel.core.config;

import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@code alerting:} section: routing rules, suppression default, rate limits,
 * per-channel dispatch timeout and the alert store location.
 *
 * <pre>
 * alerting:
 *   defaultSuppressionWindowSeconds: 300
 *   dispatchTimeoutMs: 5000
 *   storePath: .drift-sentinel/alerts.json
 *   rules:
 *     - name: everything-to-log
 *       channels: [log]
 *   rateLimits:
 *     - type: drift
 *       perMinute: 30
 * </pre>
 *
 * @since 1.0.0
 */
public class AlertingConfig {

    private List<AlertRule> rules = new ArrayList<>();

    private List<RateLimit> rateLimits = new ArrayList<>();

    private long defaultSuppressionWindowSeconds = 300;

    private long dispatchTimeoutMs = 5_000;

    /** {@code null} keeps alerts in memory only. */
    private String storePath;

    /**
     * @return the channels subscribed to an alert of this type and severity,
     *         in rule order, without duplicates
     */
    public Set<String> channelsFor(AlertType type, AlertSeverity severity) {
        Set<String> channels = new LinkedHashSet<>();
        for (AlertRule rule : rules) {
            if (rule.matches(type, severity)) {
                channels.addAll(rule.getChannels());
            }
        }
        return channels;
    }

    /**
     * @return the largest window among matching rules, else the default window
     */
    public Duration suppressionWindowFor(AlertType type, AlertSeverity severity) {
        long seconds = -1;
        for (AlertRule rule : rules) {
            if (rule.matches(type, severity)) {
                seconds = Math.max(seconds, rule.getSuppressionWindowSeconds());
            }
        }
        return Duration.ofSeconds(seconds >= 0 ? seconds : defaultSuppressionWindowSeconds);
    }

    public Optional<RateLimit> rateLimitFor(AlertType type) {
        return rateLimits.stream().filter(limit -> limit.alertType() == type).findFirst();
    }

    /**
     * Validate every rule and limit, collecting all errors.
     *
     * @throws IllegalStateException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < rules.size(); i++) {
            AlertRule rule = Objects.requireNonNull(rules.get(i), "Alert rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }
        for (RateLimit limit : rateLimits) {
            try {
                limit.alertType();
            } catch (RuntimeException e) {
                errors.add("Unknown alert type in rateLimits: '" + limit.getType() + "'");
            }
            if (limit.getPerMinute() < 0 || limit.getPerHour() < 0) {
                errors.add("Rate limit for '" + limit.getType() + "' must not be negative");
            }
        }
        if (defaultSuppressionWindowSeconds < 0) {
            errors.add("defaultSuppressionWindowSeconds must be >= 0, got: " + defaultSuppressionWindowSeconds);
        }
        if (dispatchTimeoutMs <= 0) {
            errors.add("dispatchTimeoutMs must be > 0, got: " + dispatchTimeoutMs);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<AlertRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<AlertRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public List<RateLimit> getRateLimits() {
        return Collections.unmodifiableList(rateLimits);
    }

    public void setRateLimits(List<RateLimit> rateLimits) {
        this.rateLimits = rateLimits != null ? new ArrayList<>(rateLimits) : new ArrayList<>();
    }

    public long getDefaultSuppressionWindowSeconds() {
        return defaultSuppressionWindowSeconds;
    }

    public void setDefaultSuppressionWindowSeconds(long defaultSuppressionWindowSeconds) {
        this.defaultSuppressionWindowSeconds = defaultSuppressionWindowSeconds;
    }

    public long getDispatchTimeoutMs() {
        return dispatchTimeoutMs;
    }

    public void setDispatchTimeoutMs(long dispatchTimeoutMs) {
        this.dispatchTimeoutMs = dispatchTimeoutMs;
    }

    public String getStorePath() {
        return storePath;
    }

    public void setStorePath(String storePath) {
        this.storePath = storePath;
    }

    @Override
    public String toString() {
        return "AlertingConfig{" +
                "rules=" + rules +
                ", rateLimits=" + rateLimits +
                ", defaultSuppressionWindowSeconds=" + defaultSuppressionWindowSeconds +
                ", dispatchTimeoutMs=" + dispatchTimeoutMs +
                ", storePath='" + storePath + '\'' +
                '}';
    }
}
