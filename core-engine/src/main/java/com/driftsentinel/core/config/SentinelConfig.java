package com.driftsentinel.core.config;

import com.driftsentinel.core.error.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for {@code drift-sentinel.yml}.
 *
 * <pre>
 * monitor:
 *   scanIntervalSeconds: 60
 * detection:
 *   minConfidence: 0.5
 * alerting:
 *   rules:
 *     - name: all
 *       channels: [log]
 * channels:
 *   - name: log
 *     type: log
 * realignment:
 *   enricherTimeoutMs: 10000
 * </pre>
 *
 * <p>
 * Every section is optional and defaults sensibly. Call {@link #validate()}
 * after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    private MonitorProperties monitor = new MonitorProperties();

    private DetectionSettings detection = new DetectionSettings();

    private AlertingConfig alerting = new AlertingConfig();

    private List<ChannelConfig> channels = new ArrayList<>();

    private RealignmentSettings realignment = new RealignmentSettings();

    /**
     * Validate every section and cross-check that rules only reference
     * declared channels.
     *
     * @throws ConfigException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            monitor.toMonitorConfig().validate();
        } catch (ConfigException e) {
            errors.add(e.getMessage());
        }
        try {
            detection.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        try {
            alerting.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < channels.size(); i++) {
            ChannelConfig channel = Objects.requireNonNull(channels.get(i), "Channel at index " + i + " is null");
            if (channel.getName() == null || channel.getName().isBlank()) {
                errors.add("Channel at index " + i + " requires 'name'");
            } else if (!names.add(channel.getName())) {
                errors.add("Duplicate channel name: '" + channel.getName() + "'");
            }
            if (channel.getType() == null || channel.getType().isBlank()) {
                errors.add("Channel '" + channel.getName() + "' requires 'type'");
            }
        }
        for (AlertRule rule : alerting.getRules()) {
            for (String channel : rule.getChannels()) {
                if (!names.contains(channel)) {
                    errors.add("Alert rule '" + rule.getName() + "' references undeclared channel '" + channel + "'");
                }
            }
        }
        if (realignment.getEnricherTimeoutMs() <= 0) {
            errors.add("realignment.enricherTimeoutMs must be > 0");
        }

        if (!errors.isEmpty()) {
            throw new ConfigException("Configuration validation failed:\n  - "
                    + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public MonitorProperties getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorProperties monitor) {
        this.monitor = monitor != null ? monitor : new MonitorProperties();
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public AlertingConfig getAlerting() {
        return alerting;
    }

    public void setAlerting(AlertingConfig alerting) {
        this.alerting = alerting != null ? alerting : new AlertingConfig();
    }

    public List<ChannelConfig> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public void setChannels(List<ChannelConfig> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public RealignmentSettings getRealignment() {
        return realignment;
    }

    public void setRealignment(RealignmentSettings realignment) {
        this.realignment = realignment != null ? realignment : new RealignmentSettings();
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "monitor=" + monitor +
                ", detection=" + detection +
                ", alerting=" + alerting +
                ", channels=" + channels +
                ", realignment=" + realignment +
                '}';
    }
}
