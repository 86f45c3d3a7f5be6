package com.driftsentinel.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declares one notification channel instance. The {@code settings} map is
 * interpreted by the channel type, e.g. {@code url} for a webhook or
 * {@code path} for a file channel.
 *
 * <pre>
 * channels:
 *   - name: ops-hook
 *     type: webhook
 *     settings:
 *       url: https://hooks.example.com/drift
 *       timeoutMs: 3000
 * </pre>
 *
 * @since 1.0.0
 */
public class ChannelConfig {

    private String name;

    /** One of {@code log}, {@code console}, {@code file}, {@code webhook}, {@code email}. */
    private String type;

    private Map<String, Object> settings = new LinkedHashMap<>();

    public ChannelConfig() {
    }

    public ChannelConfig(String name, String type, Map<String, Object> settings) {
        this.name = name;
        this.type = type;
        setSettings(settings);
    }

    /**
     * @param key setting name
     * @return the setting rendered as a string, or {@code null} if absent
     */
    public String setting(String key) {
        Object value = settings.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    public String setting(String key, String defaultValue) {
        String value = setting(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    /**
     * @throws IllegalStateException if the setting is present but not an integer
     */
    public long longSetting(String key, long defaultValue) {
        String value = setting(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Channel '" + name + "' setting '" + key
                    + "' must be an integer, got: '" + value + "'", e);
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Map<String, Object> getSettings() {
        return Collections.unmodifiableMap(settings);
    }

    public void setSettings(Map<String, Object> settings) {
        this.settings = settings != null ? new LinkedHashMap<>(settings) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "ChannelConfig{name='" + name + "', type='" + type + "', settings=" + settings.keySet() + '}';
    }
}
