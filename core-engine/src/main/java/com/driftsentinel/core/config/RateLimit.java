package com.driftsentinel.core.config;

import com.driftsentinel.core.model.AlertType;

import java.util.Locale;

/**
 * Dispatch ceiling for one alert type. A limit of {@code 0} disables that
 * window.
 *
 * @since 1.0.0
 */
public class RateLimit {

    private String type;

    private int perMinute;

    private int perHour;

    public AlertType alertType() {
        return AlertType.valueOf(type.trim().toUpperCase(Locale.ROOT));
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public int getPerMinute() {
        return perMinute;
    }

    public void setPerMinute(int perMinute) {
        this.perMinute = perMinute;
    }

    public int getPerHour() {
        return perHour;
    }

    public void setPerHour(int perHour) {
        this.perHour = perHour;
    }

    @Override
    public String toString() {
        return "RateLimit{type='" + type + "', perMinute=" + perMinute + ", perHour=" + perHour + '}';
    }
}
