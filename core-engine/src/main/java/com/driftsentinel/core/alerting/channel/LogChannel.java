package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Writes alerts to the {@code com.driftsentinel.alerts} logger, at WARN for
 * warnings, ERROR for errors and critical alerts, INFO otherwise.
 *
 * @since 1.0.0
 */
public class LogChannel implements ChannelHandler {

    private static final Logger ALERTS = LoggerFactory.getLogger("com.driftsentinel.alerts");

    private final String name;

    public LogChannel(String name) {
        this.name = Objects.requireNonNull(name, "Channel name must not be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        String text = alert.formatText();
        switch (alert.getSeverity()) {
            case CRITICAL, ERROR -> ALERTS.error("{} [id={}, occurrences={}]", text, alert.getId(),
                    alert.getOccurrenceCount());
            case WARNING -> ALERTS.warn("{} [id={}, occurrences={}]", text, alert.getId(),
                    alert.getOccurrenceCount());
            default -> ALERTS.info("{} [id={}, occurrences={}]", text, alert.getId(),
                    alert.getOccurrenceCount());
        }
        return DeliveryResult.success(name);
    }
}
