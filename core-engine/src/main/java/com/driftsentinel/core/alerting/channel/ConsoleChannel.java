package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.error.ChannelDeliveryException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DeliveryResult;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints a human-readable block per alert.
 *
 * @since 1.0.0
 */
public class ConsoleChannel implements ChannelHandler {

    private final String name;
    private final PrintStream out;

    public ConsoleChannel(String name) {
        this(name, System.out);
    }

    public ConsoleChannel(String name, PrintStream out) {
        this.name = Objects.requireNonNull(name, "Channel name must not be null");
        this.out = Objects.requireNonNull(out, "PrintStream must not be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        StringBuilder sb = new StringBuilder()
                .append(alert.formatText()).append(System.lineSeparator())
                .append("  id: ").append(alert.getId()).append(System.lineSeparator())
                .append("  occurrences: ").append(alert.getOccurrenceCount()).append(System.lineSeparator());
        if (alert.getSpecReference() != null) {
            sb.append("  spec: ").append(alert.getSpecReference()).append(System.lineSeparator());
        }
        alert.getContext().forEach((k, v) -> sb.append("  ").append(k).append(": ").append(v)
                .append(System.lineSeparator()));

        synchronized (out) {
            out.print(sb);
            out.flush();
            if (out.checkError()) {
                throw new ChannelDeliveryException("Console stream reported an error");
            }
        }
        return DeliveryResult.success(name);
    }
}
