package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.error.ChannelDeliveryException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DeliveryResult;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sends alerts as plain-text mail over SMTP.
 *
 * @since 1.0.0
 */
public class EmailChannel implements ChannelHandler {

    private final String name;
    private final Session session;
    private final String from;
    private final List<String> recipients;
    private final String subjectPrefix;

    public EmailChannel(String name, Session session, String from, List<String> recipients, String subjectPrefix) {
        this.name = Objects.requireNonNull(name, "Channel name must not be null");
        this.session = Objects.requireNonNull(session, "Mail session must not be null");
        this.from = Objects.requireNonNull(from, "Sender must not be null");
        if (recipients == null || recipients.isEmpty()) {
            throw new IllegalArgumentException("Email channel '" + name + "' requires at least one recipient");
        }
        this.recipients = List.copyOf(recipients);
        this.subjectPrefix = subjectPrefix != null ? subjectPrefix : "[drift-sentinel]";
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        try {
            transport(buildMessage(alert));
        } catch (MessagingException e) {
            throw new ChannelDeliveryException("Failed to send alert " + alert.getId() + " by mail: "
                    + e.getMessage(), e);
        }
        return DeliveryResult.success(name);
    }

    MimeMessage buildMessage(Alert alert) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(from));
        for (String recipient : recipients) {
            message.addRecipient(Message.RecipientType.TO, new InternetAddress(recipient));
        }
        message.setSubject(subjectPrefix + " " + alert.getSeverity() + ": "
                + (alert.getTitle() != null ? alert.getTitle() : alert.getType().name()));
        message.setSentDate(Date.from(alert.getLastOccurrenceAt() != null
                ? alert.getLastOccurrenceAt() : alert.getCreatedAt()));
        message.setText(body(alert), "UTF-8");
        return message;
    }

    /** Hands the message to the SMTP transport. */
    void transport(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    private static String body(Alert alert) {
        StringBuilder sb = new StringBuilder()
                .append(alert.formatText()).append("\n\n")
                .append("Alert id: ").append(alert.getId()).append('\n')
                .append("Created: ").append(alert.getCreatedAt()).append('\n')
                .append("Occurrences: ").append(alert.getOccurrenceCount()).append('\n');
        if (alert.getSpecReference() != null) {
            sb.append("Specification: ").append(alert.getSpecReference()).append('\n');
        }
        for (Map.Entry<String, String> entry : alert.getContext().entrySet()) {
            sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }

    public List<String> getRecipients() {
        return recipients;
    }
}
