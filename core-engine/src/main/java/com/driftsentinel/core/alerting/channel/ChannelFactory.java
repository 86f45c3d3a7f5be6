package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.alerting.JsonSupport;
import com.driftsentinel.core.config.ChannelConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Creates {@link ChannelHandler} instances from {@link ChannelConfig} entries.
 *
 * <p>
 * This is the single point of extension when adding new channel types:
 * register the type string here and create the corresponding handler.
 * </p>
 *
 * <table>
 * <caption>Settings per type</caption>
 * <tr><td>{@code log}, {@code console}</td><td>none</td></tr>
 * <tr><td>{@code file}</td><td>{@code path}</td></tr>
 * <tr><td>{@code webhook}</td><td>{@code url}, {@code timeoutMs}</td></tr>
 * <tr><td>{@code email}</td><td>{@code host}, {@code port}, {@code from},
 * {@code to} (comma separated), {@code username}, {@code password},
 * {@code startTls}, {@code subjectPrefix}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class ChannelFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelFactory.class);

    private ChannelFactory() {
    }

    /**
     * @param config channel configuration; must not be {@code null}
     * @return a handler for the configured type
     * @throws IllegalArgumentException if the type is unknown or a required
     *                                  setting is missing
     */
    public static ChannelHandler create(ChannelConfig config) {
        return create(config, JsonSupport.newObjectMapper());
    }

    static ChannelHandler create(ChannelConfig config, ObjectMapper mapper) {
        Objects.requireNonNull(config, "ChannelConfig must not be null");
        Objects.requireNonNull(config.getType(), "Channel type must not be null");
        String name = Objects.requireNonNull(config.getName(), "Channel name must not be null");

        return switch (config.getType().toLowerCase(Locale.ROOT)) {
            case "log" -> new LogChannel(name);
            case "console" -> new ConsoleChannel(name);
            case "file" -> new FileChannel(name, Path.of(required(config, "path")), mapper);
            case "webhook" -> new WebhookChannel(name, URI.create(required(config, "url")),
                    Duration.ofMillis(config.longSetting("timeoutMs", 5_000)), mapper);
            case "email" -> createEmail(config);
            default -> throw new IllegalArgumentException(
                    "Unknown channel type: '" + config.getType()
                            + "'. Supported types: log, console, file, webhook, email");
        };
    }

    /**
     * Create handlers for every configured channel, keyed by channel name in
     * declaration order. The returned map is <strong>unmodifiable</strong>.
     *
     * @param configs channel configurations; must not be {@code null}
     * @return handlers by name
     */
    public static Map<String, ChannelHandler> createAll(List<ChannelConfig> configs) {
        Objects.requireNonNull(configs, "Channel configs must not be null");
        LOG.info("Creating {} notification channel(s) from configuration", configs.size());
        ObjectMapper mapper = JsonSupport.newObjectMapper();
        Map<String, ChannelHandler> handlers = new LinkedHashMap<>();
        for (ChannelConfig config : configs) {
            handlers.put(config.getName(), create(config, mapper));
        }
        return Collections.unmodifiableMap(handlers);
    }

    private static ChannelHandler createEmail(ChannelConfig config) {
        Properties props = new Properties();
        props.put("mail.smtp.host", required(config, "host"));
        props.put("mail.smtp.port", config.setting("port", "25"));
        props.put("mail.smtp.starttls.enable", config.setting("startTls", "false"));
        props.put("mail.smtp.connectiontimeout", config.setting("timeoutMs", "10000"));
        props.put("mail.smtp.timeout", config.setting("timeoutMs", "10000"));

        String username = config.setting("username");
        Session session;
        if (username != null && !username.isBlank()) {
            props.put("mail.smtp.auth", "true");
            String password = config.setting("password", "");
            session = Session.getInstance(props, new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(username, password);
                }
            });
        } else {
            session = Session.getInstance(props);
        }

        List<String> recipients = Arrays.stream(required(config, "to").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return new EmailChannel(config.getName(), session, required(config, "from"), recipients,
                config.setting("subjectPrefix"));
    }

    private static String required(ChannelConfig config, String key) {
        String value = config.setting(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Channel '" + config.getName() + "' of type '"
                    + config.getType() + "' requires setting '" + key + "'");
        }
        return value;
    }
}
