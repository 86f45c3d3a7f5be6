package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.config.ChannelConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChannelFactory}.
 */
class ChannelFactoryTest {

    @Test
    @DisplayName("Should create a handler for every supported type")
    void shouldCreateEverySupportedType() {
        Map<String, ChannelHandler> handlers = ChannelFactory.createAll(List.of(
                new ChannelConfig("log", "log", null),
                new ChannelConfig("console", "CONSOLE", null),
                new ChannelConfig("file", "file", Map.of("path", "target/alerts.jsonl")),
                new ChannelConfig("hook", "webhook", Map.of("url", "http://localhost:9/drift", "timeoutMs", 1500)),
                new ChannelConfig("mail", "email", Map.of(
                        "host", "smtp.example.com",
                        "port", 587,
                        "from", "sentinel@example.com",
                        "to", "dev@example.com, ops@example.com"))));

        assertThat(handlers).containsOnlyKeys("log", "console", "file", "hook", "mail");
        assertThat(handlers.get("log")).isInstanceOf(LogChannel.class);
        assertThat(handlers.get("console")).isInstanceOf(ConsoleChannel.class);
        assertThat(handlers.get("file")).isInstanceOf(FileChannel.class);
        assertThat(handlers.get("hook")).isInstanceOf(WebhookChannel.class);
        assertThat(((EmailChannel) handlers.get("mail")).getRecipients())
                .containsExactly("dev@example.com", "ops@example.com");
        assertThat(handlers.values()).extracting(ChannelHandler::getName)
                .containsExactly("log", "console", "file", "hook", "mail");
    }

    @Test
    @DisplayName("Should throw for an unknown channel type")
    void shouldRejectUnknownType() {
        assertThatThrownBy(() -> ChannelFactory.create(new ChannelConfig("pager", "pagerduty", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown channel type");
    }

    @Test
    @DisplayName("Should throw when a required setting is missing")
    void shouldRejectMissingSetting() {
        assertThatThrownBy(() -> ChannelFactory.create(new ChannelConfig("hook", "webhook", Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'url'");
    }
}
