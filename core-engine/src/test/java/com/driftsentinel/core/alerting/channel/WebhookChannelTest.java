package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.alerting.JsonSupport;
import com.driftsentinel.core.error.ChannelDeliveryException;
import com.driftsentinel.core.model.DeliveryResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WebhookChannel} against a local JDK HTTP server.
 */
class WebhookChannelTest {

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final AtomicInteger status = new AtomicInteger(204);

    private HttpServer server;
    private URI url;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/drift", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
        url = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/drift");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should POST the alert as JSON")
    void shouldPostAlertJson() throws IOException {
        WebhookChannel channel = new WebhookChannel("hook", url, Duration.ofSeconds(5), mapper);

        DeliveryResult result = channel.send(ChannelTestSupport.alert("a-1"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(bodies).hasSize(1);
        assertThat(mapper.readTree(bodies.get(0)).get("id").asText()).isEqualTo("a-1");
    }

    @Test
    @DisplayName("Should report a non-2xx response as a failed delivery")
    void shouldFailOnErrorStatus() {
        status.set(503);
        WebhookChannel channel = new WebhookChannel("hook", url, Duration.ofSeconds(5), mapper);

        DeliveryResult result = channel.send(ChannelTestSupport.alert("a-1"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).contains("HTTP 503");
    }

    @Test
    @DisplayName("Should raise a delivery exception when the endpoint is unreachable")
    void shouldRaiseWhenUnreachable() {
        int port = server.getAddress().getPort();
        server.stop(0);
        WebhookChannel channel = new WebhookChannel("hook", URI.create("http://127.0.0.1:" + port + "/drift"),
                Duration.ofSeconds(2), mapper);

        assertThatThrownBy(() -> channel.send(ChannelTestSupport.alert("a-1")))
                .isInstanceOf(ChannelDeliveryException.class);
    }
}
