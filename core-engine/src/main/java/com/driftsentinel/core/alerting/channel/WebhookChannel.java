package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.error.ChannelDeliveryException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DeliveryResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * POSTs the alert as JSON to an HTTP endpoint. Any non-2xx response is a
 * failed delivery.
 *
 * @since 1.0.0
 */
public class WebhookChannel implements ChannelHandler {

    private static final Logger LOG = LoggerFactory.getLogger(WebhookChannel.class);

    private final String name;
    private final URI url;
    private final Duration timeout;
    private final HttpClient client;
    private final ObjectMapper mapper;

    public WebhookChannel(String name, URI url, Duration timeout, ObjectMapper mapper) {
        this(name, url, timeout, HttpClient.newBuilder().connectTimeout(timeout).build(), mapper);
    }

    public WebhookChannel(String name, URI url, Duration timeout, HttpClient client, ObjectMapper mapper) {
        this.name = Objects.requireNonNull(name, "Channel name must not be null");
        this.url = Objects.requireNonNull(url, "Webhook url must not be null");
        this.timeout = Objects.requireNonNull(timeout, "Timeout must not be null");
        this.client = Objects.requireNonNull(client, "HttpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(alert);
        } catch (JsonProcessingException e) {
            throw new ChannelDeliveryException("Failed to serialize alert " + alert.getId(), e);
        }

        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                return DeliveryResult.failure(name, "HTTP " + status + " from " + url);
            }
            LOG.debug("Webhook {} accepted alert {} with HTTP {}", name, alert.getId(), status);
            return DeliveryResult.success(name);
        } catch (IOException e) {
            throw new ChannelDeliveryException("Webhook " + url + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelDeliveryException("Interrupted while posting to " + url, e);
        }
    }

    public URI getUrl() {
        return url;
    }
}
