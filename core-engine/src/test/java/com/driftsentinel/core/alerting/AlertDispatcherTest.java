package com.driftsentinel.core.alerting;

import com.driftsentinel.core.alerting.channel.ChannelHandler;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.DeliveryResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertDispatcher}.
 */
class AlertDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final CountDownLatch release = new CountDownLatch(1);
    private final AlertDispatcher dispatcher = new AlertDispatcher(Duration.ofMillis(200));

    @AfterEach
    void tearDown() {
        release.countDown();
        dispatcher.close();
    }

    @Test
    @DisplayName("Should time out a hung channel without affecting the others")
    void shouldIsolateTimeout() {
        RecordingChannel fast = new RecordingChannel("log");
        ChannelHandler hung = new ChannelHandler() {
            @Override
            public String getName() {
                return "webhook";
            }

            @Override
            public DeliveryResult send(Alert alert) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return DeliveryResult.success("webhook");
            }
        };

        Map<String, DeliveryResult> results = dispatcher.dispatch(alert(), List.of(hung, fast), NOW);

        assertThat(results).containsOnlyKeys("webhook", "log");
        assertThat(results.get("webhook").isSuccess()).isFalse();
        assertThat(results.get("webhook").getReason()).startsWith("Timed out after 200 ms");
        assertThat(results.get("log").isSuccess()).isTrue();
        assertThat(results.get("log").getAttemptedAt()).isEqualTo(NOW);
        assertThat(fast.getReceived()).hasSize(1);
    }

    @Test
    @DisplayName("Should hand every channel its own copy of the alert")
    void shouldCopyAlertPerChannel() {
        ChannelHandler mutating = new ChannelHandler() {
            @Override
            public String getName() {
                return "mutating";
            }

            @Override
            public DeliveryResult send(Alert alert) {
                alert.setTitle("changed");
                return DeliveryResult.success("mutating");
            }
        };
        RecordingChannel recorder = new RecordingChannel("log");
        Alert alert = alert();

        dispatcher.dispatch(alert, List.of(mutating), NOW);
        dispatcher.dispatch(alert, List.of(recorder), NOW);

        assertThat(alert.getTitle()).isEqualTo("SIGNATURE_MISMATCH in src/calc.py");
        assertThat(recorder.getReceived().get(0).getTitle()).isEqualTo("SIGNATURE_MISMATCH in src/calc.py");
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void shouldRejectInvalidTimeout() {
        assertThatThrownBy(() -> new AlertDispatcher(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Alert alert() {
        return Alert.builder()
                .id("alert-1")
                .createdAt(NOW)
                .type(AlertType.DRIFT)
                .severity(AlertSeverity.ERROR)
                .title("SIGNATURE_MISMATCH in src/calc.py")
                .fingerprint("fp")
                .filePath("src/calc.py")
                .build();
    }
}
