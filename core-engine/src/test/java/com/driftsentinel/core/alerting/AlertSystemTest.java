package com.driftsentinel.core.alerting;

import com.driftsentinel.core.alerting.channel.ChannelHandler;
import com.driftsentinel.core.config.AlertRule;
import com.driftsentinel.core.config.AlertingConfig;
import com.driftsentinel.core.config.RateLimit;
import com.driftsentinel.core.error.AlertNotFoundException;
import com.driftsentinel.core.error.ChannelDeliveryException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.DeliveryResult;
import com.driftsentinel.core.model.DriftType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AlertSystem}.
 */
class AlertSystemTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private RecordingChannel log;
    private AlertSystem system;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        log = new RecordingChannel("log");
        system = newSystem(config(rule("all", null, "info", 60, "log")), log);
    }

    @AfterEach
    void tearDown() {
        system.close();
    }

    @Test
    @DisplayName("Should deliver once and count repeated occurrences within the suppression window")
    void shouldSuppressDuplicatesWithinWindow() {
        AlertOutcome first = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));
        clock.advance(Duration.ofSeconds(5));
        AlertOutcome second = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));

        assertThat(first.getStatus()).isEqualTo(AlertOutcome.Status.CREATED);
        assertThat(second.isSuppressed()).isTrue();
        assertThat(second.getAlert().getId()).isEqualTo(first.getAlert().getId());
        assertThat(log.getReceived()).hasSize(1);

        List<Alert> alerts = system.list(AlertQuery.all());
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getOccurrenceCount()).isEqualTo(2);
        assertThat(alerts.get(0).getDeliveryCount()).isEqualTo(1);
        assertThat(alerts.get(0).getLastOccurrenceAt()).isEqualTo(START.plusSeconds(5));
    }

    @Test
    @DisplayName("Should redeliver the same alert once the suppression window has passed")
    void shouldRedeliverAfterWindow() {
        AlertOutcome first = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));
        clock.advance(Duration.ofSeconds(61));
        AlertOutcome second = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));

        assertThat(second.getStatus()).isEqualTo(AlertOutcome.Status.REDELIVERED);
        assertThat(second.getAlert().getId()).isEqualTo(first.getAlert().getId());
        assertThat(second.getAlert().getDeliveryCount()).isEqualTo(2);
        assertThat(log.getReceived()).hasSize(2);
    }

    @Test
    @DisplayName("Should raise the severity of an open alert when a worse occurrence arrives")
    void shouldUpgradeSeverity() {
        system.createAlert(driftEvent("src/calc.py", AlertSeverity.WARNING));
        clock.advance(Duration.ofSeconds(1));
        AlertOutcome second = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));

        assertThat(second.getAlert().getSeverity()).isEqualTo(AlertSeverity.ERROR);
        assertThat(second.getStatus()).isEqualTo(AlertOutcome.Status.REDELIVERED);
        assertThat(log.getReceived()).extracting(Alert::getSeverity)
                .containsExactly(AlertSeverity.WARNING, AlertSeverity.ERROR);
    }

    @Test
    @DisplayName("Should keep suppressing an upgraded alert while its severity stays the same")
    void shouldSuppressAfterUpgrade() {
        system.createAlert(driftEvent("src/calc.py", AlertSeverity.WARNING));
        system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));
        AlertOutcome third = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));

        assertThat(third.isSuppressed()).isTrue();
        assertThat(log.getReceived()).hasSize(2);
    }

    @Test
    @DisplayName("Should create exactly one alert when the same fingerprint arrives from many threads")
    void shouldCreateOneAlertUnderConcurrentOccurrences() throws Exception {
        int threads = 32;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<AlertOutcome>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                outcomes.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    return system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));
                }));
            }
            ready.await(5, TimeUnit.SECONDS);
            go.countDown();

            List<AlertOutcome.Status> statuses = new ArrayList<>();
            for (Future<AlertOutcome> outcome : outcomes) {
                statuses.add(outcome.get(5, TimeUnit.SECONDS).getStatus());
            }
            assertThat(statuses).filteredOn(s -> s == AlertOutcome.Status.CREATED).hasSize(1);
        } finally {
            pool.shutdownNow();
        }

        List<Alert> alerts = system.list(AlertQuery.all());
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getOccurrenceCount()).isEqualTo(threads);
        assertThat(alerts.get(0).getDeliveryCount()).isEqualTo(1);
        assertThat(log.getReceived()).hasSize(1);
    }

    @Test
    @DisplayName("Should keep alerts for different files apart")
    void shouldNotMergeDifferentFingerprints() {
        system.createAlert(driftEvent("src/a.py", AlertSeverity.ERROR));
        system.createAlert(driftEvent("src/b.py", AlertSeverity.ERROR));

        assertThat(system.list(AlertQuery.all())).hasSize(2);
        assertThat(log.getReceived()).hasSize(2);
    }

    @Test
    @DisplayName("Should not dispatch to a channel whose rule requires a higher severity")
    void shouldRespectRuleSeverity() {
        ChannelHandler webhook = mock(ChannelHandler.class);
        when(webhook.getName()).thenReturn("webhook");
        system.close();
        system = newSystem(config(rule("warnings", null, "warning", 60, "webhook")), webhook);

        AlertOutcome outcome = system.createAlert(driftEvent("src/calc.py", AlertSeverity.INFO));

        verify(webhook, never()).send(any());
        assertThat(outcome.getDeliveries()).isEmpty();
        assertThat(system.list(AlertQuery.all())).hasSize(1);
    }

    @Test
    @DisplayName("Should isolate a failing channel from the others")
    void shouldIsolateChannelFailure() {
        ChannelHandler email = new ChannelHandler() {
            @Override
            public String getName() {
                return "email";
            }

            @Override
            public DeliveryResult send(Alert alert) {
                throw new ChannelDeliveryException("SMTP unavailable");
            }
        };
        system.close();
        system = newSystem(config(rule("all", null, "info", 60, "email", "log")), email, log);

        AlertOutcome outcome = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));

        assertThat(outcome.getDeliveries().get("email").isSuccess()).isFalse();
        assertThat(outcome.getDeliveries().get("email").getReason()).contains("SMTP unavailable");
        assertThat(outcome.getDeliveries().get("log").isSuccess()).isTrue();

        Alert stored = system.get(outcome.getAlert().getId()).orElseThrow();
        assertThat(stored.getDeliveryLog().get("email").isSuccess()).isFalse();
        assertThat(stored.getDeliveryLog().get("log").isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should record a failure for a channel that is not registered")
    void shouldReportUnregisteredChannel() {
        system.close();
        system = newSystem(config(rule("all", null, "info", 60, "log", "pager")), log);

        AlertOutcome outcome = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));

        assertThat(outcome.getDeliveries().get("pager").isSuccess()).isFalse();
        assertThat(outcome.getDeliveries().get("pager").getReason()).isEqualTo("Channel not registered");
        assertThat(outcome.getDeliveries().get("log").isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should create a new alert after the previous one was resolved")
    void shouldNotReopenResolvedAlert() {
        AlertOutcome first = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));
        assertThat(system.resolve(first.getAlert().getId(), "fixed")).isTrue();

        clock.advance(Duration.ofSeconds(1));
        AlertOutcome second = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));

        assertThat(second.getStatus()).isEqualTo(AlertOutcome.Status.CREATED);
        assertThat(second.getAlert().getId()).isNotEqualTo(first.getAlert().getId());
        assertThat(system.get(first.getAlert().getId()).orElseThrow().isResolved()).isTrue();
    }

    @Test
    @DisplayName("Should treat resolving twice as a no-op and reject unknown ids")
    void shouldResolveIdempotently() {
        AlertOutcome outcome = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));
        String id = outcome.getAlert().getId();

        assertThat(system.resolve(id, "fixed")).isTrue();
        clock.advance(Duration.ofMinutes(1));
        assertThat(system.resolve(id, "again")).isFalse();

        Alert stored = system.get(id).orElseThrow();
        assertThat(stored.getResolvedAt()).isEqualTo(START);
        assertThat(stored.getResolutionNote()).isEqualTo("fixed");
        assertThatThrownBy(() -> system.resolve("missing", null))
                .isInstanceOf(AlertNotFoundException.class);
    }

    @Test
    @DisplayName("Should filter and summarise alerts")
    void shouldListAndSummarise() {
        system.createAlert(driftEvent("src/a.py", AlertSeverity.WARNING));
        clock.advance(Duration.ofSeconds(1));
        AlertOutcome b = system.createAlert(driftEvent("src/b.py", AlertSeverity.CRITICAL));
        clock.advance(Duration.ofSeconds(1));
        system.createAlert(AlertEvent.scanFailure("src/c.py", 3, "boom"));
        system.resolve(b.getAlert().getId(), null);

        assertThat(system.list(AlertQuery.open()))
                .extracting(Alert::getFilePath)
                .containsExactly("src/a.py", "src/c.py");
        assertThat(system.list(AlertQuery.builder().minSeverity(AlertSeverity.ERROR).build()))
                .extracting(Alert::getFilePath)
                .containsExactly("src/b.py", "src/c.py");
        assertThat(system.list(AlertQuery.builder().type(AlertType.SCAN_FAILURE).build())).hasSize(1);
        assertThat(system.list(AlertQuery.builder().filePath("src/a.py").build())).hasSize(1);

        AlertSummary summary = system.summary();
        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getOpen()).isEqualTo(2);
        assertThat(summary.getResolved()).isEqualTo(1);
        assertThat(summary.getBySeverity()).containsEntry(AlertSeverity.CRITICAL, 1);
        assertThat(summary.getByType()).containsEntry(AlertType.DRIFT, 2).containsEntry(AlertType.SCAN_FAILURE, 1);
    }

    @Test
    @DisplayName("Should store but not deliver alerts beyond the rate limit")
    void shouldRateLimitDispatch() {
        RateLimit limit = new RateLimit();
        limit.setType("drift");
        limit.setPerMinute(2);
        AlertingConfig config = config(rule("all", null, "info", 60, "log"));
        config.setRateLimits(List.of(limit));
        system.close();
        system = newSystem(config, log);

        for (int i = 0; i < 3; i++) {
            system.createAlert(driftEvent("src/f" + i + ".py", AlertSeverity.ERROR));
        }

        assertThat(log.getReceived()).hasSize(2);
        assertThat(system.list(AlertQuery.all())).hasSize(3);

        clock.advance(Duration.ofSeconds(61));
        system.createAlert(driftEvent("src/f3.py", AlertSeverity.ERROR));
        assertThat(log.getReceived()).hasSize(3);
    }

    @Test
    @DisplayName("Should notify listeners by type and survive a failing listener")
    void shouldNotifyListeners() {
        List<AlertOutcome> all = new ArrayList<>();
        AtomicInteger scanFailures = new AtomicInteger();
        system.addListener(outcome -> {
            throw new IllegalStateException("listener bug");
        });
        system.addListener(all::add);
        system.addListener(AlertType.SCAN_FAILURE, outcome -> scanFailures.incrementAndGet());

        system.createAlert(driftEvent("src/a.py", AlertSeverity.ERROR));
        system.createAlert(AlertEvent.scanFailure("src/b.py", 3, "boom"));

        assertThat(all).hasSize(2);
        assertThat(scanFailures).hasValue(1);
    }

    @Test
    @DisplayName("Should use the largest suppression window among matching rules")
    void shouldUseLargestMatchingWindow() {
        system.close();
        system = newSystem(config(
                rule("short", null, "info", 10, "log"),
                rule("long", List.of("drift"), "warning", 120, "log")), log);

        system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));
        clock.advance(Duration.ofSeconds(60));
        AlertOutcome second = system.createAlert(driftEvent("src/calc.py", AlertSeverity.ERROR));

        assertThat(second.isSuppressed()).isTrue();
        assertThat(log.getReceived()).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertSystem newSystem(AlertingConfig config, ChannelHandler... channels) {
        AtomicInteger ids = new AtomicInteger();
        AlertSystem.Builder builder = AlertSystem.builder()
                .config(config)
                .clock(clock)
                .idGenerator(() -> "alert-" + ids.incrementAndGet());
        for (ChannelHandler channel : channels) {
            builder.channel(channel);
        }
        return builder.build();
    }

    private static AlertingConfig config(AlertRule... rules) {
        AlertingConfig config = new AlertingConfig();
        config.setRules(List.of(rules));
        return config;
    }

    private static AlertRule rule(String name, List<String> types, String minSeverity, long windowSeconds,
            String... channels) {
        AlertRule rule = new AlertRule();
        rule.setName(name);
        if (types != null) {
            rule.setTypes(types);
        }
        rule.setMinSeverity(minSeverity);
        rule.setSuppressionWindowSeconds(windowSeconds);
        rule.setChannels(List.of(channels));
        return rule;
    }

    private static AlertEvent driftEvent(String file, AlertSeverity severity) {
        return AlertEvent.builder()
                .type(AlertType.DRIFT)
                .severity(severity)
                .title("SIGNATURE_MISMATCH in " + file)
                .message("'calc' parameter count differs from specification")
                .filePath(file)
                .specReference("calc-spec@docs/calc.md")
                .driftType(DriftType.SIGNATURE_MISMATCH)
                .context(Map.of(AlertEvent.CTX_ELEMENTS, "calc"))
                .build();
    }
}
