package com.driftsentinel.core.alerting.store;

import com.driftsentinel.core.error.StoreException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.DeliveryResult;
import com.driftsentinel.core.model.DriftType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileAlertStore}.
 */
class JsonFileAlertStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should persist alerts and read them back after a restart")
    void shouldPersistAndReload() {
        Path file = tempDir.resolve("state/alerts.json");
        JsonFileAlertStore store = new JsonFileAlertStore(file);
        Alert alert = alert("a-1", "fp-1", AlertSeverity.ERROR);
        alert.recordOccurrence(NOW.plusSeconds(5));
        alert.recordDelivery(NOW, Map.of("log", DeliveryResult.success("log").timed(NOW, 3)));
        store.save(alert);
        store.flush();

        JsonFileAlertStore reloaded = new JsonFileAlertStore(file);

        Alert restored = reloaded.findById("a-1").orElseThrow();
        assertThat(restored.getOccurrenceCount()).isEqualTo(2);
        assertThat(restored.getCreatedAt()).isEqualTo(NOW);
        assertThat(restored.getDriftType()).isEqualTo(DriftType.SIGNATURE_MISMATCH);
        assertThat(restored.getDeliveryLog().get("log").isSuccess()).isTrue();
        assertThat(restored.getDeliveryLog().get("log").getDurationMs()).isEqualTo(3);
        assertThat(reloaded.findOpenByFingerprint("fp-1")).isPresent();
        assertThat(Files.exists(file.resolveSibling("alerts.json.tmp"))).isFalse();
    }

    @Test
    @DisplayName("Should drop the fingerprint index once an alert is resolved")
    void shouldUnindexResolvedAlerts() {
        JsonFileAlertStore store = new JsonFileAlertStore();
        Alert alert = alert("a-1", "fp-1", AlertSeverity.ERROR);
        store.save(alert);

        alert.resolve(NOW, "done");
        store.save(alert);

        assertThat(store.findOpenByFingerprint("fp-1")).isEmpty();
        assertThat(store.findByStatus(true, AlertSeverity.INFO)).extracting(Alert::getId).containsExactly("a-1");
        assertThat(store.findByStatus(false, AlertSeverity.INFO)).isEmpty();
    }

    @Test
    @DisplayName("Should filter by status and minimum severity")
    void shouldFindByStatusAndSeverity() {
        JsonFileAlertStore store = new JsonFileAlertStore();
        store.save(alert("a-1", "fp-1", AlertSeverity.INFO));
        store.save(alert("a-2", "fp-2", AlertSeverity.CRITICAL));
        store.save(alert("a-3", "fp-3", AlertSeverity.ERROR));

        Alert upgraded = store.findById("a-1").orElseThrow();
        upgraded.setSeverity(AlertSeverity.ERROR);
        store.save(upgraded);

        assertThat(store.findByStatus(false, AlertSeverity.ERROR))
                .extracting(Alert::getId)
                .containsExactly("a-1", "a-2", "a-3");
        assertThat(store.findByStatus(false, AlertSeverity.CRITICAL))
                .extracting(Alert::getId)
                .containsExactly("a-2");
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject a store file with an unknown version")
    void shouldRejectUnknownVersion() throws IOException {
        Path file = tempDir.resolve("alerts.json");
        Files.writeString(file, "{\"version\": 99, \"alerts\": []}");

        assertThatThrownBy(() -> new JsonFileAlertStore(file))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("version 99");
    }

    @Test
    @DisplayName("Should reject a corrupt store file")
    void shouldRejectCorruptFile() throws IOException {
        Path file = tempDir.resolve("alerts.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new JsonFileAlertStore(file))
                .isInstanceOf(StoreException.class);
    }

    private static Alert alert(String id, String fingerprint, AlertSeverity severity) {
        return Alert.builder()
                .id(id)
                .createdAt(NOW)
                .type(AlertType.DRIFT)
                .severity(severity)
                .title("SIGNATURE_MISMATCH in src/calc.py")
                .fingerprint(fingerprint)
                .filePath("src/calc.py")
                .specReference("calc-spec@docs/calc.md")
                .driftType(DriftType.SIGNATURE_MISMATCH)
                .build();
    }
}
