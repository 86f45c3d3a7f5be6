package com.driftsentinel.core.alerting.store;

import com.driftsentinel.core.alerting.JsonSupport;
import com.driftsentinel.core.error.StoreException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * {@link AlertStore} holding alerts in a {@link TreeMap} keyed by id and
 * persisting them as one JSON document.
 *
 * <p>
 * Writes are buffered until {@link #flush()}, which replaces the file
 * atomically through a sibling {@code .tmp} file. Without a path the store is
 * memory-only and {@code flush()} is a no-op.
 * </p>
 *
 * <pre>
 * { "version": 1, "alerts": [ { "id": "...", "fingerprint": "...", ... } ] }
 * </pre>
 *
 * @since 1.0.0
 */
public class JsonFileAlertStore implements AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileAlertStore.class);

    static final int FORMAT_VERSION = 1;

    private final Path path;
    private final ObjectMapper mapper;

    private final TreeMap<String, Alert> alerts = new TreeMap<>();
    private final Map<String, String> openByFingerprint = new HashMap<>();
    /** resolved flag -> severity -> ids */
    private final Map<Boolean, EnumMap<AlertSeverity, TreeSet<String>>> byStatus = new HashMap<>();
    /** Index entry per id, so an update can remove the stale one. */
    private final Map<String, Alert> indexed = new HashMap<>();

    private boolean dirty;

    /**
     * Memory-only store.
     */
    public JsonFileAlertStore() {
        this(null);
    }

    /**
     * @param path JSON file; loaded if it exists, {@code null} for memory-only
     * @throws StoreException if an existing file cannot be read
     */
    public JsonFileAlertStore(Path path) {
        this.path = path;
        this.mapper = JsonSupport.newObjectMapper();
        byStatus.put(Boolean.TRUE, new EnumMap<>(AlertSeverity.class));
        byStatus.put(Boolean.FALSE, new EnumMap<>(AlertSeverity.class));
        if (path != null && Files.exists(path)) {
            load();
        }
    }

    // ---------------------------------------------------------------
    // AlertStore
    // ---------------------------------------------------------------

    @Override
    public synchronized void save(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        Objects.requireNonNull(alert.getId(), "Alert id must not be null");
        unindex(alert.getId());
        alerts.put(alert.getId(), alert);
        index(alert);
        dirty = true;
    }

    @Override
    public synchronized Optional<Alert> findById(String id) {
        return Optional.ofNullable(alerts.get(id));
    }

    @Override
    public synchronized Optional<Alert> findOpenByFingerprint(String fingerprint) {
        String id = openByFingerprint.get(fingerprint);
        return id != null ? Optional.ofNullable(alerts.get(id)) : Optional.empty();
    }

    @Override
    public synchronized List<Alert> findByStatus(boolean resolved, AlertSeverity minSeverity) {
        TreeSet<String> ids = new TreeSet<>();
        for (Map.Entry<AlertSeverity, TreeSet<String>> entry : byStatus.get(resolved).entrySet()) {
            if (entry.getKey().isAtLeast(minSeverity)) {
                ids.addAll(entry.getValue());
            }
        }
        List<Alert> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(alerts.get(id));
        }
        return result;
    }

    @Override
    public synchronized List<Alert> findAll() {
        return new ArrayList<>(alerts.values());
    }

    @Override
    public synchronized int size() {
        return alerts.size();
    }

    @Override
    public synchronized void flush() {
        if (path == null || !dirty) {
            return;
        }
        Path tmp = path.resolveSibling(path.getFileName().toString() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            StoreDocument document = new StoreDocument();
            document.setVersion(FORMAT_VERSION);
            document.setAlerts(new ArrayList<>(alerts.values()));
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(w, document);
            }
            move(tmp, path);
            dirty = false;
            LOG.debug("Persisted {} alert(s) to {}", alerts.size(), path);
        } catch (IOException e) {
            throw new StoreException("Failed to write alert store " + path + ": " + e.getMessage(), e);
        }
    }

    public Path getPath() {
        return path;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void load() {
        try {
            StoreDocument document = mapper.readValue(path.toFile(), StoreDocument.class);
            if (document.getVersion() != FORMAT_VERSION) {
                throw new StoreException("Unsupported alert store version " + document.getVersion() + " in " + path);
            }
            for (Alert alert : document.getAlerts()) {
                alerts.put(alert.getId(), alert);
                index(alert);
            }
            LOG.info("Loaded {} alert(s) from {}", alerts.size(), path);
        } catch (IOException e) {
            throw new StoreException("Failed to read alert store " + path + ": " + e.getMessage(), e);
        }
    }

    private void index(Alert alert) {
        if (!alert.isResolved()) {
            openByFingerprint.put(alert.getFingerprint(), alert.getId());
        }
        byStatus.get(alert.isResolved())
                .computeIfAbsent(alert.getSeverity(), s -> new TreeSet<>())
                .add(alert.getId());
        indexed.put(alert.getId(), snapshotKey(alert));
    }

    private void unindex(String id) {
        Alert previous = indexed.remove(id);
        if (previous == null) {
            return;
        }
        openByFingerprint.remove(previous.getFingerprint(), id);
        TreeSet<String> ids = byStatus.get(previous.isResolved()).get(previous.getSeverity());
        if (ids != null) {
            ids.remove(id);
        }
    }

    /** Minimal copy of the indexed attributes; the stored instance is mutated in place. */
    private static Alert snapshotKey(Alert alert) {
        Alert key = new Alert();
        key.setId(alert.getId());
        key.setFingerprint(alert.getFingerprint());
        key.setResolved(alert.isResolved());
        key.setSeverity(alert.getSeverity());
        return key;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** On-disk document shape. */
    public static class StoreDocument {
        private int version;
        private List<Alert> alerts = new ArrayList<>();

        public int getVersion() {
            return version;
        }

        public void setVersion(int version) {
            this.version = version;
        }

        public List<Alert> getAlerts() {
            return alerts;
        }

        public void setAlerts(List<Alert> alerts) {
            this.alerts = alerts != null ? alerts : new ArrayList<>();
        }
    }
}
