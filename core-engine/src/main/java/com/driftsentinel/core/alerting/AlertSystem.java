package com.driftsentinel.core.alerting;

import com.driftsentinel.core.alerting.channel.ChannelHandler;
import com.driftsentinel.core.alerting.store.AlertStore;
import com.driftsentinel.core.alerting.store.JsonFileAlertStore;
import com.driftsentinel.core.config.AlertingConfig;
import com.driftsentinel.core.error.AlertNotFoundException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Turns detection events into persisted, de-duplicated alerts and delivers
 * them to the channels selected by the alert rules.
 *
 * <h3>Suppression</h3>
 * <p>
 * Each event has a fingerprint (type, file, specification, drift type). If an
 * unresolved alert with that fingerprint was last delivered (or, if never
 * delivered, created) within the suppression window of the matching rules, the
 * occurrence is counted on that alert and nothing is delivered. Once the window
 * has passed the same alert is delivered again. A resolved alert is never
 * reopened; the next occurrence creates a new alert.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All store access goes through one lock, so the fingerprint check-and-insert
 * is atomic. Channel delivery runs outside the lock on the
 * {@link AlertDispatcher}; only its results are written back under the lock.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertSystem implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertSystem.class);

    private final AlertingConfig config;
    private final AlertStore store;
    private final Map<String, ChannelHandler> channels;
    private final AlertDispatcher dispatcher;
    private final AlertRateLimiter rateLimiter;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    private final ReentrantLock storeLock = new ReentrantLock();
    private final List<Registration> listeners = new CopyOnWriteArrayList<>();

    private AlertSystem(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "AlertingConfig must not be null");
        this.clock = Objects.requireNonNull(builder.clock, "Clock must not be null");
        this.store = builder.store != null
                ? builder.store
                : new JsonFileAlertStore(config.getStorePath() != null ? Path.of(config.getStorePath()) : null);
        this.channels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.channels));
        this.dispatcher = builder.dispatcher != null
                ? builder.dispatcher
                : new AlertDispatcher(Duration.ofMillis(config.getDispatchTimeoutMs()));
        this.rateLimiter = new AlertRateLimiter(config.getRateLimits());
        this.idGenerator = builder.idGenerator;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Creation and delivery
    // ---------------------------------------------------------------

    /**
     * Record one detection event.
     *
     * @param event detection event; must not be {@code null}
     * @return whether a new alert was created, an open one redelivered, or the
     *         occurrence suppressed
     */
    public AlertOutcome createAlert(AlertEvent event) {
        Objects.requireNonNull(event, "AlertEvent must not be null");
        String fingerprint = event.fingerprint();
        Instant now = clock.instant();
        Duration window = config.suppressionWindowFor(event.getType(), event.getSeverity());

        AlertOutcome.Status status;
        Alert snapshot;
        storeLock.lock();
        try {
            Optional<Alert> open = store.findOpenByFingerprint(fingerprint);
            if (open.isPresent()) {
                Alert existing = open.get();
                existing.recordOccurrence(now);
                boolean upgraded = event.getSeverity().compareTo(existing.getSeverity()) > 0;
                if (upgraded) {
                    LOG.info("Alert {} upgraded from {} to {}", existing.getId(), existing.getSeverity(),
                            event.getSeverity());
                    existing.setSeverity(event.getSeverity());
                }
                Instant anchor = existing.getLastDeliveredAt() != null
                        ? existing.getLastDeliveredAt()
                        : existing.getCreatedAt();
                // a worse severity is delivered even inside the window
                if (!upgraded && now.isBefore(anchor.plus(window))) {
                    store.save(existing);
                    LOG.debug("Suppressed occurrence {} of alert {} ({})", existing.getOccurrenceCount(),
                            existing.getId(), existing.getTitle());
                    return new AlertOutcome(AlertOutcome.Status.SUPPRESSED, existing.copy(), Map.of());
                }
                // claim the delivery slot so concurrent occurrences stay suppressed
                existing.setLastDeliveredAt(now);
                store.save(existing);
                status = AlertOutcome.Status.REDELIVERED;
                snapshot = existing.copy();
            } else {
                Alert alert = Alert.builder()
                        .id(idGenerator.get())
                        .createdAt(now)
                        .type(event.getType())
                        .severity(event.getSeverity())
                        .title(event.getTitle())
                        .message(event.getMessage())
                        .context(event.getContext())
                        .fingerprint(fingerprint)
                        .filePath(event.getFilePath())
                        .specReference(event.getSpecReference())
                        .driftType(event.getDriftType())
                        .build();
                store.save(alert);
                status = AlertOutcome.Status.CREATED;
                snapshot = alert.copy();
            }
        } finally {
            storeLock.unlock();
        }

        LOG.info("{} alert {}: {}", status == AlertOutcome.Status.CREATED ? "Created" : "Redelivering",
                snapshot.getId(), snapshot.formatText());
        Map<String, DeliveryResult> results = deliver(snapshot, now);
        AlertOutcome outcome = new AlertOutcome(status, get(snapshot.getId()).orElse(snapshot), results);
        notifyListeners(outcome);
        return outcome;
    }

    /**
     * Deliver an alert to every channel subscribed to its type and severity.
     * Channel failures are recorded in the alert's delivery log and never
     * propagate.
     *
     * @param alert alert to deliver
     * @return per-channel results; empty if no channel is subscribed or the
     *         alert type is rate limited
     */
    public Map<String, DeliveryResult> dispatch(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        return deliver(alert.copy(), clock.instant());
    }

    private Map<String, DeliveryResult> deliver(Alert alert, Instant now) {
        Set<String> subscribed = config.channelsFor(alert.getType(), alert.getSeverity());
        if (subscribed.isEmpty()) {
            LOG.debug("No channel subscribed to {} alerts at {}", alert.getType(), alert.getSeverity());
            return Map.of();
        }
        if (!rateLimiter.tryAcquire(alert.getType(), now)) {
            LOG.warn("Rate limit reached for {} alerts; alert {} stored without delivery",
                    alert.getType(), alert.getId());
            return Map.of();
        }

        Map<String, DeliveryResult> results = new LinkedHashMap<>();
        List<ChannelHandler> handlers = new ArrayList<>();
        for (String name : subscribed) {
            ChannelHandler handler = channels.get(name);
            if (handler == null) {
                results.put(name, DeliveryResult.failure(name, "Channel not registered").timed(now, 0));
            } else {
                handlers.add(handler);
            }
        }
        results.putAll(dispatcher.dispatch(alert, handlers, now));

        storeLock.lock();
        try {
            store.findById(alert.getId()).ifPresent(stored -> {
                stored.recordDelivery(now, results);
                store.save(stored);
            });
        } finally {
            storeLock.unlock();
        }
        return Collections.unmodifiableMap(results);
    }

    // ---------------------------------------------------------------
    // Lifecycle and queries
    // ---------------------------------------------------------------

    /**
     * Mark an alert resolved. Resolving an already resolved alert changes
     * nothing.
     *
     * @param alertId alert id
     * @param note    resolution note; may be {@code null}
     * @return {@code true} if the alert was open before this call
     * @throws AlertNotFoundException if no alert has this id
     */
    public boolean resolve(String alertId, String note) {
        Objects.requireNonNull(alertId, "Alert id must not be null");
        storeLock.lock();
        try {
            Alert alert = store.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
            boolean changed = alert.resolve(clock.instant(), note);
            if (changed) {
                store.save(alert);
                LOG.info("Resolved alert {}{}", alertId, note != null ? ": " + note : "");
            } else {
                LOG.debug("Alert {} already resolved", alertId);
            }
            return changed;
        } finally {
            storeLock.unlock();
        }
    }

    public Optional<Alert> get(String alertId) {
        storeLock.lock();
        try {
            return store.findById(alertId).map(Alert::copy);
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * @param query filter
     * @return copies of matching alerts ordered by creation time
     */
    public List<Alert> list(AlertQuery query) {
        Objects.requireNonNull(query, "AlertQuery must not be null");
        storeLock.lock();
        try {
            List<Alert> candidates = query.getResolved() != null && query.getMinSeverity() != null
                    ? store.findByStatus(query.getResolved(), query.getMinSeverity())
                    : store.findAll();
            return candidates.stream()
                    .filter(query::matches)
                    .sorted(Comparator.comparing(Alert::getCreatedAt).thenComparing(Alert::getId))
                    .map(Alert::copy)
                    .toList();
        } finally {
            storeLock.unlock();
        }
    }

    public AlertSummary summary() {
        storeLock.lock();
        try {
            return AlertSummary.of(store.findAll());
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * Persist buffered alert changes.
     */
    public void flush() {
        storeLock.lock();
        try {
            store.flush();
        } finally {
            storeLock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------

    public void addListener(AlertListener listener) {
        listeners.add(new Registration(null, Objects.requireNonNull(listener, "Listener must not be null")));
    }

    public void addListener(AlertType type, AlertListener listener) {
        Objects.requireNonNull(type, "Alert type must not be null");
        listeners.add(new Registration(type, Objects.requireNonNull(listener, "Listener must not be null")));
    }

    private void notifyListeners(AlertOutcome outcome) {
        for (Registration registration : listeners) {
            if (registration.type != null && registration.type != outcome.getAlert().getType()) {
                continue;
            }
            try {
                registration.listener.onAlert(outcome);
            } catch (RuntimeException e) {
                LOG.warn("Alert listener failed for alert {}: {}", outcome.getAlert().getId(), e.getMessage(), e);
            }
        }
    }

    public Map<String, ChannelHandler> getChannels() {
        return channels;
    }

    @Override
    public void close() {
        dispatcher.close();
        flush();
    }

    private static final class Registration {
        private final AlertType type;
        private final AlertListener listener;

        private Registration(AlertType type, AlertListener listener) {
            this.type = type;
            this.listener = listener;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AlertSystem}. Only the alerting config is
     * required; the store defaults to {@link JsonFileAlertStore} at
     * {@link AlertingConfig#getStorePath()} (memory-only when unset).
     */
    public static class Builder {
        private AlertingConfig config;
        private AlertStore store;
        private final Map<String, ChannelHandler> channels = new LinkedHashMap<>();
        private AlertDispatcher dispatcher;
        private Clock clock = Clock.systemUTC();
        private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();

        public Builder config(AlertingConfig config) {
            this.config = config;
            return this;
        }

        public Builder store(AlertStore store) {
            this.store = store;
            return this;
        }

        public Builder channel(ChannelHandler handler) {
            Objects.requireNonNull(handler, "ChannelHandler must not be null");
            this.channels.put(handler.getName(), handler);
            return this;
        }

        public Builder channels(Map<String, ChannelHandler> handlers) {
            this.channels.putAll(handlers);
            return this;
        }

        public Builder dispatcher(AlertDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
            return this;
        }

        public AlertSystem build() {
            return new AlertSystem(this);
        }
    }
}
