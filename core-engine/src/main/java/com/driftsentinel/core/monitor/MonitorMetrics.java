package com.driftsentinel.core.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/**
 * Micrometer meters for the scan loop.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code drift.scans.completed} - scans that ran to completion</li>
 * <li>{@code drift.scans.throttled} - ticks skipped for resource usage</li>
 * <li>{@code drift.files.scanned} / {@code drift.files.failed}</li>
 * <li>{@code drift.items.detected} - drift items after filtering</li>
 * <li>{@code drift.alerts.raised} / {@code drift.alerts.suppressed}</li>
 * <li>{@code drift.queue.pending} - gauge of queued change events</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MonitorMetrics {

    private final MeterRegistry registry;
    private final Counter scansCompleted;
    private final Counter scansThrottled;
    private final Counter filesScanned;
    private final Counter filesFailed;
    private final Counter itemsDetected;
    private final Counter alertsRaised;
    private final Counter alertsSuppressed;

    public MonitorMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.scansCompleted = registry.counter("drift.scans.completed");
        this.scansThrottled = registry.counter("drift.scans.throttled");
        this.filesScanned = registry.counter("drift.files.scanned");
        this.filesFailed = registry.counter("drift.files.failed");
        this.itemsDetected = registry.counter("drift.items.detected");
        this.alertsRaised = registry.counter("drift.alerts.raised");
        this.alertsSuppressed = registry.counter("drift.alerts.suppressed");
    }

    void bindQueue(ChangeQueue queue) {
        Gauge.builder("drift.queue.pending", queue, ChangeQueue::size)
                .description("Change events waiting for the next scan")
                .register(registry);
    }

    public void incrementScansCompleted() {
        scansCompleted.increment();
    }

    public void incrementScansThrottled() {
        scansThrottled.increment();
    }

    public void incrementFilesScanned() {
        filesScanned.increment();
    }

    public void incrementFilesFailed() {
        filesFailed.increment();
    }

    public void recordItemsDetected(int count) {
        itemsDetected.increment(count);
    }

    public void incrementAlertsRaised() {
        alertsRaised.increment();
    }

    public void incrementAlertsSuppressed() {
        alertsSuppressed.increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
