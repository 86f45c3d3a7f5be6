package com.driftsentinel.core.monitor;

import java.time.Instant;

/**
 * Point-in-time view of a monitoring session.
 *
 * @since 1.0.0
 */
public final class MonitorStatus {

    private final boolean running;
    private final Instant lastScanAt;
    private final String lastError;
    private final boolean throttled;
    private final long scansCompleted;
    private final long filesScanned;
    private final long driftsDetected;
    private final long alertsRaised;
    private final int pendingChanges;

    public MonitorStatus(boolean running, Instant lastScanAt, String lastError, boolean throttled,
            long scansCompleted, long filesScanned, long driftsDetected, long alertsRaised, int pendingChanges) {
        this.running = running;
        this.lastScanAt = lastScanAt;
        this.lastError = lastError;
        this.throttled = throttled;
        this.scansCompleted = scansCompleted;
        this.filesScanned = filesScanned;
        this.driftsDetected = driftsDetected;
        this.alertsRaised = alertsRaised;
        this.pendingChanges = pendingChanges;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return completion time of the last scan; {@code null} before the first
     */
    public Instant getLastScanAt() {
        return lastScanAt;
    }

    /**
     * @return message of the most recent recoverable error; {@code null} if none
     */
    public String getLastError() {
        return lastError;
    }

    /**
     * @return {@code true} if the latest tick was skipped because resource
     *         usage exceeded the configured ceilings
     */
    public boolean isThrottled() {
        return throttled;
    }

    public long getScansCompleted() {
        return scansCompleted;
    }

    public long getFilesScanned() {
        return filesScanned;
    }

    public long getDriftsDetected() {
        return driftsDetected;
    }

    public long getAlertsRaised() {
        return alertsRaised;
    }

    public int getPendingChanges() {
        return pendingChanges;
    }

    @Override
    public String toString() {
        return "MonitorStatus{" +
                "running=" + running +
                ", lastScanAt=" + lastScanAt +
                ", lastError='" + lastError + '\'' +
                ", throttled=" + throttled +
                ", scansCompleted=" + scansCompleted +
                ", filesScanned=" + filesScanned +
                ", driftsDetected=" + driftsDetected +
                ", alertsRaised=" + alertsRaised +
                ", pendingChanges=" + pendingChanges +
                '}';
    }
}
