package com.driftsentinel.core.config;

import com.driftsentinel.core.error.ConfigException;
import com.driftsentinel.core.model.DriftType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * YAML-bound {@code monitor:} section, converted to an immutable
 * {@link MonitorConfig} by {@link #toMonitorConfig()}.
 *
 * <pre>
 * monitor:
 *   scanIntervalSeconds: 60
 *   batchSize: 20
 *   maxCpuPercent: 75
 *   enabledChecks: [missing_implementation, signature_mismatch]
 * </pre>
 *
 * @since 1.0.0
 */
public class MonitorProperties {

    private long scanIntervalSeconds = 300;
    private List<String> watchPatterns = new ArrayList<>(List.of("**"));
    private List<String> ignorePatterns = new ArrayList<>(List.of(".git/**", ".drift/**", "target/**", "**/target/**", "**/node_modules/**"));
    private double maxCpuPercent = 80.0;
    private long maxMemoryMb = 512;
    private int batchSize = 50;
    /** Empty means every drift type. */
    private List<String> enabledChecks = new ArrayList<>();
    private int queueCapacity = 1_000;
    private String overflowPolicy = "drop_oldest";
    private long offerTimeoutMs = 1_000;
    private int workerThreads = 2;
    private int maxScanAttempts = 3;

    /**
     * @return the immutable session config
     * @throws ConfigException if a drift type or overflow policy name is unknown
     */
    public MonitorConfig toMonitorConfig() {
        return MonitorConfig.builder()
                .scanInterval(Duration.ofSeconds(scanIntervalSeconds))
                .watchPatterns(watchPatterns)
                .ignorePatterns(ignorePatterns)
                .maxCpuPercent(maxCpuPercent)
                .maxMemoryMb(maxMemoryMb)
                .batchSize(batchSize)
                .enabledChecks(parseChecks())
                .queueCapacity(queueCapacity)
                .overflowPolicy(parsePolicy())
                .offerTimeout(Duration.ofMillis(offerTimeoutMs))
                .workerThreads(workerThreads)
                .maxScanAttempts(maxScanAttempts)
                .build();
    }

    private Set<DriftType> parseChecks() {
        if (enabledChecks == null || enabledChecks.isEmpty()) {
            return EnumSet.allOf(DriftType.class);
        }
        Set<DriftType> checks = EnumSet.noneOf(DriftType.class);
        for (String check : enabledChecks) {
            try {
                checks.add(DriftType.valueOf(check.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Unknown drift check in monitor.enabledChecks: '" + check + "'", e);
            }
        }
        return checks;
    }

    private OverflowPolicy parsePolicy() {
        try {
            return OverflowPolicy.valueOf(overflowPolicy.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new ConfigException("Unknown monitor.overflowPolicy: '" + overflowPolicy
                    + "'. Supported: block, drop_oldest", e);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public long getScanIntervalSeconds() {
        return scanIntervalSeconds;
    }

    public void setScanIntervalSeconds(long scanIntervalSeconds) {
        this.scanIntervalSeconds = scanIntervalSeconds;
    }

    public List<String> getWatchPatterns() {
        return watchPatterns;
    }

    public void setWatchPatterns(List<String> watchPatterns) {
        this.watchPatterns = watchPatterns;
    }

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }

    public void setIgnorePatterns(List<String> ignorePatterns) {
        this.ignorePatterns = ignorePatterns;
    }

    public double getMaxCpuPercent() {
        return maxCpuPercent;
    }

    public void setMaxCpuPercent(double maxCpuPercent) {
        this.maxCpuPercent = maxCpuPercent;
    }

    public long getMaxMemoryMb() {
        return maxMemoryMb;
    }

    public void setMaxMemoryMb(long maxMemoryMb) {
        this.maxMemoryMb = maxMemoryMb;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public List<String> getEnabledChecks() {
        return enabledChecks;
    }

    public void setEnabledChecks(List<String> enabledChecks) {
        this.enabledChecks = enabledChecks;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public String getOverflowPolicy() {
        return overflowPolicy;
    }

    public void setOverflowPolicy(String overflowPolicy) {
        this.overflowPolicy = overflowPolicy;
    }

    public long getOfferTimeoutMs() {
        return offerTimeoutMs;
    }

    public void setOfferTimeoutMs(long offerTimeoutMs) {
        this.offerTimeoutMs = offerTimeoutMs;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getMaxScanAttempts() {
        return maxScanAttempts;
    }

    public void setMaxScanAttempts(int maxScanAttempts) {
        this.maxScanAttempts = maxScanAttempts;
    }

    @Override
    public String toString() {
        return "MonitorProperties{" +
                "scanIntervalSeconds=" + scanIntervalSeconds +
                ", batchSize=" + batchSize +
                ", maxCpuPercent=" + maxCpuPercent +
                ", maxMemoryMb=" + maxMemoryMb +
                ", enabledChecks=" + enabledChecks +
                ", overflowPolicy='" + overflowPolicy + '\'' +
                '}';
    }
}
