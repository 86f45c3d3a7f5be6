package com.driftsentinel.core.config;

import com.driftsentinel.core.error.ConfigException;
import com.driftsentinel.core.model.DriftType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Typed, immutable configuration of one monitoring session.
 *
 * <p>
 * A session captures its config at start; changing any value requires a
 * restart. Use the {@link Builder}; {@link #validate()} is called by the
 * monitor before the scheduling loop starts and reports every problem at once.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfig {

    private final Duration scanInterval;
    private final List<String> watchPatterns;
    private final List<String> ignorePatterns;
    private final double maxCpuPercent;
    private final long maxMemoryMb;
    private final int batchSize;
    private final Set<DriftType> enabledChecks;
    private final int queueCapacity;
    private final OverflowPolicy overflowPolicy;
    private final Duration offerTimeout;
    private final int workerThreads;
    private final int maxScanAttempts;

    private MonitorConfig(Builder b) {
        this.scanInterval = b.scanInterval;
        this.watchPatterns = Collections.unmodifiableList(new ArrayList<>(b.watchPatterns));
        this.ignorePatterns = Collections.unmodifiableList(new ArrayList<>(b.ignorePatterns));
        this.maxCpuPercent = b.maxCpuPercent;
        this.maxMemoryMb = b.maxMemoryMb;
        this.batchSize = b.batchSize;
        this.enabledChecks = b.enabledChecks.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.enabledChecks));
        this.queueCapacity = b.queueCapacity;
        this.overflowPolicy = b.overflowPolicy;
        this.offerTimeout = b.offerTimeout;
        this.workerThreads = b.workerThreads;
        this.maxScanAttempts = b.maxScanAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MonitorConfig defaults() {
        return builder().build();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Verify that every value is within its legal range.
     *
     * @throws ConfigException listing every invalid value
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (scanInterval == null || scanInterval.isNegative() || scanInterval.isZero()) {
            errors.add("scanInterval must be > 0, got: " + scanInterval);
        }
        if (batchSize <= 0) {
            errors.add("batchSize must be > 0, got: " + batchSize);
        }
        if (maxCpuPercent <= 0 || maxCpuPercent > 100) {
            errors.add("maxCpuPercent must be in (0, 100], got: " + maxCpuPercent);
        }
        if (maxMemoryMb <= 0) {
            errors.add("maxMemoryMb must be > 0, got: " + maxMemoryMb);
        }
        if (queueCapacity < batchSize) {
            errors.add("queueCapacity must be >= batchSize, got: " + queueCapacity);
        }
        if (overflowPolicy == null) {
            errors.add("overflowPolicy is required");
        }
        if (offerTimeout == null || offerTimeout.isNegative()) {
            errors.add("offerTimeout must be >= 0, got: " + offerTimeout);
        }
        if (workerThreads < 1) {
            errors.add("workerThreads must be >= 1, got: " + workerThreads);
        }
        if (maxScanAttempts < 1) {
            errors.add("maxScanAttempts must be >= 1, got: " + maxScanAttempts);
        }
        if (enabledChecks.isEmpty()) {
            errors.add("enabledChecks must name at least one drift type");
        }

        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid MonitorConfig: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Duration getScanInterval() {
        return scanInterval;
    }

    public List<String> getWatchPatterns() {
        return watchPatterns;
    }

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }

    public double getMaxCpuPercent() {
        return maxCpuPercent;
    }

    public long getMaxMemoryMb() {
        return maxMemoryMb;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Set<DriftType> getEnabledChecks() {
        return enabledChecks;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public Duration getOfferTimeout() {
        return offerTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getMaxScanAttempts() {
        return maxScanAttempts;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonitorConfig}. Defaults: 300 s interval, all
     * checks enabled, batch of 50, 80 % CPU, 512 MB.
     */
    public static class Builder {
        private Duration scanInterval = Duration.ofSeconds(300);
        private List<String> watchPatterns = List.of("**");
        private List<String> ignorePatterns = List.of(".git/**", ".drift/**", "target/**", "**/target/**", "**/node_modules/**");
        private double maxCpuPercent = 80.0;
        private long maxMemoryMb = 512;
        private int batchSize = 50;
        private Set<DriftType> enabledChecks = EnumSet.allOf(DriftType.class);
        private int queueCapacity = 1_000;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
        private Duration offerTimeout = Duration.ofSeconds(1);
        private int workerThreads = 2;
        private int maxScanAttempts = 3;

        public Builder scanInterval(Duration v) {
            this.scanInterval = v;
            return this;
        }

        public Builder watchPatterns(List<String> v) {
            this.watchPatterns = v != null ? v : List.of();
            return this;
        }

        public Builder ignorePatterns(List<String> v) {
            this.ignorePatterns = v != null ? v : List.of();
            return this;
        }

        public Builder maxCpuPercent(double v) {
            this.maxCpuPercent = v;
            return this;
        }

        public Builder maxMemoryMb(long v) {
            this.maxMemoryMb = v;
            return this;
        }

        public Builder batchSize(int v) {
            this.batchSize = v;
            return this;
        }

        public Builder enabledChecks(Set<DriftType> v) {
            this.enabledChecks = v != null ? v : Set.of();
            return this;
        }

        public Builder queueCapacity(int v) {
            this.queueCapacity = v;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy v) {
            this.overflowPolicy = v;
            return this;
        }

        public Builder offerTimeout(Duration v) {
            this.offerTimeout = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder maxScanAttempts(int v) {
            this.maxScanAttempts = v;
            return this;
        }

        public MonitorConfig build() {
            return new MonitorConfig(this);
        }
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "scanInterval=" + scanInterval +
                ", watchPatterns=" + watchPatterns +
                ", ignorePatterns=" + ignorePatterns +
                ", maxCpuPercent=" + maxCpuPercent +
                ", maxMemoryMb=" + maxMemoryMb +
                ", batchSize=" + batchSize +
                ", enabledChecks=" + enabledChecks +
                ", queueCapacity=" + queueCapacity +
                ", overflowPolicy=" + overflowPolicy +
                ", workerThreads=" + workerThreads +
                '}';
    }
}
