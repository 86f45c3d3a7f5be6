package com.driftsentinel.core.monitor;

import com.driftsentinel.core.alerting.AlertSystem;
import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.detection.SpecificationProvider;
import com.driftsentinel.core.error.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Drives drift scans of a project within resource ceilings.
 *
 * <h3>Scan cycle</h3>
 * <p>
 * Each session runs a loop on its own thread. A tick fires after the scan
 * interval or as soon as a full batch of changes is queued. The tick first
 * samples CPU and memory; over budget, it is skipped and the status reports
 * {@code throttled}. Otherwise up to {@code batchSize} changed files are
 * checked on a small worker pool and non-empty reports are turned into
 * alerts. A file that fails is retried on later ticks and, after
 * {@code maxScanAttempts}, reported as a {@code SCAN_FAILURE} alert.
 * </p>
 *
 * <p>
 * Only configuration errors raised by {@link #start(Path, MonitorConfig)} are
 * fatal. Nothing that happens inside a tick ends the loop.
 * </p>
 *
 * @since 1.0.0
 */
public class ContinuousMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(ContinuousMonitor.class);

    private final DriftDetector detector;
    private final SpecificationProvider specifications;
    private final SignatureExtractor extractor;
    private final AlertSystem alertSystem;
    private final ResourceProbe probe;
    private final MonitorMetrics metrics;
    private final Clock clock;

    private ContinuousMonitor(Builder builder) {
        this.detector = Objects.requireNonNull(builder.detector, "DriftDetector must not be null");
        this.specifications = Objects.requireNonNull(builder.specifications, "SpecificationProvider must not be null");
        this.extractor = Objects.requireNonNull(builder.extractor, "SignatureExtractor must not be null");
        this.alertSystem = Objects.requireNonNull(builder.alertSystem, "AlertSystem must not be null");
        this.probe = builder.probe != null ? builder.probe : new JvmResourceProbe();
        this.metrics = builder.metrics != null ? builder.metrics : new MonitorMetrics();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Validate the configuration and start a monitoring session.
     *
     * @param projectPath project root directory
     * @param config      session configuration, fixed for the session's lifetime
     * @return handle for submitting changes, querying status and stopping
     * @throws ConfigException if the path is not a directory or the config is
     *                         invalid
     */
    public MonitorHandle start(Path projectPath, MonitorConfig config) {
        if (projectPath == null) {
            throw new ConfigException("Project path is required");
        }
        if (config == null) {
            throw new ConfigException("MonitorConfig is required");
        }
        if (!Files.isDirectory(projectPath)) {
            throw new ConfigException("Project path is not a directory: " + projectPath);
        }
        config.validate();

        Path root = projectPath.toAbsolutePath().normalize();
        ChangeQueue queue = new ChangeQueue(config.getQueueCapacity(), config.getOverflowPolicy(),
                config.getOfferTimeout());
        metrics.bindQueue(queue);

        ScanLoop loop = new ScanLoop(root, config, queue, this);
        Thread thread = new Thread(loop, "drift-monitor-" + (root.getFileName() != null ? root.getFileName() : "root"));
        thread.setUncaughtExceptionHandler((t, e) -> LOG.error("Monitor thread {} died", t.getName(), e));
        MonitorHandle handle = new MonitorHandle(root, config, queue, loop, thread, alertSystem);
        thread.start();

        LOG.info("Started monitoring {} with {}", root, config);
        return handle;
    }

    /**
     * @see MonitorHandle#stop()
     */
    public void stop(MonitorHandle handle) {
        Objects.requireNonNull(handle, "MonitorHandle must not be null").stop();
    }

    public MonitorStatus status(MonitorHandle handle) {
        return Objects.requireNonNull(handle, "MonitorHandle must not be null").status();
    }

    DriftDetector getDetector() {
        return detector;
    }

    SpecificationProvider getSpecifications() {
        return specifications;
    }

    SignatureExtractor getExtractor() {
        return extractor;
    }

    AlertSystem getAlertSystem() {
        return alertSystem;
    }

    ResourceProbe getProbe() {
        return probe;
    }

    public MonitorMetrics getMetrics() {
        return metrics;
    }

    Clock getClock() {
        return clock;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ContinuousMonitor}. Detector, specifications,
     * extractor and alert system are required; the probe defaults to
     * {@link JvmResourceProbe} and metrics to a {@code SimpleMeterRegistry}.
     */
    public static class Builder {
        private DriftDetector detector;
        private SpecificationProvider specifications;
        private SignatureExtractor extractor;
        private AlertSystem alertSystem;
        private ResourceProbe probe;
        private MonitorMetrics metrics;
        private Clock clock;

        public Builder detector(DriftDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder specifications(SpecificationProvider specifications) {
            this.specifications = specifications;
            return this;
        }

        public Builder extractor(SignatureExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder alertSystem(AlertSystem alertSystem) {
            this.alertSystem = alertSystem;
            return this;
        }

        public Builder probe(ResourceProbe probe) {
            this.probe = probe;
            return this;
        }

        public Builder metrics(MonitorMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ContinuousMonitor build() {
            return new ContinuousMonitor(this);
        }
    }
}
