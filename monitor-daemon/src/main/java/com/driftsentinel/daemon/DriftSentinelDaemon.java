package com.driftsentinel.daemon;

import com.driftsentinel.core.alerting.AlertOutcome;
import com.driftsentinel.core.alerting.AlertSystem;
import com.driftsentinel.core.alerting.JsonSupport;
import com.driftsentinel.core.alerting.channel.ChannelFactory;
import com.driftsentinel.core.alerting.store.JsonFileAlertStore;
import com.driftsentinel.core.config.ConfigLoader;
import com.driftsentinel.core.config.SentinelConfig;
import com.driftsentinel.core.config.SpecificationLoader;
import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.detection.SpecificationRegistry;
import com.driftsentinel.core.model.Suggestion;
import com.driftsentinel.core.monitor.ContinuousMonitor;
import com.driftsentinel.core.monitor.MonitorHandle;
import com.driftsentinel.core.realignment.RealignmentEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Main entry point for the Drift Sentinel daemon.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   WatchService (project tree)
 *     → ChangeEvent → MonitorHandle.submit (watch / ignore patterns)
 *     → ContinuousMonitor scan cycle (resource check, batch, DriftDetector)
 *     → AlertSystem (dedup, suppression, rate limit, channels)
 *     → RealignmentEngine suggestions logged for new alerts
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings are resolved from environment variables via
 * {@link DaemonConfig}; monitoring, detection and alerting come from
 * {@code drift-sentinel.yml}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftSentinelDaemon {

    private static final Logger LOG = LoggerFactory.getLogger(DriftSentinelDaemon.class);

    private DriftSentinelDaemon() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        DaemonConfig config = DaemonConfig.fromEnvironment();
        LOG.info("Starting Drift Sentinel with config: {}", config);

        SentinelConfig sentinel = loadConfig(config);
        SpecificationRegistry specifications = loadSpecifications(config);
        if (specifications.size() == 0) {
            LOG.warn("No specifications loaded; every file will be reported as unspecified");
        }
        LOG.info("Loaded {} specification mapping(s)", specifications.size());

        // 2. Alerting and realignment
        ObjectMapper mapper = JsonSupport.newObjectMapper();
        AlertSystem alertSystem = buildAlertSystem(config, sentinel);
        RealignmentEngine realignment = new RealignmentEngine(
                Duration.ofMillis(sentinel.getRealignment().getEnricherTimeoutMs()));
        alertSystem.addListener(outcome -> logSuggestions(realignment, outcome));

        // 3. Monitor
        ContinuousMonitor monitor = ContinuousMonitor.builder()
                .detector(new DriftDetector(sentinel.getDetection()))
                .specifications(specifications)
                .extractor(new JsonSignatureExtractor(config.getSignaturesPath(), mapper))
                .alertSystem(alertSystem)
                .build();
        MonitorHandle handle = monitor.start(config.getProjectPath(), sentinel.getMonitor().toMonitorConfig());

        // 4. File-system watcher feeding the monitor queue
        WatchServiceChangeSource watcher = new WatchServiceChangeSource(config.getProjectPath(),
                Clock.systemUTC(), true);
        watcher.start(handle::submit);

        // 5. Health server (for K8s probes and operators)
        HealthServer healthServer = new HealthServer(handle::status, alertSystem, mapper);
        healthServer.start(config.getHealthPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            watcher.close();
            handle.stop();
            healthServer.stop();
            realignment.close();
            alertSystem.close();
        }, "drift-sentinel-shutdown"));

        LOG.info("Drift Sentinel monitoring {}", config.getProjectPath());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SentinelConfig loadConfig(DaemonConfig config) {
        String path = config.getSentinelConfigPath();
        if (path != null && !path.isBlank()) {
            return ConfigLoader.fromFile(path);
        }
        return ConfigLoader.load();
    }

    private static SpecificationRegistry loadSpecifications(DaemonConfig config) {
        String path = config.getSpecsPath();
        if (path != null && !path.isBlank()) {
            return SpecificationLoader.fromFile(path);
        }
        return SpecificationLoader.fromClasspath("specifications.yml");
    }

    private static AlertSystem buildAlertSystem(DaemonConfig config, SentinelConfig sentinel) {
        AlertSystem.Builder builder = AlertSystem.builder()
                .config(sentinel.getAlerting())
                .channels(ChannelFactory.createAll(sentinel.getChannels()));
        String storePath = config.getAlertStorePath();
        if (storePath != null && !storePath.isBlank()) {
            builder.store(new JsonFileAlertStore(Path.of(storePath)));
        }
        return builder.build();
    }

    private static void logSuggestions(RealignmentEngine realignment, AlertOutcome outcome) {
        if (outcome.getStatus() != AlertOutcome.Status.CREATED) {
            return;
        }
        List<Suggestion> suggestions = realignment.suggestForAlert(outcome.getAlert(), null);
        if (!suggestions.isEmpty()) {
            Suggestion top = suggestions.get(0);
            LOG.info("Suggested fix for {} ({} option(s)): {} [priority {}, effort {}]",
                    outcome.getAlert().getFilePath(), suggestions.size(), top.getTitle(),
                    top.getPriority(), top.getEffort());
        }
    }
}
