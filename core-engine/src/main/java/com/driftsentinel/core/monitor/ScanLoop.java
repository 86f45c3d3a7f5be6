package com.driftsentinel.core.monitor;

import com.driftsentinel.core.alerting.AlertEvent;
import com.driftsentinel.core.alerting.AlertOutcome;
import com.driftsentinel.core.alerting.AlertSystem;
import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.detection.SpecificationProvider;
import com.driftsentinel.core.error.ScanException;
import com.driftsentinel.core.error.SpecLoadException;
import com.driftsentinel.core.model.ChangeEvent;
import com.driftsentinel.core.model.ChangeKind;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.SignatureSet;
import com.driftsentinel.core.model.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scheduling loop of one monitoring session. Runs on its own thread and
 * survives every failure except a stop request.
 */
final class ScanLoop implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ScanLoop.class);

    static final String MDC_PROJECT = "project";
    static final String MDC_SCAN = "scan";

    private final Path projectPath;
    private final String projectName;
    private final MonitorConfig config;
    private final ChangeQueue queue;
    private final DriftDetector detector;
    private final SpecificationProvider specifications;
    private final SignatureExtractor extractor;
    private final AlertSystem alertSystem;
    private final ResourceProbe probe;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final ExecutorService workers;

    private volatile boolean stopRequested;
    private volatile boolean running = true;
    private volatile boolean throttled;
    private volatile Instant lastScanAt;
    private volatile String lastError;

    private final AtomicLong scanCounter = new AtomicLong();
    private final AtomicLong scansCompleted = new AtomicLong();
    private final AtomicLong filesScanned = new AtomicLong();
    private final AtomicLong driftsDetected = new AtomicLong();
    private final AtomicLong alertsRaised = new AtomicLong();

    ScanLoop(Path projectPath, MonitorConfig config, ChangeQueue queue, ContinuousMonitor monitor) {
        this.projectPath = projectPath;
        this.projectName = projectPath.getFileName() != null
                ? projectPath.getFileName().toString()
                : projectPath.toString();
        this.config = config;
        this.queue = queue;
        this.detector = monitor.getDetector();
        this.specifications = monitor.getSpecifications();
        this.extractor = monitor.getExtractor();
        this.alertSystem = monitor.getAlertSystem();
        this.probe = monitor.getProbe();
        this.metrics = monitor.getMetrics();
        this.clock = monitor.getClock();
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "drift-scan-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void run() {
        LOG.info("Monitoring {} every {} s (batch size {}, {} worker(s))", projectPath,
                config.getScanInterval().toSeconds(), config.getBatchSize(), config.getWorkerThreads());
        try {
            while (!stopRequested) {
                try {
                    queue.awaitBatch(config.getBatchSize(), config.getScanInterval());
                    if (stopRequested) {
                        break;
                    }
                    tick();
                    if (throttled && !stopRequested) {
                        // a full queue must not turn a deferred tick into a spin
                        queue.awaitWakeUp(config.getScanInterval());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Monitor loop for {} interrupted", projectPath);
                    break;
                }
            }
        } finally {
            running = false;
            workers.shutdown();
            try {
                if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                    LOG.warn("Scan workers for {} did not terminate in time", projectPath);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            LOG.info("Monitor loop for {} stopped after {} scan(s)", projectPath, scansCompleted.get());
        }
    }

    void requestStop() {
        stopRequested = true;
    }

    // ---------------------------------------------------------------
    // One tick
    // ---------------------------------------------------------------

    void tick() {
        long scanId = scanCounter.incrementAndGet();
        MDC.put(MDC_PROJECT, projectName);
        MDC.put(MDC_SCAN, String.valueOf(scanId));
        try {
            if (overBudget()) {
                return;
            }
            throttled = false;

            List<ChangeEvent> batch = queue.drain(config.getBatchSize());
            if (!batch.isEmpty()) {
                LOG.debug("Scanning {} changed file(s), {} still pending", batch.size(), queue.size());
                process(batch);
            }
            flushAlerts();

            scansCompleted.incrementAndGet();
            metrics.incrementScansCompleted();
            lastScanAt = clock.instant();
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            LOG.error("Scan {} of {} failed: {}", scanId, projectPath, e.getMessage(), e);
        } finally {
            MDC.remove(MDC_PROJECT);
            MDC.remove(MDC_SCAN);
        }
    }

    private boolean overBudget() {
        double cpu = probe.cpuPercent();
        long memory = probe.usedMemoryMb();
        if (cpu > config.getMaxCpuPercent() || memory > config.getMaxMemoryMb()) {
            throttled = true;
            metrics.incrementScansThrottled();
            LOG.warn("Deferring scan: CPU {}% / memory {} MB exceeds limits {}% / {} MB ({} change(s) pending)",
                    String.format("%.1f", cpu), memory, config.getMaxCpuPercent(), config.getMaxMemoryMb(),
                    queue.size());
            return true;
        }
        return false;
    }

    private void process(List<ChangeEvent> batch) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        List<Future<FileOutcome>> futures = new ArrayList<>(batch.size());
        for (ChangeEvent event : batch) {
            futures.add(workers.submit(() -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    return scanFile(event);
                } finally {
                    MDC.clear();
                }
            }));
        }

        for (int i = 0; i < batch.size(); i++) {
            ChangeEvent event = batch.get(i);
            FileOutcome outcome;
            try {
                outcome = futures.get(i).get();
            } catch (ExecutionException e) {
                outcome = FileOutcome.failed(new ScanException(event.getPath(),
                        String.valueOf(e.getCause()), e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                queue.requeue(event);
                continue;
            }

            if (outcome.failure != null) {
                handleFailure(event, outcome.failure);
            } else {
                handleReport(outcome.report);
            }
        }
    }

    private FileOutcome scanFile(ChangeEvent event) {
        String path = event.getPath();
        try {
            Optional<Specification> specification;
            try {
                specification = specifications.specificationFor(path);
            } catch (SpecLoadException e) {
                LOG.info("Specification unavailable for {}: {}", path, e.getMessage());
                return FileOutcome.of(DriftReport.unspecified(path, e.getMessage()));
            }
            if (specification.isEmpty()) {
                return FileOutcome.of(detector.check(path, SignatureSet.empty(), null));
            }

            SignatureSet signatures = event.getKind() == ChangeKind.DELETED
                    ? SignatureSet.empty()
                    : extractor.extract(projectPath, path);
            return FileOutcome.of(detector.check(path, signatures, specification.get()));
        } catch (ScanException e) {
            return FileOutcome.failed(e);
        } catch (RuntimeException e) {
            return FileOutcome.failed(new ScanException(path, e.getMessage(), e));
        }
    }

    private void handleReport(DriftReport report) {
        filesScanned.incrementAndGet();
        metrics.incrementFilesScanned();
        for (String note : report.getNotes()) {
            LOG.debug("{}: {}", report.getFilePath(), note);
        }

        DriftReport filtered = report.retainTypes(config.getEnabledChecks());
        if (filtered.isEmpty()) {
            return;
        }
        driftsDetected.addAndGet(filtered.getItems().size());
        metrics.recordItemsDetected(filtered.getItems().size());
        LOG.info("{}: {} drift item(s) against {}", filtered.getFilePath(), filtered.getItems().size(),
                filtered.getSpecReference());

        for (AlertEvent event : AlertEvent.fromReport(filtered)) {
            raise(event);
        }
    }

    private void handleFailure(ChangeEvent event, ScanException failure) {
        lastError = failure.getMessage();
        metrics.incrementFilesFailed();
        if (event.getAttempt() >= config.getMaxScanAttempts()) {
            LOG.error("Giving up on {} after {} attempt(s): {}", event.getPath(), event.getAttempt(),
                    failure.getMessage(), failure);
            raise(AlertEvent.scanFailure(event.getPath(), event.getAttempt(), failure.getMessage()));
        } else {
            LOG.warn("Scan of {} failed (attempt {}/{}), retrying next cycle: {}", event.getPath(),
                    event.getAttempt(), config.getMaxScanAttempts(), failure.getMessage(), failure);
            queue.requeue(event.nextAttempt());
        }
    }

    private void raise(AlertEvent event) {
        try {
            AlertOutcome outcome = alertSystem.createAlert(event);
            if (outcome.isSuppressed()) {
                metrics.incrementAlertsSuppressed();
            } else {
                alertsRaised.incrementAndGet();
                metrics.incrementAlertsRaised();
            }
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            LOG.error("Failed to raise alert for {}: {}", event.getFilePath(), e.getMessage(), e);
        }
    }

    private void flushAlerts() {
        try {
            alertSystem.flush();
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            LOG.error("Failed to persist alerts: {}", e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    MonitorStatus status() {
        return new MonitorStatus(running && !stopRequested, lastScanAt, lastError, throttled,
                scansCompleted.get(), filesScanned.get(), driftsDetected.get(), alertsRaised.get(),
                queue.size());
    }

    private static final class FileOutcome {
        private final DriftReport report;
        private final ScanException failure;

        private FileOutcome(DriftReport report, ScanException failure) {
            this.report = report;
            this.failure = failure;
        }

        static FileOutcome of(DriftReport report) {
            return new FileOutcome(report, null);
        }

        static FileOutcome failed(ScanException failure) {
            return new FileOutcome(null, failure);
        }
    }
}
