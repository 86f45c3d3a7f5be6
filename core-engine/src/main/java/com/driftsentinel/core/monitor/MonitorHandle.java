package com.driftsentinel.core.monitor;

import com.driftsentinel.core.alerting.AlertSystem;
import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.model.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on one running monitoring session, returned by
 * {@link ContinuousMonitor#start(Path, MonitorConfig)}.
 *
 * <p>
 * The handle owns the session's change queue, scan thread and config; nothing
 * is shared between sessions. Change sources feed it through
 * {@link #submit(ChangeEvent)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorHandle {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorHandle.class);

    private final Path projectPath;
    private final MonitorConfig config;
    private final ChangeQueue queue;
    private final ScanLoop loop;
    private final Thread thread;
    private final AlertSystem alertSystem;
    private final List<PathMatcher> watch;
    private final List<PathMatcher> ignore;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    MonitorHandle(Path projectPath, MonitorConfig config, ChangeQueue queue, ScanLoop loop, Thread thread,
            AlertSystem alertSystem) {
        this.projectPath = projectPath;
        this.config = config;
        this.queue = queue;
        this.loop = loop;
        this.thread = thread;
        this.alertSystem = alertSystem;
        this.watch = config.getWatchPatterns().stream().map(MonitorHandle::matcher).toList();
        this.ignore = config.getIgnorePatterns().stream().map(MonitorHandle::matcher).toList();
    }

    /**
     * Queue a change for the next scan. Paths outside the watch patterns or
     * inside the ignore patterns are rejected.
     *
     * @param event change event with a project-relative path
     * @return {@code true} if the event was queued
     */
    public boolean submit(ChangeEvent event) {
        Objects.requireNonNull(event, "ChangeEvent must not be null");
        if (stopped.get()) {
            return false;
        }
        Path path = Path.of(event.getPath());
        if (ignore.stream().anyMatch(m -> m.matches(path))
                || (!watch.isEmpty() && watch.stream().noneMatch(m -> m.matches(path)))) {
            LOG.trace("Ignoring change to {}", event.getPath());
            return false;
        }
        boolean accepted = queue.offer(event);
        if (!accepted) {
            LOG.warn("Change queue full, dropped change to {}", event.getPath());
        }
        return accepted;
    }

    /**
     * Run the next scan now instead of waiting for the interval or a full
     * batch.
     */
    public void scanNow() {
        queue.wakeUp();
    }

    public MonitorStatus status() {
        return loop.status();
    }

    public boolean isRunning() {
        return status().isRunning();
    }

    /**
     * Stop the session: the scan in progress completes, the scan thread is
     * joined and buffered alerts are flushed. Calling it again has no effect.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Stopping monitor for {}", projectPath);
        loop.requestStop();
        queue.wakeUp();
        if (Thread.currentThread() != thread) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for monitor thread of {}", projectPath);
            }
        }
        try {
            alertSystem.flush();
        } catch (RuntimeException e) {
            LOG.error("Failed to flush alerts on stop: {}", e.getMessage(), e);
        }
    }

    public Path getProjectPath() {
        return projectPath;
    }

    public MonitorConfig getConfig() {
        return config;
    }

    public long droppedChanges() {
        return queue.droppedCount();
    }

    private static PathMatcher matcher(String glob) {
        return FileSystems.getDefault().getPathMatcher("glob:" + glob);
    }
}
