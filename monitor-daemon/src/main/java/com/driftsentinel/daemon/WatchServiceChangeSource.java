package com.driftsentinel.daemon;

import com.driftsentinel.core.model.ChangeEvent;
import com.driftsentinel.core.model.ChangeKind;
import com.driftsentinel.core.monitor.ChangeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * {@link ChangeSource} backed by a recursive JDK {@link WatchService}.
 *
 * <p>
 * Every directory under the project root is registered, and directories
 * created later are registered as they appear. Events carry project-relative
 * paths. With {@code initialScan} enabled, every existing regular file is
 * emitted once as {@link ChangeKind#MODIFIED} before watching starts so the
 * first cycles establish a baseline.
 * </p>
 *
 * @since 1.0.0
 */
public class WatchServiceChangeSource implements ChangeSource {

    private static final Logger LOG = LoggerFactory.getLogger(WatchServiceChangeSource.class);

    private final Path root;
    private final Clock clock;
    private final boolean initialScan;
    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();

    private WatchService watchService;
    private Thread thread;
    private volatile boolean closed;

    public WatchServiceChangeSource(Path root, Clock clock, boolean initialScan) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.initialScan = initialScan;
    }

    @Override
    public synchronized void start(Predicate<ChangeEvent> sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        if (thread != null) {
            throw new IllegalStateException("Change source already started");
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            registerTree(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot watch " + root, e);
        }
        thread = new Thread(() -> watch(sink), "drift-watch");
        thread.setDaemon(true);
        thread.start();
        LOG.info("Watching {} ({} director(ies))", root, directories.size());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                LOG.warn("Failed to close watch service for {}: {}", root, e.getMessage(), e);
            }
        }
        LOG.info("Stopped watching {}", root);
    }

    // ---------------------------------------------------------------
    // Watch loop
    // ---------------------------------------------------------------

    private void watch(Predicate<ChangeEvent> sink) {
        if (initialScan) {
            emitExisting(sink);
        }
        while (!closed) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (ClosedWatchServiceException e) {
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            Path dir = directories.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handle(dir, event, sink);
                }
            }
            if (!key.reset()) {
                directories.remove(key);
            }
        }
    }

    private void handle(Path dir, WatchEvent<?> event, Predicate<ChangeEvent> sink) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            LOG.warn("File-system events were lost under {}; changes may be missed until the next edit", dir);
            return;
        }
        Path changed = dir.resolve((Path) event.context());

        if (kind == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(changed)) {
            try {
                registerTree(changed);
            } catch (IOException e) {
                LOG.warn("Cannot watch new directory {}: {}", changed, e.getMessage(), e);
            }
            // files written before the directory was registered
            emitFiles(changed, ChangeKind.CREATED, sink);
            return;
        }
        if (Files.isDirectory(changed)) {
            return;
        }

        ChangeKind changeKind = kind == StandardWatchEventKinds.ENTRY_CREATE ? ChangeKind.CREATED
                : kind == StandardWatchEventKinds.ENTRY_DELETE ? ChangeKind.DELETED
                        : ChangeKind.MODIFIED;
        emit(changed, changeKind, sink);
    }

    private void emitExisting(Predicate<ChangeEvent> sink) {
        emitFiles(root, ChangeKind.MODIFIED, sink);
    }

    private void emitFiles(Path start, ChangeKind kind, Predicate<ChangeEvent> sink) {
        try (Stream<Path> files = Files.walk(start)) {
            files.filter(Files::isRegularFile)
                    .forEach(file -> emit(file, kind, sink));
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Scan of {} incomplete: {}", start, e.getMessage(), e);
        }
    }

    private void emit(Path file, ChangeKind kind, Predicate<ChangeEvent> sink) {
        String relative = root.relativize(file).toString();
        sink.test(new ChangeEvent(relative, kind, clock.instant()));
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                directories.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
