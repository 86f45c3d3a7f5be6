package com.driftsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single file-system change waiting to be scanned.
 *
 * <p>
 * Paths are project-relative and use {@code /} as separator. The attempt counter
 * starts at 1 and is incremented each time a failed scan re-queues the event.
 * </p>
 */
public final class ChangeEvent {

    private final String path;
    private final ChangeKind kind;
    private final Instant timestamp;
    private final int attempt;

    public ChangeEvent(String path, ChangeKind kind, Instant timestamp) {
        this(path, kind, timestamp, 1);
    }

    private ChangeEvent(String path, ChangeKind kind, Instant timestamp, int attempt) {
        this.path = normalize(Objects.requireNonNull(path, "Change path must not be null"));
        this.kind = Objects.requireNonNull(kind, "Change kind must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Change timestamp must not be null");
        this.attempt = attempt;
    }

    public static ChangeEvent modified(String path, Instant timestamp) {
        return new ChangeEvent(path, ChangeKind.MODIFIED, timestamp);
    }

    /**
     * @return a copy of this event for the next scan attempt
     */
    public ChangeEvent nextAttempt() {
        return new ChangeEvent(path, kind, timestamp, attempt + 1);
    }

    public String getPath() {
        return path;
    }

    public ChangeKind getKind() {
        return kind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getAttempt() {
        return attempt;
    }

    private static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChangeEvent that))
            return false;
        return attempt == that.attempt
                && path.equals(that.path)
                && kind == that.kind
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, kind, timestamp, attempt);
    }

    @Override
    public String toString() {
        return "ChangeEvent{" + kind + " " + path + " attempt=" + attempt + '}';
    }
}
