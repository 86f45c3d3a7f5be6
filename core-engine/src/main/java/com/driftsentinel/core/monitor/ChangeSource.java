package com.driftsentinel.core.monitor;

import com.driftsentinel.core.model.ChangeEvent;

import java.util.function.Predicate;

/**
 * Producer of file change events, typically a file-system watcher running on
 * its own thread.
 *
 * @since 1.0.0
 */
public interface ChangeSource extends AutoCloseable {

    /**
     * Begin emitting events to {@code sink}, usually
     * {@link MonitorHandle#submit(ChangeEvent)}. The sink returns
     * {@code false} for events it did not accept.
     *
     * @param sink event consumer
     */
    void start(Predicate<ChangeEvent> sink);

    /**
     * Stop emitting events and release resources.
     */
    @Override
    void close();
}
