package com.driftsentinel.core.monitor;

import com.driftsentinel.core.config.OverflowPolicy;
import com.driftsentinel.core.model.ChangeEvent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded hand-off between the change source and the scan loop.
 *
 * <p>
 * When full, {@link OverflowPolicy#BLOCK} makes the producer wait up to the
 * offer timeout and then drops the new event; {@link OverflowPolicy#DROP_OLDEST}
 * evicts the oldest queued event. Dropped events are counted. Draining merges
 * events for the same path into one, keeping the latest change kind; a fresh
 * change always wins over a requeued retry of the same path.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangeQueue {

    private final int capacity;
    private final OverflowPolicy policy;
    private final Duration offerTimeout;

    private final ArrayDeque<ChangeEvent> events;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition changed = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();

    private boolean wakeUp;

    public ChangeQueue(int capacity, OverflowPolicy policy, Duration offerTimeout) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.policy = Objects.requireNonNull(policy, "OverflowPolicy must not be null");
        this.offerTimeout = Objects.requireNonNull(offerTimeout, "offerTimeout must not be null");
        this.events = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * @param event change event
     * @return {@code false} if the event was dropped
     */
    public boolean offer(ChangeEvent event) {
        Objects.requireNonNull(event, "ChangeEvent must not be null");
        lock.lock();
        try {
            if (events.size() >= capacity) {
                if (policy == OverflowPolicy.DROP_OLDEST) {
                    events.pollFirst();
                    dropped.incrementAndGet();
                } else if (!awaitSpace()) {
                    dropped.incrementAndGet();
                    return false;
                }
            }
            events.addLast(event);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put a failed event back for the next cycle without blocking. If the
     * queue is full the oldest event is evicted.
     */
    public void requeue(ChangeEvent event) {
        lock.lock();
        try {
            if (events.size() >= capacity) {
                events.pollFirst();
                dropped.incrementAndGet();
            }
            events.addLast(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove up to {@code max} distinct paths, merging duplicates.
     *
     * @param max maximum number of distinct paths
     * @return events in first-seen order
     */
    public List<ChangeEvent> drain(int max) {
        lock.lock();
        try {
            Map<String, ChangeEvent> batch = new LinkedHashMap<>();
            while (!events.isEmpty()) {
                ChangeEvent next = events.peekFirst();
                if (!batch.containsKey(next.getPath()) && batch.size() >= max) {
                    break;
                }
                events.pollFirst();
                ChangeEvent queued = batch.get(next.getPath());
                // a fresh change supersedes a retry whatever their order in the queue
                if (queued == null || !(next.getAttempt() > 1 && queued.getAttempt() == 1)) {
                    batch.put(next.getPath(), next);
                }
            }
            notFull.signalAll();
            return new ArrayList<>(batch.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until at least {@code batchSize} events are queued, the timeout
     * elapses, or {@link #wakeUp()} is called.
     *
     * @return {@code true} if a full batch is available
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitBatch(int batchSize, Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (events.size() < batchSize && !wakeUp && nanos > 0) {
                nanos = changed.awaitNanos(nanos);
            }
            wakeUp = false;
            return events.size() >= batchSize;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for the full timeout or until {@link #wakeUp()} is called. New
     * events do not end the wait.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitWakeUp(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (!wakeUp && nanos > 0) {
                nanos = changed.awaitNanos(nanos);
            }
            wakeUp = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release a consumer blocked in {@link #awaitBatch(int, Duration)} or
     * {@link #awaitWakeUp(Duration)}.
     */
    public void wakeUp() {
        lock.lock();
        try {
            wakeUp = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int getCapacity() {
        return capacity;
    }

    private boolean awaitSpace() {
        long nanos = offerTimeout.toNanos();
        try {
            while (events.size() >= capacity) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String toString() {
        return "ChangeQueue{size=" + size() + ", capacity=" + capacity + ", policy=" + policy
                + ", dropped=" + dropped.get() + '}';
    }
}
