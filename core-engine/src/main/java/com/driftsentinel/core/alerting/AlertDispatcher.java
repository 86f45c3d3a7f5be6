package com.driftsentinel.core.alerting;

import com.driftsentinel.core.alerting.channel.ChannelHandler;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Isolated fan-out of one alert to several channels.
 *
 * <p>
 * Every handler runs on its own pool thread with its own copy of the alert.
 * The caller waits at most the configured timeout for each handler; a handler
 * that throws or overruns is recorded as a failed {@link DeliveryResult} and
 * never affects the others. Overrunning handlers are not interrupted and may
 * still complete in the background.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    private final Duration timeout;
    private final ExecutorService executor;

    public AlertDispatcher(Duration timeout) {
        this(timeout, Executors.newCachedThreadPool(new DispatchThreadFactory()));
    }

    public AlertDispatcher(Duration timeout, ExecutorService executor) {
        this.timeout = Objects.requireNonNull(timeout, "Timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Dispatch timeout must be > 0, got: " + timeout);
        }
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
    }

    /**
     * Deliver {@code alert} to every handler concurrently.
     *
     * @param alert       alert snapshot; each handler receives its own copy
     * @param handlers    channels to deliver to
     * @param attemptedAt attempt time stamped on every result
     * @return one result per handler name, in handler order
     */
    public Map<String, DeliveryResult> dispatch(Alert alert, List<ChannelHandler> handlers, Instant attemptedAt) {
        Objects.requireNonNull(alert, "Alert must not be null");
        Objects.requireNonNull(handlers, "Handlers must not be null");

        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        Map<String, Future<DeliveryResult>> futures = new LinkedHashMap<>();
        for (ChannelHandler handler : handlers) {
            Alert copy = alert.copy();
            futures.put(handler.getName(), executor.submit(() -> handler.send(copy)));
        }

        Map<String, DeliveryResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, Future<DeliveryResult>> entry : futures.entrySet()) {
            String channel = entry.getKey();
            Future<DeliveryResult> future = entry.getValue();
            DeliveryResult result;
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                DeliveryResult returned = future.get(remaining, TimeUnit.NANOSECONDS);
                result = returned != null ? returned : DeliveryResult.failure(channel, "Channel returned no result");
            } catch (TimeoutException e) {
                future.cancel(false);
                result = DeliveryResult.failure(channel, "Timed out after " + timeout.toMillis() + " ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                result = DeliveryResult.failure(channel, cause.getClass().getSimpleName() + ": " + cause.getMessage());
                LOG.debug("Channel {} raised while delivering alert {}", channel, alert.getId(), cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = DeliveryResult.failure(channel, "Interrupted while waiting for delivery");
            }

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            result = result.timed(attemptedAt, elapsedMs);
            if (!result.isSuccess()) {
                LOG.warn("Delivery of alert {} to channel {} failed: {}", alert.getId(), channel, result.getReason());
            }
            results.put(channel, result);
        }
        return results;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Alert dispatch threads still running after {} ms", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class DispatchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "drift-alert-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
