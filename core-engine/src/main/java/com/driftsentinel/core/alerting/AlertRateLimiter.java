package com.driftsentinel.core.alerting;

import com.driftsentinel.core.config.RateLimit;
import com.driftsentinel.core.model.AlertType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Sliding-window dispatch limiter keyed by alert type.
 *
 * @since 1.0.0
 */
final class AlertRateLimiter {

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);

    private final Map<AlertType, RateLimit> limits = new EnumMap<>(AlertType.class);
    private final Map<AlertType, Deque<Instant>> history = new EnumMap<>(AlertType.class);

    AlertRateLimiter(List<RateLimit> rateLimits) {
        for (RateLimit limit : rateLimits) {
            limits.put(limit.alertType(), limit);
        }
    }

    /**
     * Record a dispatch if it fits within the limits for its type.
     *
     * @return {@code false} if the per-minute or per-hour limit is exhausted
     */
    synchronized boolean tryAcquire(AlertType type, Instant now) {
        RateLimit limit = limits.get(type);
        if (limit == null) {
            return true;
        }
        Deque<Instant> sent = history.computeIfAbsent(type, t -> new ArrayDeque<>());
        Instant hourAgo = now.minus(HOUR);
        while (!sent.isEmpty() && !sent.peekFirst().isAfter(hourAgo)) {
            sent.pollFirst();
        }
        if (limit.getPerHour() > 0 && sent.size() >= limit.getPerHour()) {
            return false;
        }
        if (limit.getPerMinute() > 0) {
            Instant minuteAgo = now.minus(MINUTE);
            long lastMinute = sent.stream().filter(t -> t.isAfter(minuteAgo)).count();
            if (lastMinute >= limit.getPerMinute()) {
                return false;
            }
        }
        sent.addLast(now);
        return true;
    }
}
