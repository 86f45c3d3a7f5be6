package com.driftsentinel.core.config;

/**
 * Suggestion-engine tuning.
 *
 * @since 1.0.0
 */
public class RealignmentSettings {

    /** Upper bound on one enricher call before falling back to rule output. */
    private long enricherTimeoutMs = 10_000;

    public long getEnricherTimeoutMs() {
        return enricherTimeoutMs;
    }

    public void setEnricherTimeoutMs(long enricherTimeoutMs) {
        this.enricherTimeoutMs = enricherTimeoutMs;
    }

    @Override
    public String toString() {
        return "RealignmentSettings{enricherTimeoutMs=" + enricherTimeoutMs + '}';
    }
}
