package com.driftsentinel.core.config;

/**
 * What the change queue does when a producer offers an event while it is full.
 */
public enum OverflowPolicy {
    /** The producer waits for space, up to the configured offer timeout. */
    BLOCK,
    /** The oldest pending event is discarded to make room. */
    DROP_OLDEST
}
