package com.driftsentinel.core.model;

/**
 * Origin of a {@link Suggestion}.
 */
public enum SuggestionSource {
    /** Produced by the built-in rule templates. */
    RULE,
    /** Produced by an external enricher. */
    AI
}
