package com.driftsentinel.core.realignment;

import com.driftsentinel.core.error.SuggestionGenerationException;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.Suggestion;

import java.util.List;

/**
 * Optional source of additional suggestions, typically backed by a language
 * model. Invoked with a timeout; any failure falls back to the rule-based
 * suggestions.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SuggestionEnricher {

    /**
     * @param report drift report to enrich
     * @return extra suggestions; may be empty
     * @throws SuggestionGenerationException if generation failed
     */
    List<Suggestion> enrich(DriftReport report);
}
