package com.driftsentinel.core.error;

/**
 * The suggestion enricher failed or timed out; rule-based suggestions are used instead.
 */
public class SuggestionGenerationException extends DriftSentinelException {

    private static final long serialVersionUID = 1L;

    public SuggestionGenerationException(String message) {
        super(ErrorCode.SUGGESTION_GENERATION_FAILED, message);
    }

    public SuggestionGenerationException(String message, Throwable cause) {
        super(ErrorCode.SUGGESTION_GENERATION_FAILED, message, cause);
    }
}
