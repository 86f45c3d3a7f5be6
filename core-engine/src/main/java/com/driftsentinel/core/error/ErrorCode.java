package com.driftsentinel.core.error;

/**
 * Standardized error codes for Drift Sentinel.
 *
 * <p>
 * Format: {@code DS-{CATEGORY}{NUMBER}}
 * </p>
 * <ul>
 * <li>1xx: configuration errors</li>
 * <li>2xx: scanning and specification errors</li>
 * <li>3xx: alerting errors</li>
 * <li>4xx: realignment errors</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum ErrorCode {

    CONFIGURATION_ERROR("DS-100", "Invalid configuration", ErrorCategory.FATAL),

    SCAN_FAILED("DS-200", "Drift scan failed", ErrorCategory.RECOVERABLE),
    SPECIFICATION_UNAVAILABLE("DS-210", "Specification unavailable", ErrorCategory.RECOVERABLE),

    CHANNEL_DELIVERY_FAILED("DS-300", "Alert channel delivery failed", ErrorCategory.RECOVERABLE),
    ALERT_NOT_FOUND("DS-310", "Alert not found", ErrorCategory.RECOVERABLE),
    STORE_ERROR("DS-320", "Alert store error", ErrorCategory.RECOVERABLE),

    SUGGESTION_GENERATION_FAILED("DS-400", "Suggestion generation failed", ErrorCategory.RECOVERABLE);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    /**
     * Whether an error aborts the process or only the current unit of work.
     */
    public enum ErrorCategory {
        /** The current unit of work is skipped; the monitor keeps running. */
        RECOVERABLE,

        /** Startup is aborted. */
        FATAL
    }
}
