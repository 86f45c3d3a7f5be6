package com.driftsentinel.core.error;

/**
 * Base exception for all Drift Sentinel failures.
 * Carries an {@link ErrorCode} so callers can tell fatal from recoverable errors.
 */
public abstract class DriftSentinelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    protected DriftSentinelException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DriftSentinelException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
