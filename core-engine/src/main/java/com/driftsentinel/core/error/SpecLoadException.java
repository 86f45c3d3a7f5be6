package com.driftsentinel.core.error;

/**
 * No usable specification for a path. Surfaced as an informational report note, never as an alert.
 */
public class SpecLoadException extends DriftSentinelException {

    private static final long serialVersionUID = 1L;

    public SpecLoadException(String message) {
        super(ErrorCode.SPECIFICATION_UNAVAILABLE, message);
    }

    public SpecLoadException(String message, Throwable cause) {
        super(ErrorCode.SPECIFICATION_UNAVAILABLE, message, cause);
    }
}
