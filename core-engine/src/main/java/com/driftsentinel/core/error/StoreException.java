package com.driftsentinel.core.error;

/**
 * The alert store could not be read or written.
 */
public class StoreException extends DriftSentinelException {

    private static final long serialVersionUID = 1L;

    public StoreException(String message) {
        super(ErrorCode.STORE_ERROR, message);
    }

    public StoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_ERROR, message, cause);
    }
}
