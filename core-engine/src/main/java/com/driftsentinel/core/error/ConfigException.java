package com.driftsentinel.core.error;

/**
 * Invalid startup parameters. Fatal: the monitor never starts.
 */
public class ConfigException extends DriftSentinelException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
