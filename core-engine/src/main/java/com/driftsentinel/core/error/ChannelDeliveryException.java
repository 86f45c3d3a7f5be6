package com.driftsentinel.core.error;

/**
 * A single channel could not deliver an alert. Recorded in the alert's delivery log only.
 */
public class ChannelDeliveryException extends DriftSentinelException {

    private static final long serialVersionUID = 1L;

    public ChannelDeliveryException(String message) {
        super(ErrorCode.CHANNEL_DELIVERY_FAILED, message);
    }

    public ChannelDeliveryException(String message, Throwable cause) {
        super(ErrorCode.CHANNEL_DELIVERY_FAILED, message, cause);
    }
}
