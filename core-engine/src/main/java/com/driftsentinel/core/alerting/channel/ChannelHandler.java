package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.error.ChannelDeliveryException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DeliveryResult;

/**
 * A notification channel. Channels are selected per alert by the configured
 * alert rules and invoked concurrently, each on its own thread.
 *
 * <p>
 * Implementations receive an independent copy of the alert and must not keep
 * state shared with other channels. Failure may be reported either by
 * returning {@link DeliveryResult#failure(String, String)} or by throwing;
 * both end up in the alert's delivery log.
 * </p>
 *
 * @since 1.0.0
 */
public interface ChannelHandler {

    /**
     * @return channel name as referenced by alert rules
     */
    String getName();

    /**
     * Deliver one alert.
     *
     * @param alert alert snapshot
     * @return delivery outcome
     * @throws ChannelDeliveryException if delivery failed
     */
    DeliveryResult send(Alert alert);
}
