/**
 * Alerting pipeline: fingerprinting and suppression in
 * {@link com.driftsentinel.core.alerting.AlertSystem}, isolated channel
 * fan-out in {@link com.driftsentinel.core.alerting.AlertDispatcher}.
 */
package com.driftsentinel.core.alerting;
