package com.driftsentinel.core.alerting;

/**
 * Callback invoked after an alert has been created or redelivered.
 * Exceptions thrown by a listener are logged and never reach the caller.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertListener {

    void onAlert(AlertOutcome outcome);
}
