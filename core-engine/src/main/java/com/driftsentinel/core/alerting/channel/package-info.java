/**
 * Built-in notification channels and the factory that creates them from
 * configuration.
 */
package com.driftsentinel.core.alerting.channel;
