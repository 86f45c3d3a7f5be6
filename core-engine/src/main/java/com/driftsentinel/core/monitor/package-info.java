/**
 * Scan scheduling: {@link com.driftsentinel.core.monitor.ContinuousMonitor}
 * starts sessions, each fed by a bounded
 * {@link com.driftsentinel.core.monitor.ChangeQueue} and controlled through a
 * {@link com.driftsentinel.core.monitor.MonitorHandle}.
 */
package com.driftsentinel.core.monitor;
