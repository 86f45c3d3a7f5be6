/**
 * Configuration: the YAML-bound {@link com.driftsentinel.core.config.SentinelConfig}
 * and its sections, the immutable
 * {@link com.driftsentinel.core.config.MonitorConfig} of a monitoring session,
 * and loaders for the config and specification files.
 */
package com.driftsentinel.core.config;
