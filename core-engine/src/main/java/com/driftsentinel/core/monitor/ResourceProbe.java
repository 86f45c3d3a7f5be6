package com.driftsentinel.core.monitor;

/**
 * Samples the resource usage of the current process.
 *
 * @since 1.0.0
 */
public interface ResourceProbe {

    /**
     * @return process CPU usage in percent (0-100), or a negative value if
     *         unavailable
     */
    double cpuPercent();

    /**
     * @return memory currently used by the process in MB
     */
    long usedMemoryMb();
}
