package com.driftsentinel.core.monitor;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;

/**
 * {@link ResourceProbe} backed by the platform MXBeans: process CPU load from
 * {@code com.sun.management.OperatingSystemMXBean} when the JVM provides it,
 * used heap for memory.
 *
 * @since 1.0.0
 */
public class JvmResourceProbe implements ResourceProbe {

    private static final long MB = 1024L * 1024L;

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

    @Override
    public double cpuPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            double load = sun.getProcessCpuLoad();
            return load < 0 ? -1 : load * 100.0;
        }
        return -1;
    }

    @Override
    public long usedMemoryMb() {
        return memory.getHeapMemoryUsage().getUsed() / MB;
    }
}
