package com.plazaintel.comparisons.scheduler;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * Heap plus non-heap usage as reported by the JVM. Close enough to the
 * process footprint for threshold checks without reading /proc.
 */
public class JvmMemorySampler implements MemorySampler {

    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

    @Override
    public long usedBytes() {
        return memory.getHeapMemoryUsage().getUsed() + memory.getNonHeapMemoryUsage().getUsed();
    }
}
