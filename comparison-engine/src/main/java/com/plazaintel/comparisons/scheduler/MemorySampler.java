package com.plazaintel.comparisons.scheduler;

/** Current memory footprint of the process, in bytes. */
@FunctionalInterface
public interface MemorySampler {

    long usedBytes();
}
