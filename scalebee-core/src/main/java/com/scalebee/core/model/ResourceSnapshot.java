package com.scalebee.core.model;

import java.time.Instant;

/**
 * Raw point-in-time resource counters of one task instance.
 *
 * @param cpuTimeUsed cumulative CPU time consumed by the instance
 * @param cpuTimeTotal cumulative CPU time of the host, the normalization base for {@code cpuTimeUsed}
 * @param numCores number of cores the host reported; values below 1 are treated as 1
 * @param memoryBytesUsed memory currently in use
 * @param memoryBytesLimit memory limit of the instance
 * @param capturedAt when the counters were read
 */
public record ResourceSnapshot(
        long cpuTimeUsed,
        long cpuTimeTotal,
        int numCores,
        long memoryBytesUsed,
        long memoryBytesLimit,
        Instant capturedAt) {

    public ResourceSnapshot {
        numCores = Math.max(1, numCores);
    }
}
