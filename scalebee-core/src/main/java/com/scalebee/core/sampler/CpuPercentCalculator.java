package com.scalebee.core.sampler;

import com.scalebee.core.model.ResourceSnapshot;

/** CPU utilization between two counter reads, scaled by the host core count. */
public final class CpuPercentCalculator {

    private CpuPercentCalculator() {}

    public static double cpuPercent(ResourceSnapshot current, ResourceSnapshot previous) {
        double cpuDelta = (double) current.cpuTimeUsed() - previous.cpuTimeUsed();
        double systemDelta = (double) current.cpuTimeTotal() - previous.cpuTimeTotal();
        return cpuPercent(cpuDelta, systemDelta, current.numCores());
    }

    /** Zero unless both deltas are positive. {@code numCores} below 1 counts as 1. */
    public static double cpuPercent(double cpuDelta, double systemDelta, int numCores) {
        if (systemDelta > 0.0 && cpuDelta > 0.0) {
            int cores = Math.max(1, numCores);
            return (cpuDelta / systemDelta) * cores * 100.0;
        }
        return 0.0;
    }
}
