package com.scalebee.core.decision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hysteresis band for CPU and memory utilization, in percent. Crossing an upper limit scales up,
 * staying under both lower limits scales down.
 *
 * <p>Any values are accepted. A band whose lower limit is not below its upper limit is logged,
 * since it can flip a workload between scale-up and scale-down on consecutive cycles.
 */
public record ScalingThresholds(double cpuUpper, double cpuLower, double memoryUpper, double memoryLower) {

    private static final Logger log = LoggerFactory.getLogger(ScalingThresholds.class);

    public static final double DEFAULT_CPU_UPPER = 75.0;
    public static final double DEFAULT_CPU_LOWER = 20.0;
    public static final double DEFAULT_MEMORY_UPPER = 80.0;
    public static final double DEFAULT_MEMORY_LOWER = 20.0;

    public static final ScalingThresholds DEFAULT =
            new ScalingThresholds(DEFAULT_CPU_UPPER, DEFAULT_CPU_LOWER, DEFAULT_MEMORY_UPPER, DEFAULT_MEMORY_LOWER);

    public ScalingThresholds {
        if (cpuLower >= cpuUpper) {
            log.warn("CPU lower limit {}% is not below CPU upper limit {}%", cpuLower, cpuUpper);
        }
        if (memoryLower >= memoryUpper) {
            log.warn("Memory lower limit {}% is not below memory upper limit {}%", memoryLower, memoryUpper);
        }
    }

    /** Unset (zero) values fall back to the defaults. */
    public static ScalingThresholds of(double cpuUpper, double cpuLower, double memoryUpper, double memoryLower) {
        return new ScalingThresholds(
                orDefault(cpuUpper, DEFAULT_CPU_UPPER),
                orDefault(cpuLower, DEFAULT_CPU_LOWER),
                orDefault(memoryUpper, DEFAULT_MEMORY_UPPER),
                orDefault(memoryLower, DEFAULT_MEMORY_LOWER));
    }

    private static double orDefault(double value, double fallback) {
        return value == 0 ? fallback : value;
    }
}
