package com.scalebee.core.model;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-workload averages for one evaluation cycle. Every workload with a CPU figure is evaluated;
 * memory figures are optional.
 */
public record AggregatedMetrics(Map<String, Double> cpuByWorkload, Map<String, Double> memoryByWorkload) {

    public AggregatedMetrics {
        cpuByWorkload = cpuByWorkload == null ? Map.of() : Map.copyOf(cpuByWorkload);
        memoryByWorkload = memoryByWorkload == null ? Map.of() : Map.copyOf(memoryByWorkload);
    }

    public SortedSet<String> workloads() {
        return new TreeSet<>(cpuByWorkload.keySet());
    }

    public double cpu(String workload) {
        Double value = cpuByWorkload.get(workload);
        return value == null ? 0.0 : value;
    }

    public OptionalDouble memory(String workload) {
        Double value = memoryByWorkload.get(workload);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
