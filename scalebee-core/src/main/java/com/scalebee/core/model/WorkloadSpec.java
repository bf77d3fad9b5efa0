package com.scalebee.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Declarative view of a workload as the runtime reports it.
 *
 * @param replicated false for workloads that do not run a fixed replica count (global services);
 *     their {@code currentReplicas} is 0
 */
public record WorkloadSpec(String name, Map<String, String> labels, int currentReplicas, boolean replicated) {

    public WorkloadSpec {
        Objects.requireNonNull(name, "name");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
