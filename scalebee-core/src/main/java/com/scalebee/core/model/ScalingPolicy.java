package com.scalebee.core.model;

import java.util.Map;

/**
 * Autoscaling policy of one workload, read from its labels every time it is needed.
 *
 * <p>A bound of 0 means unconstrained.
 */
public record ScalingPolicy(
        String workloadName, boolean enabled, int minReplicas, int maxReplicas, int currentReplicas) {

    public static final String LABEL_ENABLED = "swarm.autoscaler";
    public static final String LABEL_MINIMUM = "swarm.autoscaler.minimum";
    public static final String LABEL_MAXIMUM = "swarm.autoscaler.maximum";

    /** Labels that are missing or malformed fall back to disabled / unconstrained. */
    public static ScalingPolicy fromSpec(WorkloadSpec spec) {
        Map<String, String> labels = spec.labels();
        return new ScalingPolicy(
                spec.name(),
                "true".equals(labels.get(LABEL_ENABLED)),
                replicaBound(labels.get(LABEL_MINIMUM)),
                replicaBound(labels.get(LABEL_MAXIMUM)),
                Math.max(0, spec.currentReplicas()));
    }

    public boolean hasMinimum() {
        return minReplicas > 0;
    }

    public boolean hasMaximum() {
        return maxReplicas > 0;
    }

    static int replicaBound(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
