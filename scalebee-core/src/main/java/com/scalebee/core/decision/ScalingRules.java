package com.scalebee.core.decision;

import com.scalebee.core.model.ScalingPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/** Pure replica-count rules. Empty results mean no scaling call. */
public final class ScalingRules {

    private ScalingRules() {}

    /** Replica count that brings the workload back inside its configured bounds, if it is outside. */
    public static OptionalInt boundCorrection(ScalingPolicy policy) {
        int current = policy.currentReplicas();
        if (policy.hasMinimum() && current < policy.minReplicas()) {
            return OptionalInt.of(policy.minReplicas());
        }
        if (policy.hasMaximum() && current > policy.maxReplicas()) {
            return OptionalInt.of(policy.maxReplicas());
        }
        return OptionalInt.empty();
    }

    public static OptionalInt scaleUpTarget(ScalingPolicy policy) {
        int current = policy.currentReplicas();
        int target = current + 1;
        if (policy.hasMaximum() && current >= policy.maxReplicas()) {
            return OptionalInt.empty();
        }
        if (policy.hasMaximum() && target > policy.maxReplicas()) {
            target = policy.maxReplicas();
        }
        return OptionalInt.of(target);
    }

    /**
     * One replica fewer, unless that would undercut the minimum. A workload sitting exactly at its
     * minimum is left alone, which for an unconstrained minimum also keeps it from going below zero.
     */
    public static OptionalInt scaleDownTarget(ScalingPolicy policy) {
        int current = policy.currentReplicas();
        int target = current - 1;
        if (policy.hasMinimum() && target < policy.minReplicas()) {
            return OptionalInt.empty();
        }
        if (current == policy.minReplicas()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(target);
    }

    /** Either limit alone is enough. Missing memory data never exceeds. */
    public static Optional<String> scaleUpReason(double cpu, OptionalDouble memory, ScalingThresholds thresholds) {
        List<String> reasons = new ArrayList<>(2);
        if (cpu > thresholds.cpuUpper()) {
            reasons.add(format("CPU", cpu, ">", thresholds.cpuUpper()));
        }
        if (memory.isPresent() && memory.getAsDouble() > thresholds.memoryUpper()) {
            reasons.add(format("Memory", memory.getAsDouble(), ">", thresholds.memoryUpper()));
        }
        return reasons.isEmpty() ? Optional.empty() : Optional.of(String.join(" and ", reasons));
    }

    /** Both limits are required. Missing memory data counts as 0%. */
    public static Optional<String> scaleDownReason(double cpu, OptionalDouble memory, ScalingThresholds thresholds) {
        double mem = memory.orElse(0.0);
        if (cpu < thresholds.cpuLower() && mem < thresholds.memoryLower()) {
            return Optional.of(format("CPU", cpu, "<", thresholds.cpuLower()) + " and "
                    + format("Memory", mem, "<", thresholds.memoryLower()));
        }
        return Optional.empty();
    }

    private static String format(String resource, double value, String op, double limit) {
        return String.format(Locale.ROOT, "%s %.2f%% %s %.0f%%", resource, value, op, limit);
    }
}
