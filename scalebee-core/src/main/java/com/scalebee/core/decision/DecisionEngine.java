package com.scalebee.core.decision;

import com.scalebee.core.exception.WorkloadRuntimeException;
import com.scalebee.core.model.AggregatedMetrics;
import com.scalebee.core.model.ScalingPolicy;
import com.scalebee.core.spi.WorkloadRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the scaling policy of every workload that has aggregated metrics.
 *
 * <p>Per workload and cycle: read the policy, skip unless autoscaling is enabled, correct the
 * replica count into its min/max bounds, otherwise scale up by one if CPU or memory is above its
 * upper limit, or down by one if both are below their lower limits. At most one scaling call is
 * issued per workload; there is no state carried from one cycle to the next. Policy and scaling
 * failures only affect the workload they belong to.
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final WorkloadRuntime runtime;
    private final ScalingThresholds thresholds;

    public DecisionEngine(WorkloadRuntime runtime, ScalingThresholds thresholds) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public ScalingThresholds thresholds() {
        return thresholds;
    }

    public EvaluationReport evaluate(AggregatedMetrics metrics) {
        List<WorkloadOutcome> outcomes = new ArrayList<>();
        for (String workload : metrics.workloads()) {
            outcomes.add(evaluateWorkload(workload, metrics.cpu(workload), metrics.memory(workload)));
        }
        return new EvaluationReport(outcomes);
    }

    WorkloadOutcome evaluateWorkload(String workload, double avgCpu, OptionalDouble avgMemory) {
        log.info(
                "Workload: {}, Avg CPU: {}%, Avg Memory: {}",
                workload,
                String.format(Locale.ROOT, "%.2f", avgCpu),
                avgMemory.isPresent() ? String.format(Locale.ROOT, "%.2f%%", avgMemory.getAsDouble()) : "n/a");

        ScalingPolicy policy;
        try {
            policy = readPolicy(workload);
        } catch (WorkloadRuntimeException ex) {
            log.warn("Failed to get policy for workload {}: {}", workload, ex.getMessage());
            return WorkloadOutcome.policyUnavailable(workload, ex.getMessage());
        }
        if (!policy.enabled()) {
            log.info("Workload {} does not have autoscaling enabled", workload);
            return WorkloadOutcome.unchanged(workload, ScalingAction.DISABLED, policy.currentReplicas(), null);
        }

        Optional<String> upReason = ScalingRules.scaleUpReason(avgCpu, avgMemory, thresholds);
        Optional<String> downReason =
                upReason.isPresent() ? Optional.empty() : ScalingRules.scaleDownReason(avgCpu, avgMemory, thresholds);

        OptionalInt bound = ScalingRules.boundCorrection(policy);
        if (bound.isPresent()) {
            WorkloadOutcome outcome = enforceBound(policy, bound.getAsInt());
            upReason.or(() -> downReason)
                    .ifPresent(reason -> log.info(
                            "Workload {} crossed a threshold ({}), deferring to the next cycle after bound correction",
                            workload,
                            reason));
            return outcome;
        }

        if (upReason.isPresent()) {
            log.info("Workload {} is above threshold: {}", workload, upReason.get());
            return scaleUp(workload, upReason.get());
        }
        if (downReason.isPresent()) {
            log.info("Workload {} is below threshold: {}", workload, downReason.get());
            return scaleDown(workload, downReason.get());
        }
        return WorkloadOutcome.unchanged(workload, ScalingAction.NONE, policy.currentReplicas(), null);
    }

    private WorkloadOutcome enforceBound(ScalingPolicy policy, int target) {
        ScalingAction action;
        String reason;
        if (target > policy.currentReplicas()) {
            action = ScalingAction.BOUND_TO_MIN;
            reason = "below the minimum of " + policy.minReplicas();
            log.info("Workload {} is below the minimum. Scaling to the minimum of {}", policy.workloadName(), target);
        } else {
            action = ScalingAction.BOUND_TO_MAX;
            reason = "above the maximum of " + policy.maxReplicas();
            log.info("Workload {} is above the maximum. Scaling to the maximum of {}", policy.workloadName(), target);
        }
        return apply(new WorkloadOutcome(
                policy.workloadName(), action, policy.currentReplicas(), target, reason, null));
    }

    private WorkloadOutcome scaleUp(String workload, String reason) {
        ScalingPolicy policy;
        try {
            policy = readPolicy(workload);
        } catch (WorkloadRuntimeException ex) {
            log.warn("Error scaling up {}: {}", workload, ex.getMessage());
            return WorkloadOutcome.policyUnavailable(workload, ex.getMessage());
        }
        if (!policy.enabled()) {
            return WorkloadOutcome.unchanged(workload, ScalingAction.DISABLED, policy.currentReplicas(), reason);
        }
        OptionalInt target = ScalingRules.scaleUpTarget(policy);
        if (target.isEmpty()) {
            log.info("Workload {} already has the maximum of {} replicas", workload, policy.maxReplicas());
            return WorkloadOutcome.unchanged(workload, ScalingAction.AT_MAXIMUM, policy.currentReplicas(), reason);
        }
        log.info("Scaling up workload {} to {}", workload, target.getAsInt());
        return apply(new WorkloadOutcome(
                workload, ScalingAction.SCALE_UP, policy.currentReplicas(), target.getAsInt(), reason, null));
    }

    private WorkloadOutcome scaleDown(String workload, String reason) {
        ScalingPolicy policy;
        try {
            policy = readPolicy(workload);
        } catch (WorkloadRuntimeException ex) {
            log.warn("Error scaling down {}: {}", workload, ex.getMessage());
            return WorkloadOutcome.policyUnavailable(workload, ex.getMessage());
        }
        if (!policy.enabled()) {
            return WorkloadOutcome.unchanged(workload, ScalingAction.DISABLED, policy.currentReplicas(), reason);
        }
        OptionalInt target = ScalingRules.scaleDownTarget(policy);
        if (target.isEmpty()) {
            log.info("Workload {} has the minimum number of replicas ({})", workload, policy.minReplicas());
            return WorkloadOutcome.unchanged(workload, ScalingAction.AT_MINIMUM, policy.currentReplicas(), reason);
        }
        log.info("Scaling down workload {} to {}", workload, target.getAsInt());
        return apply(new WorkloadOutcome(
                workload, ScalingAction.SCALE_DOWN, policy.currentReplicas(), target.getAsInt(), reason, null));
    }

    private WorkloadOutcome apply(WorkloadOutcome outcome) {
        try {
            runtime.setReplicaCount(outcome.workload(), outcome.toReplicas());
            return outcome;
        } catch (WorkloadRuntimeException ex) {
            log.warn(
                    "Failed to scale workload {} from {} to {} replicas: {}",
                    outcome.workload(),
                    outcome.fromReplicas(),
                    outcome.toReplicas(),
                    ex.getMessage());
            return outcome.failed(ex.getMessage());
        }
    }

    private ScalingPolicy readPolicy(String workload) {
        return ScalingPolicy.fromSpec(runtime.getWorkloadSpec(workload));
    }
}
