package com.scalebee.core.decision;

/**
 * What the engine did for one workload in one cycle.
 *
 * @param fromReplicas replica count the decision was based on, -1 when the policy was unavailable
 * @param toReplicas requested replica count; equal to {@code fromReplicas} when nothing was requested
 * @param failure error text when the policy read or scaling call failed, otherwise null
 */
public record WorkloadOutcome(
        String workload, ScalingAction action, int fromReplicas, int toReplicas, String reason, String failure) {

    static WorkloadOutcome unchanged(String workload, ScalingAction action, int replicas, String reason) {
        return new WorkloadOutcome(workload, action, replicas, replicas, reason, null);
    }

    static WorkloadOutcome policyUnavailable(String workload, String failure) {
        return new WorkloadOutcome(workload, ScalingAction.POLICY_UNAVAILABLE, -1, -1, null, failure);
    }

    WorkloadOutcome failed(String failure) {
        return new WorkloadOutcome(workload, action, fromReplicas, toReplicas, reason, failure);
    }

    public boolean failed() {
        return failure != null;
    }

    /** True when a scaling call was issued to the runtime, whether or not it succeeded. */
    public boolean scalingCallIssued() {
        return action.changesReplicas();
    }
}
