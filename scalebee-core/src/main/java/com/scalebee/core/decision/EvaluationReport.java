package com.scalebee.core.decision;

import java.util.List;
import java.util.Optional;

public record EvaluationReport(List<WorkloadOutcome> outcomes) {

    public EvaluationReport {
        outcomes = List.copyOf(outcomes);
    }

    public Optional<WorkloadOutcome> outcome(String workload) {
        return outcomes.stream().filter(o -> o.workload().equals(workload)).findFirst();
    }

    public long scalingCalls() {
        return outcomes.stream().filter(WorkloadOutcome::scalingCallIssued).count();
    }

    public long failures() {
        return outcomes.stream().filter(WorkloadOutcome::failed).count();
    }
}
