package com.scalebee.core.spi;

import com.scalebee.core.exception.WorkloadRuntimeException;
import com.scalebee.core.model.TaskInstance;
import com.scalebee.core.model.TaskStats;
import com.scalebee.core.model.WorkloadSpec;
import java.util.List;

/**
 * Runtime that runs the scaled workloads. Every call is a short independent request; failures
 * surface as {@link WorkloadRuntimeException} carrying the workload or instance involved.
 */
public interface WorkloadRuntime {

    List<TaskInstance> listRunningTasks();

    TaskStats sampleResourceUsage(String instanceId);

    WorkloadSpec getWorkloadSpec(String workloadName);

    void setReplicaCount(String workloadName, int replicas);
}
