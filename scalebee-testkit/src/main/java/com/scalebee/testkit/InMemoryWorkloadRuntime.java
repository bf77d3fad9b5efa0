package com.scalebee.testkit;

import com.scalebee.core.exception.WorkloadRuntimeException;
import com.scalebee.core.model.TaskInstance;
import com.scalebee.core.model.TaskStats;
import com.scalebee.core.model.WorkloadSpec;
import com.scalebee.core.spi.WorkloadRuntime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test double for a workload runtime. Tasks, stats and specs are seeded by the test; replica
 * changes are recorded and applied to the stored spec so later reads see them.
 */
public class InMemoryWorkloadRuntime implements WorkloadRuntime {

    /** A replica change requested through {@link #setReplicaCount}. */
    public record ScaleCall(String workloadName, int replicas) {}

    private final Map<String, TaskInstance> tasks = new LinkedHashMap<>();
    private final Map<String, Deque<TaskStats>> stats = new HashMap<>();
    private final Map<String, WorkloadSpec> specs = new HashMap<>();
    private final Map<String, String> scaleFailures = new HashMap<>();
    private final List<ScaleCall> scaleCalls = new ArrayList<>();
    private String listingFailure;

    public synchronized InMemoryWorkloadRuntime addTask(TaskInstance task) {
        tasks.put(task.instanceId(), task);
        return this;
    }

    public synchronized InMemoryWorkloadRuntime removeTask(String instanceId) {
        tasks.remove(instanceId);
        return this;
    }

    /** Queues stats for an instance; the last queued entry keeps being returned once reached. */
    public synchronized InMemoryWorkloadRuntime addStats(String instanceId, TaskStats... sequence) {
        Deque<TaskStats> queue = stats.computeIfAbsent(instanceId, id -> new ArrayDeque<>());
        Collections.addAll(queue, sequence);
        return this;
    }

    public synchronized InMemoryWorkloadRuntime putSpec(WorkloadSpec spec) {
        specs.put(spec.name(), spec);
        return this;
    }

    public synchronized InMemoryWorkloadRuntime failListing(String message) {
        listingFailure = message;
        return this;
    }

    public synchronized InMemoryWorkloadRuntime failScaling(String workloadName, String message) {
        scaleFailures.put(workloadName, message);
        return this;
    }

    @Override
    public synchronized List<TaskInstance> listRunningTasks() {
        if (listingFailure != null) {
            throw new WorkloadRuntimeException(listingFailure);
        }
        return List.copyOf(tasks.values());
    }

    @Override
    public synchronized TaskStats sampleResourceUsage(String instanceId) {
        Deque<TaskStats> queue = stats.get(instanceId);
        if (queue == null || queue.isEmpty()) {
            throw new WorkloadRuntimeException("No stats for task instance " + instanceId);
        }
        return queue.size() > 1 ? queue.poll() : queue.peek();
    }

    @Override
    public synchronized WorkloadSpec getWorkloadSpec(String workloadName) {
        WorkloadSpec spec = specs.get(workloadName);
        if (spec == null) {
            throw new WorkloadRuntimeException("Workload " + workloadName + " not found");
        }
        return spec;
    }

    @Override
    public synchronized void setReplicaCount(String workloadName, int replicas) {
        scaleCalls.add(new ScaleCall(workloadName, replicas));
        String failure = scaleFailures.get(workloadName);
        if (failure != null) {
            throw new WorkloadRuntimeException(failure);
        }
        WorkloadSpec spec = getWorkloadSpec(workloadName);
        if (!spec.replicated()) {
            throw new WorkloadRuntimeException("Workload " + workloadName + " is not in replicated mode");
        }
        specs.put(workloadName, new WorkloadSpec(spec.name(), spec.labels(), replicas, true));
    }

    public synchronized List<ScaleCall> scaleCalls() {
        return List.copyOf(scaleCalls);
    }

    public synchronized int replicas(String workloadName) {
        return getWorkloadSpec(workloadName).currentReplicas();
    }
}
