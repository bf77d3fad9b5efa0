package com.scalebee.runtime.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Service;
import com.github.dockerjava.api.model.ServiceReplicatedModeOptions;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.core.InvocationBuilder;
import com.scalebee.core.exception.WorkloadRuntimeException;
import com.scalebee.core.model.TaskInstance;
import com.scalebee.core.model.TaskStats;
import com.scalebee.core.model.WorkloadSpec;
import com.scalebee.core.spi.WorkloadRuntime;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Docker Swarm backed runtime: task instances are the running containers on this engine, workloads
 * are Swarm services. Every docker-java failure is rethrown as a {@link WorkloadRuntimeException}
 * naming the container or service involved.
 */
@Slf4j
public class DockerWorkloadRuntime implements WorkloadRuntime {

    private static final List<String> RUNNING = List.of("running");

    private final DockerClient client;

    public DockerWorkloadRuntime(DockerClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public List<TaskInstance> listRunningTasks() {
        List<Container> containers;
        try {
            containers = client.listContainersCmd().withStatusFilter(RUNNING).exec();
        } catch (RuntimeException ex) {
            throw new WorkloadRuntimeException("Failed to list running containers: " + ex.getMessage(), ex);
        }
        List<TaskInstance> tasks = new ArrayList<>(containers.size());
        for (Container container : containers) {
            Map<String, String> labels = container.getLabels() == null ? Map.of() : container.getLabels();
            tasks.add(new TaskInstance(
                    container.getId(), labels.get(DockerLabels.SERVICE_NAME), labels.get(DockerLabels.TASK_NAME)));
        }
        return tasks;
    }

    @Override
    public TaskStats sampleResourceUsage(String instanceId) {
        Statistics stats;
        try (InvocationBuilder.AsyncResultCallback<Statistics> callback =
                client.statsCmd(instanceId).withNoStream(true).exec(new InvocationBuilder.AsyncResultCallback<>())) {
            stats = callback.awaitResult();
        } catch (IOException | RuntimeException ex) {
            throw new WorkloadRuntimeException(
                    "Failed to read stats of container " + instanceId + ": " + ex.getMessage(), ex);
        }
        if (stats == null) {
            throw new WorkloadRuntimeException("No stats returned for container " + instanceId);
        }
        return DockerStatsMapper.toTaskStats(stats);
    }

    @Override
    public WorkloadSpec getWorkloadSpec(String workloadName) {
        return DockerServiceMapper.toWorkloadSpec(workloadName, inspect(workloadName));
    }

    /** Inspects the service and submits its spec with the new count against the inspected version. */
    @Override
    public void setReplicaCount(String workloadName, int replicas) {
        Service service = inspect(workloadName);
        ServiceSpec spec = service.getSpec();
        ServiceReplicatedModeOptions replicated = DockerServiceMapper.replicatedMode(spec);
        if (replicated == null) {
            throw new WorkloadRuntimeException("Service " + workloadName + " is not in replicated mode");
        }
        replicated.withReplicas(replicas);
        try {
            client.updateServiceCmd(service.getId(), spec)
                    .withVersion(service.getVersion().getIndex())
                    .exec();
        } catch (RuntimeException ex) {
            throw new WorkloadRuntimeException(
                    "Failed to scale service " + workloadName + " to " + replicas + " replicas: " + ex.getMessage(),
                    ex);
        }
        log.debug("Service {} updated to {} replicas", workloadName, replicas);
    }

    private Service inspect(String workloadName) {
        Service service;
        try {
            service = client.inspectServiceCmd(workloadName).exec();
        } catch (RuntimeException ex) {
            throw new WorkloadRuntimeException(
                    "Failed to inspect service " + workloadName + ": " + ex.getMessage(), ex);
        }
        if (service == null) {
            throw new WorkloadRuntimeException("Service " + workloadName + " not found");
        }
        return service;
    }
}
