package com.scalebee.runtime.docker;

import com.github.dockerjava.api.model.Service;
import com.github.dockerjava.api.model.ServiceModeConfig;
import com.github.dockerjava.api.model.ServiceReplicatedModeOptions;
import com.github.dockerjava.api.model.ServiceSpec;
import com.scalebee.core.model.WorkloadSpec;
import java.util.Map;

final class DockerServiceMapper {

    private DockerServiceMapper() {}

    /** Global services are reported with 0 replicas and {@code replicated=false}. */
    static WorkloadSpec toWorkloadSpec(String requestedName, Service service) {
        ServiceSpec spec = service.getSpec();
        String name = spec != null && spec.getName() != null ? spec.getName() : requestedName;
        Map<String, String> labels = spec == null ? Map.of() : spec.getLabels();
        ServiceReplicatedModeOptions replicated = replicatedMode(spec);
        int replicas = replicated == null ? 0 : Math.toIntExact(replicated.getReplicas());
        return new WorkloadSpec(name, labels, replicas, replicated != null);
    }

    static ServiceReplicatedModeOptions replicatedMode(ServiceSpec spec) {
        if (spec == null) {
            return null;
        }
        ServiceModeConfig mode = spec.getMode();
        return mode == null ? null : mode.getReplicated();
    }
}
