package com.scalebee.core.model;

import java.util.Objects;

/** One running replica of a workload, as listed by the runtime. */
public record TaskInstance(String instanceId, String workloadName, String taskName) {

    public TaskInstance {
        Objects.requireNonNull(instanceId, "instanceId");
        taskName = taskName == null ? "" : taskName;
    }

    public boolean hasWorkload() {
        return workloadName != null && !workloadName.isBlank();
    }
}
