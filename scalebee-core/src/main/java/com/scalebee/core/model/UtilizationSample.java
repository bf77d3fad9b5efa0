package com.scalebee.core.model;

import java.time.Instant;

public record UtilizationSample(
        String workloadName,
        String taskName,
        String instanceId,
        double cpuPercent,
        double memoryPercent,
        double memoryUsedMb,
        double memoryLimitMb,
        Instant sampledAt) {}
