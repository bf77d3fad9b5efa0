package com.scalebee.core.exposition;

import com.scalebee.core.model.UtilizationSample;
import java.util.function.ToDoubleFunction;

/** Gauges published per task instance. */
public enum ExposedMetric {
    CPU_USAGE_PERCENT(
            "container_cpu_usage_percent", "CPU usage percentage of the container", UtilizationSample::cpuPercent),
    MEMORY_USAGE_MB("container_memory_usage_mb", "Memory usage in megabytes", UtilizationSample::memoryUsedMb),
    MEMORY_LIMIT_MB("container_memory_limit_mb", "Memory limit in megabytes", UtilizationSample::memoryLimitMb);

    public static final String LABEL_WORKLOAD = "service";
    public static final String LABEL_TASK = "task";
    public static final String LABEL_INSTANCE = "container_id";

    private final String metricName;
    private final String help;
    private final ToDoubleFunction<UtilizationSample> extractor;

    ExposedMetric(String metricName, String help, ToDoubleFunction<UtilizationSample> extractor) {
        this.metricName = metricName;
        this.help = help;
        this.extractor = extractor;
    }

    public String metricName() {
        return metricName;
    }

    public String help() {
        return help;
    }

    public double valueOf(UtilizationSample sample) {
        return extractor.applyAsDouble(sample);
    }
}
