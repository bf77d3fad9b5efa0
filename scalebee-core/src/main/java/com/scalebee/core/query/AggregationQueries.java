package com.scalebee.core.query;

import com.scalebee.core.exposition.ExposedMetric;

/** The two aggregation expressions the decision engine depends on. */
public final class AggregationQueries {

    public static final String WORKLOAD_LABEL = ExposedMetric.LABEL_WORKLOAD;

    public static final String MEAN_CPU_BY_WORKLOAD =
            "avg(" + ExposedMetric.CPU_USAGE_PERCENT.metricName() + ") BY (" + WORKLOAD_LABEL + ")";

    public static final String MEMORY_PERCENT_BY_WORKLOAD = "(avg(" + ExposedMetric.MEMORY_USAGE_MB.metricName()
            + ") BY (" + WORKLOAD_LABEL + ") / avg(" + ExposedMetric.MEMORY_LIMIT_MB.metricName() + ") BY ("
            + WORKLOAD_LABEL + ")) * 100";

    private AggregationQueries() {}
}
