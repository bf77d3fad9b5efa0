package com.scalebee.core.query;

import com.scalebee.core.exception.AggregationQueryException;
import com.scalebee.core.model.AggregatedMetrics;
import com.scalebee.core.spi.MetricsStore;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the per-workload CPU and memory averages. Both queries run concurrently and are joined
 * before returning. CPU is required; a failed memory query degrades to an empty memory map.
 */
public class AggregationQueryService {

    private static final Logger log = LoggerFactory.getLogger(AggregationQueryService.class);

    private final MetricsStore store;
    private final Executor executor;

    public AggregationQueryService(MetricsStore store, Executor executor) {
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public AggregatedMetrics fetch() {
        CompletableFuture<Map<String, Double>> cpu =
                CompletableFuture.supplyAsync(() -> meanByWorkload(AggregationQueries.MEAN_CPU_BY_WORKLOAD), executor);
        CompletableFuture<Map<String, Double>> memory = CompletableFuture.supplyAsync(
                () -> meanByWorkload(AggregationQueries.MEMORY_PERCENT_BY_WORKLOAD), executor);

        Map<String, Double> memoryByWorkload;
        try {
            memoryByWorkload = await(memory, cpu);
        } catch (ExecutionException ex) {
            log.warn(
                    "Memory aggregation query failed, continuing with CPU only: {}",
                    ex.getCause().getMessage());
            memoryByWorkload = Map.of();
        }

        Map<String, Double> cpuByWorkload;
        try {
            cpuByWorkload = await(cpu, memory);
        } catch (ExecutionException ex) {
            throw new AggregationQueryException(
                    AggregationQueries.MEAN_CPU_BY_WORKLOAD,
                    "CPU aggregation query failed: " + ex.getCause().getMessage(),
                    ex.getCause());
        }

        log.info("Retrieved {} workload CPU metrics and {} memory metrics", cpuByWorkload.size(), memoryByWorkload.size());
        return new AggregatedMetrics(cpuByWorkload, memoryByWorkload);
    }

    private Map<String, Double> meanByWorkload(String expression) {
        return QueryResultParser.meanByLabel(store.query(expression), AggregationQueries.WORKLOAD_LABEL);
    }

    private static Map<String, Double> await(
            CompletableFuture<Map<String, Double>> future, CompletableFuture<?> sibling) throws ExecutionException {
        try {
            return future.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            sibling.cancel(true);
            throw new AggregationQueryException(
                    AggregationQueries.MEAN_CPU_BY_WORKLOAD, "Interrupted while waiting for aggregation queries", ie);
        }
    }
}
