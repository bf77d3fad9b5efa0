package com.scalebee.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.scalebee.core.decision.DecisionEngine;
import com.scalebee.core.decision.ScalingThresholds;
import com.scalebee.core.exposition.ExpositionRenderer;
import com.scalebee.core.query.AggregationQueryService;
import com.scalebee.core.readiness.CancellableSleeper;
import com.scalebee.core.readiness.MetricsStoreReadiness;
import com.scalebee.core.sampler.ResourceSampler;
import com.scalebee.core.sampler.SnapshotStore;
import com.scalebee.core.spi.MetricsStore;
import com.scalebee.core.spi.WorkloadRuntime;
import com.scalebee.runtime.docker.DockerClients;
import com.scalebee.runtime.docker.DockerWorkloadRuntime;
import com.scalebee.service.prometheus.PrometheusMetricsStore;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ScaleBeeConfiguration {

    @Bean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public DockerClient dockerClient(ScaleBeeProperties properties) {
        ScaleBeeProperties.Docker docker = properties.getDocker();
        return DockerClients.create(docker.getHost(), docker.getConnectTimeout(), docker.getResponseTimeout());
    }

    @Bean
    public WorkloadRuntime workloadRuntime(DockerClient dockerClient) {
        return new DockerWorkloadRuntime(dockerClient);
    }

    @Bean
    public RestTemplate prometheusRestTemplate(RestTemplateBuilder builder, ScaleBeeProperties properties) {
        ScaleBeeProperties.Prometheus prometheus = properties.getPrometheus();
        return builder.rootUri(prometheus.getUrl())
                .setConnectTimeout(prometheus.getTimeout())
                .setReadTimeout(prometheus.getTimeout())
                .build();
    }

    @Bean
    public MetricsStore metricsStore(RestTemplate prometheusRestTemplate, ObjectMapper objectMapper) {
        return new PrometheusMetricsStore(prometheusRestTemplate, objectMapper);
    }

    @Bean
    public SnapshotStore snapshotStore() {
        return new SnapshotStore();
    }

    @Bean
    public ResourceSampler resourceSampler(WorkloadRuntime workloadRuntime, SnapshotStore snapshotStore, Clock clock) {
        return new ResourceSampler(workloadRuntime, snapshotStore, clock);
    }

    @Bean
    public ExpositionRenderer expositionRenderer() {
        return new ExpositionRenderer();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService queryExecutor() {
        AtomicInteger n = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "scalebee-query-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public AggregationQueryService aggregationQueryService(MetricsStore metricsStore, ExecutorService queryExecutor) {
        return new AggregationQueryService(metricsStore, queryExecutor);
    }

    @Bean
    public ScalingThresholds scalingThresholds(ScaleBeeProperties properties) {
        ScaleBeeProperties.Thresholds t = properties.getThresholds();
        return ScalingThresholds.of(t.getCpuUpper(), t.getCpuLower(), t.getMemoryUpper(), t.getMemoryLower());
    }

    @Bean
    public DecisionEngine decisionEngine(WorkloadRuntime workloadRuntime, ScalingThresholds scalingThresholds) {
        return new DecisionEngine(workloadRuntime, scalingThresholds);
    }

    /** Cancelled when the context closes, which ends a pending readiness backoff. */
    @Bean(destroyMethod = "cancel")
    public CancellableSleeper shutdownSleeper() {
        return new CancellableSleeper();
    }

    @Bean
    public MetricsStoreReadiness metricsStoreReadiness(
            MetricsStore metricsStore, CancellableSleeper shutdownSleeper, ScaleBeeProperties properties) {
        ScaleBeeProperties.Readiness readiness = properties.getPrometheus().getReadiness();
        return new MetricsStoreReadiness(
                metricsStore, readiness.getMaxAttempts(), readiness.getMaxBackoff(), shutdownSleeper);
    }
}
