package com.scalebee.service.scheduling;

import com.scalebee.core.decision.DecisionEngine;
import com.scalebee.core.decision.EvaluationReport;
import com.scalebee.core.decision.ScalingThresholds;
import com.scalebee.core.exception.AggregationQueryException;
import com.scalebee.core.model.AggregatedMetrics;
import com.scalebee.core.query.AggregationQueryService;
import com.scalebee.core.readiness.MetricsStoreReadiness;
import com.scalebee.service.config.ScaleBeeProperties;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Drives the evaluation cycle: wait for the metrics store, run one cycle immediately, then repeat
 * with a fixed delay. A cycle that fails is logged and the next one runs on schedule.
 */
@Slf4j
@Component
public class EvaluationLoop implements ApplicationRunner {
    private final AggregationQueryService queries;
    private final DecisionEngine engine;
    private final MetricsStoreReadiness readiness;
    private final ScaleBeeProperties properties;

    private ScheduledExecutorService scheduler;
    private volatile boolean singleCycle;

    public EvaluationLoop(
            AggregationQueryService queries,
            DecisionEngine engine,
            MetricsStoreReadiness readiness,
            ScaleBeeProperties properties) {
        this.queries = queries;
        this.engine = engine;
        this.readiness = readiness;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        logConfiguration();
        try {
            readiness.awaitReady();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("Shutdown requested while waiting for the metrics store, not starting evaluation");
            return;
        }

        ScaleBeeProperties.Evaluation evaluation = properties.getEvaluation();
        if (!evaluation.isLoop()) {
            singleCycle = true;
            runCycle();
            return;
        }
        Duration interval = evaluation.getInterval();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scalebee-evaluation");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runCycleSafely, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Evaluation loop started, interval {}s", interval.toSeconds());
    }

    /** True once a single cycle ran because the loop is disabled. */
    public boolean isSingleCycle() {
        return singleCycle;
    }

    /** One cycle; empty when the CPU aggregates could not be fetched. */
    public Optional<EvaluationReport> runCycle() {
        AggregatedMetrics metrics;
        try {
            metrics = queries.fetch();
        } catch (AggregationQueryException ex) {
            log.error("Skipping evaluation cycle, query '{}' failed: {}", ex.getExpression(), ex.getMessage());
            return Optional.empty();
        }
        log.info("Evaluating {} workloads", metrics.workloads().size());
        EvaluationReport report = engine.evaluate(metrics);
        if (report.scalingCalls() > 0 || report.failures() > 0) {
            log.info(
                    "Evaluation cycle finished: {} scaling calls, {} failures",
                    report.scalingCalls(),
                    report.failures());
        }
        return Optional.of(report);
    }

    private void runCycleSafely() {
        try {
            runCycle();
        } catch (RuntimeException ex) {
            log.error("Unexpected error in evaluation cycle", ex);
        }
    }

    private void logConfiguration() {
        ScalingThresholds t = engine.thresholds();
        ScaleBeeProperties.Evaluation evaluation = properties.getEvaluation();
        log.info("Prometheus URL: {}", properties.getPrometheus().getUrl());
        log.info("Loop: {}, interval: {}s", evaluation.isLoop(), evaluation.getInterval().toSeconds());
        log.info("CPU thresholds: upper {}%, lower {}%", t.cpuUpper(), t.cpuLower());
        log.info("Memory thresholds: upper {}%, lower {}%", t.memoryUpper(), t.memoryLower());
        log.info(
                "Metrics publishing: {}, sampling interval: {}s",
                properties.getMetrics().isEnabled(),
                properties.getMetrics().getSamplingInterval().toSeconds());
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }
}
