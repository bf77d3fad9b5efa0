package com.scalebee.service.scheduling;

import com.scalebee.core.sampler.ResourceSampler;
import com.scalebee.service.config.ScaleBeeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Refreshes the published samples at the sampling interval, starting right after startup. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SamplingScheduler {
    private final ResourceSampler sampler;
    private final ScaleBeeProperties properties;

    @Scheduled(fixedDelayString = "#{@scaleBeeProperties.metrics.samplingInterval.toMillis()}")
    public void sample() {
        if (!properties.getMetrics().isEnabled()) {
            return;
        }
        try {
            int sampled = sampler.sampleOnce();
            if (sampled >= 0) {
                log.debug("Sampled {} task instances", sampled);
            }
        } catch (RuntimeException ex) {
            log.error("Sampling cycle failed", ex);
        }
    }
}
