package com.scalebee.service.web;

import com.scalebee.core.exposition.ExpositionRenderer;
import com.scalebee.core.sampler.ResourceSampler;
import com.scalebee.service.config.ScaleBeeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Scrape endpoint for the per-instance gauges; 404 while publishing is switched off. */
@RestController
@RequiredArgsConstructor
public class MetricsController {
    private static final MediaType EXPOSITION = MediaType.parseMediaType(ExpositionRenderer.CONTENT_TYPE);

    private final ResourceSampler sampler;
    private final ExpositionRenderer renderer;
    private final ScaleBeeProperties properties;

    @GetMapping("/metrics")
    public ResponseEntity<String> metrics() {
        if (!properties.getMetrics().isEnabled()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok().contentType(EXPOSITION).body(renderer.render(sampler.currentSamples()));
    }
}
