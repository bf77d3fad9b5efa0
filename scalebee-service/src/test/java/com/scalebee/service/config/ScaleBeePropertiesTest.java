package com.scalebee.service.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.scalebee.core.decision.ScalingThresholds;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.PropertySourcesPlaceholdersResolver;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.io.ClassPathResource;

class ScaleBeePropertiesTest {

    @Test
    void defaultsMatchTheDocumentedEnvironment() throws IOException {
        ScaleBeeProperties properties = bind("application.yml");

        assertEquals("http://prometheus:9090", properties.getPrometheus().getUrl());
        assertEquals(10, properties.getPrometheus().getReadiness().getMaxAttempts());
        assertEquals(Duration.ofSeconds(32), properties.getPrometheus().getReadiness().getMaxBackoff());
        assertThat(properties.getEvaluation().isLoop()).isTrue();
        assertEquals(Duration.ofSeconds(13), properties.getEvaluation().getInterval());
        assertThat(properties.getMetrics().isEnabled()).isTrue();
        assertEquals(Duration.ofSeconds(10), properties.getMetrics().getSamplingInterval());
        assertEquals("", properties.getDocker().getHost());
        assertEquals(ScalingThresholds.DEFAULT, thresholds(properties));
    }

    @Test
    void strictProfileTightensCpuBand() throws IOException {
        ScaleBeeProperties properties = bind("application-strict.yml", "application.yml");

        ScalingThresholds thresholds = thresholds(properties);
        assertEquals(85.0, thresholds.cpuUpper());
        assertEquals(25.0, thresholds.cpuLower());
        assertEquals(80.0, thresholds.memoryUpper());
    }

    @Test
    void zeroThresholdsFallBackToDefaults() {
        ScaleBeeProperties properties = new ScaleBeeProperties();
        properties.getThresholds().setCpuUpper(0);
        properties.getThresholds().setMemoryLower(0);

        assertEquals(ScalingThresholds.DEFAULT, thresholds(properties));
    }

    private static ScalingThresholds thresholds(ScaleBeeProperties properties) {
        return new ScaleBeeConfiguration().scalingThresholds(properties);
    }

    /** Binds the given files, first one wins, with placeholders resolved to their defaults. */
    private static ScaleBeeProperties bind(String... files) throws IOException {
        MutablePropertySources sources = new MutablePropertySources();
        YamlPropertySourceLoader loader = new YamlPropertySourceLoader();
        for (String file : files) {
            loader.load(file, new ClassPathResource(file)).forEach(sources::addLast);
        }
        Binder binder = new Binder(
                ConfigurationPropertySources.from(sources), new PropertySourcesPlaceholdersResolver(sources));
        return binder.bind("scalebee", ScaleBeeProperties.class).get();
    }
}
