package com.scalebee.service.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "scalebee")
public class ScaleBeeProperties {
    private Prometheus prometheus = new Prometheus();
    private Evaluation evaluation = new Evaluation();
    private Thresholds thresholds = new Thresholds();
    private Metrics metrics = new Metrics();
    private Docker docker = new Docker();

    public Prometheus getPrometheus() {
        return prometheus;
    }

    public void setPrometheus(Prometheus prometheus) {
        this.prometheus = prometheus;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(Evaluation evaluation) {
        this.evaluation = evaluation;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Docker getDocker() {
        return docker;
    }

    public void setDocker(Docker docker) {
        this.docker = docker;
    }

    public static class Prometheus {
        private String url = "http://prometheus:9090";
        private Duration timeout = Duration.ofSeconds(10);
        private Readiness readiness = new Readiness();

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Readiness getReadiness() {
            return readiness;
        }

        public void setReadiness(Readiness readiness) {
            this.readiness = readiness;
        }
    }

    public static class Readiness {
        private int maxAttempts = 10;
        private Duration maxBackoff = Duration.ofSeconds(32);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class Evaluation {
        /** When false a single cycle runs after the store is ready and the process exits. */
        private boolean loop = true;

        private Duration interval = Duration.ofSeconds(13);

        public boolean isLoop() {
            return loop;
        }

        public void setLoop(boolean loop) {
            this.loop = loop;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    /** Percent values; zero falls back to the built-in default. */
    public static class Thresholds {
        private double cpuUpper = 75;
        private double cpuLower = 20;
        private double memoryUpper = 80;
        private double memoryLower = 20;

        public double getCpuUpper() {
            return cpuUpper;
        }

        public void setCpuUpper(double cpuUpper) {
            this.cpuUpper = cpuUpper;
        }

        public double getCpuLower() {
            return cpuLower;
        }

        public void setCpuLower(double cpuLower) {
            this.cpuLower = cpuLower;
        }

        public double getMemoryUpper() {
            return memoryUpper;
        }

        public void setMemoryUpper(double memoryUpper) {
            this.memoryUpper = memoryUpper;
        }

        public double getMemoryLower() {
            return memoryLower;
        }

        public void setMemoryLower(double memoryLower) {
            this.memoryLower = memoryLower;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private Duration samplingInterval = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getSamplingInterval() {
            return samplingInterval;
        }

        public void setSamplingInterval(Duration samplingInterval) {
            this.samplingInterval = samplingInterval;
        }
    }

    public static class Docker {
        /** Empty keeps the docker-java default. */
        private String host = "";

        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(30);

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }

        public void setResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
        }
    }
}
