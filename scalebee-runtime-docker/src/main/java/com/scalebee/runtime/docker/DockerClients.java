package com.scalebee.runtime.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/** Builds a Docker Engine client over the Apache HttpClient 5 transport. */
@Slf4j
public final class DockerClients {

    private static final int MAX_CONNECTIONS = 16;

    private DockerClients() {}

    /**
     * @param dockerHost engine endpoint such as {@code unix:///var/run/docker.sock}; null or blank
     *     keeps the docker-java default ({@code DOCKER_HOST} or the local socket)
     */
    public static DockerClient create(String dockerHost, Duration connectTimeout, Duration responseTimeout) {
        DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (dockerHost != null && !dockerHost.isBlank()) {
            builder.withDockerHost(dockerHost);
        }
        DockerClientConfig config = builder.build();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(MAX_CONNECTIONS)
                .connectionTimeout(connectTimeout)
                .responseTimeout(responseTimeout)
                .build();
        log.info("Docker client configured for {}", config.getDockerHost());
        return DockerClientImpl.getInstance(config, httpClient);
    }
}
