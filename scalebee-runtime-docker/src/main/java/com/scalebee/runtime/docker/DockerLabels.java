package com.scalebee.runtime.docker;

/** Labels Swarm puts on the containers of a service task. */
final class DockerLabels {

    static final String SERVICE_NAME = "com.docker.swarm.service.name";
    static final String TASK_NAME = "com.docker.swarm.task.name";

    private DockerLabels() {}
}
