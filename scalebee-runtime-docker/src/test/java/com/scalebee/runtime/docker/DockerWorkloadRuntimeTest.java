package com.scalebee.runtime.docker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectServiceCmd;
import com.github.dockerjava.api.command.ListContainersCmd;
import com.github.dockerjava.api.command.StatsCmd;
import com.github.dockerjava.api.command.UpdateServiceCmd;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Service;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.core.InvocationBuilder;
import com.scalebee.core.exception.WorkloadRuntimeException;
import com.scalebee.core.model.TaskInstance;
import com.scalebee.core.model.TaskStats;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class DockerWorkloadRuntimeTest {

    @Mock
    private DockerClient client;

    private DockerWorkloadRuntime runtime;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        runtime = new DockerWorkloadRuntime(client);
    }

    @Test
    void listsRunningContainersWithSwarmLabels() {
        ListContainersCmd cmd = mock(ListContainersCmd.class);
        when(client.listContainersCmd()).thenReturn(cmd);
        when(cmd.withStatusFilter(anyList())).thenReturn(cmd);
        when(cmd.exec()).thenReturn(List.of(
                DockerFixtures.parse(
                        "{\"Id\":\"abcdef1234567890\",\"Labels\":{"
                                + "\"com.docker.swarm.service.name\":\"web\","
                                + "\"com.docker.swarm.task.name\":\"web.1.xyz\"}}",
                        Container.class),
                DockerFixtures.parse("{\"Id\":\"fedcba0987654321\"}", Container.class)));

        List<TaskInstance> tasks = runtime.listRunningTasks();

        assertThat(tasks).containsExactly(
                new TaskInstance("abcdef1234567890", "web", "web.1.xyz"),
                new TaskInstance("fedcba0987654321", null, ""));
        assertThat(tasks.get(1).hasWorkload()).isFalse();
    }

    @Test
    void listingFailureIsWrapped() {
        when(client.listContainersCmd()).thenThrow(new RuntimeException("connection refused"));

        assertThatThrownBy(() -> runtime.listRunningTasks())
                .isInstanceOf(WorkloadRuntimeException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void readsOneShotStats() {
        StatsCmd cmd = mock(StatsCmd.class);
        when(client.statsCmd("abc")).thenReturn(cmd);
        when(cmd.withNoStream(true)).thenReturn(cmd);
        Statistics statistics = DockerFixtures.load("stats-percpu.json", Statistics.class);
        doAnswer(invocation -> {
                    InvocationBuilder.AsyncResultCallback<Statistics> callback = invocation.getArgument(0);
                    callback.onNext(statistics);
                    callback.onComplete();
                    return callback;
                })
                .when(cmd)
                .exec(any());

        TaskStats stats = runtime.sampleResourceUsage("abc");

        assertEquals(800_000_000L, stats.current().cpuTimeUsed());
        verify(cmd).withNoStream(true);
    }

    @Test
    void statsFailureNamesTheContainer() {
        when(client.statsCmd("gone")).thenThrow(new NotFoundException("No such container"));

        assertThatThrownBy(() -> runtime.sampleResourceUsage("gone"))
                .isInstanceOf(WorkloadRuntimeException.class)
                .hasMessageContaining("gone");
    }

    @Test
    void scalingSubmitsSpecAgainstInspectedVersion() {
        Service service = DockerFixtures.load("service-replicated.json", Service.class);
        givenService("web", service);
        UpdateServiceCmd update = mock(UpdateServiceCmd.class);
        when(client.updateServiceCmd(anyString(), any())).thenReturn(update);
        when(update.withVersion(19L)).thenReturn(update);

        runtime.setReplicaCount("web", 4);

        ArgumentCaptor<ServiceSpec> spec = ArgumentCaptor.forClass(ServiceSpec.class);
        verify(client).updateServiceCmd(eq(service.getId()), spec.capture());
        verify(update).withVersion(19L);
        verify(update).exec();
        assertEquals(4, spec.getValue().getMode().getReplicated().getReplicas());
    }

    @Test
    void globalServiceCannotBeScaled() {
        givenService("node-agent", DockerFixtures.load("service-global.json", Service.class));

        assertThatThrownBy(() -> runtime.setReplicaCount("node-agent", 2))
                .isInstanceOf(WorkloadRuntimeException.class)
                .hasMessageContaining("not in replicated mode");
        verify(client, never()).updateServiceCmd(anyString(), any());
    }

    @Test
    void missingServiceIsWrapped() {
        InspectServiceCmd inspect = mock(InspectServiceCmd.class);
        when(client.inspectServiceCmd("ghost")).thenReturn(inspect);
        when(inspect.exec()).thenThrow(new NotFoundException("service ghost not found"));

        assertThatThrownBy(() -> runtime.getWorkloadSpec("ghost"))
                .isInstanceOf(WorkloadRuntimeException.class)
                .hasMessageContaining("ghost");
    }

    private void givenService(String name, Service service) {
        InspectServiceCmd inspect = mock(InspectServiceCmd.class);
        when(client.inspectServiceCmd(name)).thenReturn(inspect);
        when(inspect.exec()).thenReturn(service);
    }
}
