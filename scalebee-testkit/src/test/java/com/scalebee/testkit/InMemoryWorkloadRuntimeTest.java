package com.scalebee.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.scalebee.core.exception.WorkloadRuntimeException;
import com.scalebee.core.model.ResourceSnapshot;
import com.scalebee.core.model.TaskStats;
import com.scalebee.core.model.WorkloadSpec;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryWorkloadRuntimeTest {

    private final InMemoryWorkloadRuntime runtime = new InMemoryWorkloadRuntime();

    @Test
    void scalingUpdatesStoredSpecAndRecordsCall() {
        runtime.putSpec(new WorkloadSpec("web", Map.of("swarm.autoscaler", "true"), 2, true));

        runtime.setReplicaCount("web", 3);

        assertEquals(3, runtime.replicas("web"));
        assertThat(runtime.scaleCalls()).containsExactly(new InMemoryWorkloadRuntime.ScaleCall("web", 3));
        assertEquals("true", runtime.getWorkloadSpec("web").labels().get("swarm.autoscaler"));
    }

    @Test
    void globalWorkloadCannotBeScaled() {
        runtime.putSpec(new WorkloadSpec("agent", Map.of(), 0, false));

        assertThatThrownBy(() -> runtime.setReplicaCount("agent", 2))
                .isInstanceOf(WorkloadRuntimeException.class)
                .hasMessageContaining("not in replicated mode");
    }

    @Test
    void statsSequenceRepeatsLastEntry() {
        TaskStats first = TaskStats.of(new ResourceSnapshot(1, 10, 1, 0, 0, Instant.EPOCH));
        TaskStats second = TaskStats.of(new ResourceSnapshot(2, 20, 1, 0, 0, Instant.EPOCH));
        runtime.addStats("c1", first, second);

        assertEquals(first, runtime.sampleResourceUsage("c1"));
        assertEquals(second, runtime.sampleResourceUsage("c1"));
        assertEquals(second, runtime.sampleResourceUsage("c1"));
        assertThatThrownBy(() -> runtime.sampleResourceUsage("c2")).isInstanceOf(WorkloadRuntimeException.class);
    }
}
