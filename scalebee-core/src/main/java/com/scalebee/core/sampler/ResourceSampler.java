package com.scalebee.core.sampler;

import com.scalebee.core.exception.WorkloadRuntimeException;
import com.scalebee.core.model.ResourceSnapshot;
import com.scalebee.core.model.TaskInstance;
import com.scalebee.core.model.TaskStats;
import com.scalebee.core.model.UtilizationSample;
import com.scalebee.core.spi.WorkloadRuntime;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw counters of every running task instance into utilization samples.
 *
 * <p>CPU usage is a rate, so each instance's counters are kept in the {@link SnapshotStore} and the
 * next cycle computes the delta against them. An instance seen for the first time is measured
 * against the baseline its stats call returned. The sample set is rebuilt without holding the lock
 * and then swapped in under the write lock; readers only hold the read lock while copying it out.
 */
public class ResourceSampler {

    private static final Logger log = LoggerFactory.getLogger(ResourceSampler.class);

    static final int SHORT_ID_LENGTH = 12;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final WorkloadRuntime runtime;
    private final SnapshotStore snapshots;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, UtilizationSample> samples = Map.of();

    public ResourceSampler(WorkloadRuntime runtime, SnapshotStore snapshots, Clock clock) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Runs one sampling cycle. Returns the number of instances sampled, or -1 if listing failed. */
    public int sampleOnce() {
        List<TaskInstance> tasks;
        try {
            tasks = runtime.listRunningTasks();
        } catch (WorkloadRuntimeException ex) {
            log.error("Failed to list running tasks, keeping {} previous samples", sampleCount(), ex);
            return -1;
        }

        Map<String, UtilizationSample> fresh = new LinkedHashMap<>();
        Set<String> running = new HashSet<>();
        for (TaskInstance task : tasks) {
            running.add(task.instanceId());
            if (!task.hasWorkload()) {
                continue;
            }
            try {
                fresh.put(task.instanceId(), sample(task));
            } catch (WorkloadRuntimeException ex) {
                log.warn(
                        "Failed to get stats for task instance {} of workload {}: {}",
                        shortId(task.instanceId()),
                        task.workloadName(),
                        ex.getMessage());
            }
        }

        install(fresh);
        int evicted = snapshots.retainOnly(running);
        if (evicted > 0) {
            log.debug("Evicted {} snapshots of task instances no longer running", evicted);
        }
        return fresh.size();
    }

    public List<UtilizationSample> currentSamples() {
        lock.readLock().lock();
        try {
            return List.copyOf(samples.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int sampleCount() {
        lock.readLock().lock();
        try {
            return samples.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private UtilizationSample sample(TaskInstance task) {
        TaskStats stats = runtime.sampleResourceUsage(task.instanceId());
        ResourceSnapshot current = stats.current();
        Optional<ResourceSnapshot> previous = snapshots.previous(task.instanceId()).or(stats::baseline);
        double cpuPercent = previous.map(p -> CpuPercentCalculator.cpuPercent(current, p))
                .orElse(0.0);
        snapshots.put(task.instanceId(), current);

        double usedMb = current.memoryBytesUsed() / BYTES_PER_MB;
        double limitMb = current.memoryBytesLimit() / BYTES_PER_MB;
        double memoryPercent = limitMb > 0 ? (usedMb / limitMb) * 100.0 : 0.0;
        Instant sampledAt = current.capturedAt() != null ? current.capturedAt() : clock.instant();

        UtilizationSample sample = new UtilizationSample(
                task.workloadName(),
                task.taskName(),
                shortId(task.instanceId()),
                cpuPercent,
                memoryPercent,
                usedMb,
                limitMb,
                sampledAt);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Sampled {} ({}) cpu={}% memory={}/{}MB",
                    sample.instanceId(),
                    sample.workloadName(),
                    String.format("%.2f", cpuPercent),
                    String.format("%.2f", usedMb),
                    String.format("%.2f", limitMb));
        }
        return sample;
    }

    private void install(Map<String, UtilizationSample> fresh) {
        Map<String, UtilizationSample> frozen = Collections.unmodifiableMap(fresh);
        lock.writeLock().lock();
        try {
            samples = frozen;
        } finally {
            lock.writeLock().unlock();
        }
    }

    static String shortId(String instanceId) {
        return instanceId.length() > SHORT_ID_LENGTH ? instanceId.substring(0, SHORT_ID_LENGTH) : instanceId;
    }
}
