package com.scalebee.runtime.docker;

import com.github.dockerjava.api.model.CpuStatsConfig;
import com.github.dockerjava.api.model.CpuUsageConfig;
import com.github.dockerjava.api.model.MemoryStatsConfig;
import com.github.dockerjava.api.model.Statistics;
import com.scalebee.core.model.ResourceSnapshot;
import com.scalebee.core.model.TaskStats;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Maps a one-shot stats response onto core snapshots. {@code cpu_stats} becomes the current
 * snapshot and {@code precpu_stats}, when the daemon filled it in, the baseline.
 */
final class DockerStatsMapper {

    private DockerStatsMapper() {}

    static TaskStats toTaskStats(Statistics stats) {
        MemoryStatsConfig memory = stats.getMemoryStats();
        long used = memory == null ? 0L : orZero(memory.getUsage());
        long limit = memory == null ? 0L : orZero(memory.getLimit());
        ResourceSnapshot current = snapshot(stats.getCpuStats(), used, limit, readAt(stats.getRead()));
        ResourceSnapshot pre = hasCounters(stats.getPreCpuStats())
                ? snapshot(stats.getPreCpuStats(), used, limit, null)
                : null;
        return new TaskStats(current, pre);
    }

    private static ResourceSnapshot snapshot(CpuStatsConfig cpu, long used, long limit, Instant at) {
        if (cpu == null) {
            return new ResourceSnapshot(0L, 0L, 1, used, limit, at);
        }
        CpuUsageConfig usage = cpu.getCpuUsage();
        long total = usage == null ? 0L : orZero(usage.getTotalUsage());
        return new ResourceSnapshot(total, orZero(cpu.getSystemCpuUsage()), numCores(cpu), used, limit, at);
    }

    /** Per-CPU entries when reported (cgroup v1), otherwise {@code online_cpus}, otherwise 1. */
    static int numCores(CpuStatsConfig cpu) {
        CpuUsageConfig usage = cpu.getCpuUsage();
        List<Long> perCpu = usage == null ? null : usage.getPercpuUsage();
        if (perCpu != null && !perCpu.isEmpty()) {
            return perCpu.size();
        }
        Long online = cpu.getOnlineCpus();
        return online != null && online > 0 ? online.intValue() : 1;
    }

    private static boolean hasCounters(CpuStatsConfig cpu) {
        return cpu != null && cpu.getSystemCpuUsage() != null && cpu.getSystemCpuUsage() > 0;
    }

    private static Instant readAt(String read) {
        if (read == null || read.isBlank()) {
            return null;
        }
        try {
            Instant parsed = Instant.parse(read);
            // the daemon reports the zero time for counters it has not read yet
            return parsed.isAfter(Instant.EPOCH) ? parsed : null;
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
