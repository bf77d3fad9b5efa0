package com.scalebee.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one stats call against the runtime. Besides the current counters the runtime may hand
 * back the counters of its own previous read, which serve as the baseline for an instance seen for
 * the first time.
 */
public record TaskStats(ResourceSnapshot current, ResourceSnapshot pre) {

    public TaskStats {
        Objects.requireNonNull(current, "current");
    }

    public static TaskStats of(ResourceSnapshot current) {
        return new TaskStats(current, null);
    }

    public Optional<ResourceSnapshot> baseline() {
        return Optional.ofNullable(pre);
    }
}
