package com.scalebee.core.sampler;

import com.scalebee.core.model.ResourceSnapshot;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Last counters seen per task instance, keyed by full instance id. Holds at most one snapshot per
 * instance; entries of instances that stopped running are removed by {@link #retainOnly(Set)}.
 */
public class SnapshotStore {

    private final ConcurrentMap<String, ResourceSnapshot> snapshots = new ConcurrentHashMap<>();

    public Optional<ResourceSnapshot> previous(String instanceId) {
        return Optional.ofNullable(snapshots.get(instanceId));
    }

    public void put(String instanceId, ResourceSnapshot snapshot) {
        snapshots.put(instanceId, snapshot);
    }

    /** Drops every entry whose instance is not in {@code liveInstanceIds}; returns how many went. */
    public int retainOnly(Set<String> liveInstanceIds) {
        int before = snapshots.size();
        snapshots.keySet().retainAll(liveInstanceIds);
        return before - snapshots.size();
    }

    public int size() {
        return snapshots.size();
    }

    public Map<String, ResourceSnapshot> view() {
        return Map.copyOf(snapshots);
    }
}
