package com.governance.orchestration.resource;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 资源池某一时刻的快照（只读）
 */
public record ResourcePoolState(Map<ResourceKind, ResourceLevel> levels, int activeAllocations, Instant capturedAt) {

    public ResourcePoolState {
        levels = Collections.unmodifiableMap(new EnumMap<>(levels));
    }

    public ResourceLevel level(ResourceKind kind) {
        ResourceLevel level = levels.get(kind);
        return level != null ? level : new ResourceLevel(0, 0, 0);
    }

    public double utilization(ResourceKind kind) {
        return level(kind).utilization();
    }

    public ResourceRequirement available() {
        Map<ResourceKind, Double> values = new EnumMap<>(ResourceKind.class);
        levels.forEach((kind, level) -> values.put(kind, level.available()));
        return ResourceRequirement.of(values);
    }

    public ResourceRequirement total() {
        Map<ResourceKind, Double> values = new EnumMap<>(ResourceKind.class);
        levels.forEach((kind, level) -> values.put(kind, level.total()));
        return ResourceRequirement.of(values);
    }

    /**
     * 构造一个指定利用率的快照，主要用于策略推演
     */
    public static ResourcePoolState ofUtilization(ResourceRequirement capacity, double utilization) {
        Map<ResourceKind, ResourceLevel> levels = new EnumMap<>(ResourceKind.class);
        for (ResourceKind kind : ResourceKind.values()) {
            double total = capacity.get(kind);
            levels.put(kind, new ResourceLevel(total, total * utilization, 0));
        }
        return new ResourcePoolState(levels, 0, Instant.now());
    }
}
