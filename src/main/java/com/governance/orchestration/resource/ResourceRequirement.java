package com.governance.orchestration.resource;

import java.util.EnumMap;
import java.util.Map;

/**
 * 资源需求 / 已分配量
 * 四种资源均不能为负，既用于"申请"也用于"已分配"
 *
 * @param cpuCores    CPU 核数
 * @param memoryMb    内存（MB）
 * @param networkMbps 网络带宽（Mbps）
 * @param storageGb   存储（GB）
 */
public record ResourceRequirement(double cpuCores, double memoryMb, double networkMbps, double storageGb) {

    public static final ResourceRequirement ZERO = new ResourceRequirement(0, 0, 0, 0);

    public ResourceRequirement {
        requireValid("cpuCores", cpuCores);
        requireValid("memoryMb", memoryMb);
        requireValid("networkMbps", networkMbps);
        requireValid("storageGb", storageGb);
    }

    private static void requireValid(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException("Malformed resource requirement: " + name + "=" + value);
        }
    }

    public double get(ResourceKind kind) {
        switch (kind) {
            case CPU:
                return cpuCores;
            case MEMORY:
                return memoryMb;
            case NETWORK:
                return networkMbps;
            case STORAGE:
                return storageGb;
            default:
                throw new IllegalArgumentException("Unknown resource kind: " + kind);
        }
    }

    public ResourceRequirement plus(ResourceRequirement other) {
        return new ResourceRequirement(
            cpuCores + other.cpuCores,
            memoryMb + other.memoryMb,
            networkMbps + other.networkMbps,
            storageGb + other.storageGb);
    }

    public ResourceRequirement scale(double factor) {
        if (factor < 0) {
            throw new IllegalArgumentException("Scale factor must be non-negative: " + factor);
        }
        return new ResourceRequirement(
            cpuCores * factor, memoryMb * factor, networkMbps * factor, storageGb * factor);
    }

    /**
     * 逐项取较小值
     */
    public ResourceRequirement min(ResourceRequirement other) {
        return new ResourceRequirement(
            Math.min(cpuCores, other.cpuCores),
            Math.min(memoryMb, other.memoryMb),
            Math.min(networkMbps, other.networkMbps),
            Math.min(storageGb, other.storageGb));
    }

    /**
     * 是否每一项都不超过 limit
     */
    public boolean fitsWithin(ResourceRequirement limit) {
        for (ResourceKind kind : ResourceKind.values()) {
            if (get(kind) > limit.get(kind)) {
                return false;
            }
        }
        return true;
    }

    public boolean isZero() {
        return cpuCores == 0 && memoryMb == 0 && networkMbps == 0 && storageGb == 0;
    }

    public Map<ResourceKind, Double> asMap() {
        Map<ResourceKind, Double> map = new EnumMap<>(ResourceKind.class);
        for (ResourceKind kind : ResourceKind.values()) {
            map.put(kind, get(kind));
        }
        return map;
    }

    public static ResourceRequirement of(Map<ResourceKind, Double> values) {
        return new ResourceRequirement(
            values.getOrDefault(ResourceKind.CPU, 0.0),
            values.getOrDefault(ResourceKind.MEMORY, 0.0),
            values.getOrDefault(ResourceKind.NETWORK, 0.0),
            values.getOrDefault(ResourceKind.STORAGE, 0.0));
    }
}
