package com.governance.orchestration.resource;

import com.governance.orchestration.config.OrchestrationProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 有限资源池（计算 / 内存 / 网络 / 存储）
 *
 * <p>所有状态变更（allocate / commit / release）都在同一把锁内完成，
 * 任意时刻都满足 {@code used + reserved <= total}。资源不足立即返回，不阻塞等待。
 */
@Component
public class ResourcePool {

    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    // 浮点累加误差容忍
    private static final double EPSILON = 1e-9;

    private final ReentrantLock lock = new ReentrantLock();

    private final EnumMap<ResourceKind, Double> total = new EnumMap<>(ResourceKind.class);
    private final EnumMap<ResourceKind, Double> used = new EnumMap<>(ResourceKind.class);
    private final EnumMap<ResourceKind, Double> reserved = new EnumMap<>(ResourceKind.class);

    // 未释放的分配
    private final Map<String, Allocation> liveAllocations = new LinkedHashMap<>();

    private final Counter grantedCounter;
    private final Counter rejectedCounter;

    @Autowired
    public ResourcePool(OrchestrationProperties properties, MeterRegistry meterRegistry) {
        this(capacityOf(properties.getResourcePool()), meterRegistry);
    }

    public ResourcePool(ResourceRequirement capacity, MeterRegistry meterRegistry) {
        for (ResourceKind kind : ResourceKind.values()) {
            total.put(kind, capacity.get(kind));
            used.put(kind, 0.0);
            reserved.put(kind, 0.0);
        }

        this.grantedCounter = Counter.builder("orchestration.resource.allocations")
            .tag("result", "granted")
            .description("Granted resource allocations")
            .register(meterRegistry);
        this.rejectedCounter = Counter.builder("orchestration.resource.allocations")
            .tag("result", "insufficient")
            .description("Allocations rejected for insufficient resources")
            .register(meterRegistry);

        for (ResourceKind kind : ResourceKind.values()) {
            Gauge.builder("orchestration.resource.reserved", this, p -> p.snapshot().level(kind).reserved())
                .tag("kind", kind.name().toLowerCase())
                .register(meterRegistry);
            Gauge.builder("orchestration.resource.used", this, p -> p.snapshot().level(kind).used())
                .tag("kind", kind.name().toLowerCase())
                .register(meterRegistry);
        }

        log.info("Resource pool initialized: capacity={}", capacity);
    }

    private static ResourceRequirement capacityOf(OrchestrationProperties.ResourcePoolConfig config) {
        return new ResourceRequirement(
            config.getCpuCores(), config.getMemoryMb(), config.getNetworkMbps(), config.getStorageGb());
    }

    /**
     * 预留资源。任一资源不足则整体失败，不产生部分预留
     *
     * @param ownerId     归属方（planId）
     * @param requirement 需求量
     */
    public AllocationResult allocate(String ownerId, ResourceRequirement requirement) {
        lock.lock();
        try {
            Map<ResourceKind, Double> shortfall = new EnumMap<>(ResourceKind.class);
            List<ResourceKind> insufficient = new ArrayList<>();
            for (ResourceKind kind : ResourceKind.values()) {
                double available = availableOf(kind);
                double requested = requirement.get(kind);
                if (requested > available + EPSILON) {
                    shortfall.put(kind, requested - available);
                    insufficient.add(kind);
                }
            }

            if (!insufficient.isEmpty()) {
                rejectedCounter.increment();
                log.warn("Insufficient resources for owner={}, requested={}, short on {}",
                    ownerId, requirement, insufficient);
                return AllocationResult.insufficient(ResourceRequirement.of(shortfall), insufficient);
            }

            for (ResourceKind kind : ResourceKind.values()) {
                reserved.merge(kind, requirement.get(kind), Double::sum);
            }
            Allocation allocation = new Allocation("alloc_" + UUID.randomUUID().toString().substring(0, 12),
                ownerId, requirement);
            liveAllocations.put(allocation.getAllocationId(), allocation);
            grantedCounter.increment();
            log.debug("Reserved {} for owner={}", allocation.getAllocationId(), ownerId);
            return AllocationResult.granted(allocation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 将预留量转为已使用量（任务真正开始消耗资源时调用）
     *
     * @return 是否发生了转换；已提交或已释放的分配返回 false
     */
    public boolean commit(Allocation allocation) {
        lock.lock();
        try {
            if (allocation.getState() != AllocationState.RESERVED
                || !liveAllocations.containsKey(allocation.getAllocationId())) {
                log.debug("Commit ignored for {} in state {}", allocation.getAllocationId(), allocation.getState());
                return false;
            }
            ResourceRequirement requirement = allocation.getRequirement();
            for (ResourceKind kind : ResourceKind.values()) {
                reserved.put(kind, clampZero(reserved.get(kind) - requirement.get(kind)));
                used.merge(kind, requirement.get(kind), Double::sum);
            }
            allocation.markCommitted();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 释放分配，幂等：重复释放是空操作
     *
     * @return 本次调用是否真正归还了资源
     */
    public boolean release(Allocation allocation) {
        lock.lock();
        try {
            if (liveAllocations.remove(allocation.getAllocationId()) == null) {
                return false;
            }
            ResourceRequirement requirement = allocation.getRequirement();
            Map<ResourceKind, Double> bucket = allocation.getState() == AllocationState.COMMITTED ? used : reserved;
            for (ResourceKind kind : ResourceKind.values()) {
                bucket.put(kind, clampZero(bucket.get(kind) - requirement.get(kind)));
            }
            allocation.markReleased();
            log.debug("Released {} for owner={}", allocation.getAllocationId(), allocation.getOwnerId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 释放某个归属方的全部分配（计划取消 / 清理时使用）
     *
     * @return 释放的分配数
     */
    public int releaseAll(String ownerId) {
        lock.lock();
        try {
            List<Allocation> owned = new ArrayList<>();
            for (Allocation allocation : liveAllocations.values()) {
                if (allocation.getOwnerId().equals(ownerId)) {
                    owned.add(allocation);
                }
            }
            int released = 0;
            for (Allocation allocation : owned) {
                if (release(allocation)) {
                    released++;
                }
            }
            if (released > 0) {
                log.info("Released {} allocation(s) held by {}", released, ownerId);
            }
            return released;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 试算：需求是否在总容量之内（不考虑当前占用，也不产生预留）
     */
    public boolean canEverSatisfy(ResourceRequirement requirement) {
        return requirement.fitsWithin(capacity());
    }

    /**
     * 试算：当前可用量是否足够
     */
    public boolean canSatisfyNow(ResourceRequirement requirement) {
        lock.lock();
        try {
            for (ResourceKind kind : ResourceKind.values()) {
                if (requirement.get(kind) > availableOf(kind) + EPSILON) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前可用量 = total - used - reserved
     */
    public ResourceRequirement available() {
        lock.lock();
        try {
            Map<ResourceKind, Double> values = new EnumMap<>(ResourceKind.class);
            for (ResourceKind kind : ResourceKind.values()) {
                values.put(kind, availableOf(kind));
            }
            return ResourceRequirement.of(values);
        } finally {
            lock.unlock();
        }
    }

    public ResourceRequirement capacity() {
        lock.lock();
        try {
            return ResourceRequirement.of(total);
        } finally {
            lock.unlock();
        }
    }

    public ResourcePoolState snapshot() {
        lock.lock();
        try {
            Map<ResourceKind, ResourceLevel> levels = new EnumMap<>(ResourceKind.class);
            for (ResourceKind kind : ResourceKind.values()) {
                levels.put(kind, new ResourceLevel(total.get(kind), used.get(kind), reserved.get(kind)));
            }
            return new ResourcePoolState(levels, liveAllocations.size(), Instant.now());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 某个归属方当前持有的分配
     */
    public List<Allocation> allocationsOf(String ownerId) {
        lock.lock();
        try {
            List<Allocation> owned = new ArrayList<>();
            for (Allocation allocation : liveAllocations.values()) {
                if (allocation.getOwnerId().equals(ownerId)) {
                    owned.add(allocation);
                }
            }
            return owned;
        } finally {
            lock.unlock();
        }
    }

    private double availableOf(ResourceKind kind) {
        return Math.max(0, total.get(kind) - used.get(kind) - reserved.get(kind));
    }

    private static double clampZero(double value) {
        return Math.abs(value) < EPSILON ? 0.0 : Math.max(0.0, value);
    }
}
