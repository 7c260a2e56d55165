package com.governance.orchestration.resource;

import java.time.Instant;

/**
 * 一次资源分配的句柄
 * 状态只由 {@link ResourcePool} 在池锁内修改
 */
public final class Allocation {

    private final String allocationId;
    private final String ownerId;
    private final ResourceRequirement requirement;
    private final Instant createdAt;
    private volatile AllocationState state = AllocationState.RESERVED;
    private volatile Instant releasedAt;

    Allocation(String allocationId, String ownerId, ResourceRequirement requirement) {
        this.allocationId = allocationId;
        this.ownerId = ownerId;
        this.requirement = requirement;
        this.createdAt = Instant.now();
    }

    public String getAllocationId() {
        return allocationId;
    }

    /**
     * 归属方，一般是 planId
     */
    public String getOwnerId() {
        return ownerId;
    }

    public ResourceRequirement getRequirement() {
        return requirement;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public AllocationState getState() {
        return state;
    }

    public Instant getReleasedAt() {
        return releasedAt;
    }

    public boolean isReleased() {
        return state == AllocationState.RELEASED;
    }

    void markCommitted() {
        this.state = AllocationState.COMMITTED;
    }

    void markReleased() {
        this.state = AllocationState.RELEASED;
        this.releasedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "Allocation{" + allocationId + ", owner=" + ownerId + ", state=" + state + ", " + requirement + "}";
    }
}
