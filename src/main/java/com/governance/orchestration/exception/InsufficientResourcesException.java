package com.governance.orchestration.exception;

import com.governance.orchestration.resource.ResourceRequirement;

/**
 * 资源池总容量无法满足计划需求
 */
public class InsufficientResourcesException extends RuntimeException {

    private final ResourceRequirement requested;
    private final ResourceRequirement capacity;

    public InsufficientResourcesException(ResourceRequirement requested, ResourceRequirement capacity) {
        super("资源不足: requested=" + requested + ", capacity=" + capacity);
        this.requested = requested;
        this.capacity = capacity;
    }

    public ResourceRequirement getRequested() {
        return requested;
    }

    public ResourceRequirement getCapacity() {
        return capacity;
    }
}
