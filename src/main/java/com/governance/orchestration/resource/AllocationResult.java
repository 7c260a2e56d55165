package com.governance.orchestration.resource;

import java.util.List;

/**
 * 分配结果：成功返回 allocation，资源不足时返回缺口
 * 资源不足是可预期的结果，不走异常
 */
public record AllocationResult(Allocation allocation, ResourceRequirement shortfall, List<ResourceKind> insufficientKinds) {

    public static AllocationResult granted(Allocation allocation) {
        return new AllocationResult(allocation, ResourceRequirement.ZERO, List.of());
    }

    public static AllocationResult insufficient(ResourceRequirement shortfall, List<ResourceKind> kinds) {
        return new AllocationResult(null, shortfall, List.copyOf(kinds));
    }

    public boolean isGranted() {
        return allocation != null;
    }
}
