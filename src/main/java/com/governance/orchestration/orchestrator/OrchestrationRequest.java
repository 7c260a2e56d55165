package com.governance.orchestration.orchestrator;

import java.util.List;

/**
 * 一次编排请求
 *
 * @param explicitStrategy 显式指定的策略名，为空时由决策引擎选择
 * @param optimizationType 资源分配方式，为空时使用 RESOURCE_POOLING
 */
public record OrchestrationRequest(
    List<ScanRequest> requests,
    OrchestrationContext context,
    String explicitStrategy,
    OrchestrationConstraints constraints,
    ResourceOptimizationType optimizationType) {

    public OrchestrationRequest {
        requests = requests == null ? List.of() : List.copyOf(requests);
        context = context == null ? OrchestrationContext.anonymous() : context;
        constraints = constraints == null ? OrchestrationConstraints.none() : constraints;
        optimizationType = optimizationType == null ? ResourceOptimizationType.RESOURCE_POOLING : optimizationType;
    }

    public static OrchestrationRequest of(List<ScanRequest> requests) {
        return new OrchestrationRequest(requests, null, null, null, null);
    }
}
