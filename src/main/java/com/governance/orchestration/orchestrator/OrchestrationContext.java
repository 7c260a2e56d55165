package com.governance.orchestration.orchestrator;

import java.util.Map;

/**
 * 编排上下文
 *
 * @param businessContext    业务上下文（透传到报告）
 * @param performanceTargets 性能目标，例如 max_duration_minutes
 */
public record OrchestrationContext(
    String userId,
    Map<String, Object> businessContext,
    Map<String, Double> performanceTargets) {

    public OrchestrationContext {
        businessContext = businessContext == null ? Map.of() : Map.copyOf(businessContext);
        performanceTargets = performanceTargets == null ? Map.of() : Map.copyOf(performanceTargets);
    }

    public static OrchestrationContext anonymous() {
        return new OrchestrationContext("anonymous", Map.of(), Map.of());
    }
}
