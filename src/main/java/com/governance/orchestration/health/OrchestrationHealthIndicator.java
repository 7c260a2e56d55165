package com.governance.orchestration.health;

import com.governance.orchestration.alert.Alert;
import com.governance.orchestration.alert.AlertEvaluator;
import com.governance.orchestration.alert.AlertSeverity;
import com.governance.orchestration.orchestrator.PlanRegistry;
import com.governance.orchestration.resource.ResourceKind;
import com.governance.orchestration.resource.ResourcePool;
import com.governance.orchestration.resource.ResourcePoolState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 编排服务健康检查：存在 CRITICAL 级活动告警时为 DOWN
 */
@Slf4j
@Component("orchestrationHealthIndicator")
@RequiredArgsConstructor
public class OrchestrationHealthIndicator implements HealthIndicator {

    private final ResourcePool resourcePool;
    private final AlertEvaluator alertEvaluator;
    private final PlanRegistry planRegistry;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        // 1. 资源池
        try {
            ResourcePoolState state = resourcePool.snapshot();
            Map<String, Double> utilization = new HashMap<>();
            for (ResourceKind kind : ResourceKind.values()) {
                utilization.put(kind.name().toLowerCase(), state.utilization(kind));
            }
            details.put("resource_utilization", utilization);
            details.put("active_allocations", state.activeAllocations());
        } catch (Exception e) {
            log.error("Resource pool health check failed", e);
            details.put("resource_pool", "DOWN");
            details.put("resource_pool_error", e.getMessage());
            healthy = false;
        }

        // 2. 告警
        List<String> critical = new ArrayList<>();
        for (Alert alert : alertEvaluator.activeAlerts()) {
            if (alert.getSeverity() == AlertSeverity.CRITICAL) {
                critical.add(alert.getMetric());
            }
        }
        details.put("active_alerts", alertEvaluator.activeAlerts().size());
        if (!critical.isEmpty()) {
            details.put("critical_alerts", critical);
            healthy = false;
        }

        // 3. 计划
        details.put("active_plans", planRegistry.activeCount());

        if (healthy) {
            return Health.up().withDetails(details).build();
        }
        return Health.down().withDetails(details).build();
    }
}
