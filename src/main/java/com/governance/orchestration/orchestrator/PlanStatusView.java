package com.governance.orchestration.orchestrator;

import com.governance.orchestration.alert.Alert;
import com.governance.orchestration.resource.ResourcePoolState;
import com.governance.orchestration.resource.ResourceRequirement;
import com.governance.orchestration.workflow.StepPerformance;
import com.governance.orchestration.workflow.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 计划的实时状态
 *
 * @param progressPercent 已结束工作流占比 [0,100]
 * @param heldResources   计划当前仍持有的资源
 * @param performance     工作流 → 步骤 → 已采集的性能数据
 * @param activeAlerts    全局活动告警
 */
public record PlanStatusView(
    String planId,
    PlanStatus status,
    OrchestrationMode mode,
    double progressPercent,
    int workflowsTotal,
    int workflowsCompleted,
    int workflowsFailed,
    int workflowsRunning,
    int workflowsQueued,
    Map<String, WorkflowStatus> workflowStatuses,
    ResourceRequirement heldResources,
    ResourcePoolState poolState,
    Map<String, Map<String, StepPerformance>> performance,
    List<Alert> activeAlerts,
    Instant startedAt,
    long elapsedMs) {
}
