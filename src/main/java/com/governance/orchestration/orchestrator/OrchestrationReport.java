package com.governance.orchestration.orchestrator;

import com.governance.orchestration.decision.OrchestrationStrategy;
import com.governance.orchestration.optimizer.AppliedChange;
import com.governance.orchestration.optimizer.ParameterRecommendation;
import com.governance.orchestration.resource.ResourceRequirement;

import java.time.Instant;
import java.util.List;

/**
 * 计划执行报告：每个工作流 / 步骤的机器可读状态 + 一段可读摘要
 *
 * @param appliedChanges       本次执行中应用的参数变更
 * @param pendingRecommendations 记录但未应用的建议
 * @param resourcesAllocated   执行期间申请过的资源总量
 * @param allocationsReleased  执行结束时归还的分配数
 */
public record OrchestrationReport(
    String planId,
    PlanStatus status,
    OrchestrationMode mode,
    OrchestrationStrategy strategy,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    List<WorkflowReport> workflows,
    List<AppliedChange> appliedChanges,
    List<ParameterRecommendation> pendingRecommendations,
    ResourceRequirement resourcesAllocated,
    int allocationsReleased,
    double estimatedCost,
    double actualCost,
    double efficiencyScore,
    String stopReason,
    String summary) {

    public OrchestrationReport {
        workflows = List.copyOf(workflows);
        appliedChanges = List.copyOf(appliedChanges);
        pendingRecommendations = List.copyOf(pendingRecommendations);
    }
}
