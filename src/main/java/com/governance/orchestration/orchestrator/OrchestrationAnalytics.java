package com.governance.orchestration.orchestrator;

import com.governance.orchestration.predictor.ModelStatus;

import java.util.Map;

/**
 * 进程启动以来的编排统计
 *
 * @param successRate       COMPLETED 计划占已结束计划的比例
 * @param averageDurationMs 已结束计划的平均执行时长
 */
public record OrchestrationAnalytics(
    long plansCreated,
    int activePlans,
    long retainedPlans,
    Map<PlanStatus, Long> plansByStatus,
    double successRate,
    long averageDurationMs,
    long adaptationsApplied,
    int activeAlerts,
    ModelStatus predictorStatus,
    int trainingHistorySize) {
}
