package com.governance.orchestration.orchestrator;

import com.governance.orchestration.decision.StrategyDecision;
import com.governance.orchestration.predictor.FeatureVector;
import com.governance.orchestration.predictor.PerformancePrediction;
import com.governance.orchestration.resource.ResourceRequirement;
import com.governance.orchestration.workflow.Workflow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 执行计划，创建后不可变；执行期间的状态记录在 {@link PlanExecution} 中
 *
 * @param executionOrder     工作流启动顺序，满足工作流间依赖的拓扑序
 * @param resourceAllocation 工作流 → 分配量
 * @param complexity         工作流 → 对应请求的复杂度分析
 * @param features           "工作流ID:规则ID" → 计划时使用的预测特征
 * @param predictions        同一键 → 性能预测
 * @param estimatedCost      预估成本（按小时单价 × 预估时长）
 */
public record ExecutionPlan(
    String planId,
    Instant createdAt,
    List<Workflow> workflows,
    List<String> executionOrder,
    Map<String, ResourceRequirement> resourceAllocation,
    Duration estimatedDuration,
    RiskAssessment riskAssessment,
    List<ContingencyPlan> contingencyPlans,
    StrategyDecision strategy,
    ResourceOptimizationType optimizationType,
    Map<String, ComplexityAnalysis> complexity,
    ResourceRequirement totalRequirement,
    double estimatedCost,
    Map<String, FeatureVector> features,
    Map<String, PerformancePrediction> predictions,
    OrchestrationContext context,
    OrchestrationConstraints constraints) {

    public ExecutionPlan {
        workflows = List.copyOf(workflows);
        executionOrder = List.copyOf(executionOrder);
        resourceAllocation = Collections.unmodifiableMap(new LinkedHashMap<>(resourceAllocation));
        contingencyPlans = List.copyOf(contingencyPlans);
        complexity = Collections.unmodifiableMap(new LinkedHashMap<>(complexity));
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
        predictions = Collections.unmodifiableMap(new LinkedHashMap<>(predictions));
    }

    public List<String> workflowIds() {
        List<String> ids = new ArrayList<>(workflows.size());
        for (Workflow workflow : workflows) {
            ids.add(workflow.workflowId());
        }
        return ids;
    }

    public Optional<Workflow> workflow(String workflowId) {
        for (Workflow workflow : workflows) {
            if (workflow.workflowId().equals(workflowId)) {
                return Optional.of(workflow);
            }
        }
        return Optional.empty();
    }

    public static String predictionKey(String workflowId, String ruleId) {
        return workflowId + ":" + ruleId;
    }
}
