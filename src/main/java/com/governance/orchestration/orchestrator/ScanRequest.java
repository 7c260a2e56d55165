package com.governance.orchestration.orchestrator;

import com.governance.orchestration.workflow.WorkflowPriority;
import com.governance.orchestration.workflow.WorkflowStep;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 扫描请求，提交后不可变
 *
 * @param dataSourceIds          覆盖的数据源
 * @param rules                  要执行的规则
 * @param estimatedDataVolumeGb  预估数据量（GB）
 * @param complianceRequirements 合规要求
 * @param dependsOn              必须先完成的其它请求
 * @param criticalPath           失败时是否终止整个编排
 * @param criticalDataSource     数据源是否标记为关键
 * @param steps                  显式步骤；为空时按规则生成默认工作流
 */
public record ScanRequest(
    String requestId,
    List<String> dataSourceIds,
    List<RuleSpec> rules,
    WorkflowPriority priority,
    double estimatedDataVolumeGb,
    List<String> complianceRequirements,
    Set<String> dependsOn,
    boolean criticalPath,
    boolean criticalDataSource,
    List<WorkflowStep> steps) {

    public ScanRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        if (dataSourceIds == null || dataSourceIds.isEmpty()) {
            throw new IllegalArgumentException("request " + requestId + " has no data source");
        }
        if (Double.isNaN(estimatedDataVolumeGb) || estimatedDataVolumeGb < 0) {
            throw new IllegalArgumentException("request " + requestId + " has invalid data volume: "
                + estimatedDataVolumeGb);
        }
        dataSourceIds = List.copyOf(new LinkedHashSet<>(dataSourceIds));
        rules = rules == null ? List.of() : List.copyOf(rules);
        priority = priority == null ? WorkflowPriority.NORMAL : priority;
        complianceRequirements = complianceRequirements == null ? List.of() : List.copyOf(complianceRequirements);
        dependsOn = dependsOn == null ? Set.of() : Set.copyOf(dependsOn);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static ScanRequest of(String requestId, String dataSourceId, List<RuleSpec> rules) {
        return new ScanRequest(requestId, List.of(dataSourceId), rules, WorkflowPriority.NORMAL, 0,
            List.of(), Set.of(), false, false, List.of());
    }

    /**
     * 主数据源
     */
    public String getDataSourceId() {
        return dataSourceIds.get(0);
    }

    public List<String> getRuleIds() {
        List<String> ids = new ArrayList<>(rules.size());
        for (RuleSpec rule : rules) {
            ids.add(rule.ruleId());
        }
        return ids;
    }

    public ScanRequest withPriority(WorkflowPriority newPriority) {
        return new ScanRequest(requestId, dataSourceIds, rules, newPriority, estimatedDataVolumeGb,
            complianceRequirements, dependsOn, criticalPath, criticalDataSource, steps);
    }

    public ScanRequest withDependsOn(Set<String> upstream) {
        return new ScanRequest(requestId, dataSourceIds, rules, priority, estimatedDataVolumeGb,
            complianceRequirements, upstream, criticalPath, criticalDataSource, steps);
    }

    public ScanRequest withSteps(List<WorkflowStep> explicitSteps) {
        return new ScanRequest(requestId, dataSourceIds, rules, priority, estimatedDataVolumeGb,
            complianceRequirements, dependsOn, criticalPath, criticalDataSource, explicitSteps);
    }

    public ScanRequest asCriticalPath() {
        return new ScanRequest(requestId, dataSourceIds, rules, priority, estimatedDataVolumeGb,
            complianceRequirements, dependsOn, true, criticalDataSource, steps);
    }
}
