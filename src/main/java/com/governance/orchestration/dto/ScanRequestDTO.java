package com.governance.orchestration.dto;

import com.governance.orchestration.orchestrator.RuleSpec;
import com.governance.orchestration.orchestrator.ScanRequest;
import com.governance.orchestration.workflow.WorkflowPriority;
import com.governance.orchestration.workflow.WorkflowStep;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 单个扫描请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequestDTO {

    private String requestId;
    private List<String> dataSourceIds;
    private List<RuleSpecDTO> rules;
    private WorkflowPriority priority;

    /** 预估数据量（GB） */
    private double estimatedDataVolumeGb;

    private List<String> complianceRequirements;

    /** 必须先完成的其它请求 ID */
    private Set<String> dependsOn;

    private boolean criticalPath;
    private boolean criticalDataSource;

    /** 为空时按规则生成默认工作流 */
    private List<WorkflowStepDTO> steps;

    public ScanRequest toScanRequest() {
        List<RuleSpec> ruleSpecs = new ArrayList<>();
        if (rules != null) {
            for (RuleSpecDTO rule : rules) {
                ruleSpecs.add(rule.toRuleSpec());
            }
        }
        List<WorkflowStep> explicitSteps = new ArrayList<>();
        if (steps != null) {
            for (WorkflowStepDTO step : steps) {
                explicitSteps.add(step.toStep());
            }
        }
        return new ScanRequest(requestId, dataSourceIds, ruleSpecs, priority, estimatedDataVolumeGb,
            complianceRequirements, dependsOn, criticalPath, criticalDataSource, explicitSteps);
    }
}
