package com.governance.orchestration.orchestrator;

import com.governance.orchestration.resource.ResourceRequirement;
import com.governance.orchestration.workflow.FailureReason;
import com.governance.orchestration.workflow.WorkflowStatus;

import java.util.List;

/**
 * 单个工作流的最终结果
 *
 * @param allocated       执行时占用的资源
 * @param efficiencyScore 效率分 [0,100]，未执行时为 0
 */
public record WorkflowReport(
    String workflowId,
    String requestId,
    WorkflowStatus status,
    FailureReason failureReason,
    int stepsCompleted,
    int stepsFailed,
    long durationMs,
    ResourceRequirement allocated,
    double efficiencyScore,
    List<StepReport> steps,
    List<String> errors) {

    public WorkflowReport {
        steps = List.copyOf(steps);
        errors = List.copyOf(errors);
    }
}
