package com.governance.orchestration.dto;

import com.governance.orchestration.workflow.StepType;
import com.governance.orchestration.workflow.WorkflowStep;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * 显式定义的工作流步骤
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowStepDTO {

    private String stepId;
    private String name;
    private StepType type;
    private Set<String> dependencies;

    /** 缺省为必需步骤 */
    private Boolean required;

    /** 单次尝试超时（秒），为空使用默认值 */
    private Long timeoutSeconds;

    private int maxAttempts;
    private String ruleId;
    private Map<String, Object> parameters;

    public WorkflowStep toStep() {
        return new WorkflowStep(stepId, name, type, dependencies, required == null || required,
            timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds), maxAttempts, ruleId, parameters);
    }
}
