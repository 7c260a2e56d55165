package com.governance.orchestration.workflow;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 工作流中的一个步骤
 *
 * @param dependencies 必须先 COMPLETED 的步骤 ID
 * @param required     失败时是否导致整个工作流失败
 * @param timeout      单次尝试超时，null 表示使用默认值
 * @param maxAttempts  超时重试的最大尝试次数，0 表示使用默认值
 * @param ruleId       关联的扫描规则，可为空
 * @param parameters   传给处理器的参数
 */
public record WorkflowStep(
    String stepId,
    String name,
    StepType type,
    Set<String> dependencies,
    boolean required,
    Duration timeout,
    int maxAttempts,
    String ruleId,
    Map<String, Object> parameters) {

    public WorkflowStep {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("stepId must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("step type must not be null: " + stepId);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + stepId);
        }
        dependencies = dependencies == null ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        parameters = parameters == null ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        name = name == null ? stepId : name;
    }

    public static WorkflowStep of(String stepId, StepType type, String... dependencies) {
        return new WorkflowStep(stepId, stepId, type, Set.of(dependencies), true, null, 0, null, Map.of());
    }

    public WorkflowStep optional() {
        return new WorkflowStep(stepId, name, type, dependencies, false, timeout, maxAttempts, ruleId, parameters);
    }

    public WorkflowStep withTimeout(Duration stepTimeout) {
        return new WorkflowStep(stepId, name, type, dependencies, required, stepTimeout, maxAttempts, ruleId, parameters);
    }

    public WorkflowStep withMaxAttempts(int attempts) {
        return new WorkflowStep(stepId, name, type, dependencies, required, timeout, attempts, ruleId, parameters);
    }

    public WorkflowStep withRule(String rule, Map<String, Object> params) {
        return new WorkflowStep(stepId, name, type, dependencies, required, timeout, maxAttempts, rule, params);
    }
}
