package com.governance.orchestration.workflow;

import java.util.Map;

/**
 * 传给步骤处理器的上下文
 *
 * @param attempt 第几次尝试，从 1 开始
 */
public record StepContext(
    String planId,
    String workflowId,
    WorkflowStep step,
    int attempt,
    CancellationToken cancellationToken) {

    public Map<String, Object> parameters() {
        return step.parameters();
    }
}
