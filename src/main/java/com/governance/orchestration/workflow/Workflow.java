package com.governance.orchestration.workflow;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 一个扫描请求对应的步骤 DAG
 *
 * @param requestId            来源扫描请求
 * @param dependsOnWorkflowIds 必须先完成的其它工作流
 * @param criticalPath         失败时是否终止整个编排
 */
public record Workflow(
    String workflowId,
    String requestId,
    WorkflowPriority priority,
    List<WorkflowStep> steps,
    Set<String> dependsOnWorkflowIds,
    boolean criticalPath) {

    public Workflow {
        steps = List.copyOf(steps);
        dependsOnWorkflowIds = dependsOnWorkflowIds == null ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOnWorkflowIds));
        priority = priority == null ? WorkflowPriority.NORMAL : priority;
    }

    public static Workflow of(String workflowId, List<WorkflowStep> steps) {
        return new Workflow(workflowId, workflowId, WorkflowPriority.NORMAL, steps, Set.of(), false);
    }

    public Optional<WorkflowStep> step(String stepId) {
        for (WorkflowStep step : steps) {
            if (step.stepId().equals(stepId)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    public DependencyGraph dependencyGraph() {
        return DependencyGraph.ofSteps(steps);
    }
}
