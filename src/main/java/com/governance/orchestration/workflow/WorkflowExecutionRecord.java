package com.governance.orchestration.workflow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流执行记录
 *
 * <p>工作流开始时创建，只由执行引擎（以及编排器的排队 / 跳过逻辑）修改。
 * 进入终态（COMPLETED / FAILED / CANCELLED / SKIPPED）后不再变化。
 */
public class WorkflowExecutionRecord {

    private final String workflowId;
    private final String planId;
    private final Map<String, StepExecutionRecord> steps = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private WorkflowStatus status = WorkflowStatus.QUEUED;
    private FailureReason failureReason;
    private final Instant createdAt = Instant.now();
    private Instant startedAt;
    private Instant finishedAt;

    public WorkflowExecutionRecord(Workflow workflow, String planId) {
        this.workflowId = workflow.workflowId();
        this.planId = planId;
        for (WorkflowStep step : workflow.steps()) {
            steps.put(step.stepId(), new StepExecutionRecord(step.stepId(), step.required()));
        }
    }

    public synchronized boolean markRunning() {
        if (status != WorkflowStatus.QUEUED) {
            return false;
        }
        status = WorkflowStatus.RUNNING;
        startedAt = Instant.now();
        return true;
    }

    /**
     * 进入终态，已是终态时忽略
     */
    public synchronized boolean finish(WorkflowStatus terminal, FailureReason reason, String error) {
        if (status.isTerminal() || !terminal.isTerminal()) {
            return false;
        }
        status = terminal;
        failureReason = reason;
        if (error != null) {
            errors.add(error);
        }
        finishedAt = Instant.now();
        return true;
    }

    synchronized void addError(String error) {
        if (!status.isTerminal()) {
            errors.add(error);
        }
    }

    StepExecutionRecord step(String stepId) {
        return steps.get(stepId);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getPlanId() {
        return planId;
    }

    public synchronized WorkflowStatus getStatus() {
        return status;
    }

    public synchronized FailureReason getFailureReason() {
        return failureReason;
    }

    public synchronized List<String> getErrors() {
        return List.copyOf(errors);
    }

    public synchronized Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized Duration getDuration() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt != null ? finishedAt : Instant.now());
    }

    public Map<String, StepExecutionRecord> getSteps() {
        return Collections.unmodifiableMap(steps);
    }

    public StepExecutionRecord getStep(String stepId) {
        return steps.get(stepId);
    }

    public int getStepsCompleted() {
        return countSteps(StepStatus.COMPLETED);
    }

    public int getStepsFailed() {
        return countSteps(StepStatus.FAILED);
    }

    public int countSteps(StepStatus stepStatus) {
        int count = 0;
        for (StepExecutionRecord step : steps.values()) {
            if (step.getStatus() == stepStatus) {
                count++;
            }
        }
        return count;
    }

    /**
     * 每个步骤的耗时与采样
     */
    public Map<String, StepPerformance> getPerformanceData() {
        Map<String, StepPerformance> data = new LinkedHashMap<>();
        steps.forEach((id, step) -> data.put(id, StepPerformance.of(step)));
        return data;
    }

    public boolean isTerminal() {
        return getStatus().isTerminal();
    }
}
