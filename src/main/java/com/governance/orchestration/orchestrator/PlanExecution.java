package com.governance.orchestration.orchestrator;

import com.governance.orchestration.optimizer.AdaptationOutcome;
import com.governance.orchestration.workflow.CancellationToken;
import com.governance.orchestration.workflow.Workflow;
import com.governance.orchestration.workflow.WorkflowExecutionRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 计划的执行簿记：状态、各工作流记录、取消信号、自适应结果
 *
 * <p>计划本身不可变，所有随执行变化的数据都在这里。
 */
public class PlanExecution {

    private final ExecutionPlan plan;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final Map<String, WorkflowExecutionRecord> workflowRecords = new LinkedHashMap<>();
    private final Map<String, CancellationToken> workflowTokens = new LinkedHashMap<>();
    private final List<AdaptationOutcome> adaptations = new ArrayList<>();

    private PlanStatus status = PlanStatus.CREATED;
    private OrchestrationMode mode;
    private Instant startedAt;
    private Instant finishedAt;
    private String stopReason;
    private OrchestrationReport report;

    public PlanExecution(ExecutionPlan plan) {
        this.plan = plan;
        for (Workflow workflow : plan.workflows()) {
            workflowRecords.put(workflow.workflowId(), new WorkflowExecutionRecord(workflow, plan.planId()));
            workflowTokens.put(workflow.workflowId(), new CancellationToken());
        }
    }

    /**
     * CREATED → RUNNING，只能成功一次
     */
    synchronized boolean start(OrchestrationMode executionMode) {
        if (status != PlanStatus.CREATED) {
            return false;
        }
        status = PlanStatus.RUNNING;
        mode = executionMode;
        startedAt = Instant.now();
        return true;
    }

    synchronized boolean finish(PlanStatus terminal, String reason, OrchestrationReport finalReport) {
        if (status.isTerminal()) {
            return false;
        }
        status = terminal;
        stopReason = reason;
        report = finalReport;
        finishedAt = Instant.now();
        return true;
    }

    /**
     * 尚未启动的计划直接取消；之后 {@link #start} 不会再成功
     */
    synchronized boolean cancelBeforeStart(String reason) {
        if (status != PlanStatus.CREATED) {
            return false;
        }
        status = PlanStatus.CANCELLED;
        stopReason = reason;
        finishedAt = Instant.now();
        return true;
    }

    synchronized void attachReport(OrchestrationReport finalReport) {
        report = finalReport;
    }

    synchronized void recordAdaptation(AdaptationOutcome outcome) {
        adaptations.add(outcome);
    }

    public String getPlanId() {
        return plan.planId();
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * 单个工作流的取消信号；取消整个计划时会逐个触发
     */
    public CancellationToken getWorkflowToken(String workflowId) {
        return workflowTokens.get(workflowId);
    }

    public WorkflowExecutionRecord getWorkflowRecord(String workflowId) {
        return workflowRecords.get(workflowId);
    }

    public Map<String, WorkflowExecutionRecord> getWorkflowRecords() {
        return Collections.unmodifiableMap(workflowRecords);
    }

    public synchronized List<AdaptationOutcome> getAdaptations() {
        return List.copyOf(adaptations);
    }

    public synchronized PlanStatus getStatus() {
        return status;
    }

    public synchronized OrchestrationMode getMode() {
        return mode;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized String getStopReason() {
        return stopReason;
    }

    public synchronized OrchestrationReport getReport() {
        return report;
    }

    public synchronized Duration getDuration() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt != null ? finishedAt : Instant.now());
    }

    public boolean isTerminal() {
        return getStatus().isTerminal();
    }
}
