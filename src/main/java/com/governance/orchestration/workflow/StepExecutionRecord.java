package com.governance.orchestration.workflow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 单个步骤的执行记录，只由执行引擎修改
 */
public class StepExecutionRecord {

    private final String stepId;
    private final boolean required;
    private StepStatus status = StepStatus.PENDING;
    private FailureReason failureReason;
    private String error;
    private int attempts;
    private Instant startedAt;
    private Instant finishedAt;
    private Map<String, Object> output = Map.of();
    private final List<ResourceSample> samples = new ArrayList<>();

    StepExecutionRecord(String stepId, boolean required) {
        this.stepId = stepId;
        this.required = required;
    }

    synchronized void markRunning() {
        if (status == StepStatus.PENDING) {
            status = StepStatus.RUNNING;
            startedAt = Instant.now();
        }
    }

    synchronized void incrementAttempts() {
        attempts++;
    }

    synchronized void markCompleted(Map<String, Object> stepOutput) {
        if (!status.isTerminal()) {
            status = StepStatus.COMPLETED;
            output = stepOutput == null ? Map.of() : Map.copyOf(stepOutput);
            finishedAt = Instant.now();
        }
    }

    synchronized void markFailed(FailureReason reason, String message) {
        if (!status.isTerminal()) {
            status = StepStatus.FAILED;
            failureReason = reason;
            error = message;
            finishedAt = Instant.now();
        }
    }

    /**
     * 从未启动的步骤收尾为 SKIPPED / CANCELLED；已在运行的步骤只能被 CANCELLED
     */
    synchronized void markNotRun(StepStatus terminal, FailureReason reason, String message) {
        if (!status.isTerminal()) {
            status = terminal;
            failureReason = reason;
            error = message;
            finishedAt = Instant.now();
        }
    }

    synchronized void addSample(ResourceSample sample) {
        samples.add(sample);
    }

    public String getStepId() {
        return stepId;
    }

    public boolean isRequired() {
        return required;
    }

    public synchronized StepStatus getStatus() {
        return status;
    }

    public synchronized FailureReason getFailureReason() {
        return failureReason;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized Map<String, Object> getOutput() {
        return output;
    }

    /**
     * 运行期间按固定间隔采集的资源使用
     */
    public synchronized List<ResourceSample> getSamples() {
        return List.copyOf(samples);
    }

    public synchronized Duration getDuration() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(startedAt, end);
    }
}
