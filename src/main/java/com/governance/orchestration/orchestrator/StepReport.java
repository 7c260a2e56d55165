package com.governance.orchestration.orchestrator;

import com.governance.orchestration.workflow.FailureReason;
import com.governance.orchestration.workflow.StepExecutionRecord;
import com.governance.orchestration.workflow.StepStatus;

public record StepReport(
    String stepId,
    StepStatus status,
    FailureReason failureReason,
    String error,
    int attempts,
    long durationMs) {

    static StepReport of(StepExecutionRecord record) {
        return new StepReport(record.getStepId(), record.getStatus(), record.getFailureReason(), record.getError(),
            record.getAttempts(), record.getDuration().toMillis());
    }
}
