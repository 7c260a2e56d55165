package com.governance.orchestration.workflow;

/**
 * 步骤状态：PENDING → RUNNING → COMPLETED | FAILED
 * SKIPPED / CANCELLED 只用于从未启动过的步骤（以及宽限期后被放弃的在途步骤）
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
