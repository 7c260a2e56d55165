package com.governance.orchestration.workflow;

/**
 * 工作流执行状态，COMPLETED / FAILED / CANCELLED / SKIPPED 为终态
 */
public enum WorkflowStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    /** 因关键路径失败未启动 */
    SKIPPED;

    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }
}
