package com.governance.orchestration.orchestrator;

/**
 * 计划状态
 */
public enum PlanStatus {
    CREATED,
    RUNNING,
    COMPLETED,
    /** 部分工作流或可选步骤失败 */
    PARTIALLY_FAILED,
    FAILED,
    /** 关键路径工作流失败，提前终止 */
    STOPPED_CRITICAL_FAILURE,
    CANCELLED;

    public boolean isTerminal() {
        return this != CREATED && this != RUNNING;
    }
}
