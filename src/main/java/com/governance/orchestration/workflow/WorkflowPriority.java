package com.governance.orchestration.workflow;

/**
 * 扫描请求 / 工作流优先级
 */
public enum WorkflowPriority {

    LOW(1, 0.8),
    NORMAL(2, 1.0),
    HIGH(3, 1.2),
    CRITICAL(4, 1.5),
    EMERGENCY(5, 2.0);

    private final int rank;
    private final double resourceMultiplier;

    WorkflowPriority(int rank, double resourceMultiplier) {
        this.rank = rank;
        this.resourceMultiplier = resourceMultiplier;
    }

    /**
     * 数值越大越优先
     */
    public int getRank() {
        return rank;
    }

    /**
     * 优先级调度下的资源放大系数
     */
    public double getResourceMultiplier() {
        return resourceMultiplier;
    }
}
