package com.governance.orchestration.orchestrator;

/**
 * 单个工作流资源分配量的推导方式
 */
public enum ResourceOptimizationType {
    /** 单个工作流最多占总容量的 30% */
    LOAD_BALANCING,
    /** 按优先级放大 / 缩小 */
    PRIORITY_SCHEDULING,
    /** 直接使用推荐量 */
    RESOURCE_POOLING,
    /** 按当前可用度伸缩 */
    DYNAMIC_SCALING,
    /** 统一缩减到 80% */
    COST_OPTIMIZATION
}
