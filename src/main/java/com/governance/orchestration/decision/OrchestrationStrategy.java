package com.governance.orchestration.decision;

import java.util.Locale;

/**
 * 编排策略
 */
public enum OrchestrationStrategy {

    /** 全部并行 */
    PARALLEL,
    /** 逐个串行 */
    SEQUENTIAL,
    /** 按优先级排序后执行 */
    PRIORITY_BASED,
    /** 以资源可分配为准入条件 */
    RESOURCE_AWARE,
    /** 按依赖分层波次执行 */
    DEPENDENCY_AWARE,
    /** 根据运行时告警动态调整并发 */
    ADAPTIVE;

    /**
     * 按名称解析，忽略大小写与连字符
     *
     * @throws IllegalArgumentException 未知策略
     */
    public static OrchestrationStrategy parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (OrchestrationStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown orchestration strategy: " + name);
    }
}
