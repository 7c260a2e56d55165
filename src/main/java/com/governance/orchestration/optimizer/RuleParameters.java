package com.governance.orchestration.optimizer;

import java.util.Map;

/**
 * 可调规则参数名与默认值
 */
public final class RuleParameters {

    /** 单步超时（秒） */
    public static final String EXECUTION_TIMEOUT = "execution_timeout";
    /** 内存上限（MB） */
    public static final String MEMORY_LIMIT_MB = "memory_limit_mb";
    /** 检测灵敏度阈值 */
    public static final String SENSITIVITY_THRESHOLD = "sensitivity_threshold";
    /** 最大并行度 */
    public static final String MAX_PARALLELISM = "max_parallelism";

    public static final double MAX_EXECUTION_TIMEOUT = 600;

    static final Map<String, Double> DEFAULTS = Map.of(
        EXECUTION_TIMEOUT, 300.0,
        MEMORY_LIMIT_MB, 1024.0,
        SENSITIVITY_THRESHOLD, 0.5,
        MAX_PARALLELISM, 4.0);

    private RuleParameters() {
    }
}
