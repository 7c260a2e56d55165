package com.governance.orchestration.constant;

/**
 * 编排相关常量
 */
public final class OrchestrationConstants {

    private OrchestrationConstants() {}

    // ==================== 步骤输出键 ====================

    /** 规则准确率 [0,1] */
    public static final String OUTPUT_ACCURACY = "accuracy";

    /** 吞吐（记录/秒） */
    public static final String OUTPUT_THROUGHPUT = "throughput";

    /** 扫描记录数，没有 throughput 时用它和耗时推算 */
    public static final String OUTPUT_RECORDS_SCANNED = "records_scanned";

    /** 误报率 [0,1] */
    public static final String OUTPUT_FALSE_POSITIVE_RATE = "false_positive_rate";

    /** 覆盖率 [0,1] */
    public static final String OUTPUT_COVERAGE = "coverage";

    // ==================== 计划 ====================

    /** 计划 ID 前缀 */
    public static final String PLAN_ID_PREFIX = "plan_";

    /** 关键失败终止时的原因 */
    public static final String STOPPED_DUE_TO_CRITICAL_FAILURE = "stopped due to critical failure";

    // ==================== 缓存名 ====================

    /** 已结束计划 */
    public static final String FINISHED_PLAN_CACHE = "finishedPlanCache";

    /** 性能时间序列 */
    public static final String PERFORMANCE_SERIES_CACHE = "performanceSeriesCache";
}
