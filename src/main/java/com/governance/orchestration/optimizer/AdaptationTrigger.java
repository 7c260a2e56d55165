package com.governance.orchestration.optimizer;

/**
 * 触发自适应的信号
 */
public enum AdaptationTrigger {
    /** 近期执行时间劣化 */
    TIME_DECLINE,
    /** 近期准确率劣化 */
    ACCURACY_DECLINE,
    /** 执行时间波动过大 */
    HIGH_VARIANCE
}
