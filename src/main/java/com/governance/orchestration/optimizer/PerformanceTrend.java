package com.governance.orchestration.optimizer;

import java.util.Set;

/**
 * 最近 N 次与之前 N 次执行的对比
 *
 * @param timeChange      执行时间相对变化，正数表示变慢
 * @param accuracyChange  准确率相对下降，正数表示变差；无准确率数据时为 0
 * @param coefficientOfVariation 最近窗口执行时间的变异系数
 */
public record PerformanceTrend(
    String ruleId,
    int window,
    double recentAverageTime,
    double previousAverageTime,
    double timeChange,
    double recentAccuracy,
    double previousAccuracy,
    double accuracyChange,
    double coefficientOfVariation,
    double recentCpuUsage,
    double recentMemoryUsage,
    Set<AdaptationTrigger> triggers) {

    public boolean isDeclining() {
        return triggers.contains(AdaptationTrigger.TIME_DECLINE) || triggers.contains(AdaptationTrigger.ACCURACY_DECLINE);
    }

    public boolean isHighVariance() {
        return triggers.contains(AdaptationTrigger.HIGH_VARIANCE);
    }

    public boolean requiresAdaptation() {
        return !triggers.isEmpty();
    }
}
