package com.governance.orchestration.predictor;

/**
 * 一次执行的实际观测结果（训练标签）
 *
 * @param executionTimeSeconds 执行耗时（秒）
 * @param accuracyScore        准确率 [0,1]
 * @param falsePositiveRate    误报率 [0,1]
 * @param resourceUsage        资源占用比例 [0,1]
 * @param throughput           吞吐（记录/秒）
 * @param costScore            成本分 [0,1]
 * @param coverageScore        覆盖率 [0,1]
 * @param complexityScore      复杂度分 [0,1]
 */
public record PerformanceOutcome(
    double executionTimeSeconds,
    double accuracyScore,
    double falsePositiveRate,
    double resourceUsage,
    double throughput,
    double costScore,
    double coverageScore,
    double complexityScore) {
}
