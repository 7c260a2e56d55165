package com.governance.orchestration.predictor;

import java.util.EnumMap;
import java.util.Map;

/**
 * 性能预测结果，各项均已裁剪到合法区间
 *
 * @param defaulted 为 true 表示模型不可用，返回的是中性估计
 */
public record PerformancePrediction(
    double executionTimeSeconds,
    double accuracyScore,
    double falsePositiveRate,
    double resourceUsage,
    double throughput,
    double costScore,
    double coverageScore,
    double complexityScore,
    boolean defaulted) {

    public static PerformancePrediction neutral() {
        return fromMap(new EnumMap<>(PredictionTarget.class), true);
    }

    static PerformancePrediction fromMap(Map<PredictionTarget, Double> values, boolean defaulted) {
        return new PerformancePrediction(
            resolve(values, PredictionTarget.EXECUTION_TIME),
            resolve(values, PredictionTarget.ACCURACY),
            resolve(values, PredictionTarget.FALSE_POSITIVE_RATE),
            resolve(values, PredictionTarget.RESOURCE_USAGE),
            resolve(values, PredictionTarget.THROUGHPUT),
            resolve(values, PredictionTarget.COST_SCORE),
            resolve(values, PredictionTarget.COVERAGE_SCORE),
            resolve(values, PredictionTarget.COMPLEXITY_SCORE),
            defaulted);
    }

    private static double resolve(Map<PredictionTarget, Double> values, PredictionTarget target) {
        Double value = values.get(target);
        return target.clamp(value != null ? value : target.neutral());
    }
}
