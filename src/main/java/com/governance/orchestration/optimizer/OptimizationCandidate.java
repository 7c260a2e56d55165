package com.governance.orchestration.optimizer;

import java.util.Map;

/**
 * 优化候选，生成后不再修改，被新候选取代时直接丢弃
 *
 * @param configuration     调整后的参数
 * @param predictedMetrics  预期指标
 * @param confidence        置信度 [0,1]
 * @param optimizationScore 综合得分
 */
public record OptimizationCandidate(
    String ruleId,
    Map<String, Double> configuration,
    Map<String, Double> predictedMetrics,
    double confidence,
    double optimizationScore) {

    public OptimizationCandidate {
        configuration = Map.copyOf(configuration);
        predictedMetrics = Map.copyOf(predictedMetrics);
        confidence = Math.max(0, Math.min(1, confidence));
    }
}
