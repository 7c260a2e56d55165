package com.governance.orchestration.optimizer;

/**
 * 一项参数调整建议
 *
 * @param expectedImprovement 预期改善比例
 * @param baseSafety          按调整类型给定的基础安全分
 * @param safetyScore         叠加反馈权重后的安全分 [0,1]
 */
public record ParameterRecommendation(
    String ruleId,
    String parameter,
    double currentValue,
    double proposedValue,
    double expectedImprovement,
    double baseSafety,
    double safetyScore,
    String reason) {

    /**
     * 排序依据：预期改善 × 安全分
     */
    public double rankScore() {
        return expectedImprovement * safetyScore;
    }
}
