package com.governance.orchestration.optimizer;

import java.util.List;

/**
 * 一次自适应评估的结果
 *
 * @param trend           趋势分析，样本不足时为 null
 * @param recommendations 排序后的建议（含已应用的）
 * @param candidates      对应的优化候选
 * @param applied         实际应用的变更
 * @param skippedReason   未触发时的原因
 */
public record AdaptationOutcome(
    String ruleId,
    PerformanceTrend trend,
    List<ParameterRecommendation> recommendations,
    List<OptimizationCandidate> candidates,
    List<AppliedChange> applied,
    String skippedReason) {

    static AdaptationOutcome skipped(String ruleId, PerformanceTrend trend, String reason) {
        return new AdaptationOutcome(ruleId, trend, List.of(), List.of(), List.of(), reason);
    }

    public boolean isTriggered() {
        return skippedReason == null;
    }
}
