package com.governance.orchestration.optimizer;

/**
 * 决定某项建议是否应用（按编排模式提供不同实现）
 */
@FunctionalInterface
public interface AdaptationApproval {

    boolean approve(ParameterRecommendation recommendation);

    /**
     * 只记录建议，不应用
     */
    static AdaptationApproval none() {
        return recommendation -> false;
    }

    /**
     * 安全分严格大于阈值才应用
     */
    static AdaptationApproval safetyAbove(double threshold) {
        return recommendation -> recommendation.safetyScore() > threshold;
    }
}
