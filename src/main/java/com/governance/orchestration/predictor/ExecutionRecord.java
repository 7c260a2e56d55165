package com.governance.orchestration.predictor;

import java.time.Instant;

/**
 * 历史执行记录：特征 + 观测结果
 */
public record ExecutionRecord(String ruleId, FeatureVector features, PerformanceOutcome outcome, Instant observedAt) {
}
