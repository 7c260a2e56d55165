package com.governance.orchestration.optimizer;

import java.time.Instant;
import java.util.Set;

/**
 * 已应用的参数变更，附带回滚计划
 */
public record AppliedChange(
    String changeId,
    String ruleId,
    String parameter,
    double previousValue,
    double newValue,
    double expectedImprovement,
    double safetyScore,
    Set<AdaptationTrigger> triggers,
    Instant appliedAt,
    RollbackPlan rollbackPlan) {
}
