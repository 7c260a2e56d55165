package com.governance.orchestration.optimizer;

import java.time.Instant;
import java.util.Map;

/**
 * 回滚计划：变更前的参数值
 */
public record RollbackPlan(String ruleId, Map<String, Double> previousValues, Instant createdAt) {

    public RollbackPlan {
        previousValues = Map.copyOf(previousValues);
    }

    public boolean isEmpty() {
        return previousValues.isEmpty();
    }
}
