package com.governance.orchestration.orchestrator;

import java.time.Instant;

/**
 * 约束条件，均可为空
 *
 * @param budget   成本上限
 * @param deadline 截止时间
 */
public record OrchestrationConstraints(Double budget, Instant deadline) {

    public static OrchestrationConstraints none() {
        return new OrchestrationConstraints(null, null);
    }
}
