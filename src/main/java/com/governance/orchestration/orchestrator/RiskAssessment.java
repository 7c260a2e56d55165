package com.governance.orchestration.orchestrator;

import java.util.List;

/**
 * 计划风险评估，总体等级取各风险因素的最高级
 *
 * @param resourceTightness 计划总需求 / 当前可用量 的最大比值
 */
public record RiskAssessment(RiskLevel level, List<RiskFactor> factors, double resourceTightness) {

    public RiskAssessment {
        factors = List.copyOf(factors);
    }
}
