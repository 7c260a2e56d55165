package com.governance.orchestration.decision;

/**
 * 策略选择结果，带上用于审计的输入与理由
 *
 * @param availabilityScore    资源可用度 [0,1]
 * @param dependencyComplexity 依赖复杂度 [0,1]
 * @param anyCritical          是否存在关键数据源
 * @param rationale            可读的选择理由
 */
public record StrategyDecision(
    OrchestrationStrategy strategy,
    double availabilityScore,
    double dependencyComplexity,
    boolean anyCritical,
    boolean explicit,
    String rationale) {

    public static StrategyDecision explicit(OrchestrationStrategy strategy) {
        return new StrategyDecision(strategy, Double.NaN, Double.NaN, false, true,
            "explicitly requested by caller");
    }
}
