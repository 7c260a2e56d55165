package com.governance.orchestration.orchestrator;

import com.governance.orchestration.resource.ResourceKind;
import com.governance.orchestration.resource.ResourceRequirement;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 计划风险评估与应急预案
 */
@Component
public class RiskAnalyzer {

    static final double TIGHTNESS_HIGH = 0.9;
    static final double TIGHTNESS_MEDIUM = 0.7;
    static final double DEPENDENCY_HIGH = 0.7;
    static final double DEPENDENCY_MEDIUM = 0.3;
    static final double BUDGET_WARNING_RATIO = 0.8;

    // 资源紧张度上限，避免可用量为 0 时出现无穷大
    private static final double MAX_TIGHTNESS = 10.0;

    public RiskAssessment assess(Collection<ComplexityAnalysis> complexities,
                                 ResourceRequirement totalRequirement,
                                 ResourceRequirement available,
                                 double dependencyComplexity,
                                 double estimatedCost,
                                 Duration estimatedDuration,
                                 OrchestrationConstraints constraints,
                                 Instant plannedAt) {
        List<RiskFactor> factors = new ArrayList<>();

        ComplexityGrade worst = ComplexityGrade.VERY_LOW;
        for (ComplexityAnalysis analysis : complexities) {
            if (analysis.grade().compareTo(worst) > 0) {
                worst = analysis.grade();
            }
        }
        if (worst == ComplexityGrade.VERY_HIGH) {
            factors.add(new RiskFactor(RiskType.HIGH_COMPLEXITY, RiskLevel.HIGH,
                "at least one request scores very_high complexity"));
        } else if (worst == ComplexityGrade.HIGH) {
            factors.add(new RiskFactor(RiskType.HIGH_COMPLEXITY, RiskLevel.MEDIUM,
                "at least one request scores high complexity"));
        }

        double tightness = tightness(totalRequirement, available);
        if (tightness > TIGHTNESS_HIGH) {
            factors.add(new RiskFactor(RiskType.RESOURCE_TIGHTNESS, RiskLevel.HIGH,
                String.format("plan needs %.0f%% of currently available resources", tightness * 100)));
        } else if (tightness > TIGHTNESS_MEDIUM) {
            factors.add(new RiskFactor(RiskType.RESOURCE_TIGHTNESS, RiskLevel.MEDIUM,
                String.format("plan needs %.0f%% of currently available resources", tightness * 100)));
        }

        if (dependencyComplexity > DEPENDENCY_HIGH) {
            factors.add(new RiskFactor(RiskType.COMPLEX_DEPENDENCIES, RiskLevel.HIGH,
                String.format("dependency complexity %.2f", dependencyComplexity)));
        } else if (dependencyComplexity > DEPENDENCY_MEDIUM) {
            factors.add(new RiskFactor(RiskType.COMPLEX_DEPENDENCIES, RiskLevel.MEDIUM,
                String.format("dependency complexity %.2f", dependencyComplexity)));
        }

        Double budget = constraints.budget();
        if (budget != null) {
            if (estimatedCost > budget) {
                factors.add(new RiskFactor(RiskType.BUDGET_OVERRUN, RiskLevel.HIGH,
                    String.format("estimated cost %.4f exceeds budget %.4f", estimatedCost, budget)));
            } else if (estimatedCost > budget * BUDGET_WARNING_RATIO) {
                factors.add(new RiskFactor(RiskType.BUDGET_OVERRUN, RiskLevel.MEDIUM,
                    String.format("estimated cost %.4f is above 80%% of budget %.4f", estimatedCost, budget)));
            }
        }

        Instant deadline = constraints.deadline();
        if (deadline != null && plannedAt.plus(estimatedDuration).isAfter(deadline)) {
            factors.add(new RiskFactor(RiskType.DEADLINE_OVERRUN, RiskLevel.HIGH,
                "estimated completion " + plannedAt.plus(estimatedDuration) + " is after deadline " + deadline));
        }

        return new RiskAssessment(overall(factors), factors, tightness);
    }

    /**
     * 任一 HIGH → HIGH；任一 MEDIUM → MEDIUM；否则 LOW
     */
    static RiskLevel overall(List<RiskFactor> factors) {
        RiskLevel level = RiskLevel.LOW;
        for (RiskFactor factor : factors) {
            if (factor.level().compareTo(level) > 0) {
                level = factor.level();
            }
        }
        return level;
    }

    /**
     * 各资源 需求 / 当前可用 的最大值
     */
    static double tightness(ResourceRequirement required, ResourceRequirement available) {
        double max = 0;
        for (ResourceKind kind : ResourceKind.values()) {
            double need = required.get(kind);
            if (need <= 0) {
                continue;
            }
            double free = available.get(kind);
            double ratio = free > 0 ? need / free : MAX_TIGHTNESS;
            max = Math.max(max, Math.min(MAX_TIGHTNESS, ratio));
        }
        return max;
    }

    public List<ContingencyPlan> contingencies(RiskAssessment assessment) {
        List<ContingencyPlan> plans = new ArrayList<>();
        for (RiskFactor factor : assessment.factors()) {
            switch (factor.type()) {
                case HIGH_COMPLEXITY:
                    plans.add(new ContingencyPlan(factor.type(), "step timeouts or repeated retries",
                        List.of("increase step timeouts for complex rules", "split large requests by data source")));
                    break;
                case RESOURCE_TIGHTNESS:
                    plans.add(new ContingencyPlan(factor.type(), "allocation rejected for insufficient resources",
                        List.of("reduce parallelism", "fall back to sequential execution")));
                    break;
                case COMPLEX_DEPENDENCIES:
                    plans.add(new ContingencyPlan(factor.type(), "upstream workflow failure",
                        List.of("switch to dependency-aware execution", "isolate critical path workflows")));
                    break;
                case BUDGET_OVERRUN:
                    plans.add(new ContingencyPlan(factor.type(), "actual cost approaches budget",
                        List.of("re-plan with cost optimization allocation", "defer low priority workflows")));
                    break;
                case DEADLINE_OVERRUN:
                    plans.add(new ContingencyPlan(factor.type(), "progress behind estimated schedule",
                        List.of("raise priority of critical path workflows", "skip optional notification steps")));
                    break;
                default:
                    break;
            }
        }
        return plans;
    }
}
