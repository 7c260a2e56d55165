package com.governance.orchestration.decision;

import com.governance.orchestration.resource.ResourceKind;
import com.governance.orchestration.resource.ResourcePoolState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 编排策略决策
 *
 * <p>固定阈值，不做学习，保证计划可解释：
 * <ul>
 *   <li>可用度 &gt; 0.8 且依赖复杂度 &lt; 0.3 → PARALLEL</li>
 *   <li>依赖复杂度 &gt; 0.7 → DEPENDENCY_AWARE</li>
 *   <li>可用度 &lt; 0.4 → RESOURCE_AWARE</li>
 *   <li>存在关键数据源 → PRIORITY_BASED</li>
 *   <li>其余 → ADAPTIVE</li>
 * </ul>
 * SEQUENTIAL 只在调用方显式指定时使用。
 */
@Component
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final double HIGH_AVAILABILITY = 0.8;
    static final double LOW_DEPENDENCY = 0.3;
    static final double HIGH_DEPENDENCY = 0.7;
    static final double LOW_AVAILABILITY = 0.4;

    private final Map<OrchestrationStrategy, Counter> decisionCounters = new EnumMap<>(OrchestrationStrategy.class);

    public DecisionEngine(MeterRegistry meterRegistry) {
        for (OrchestrationStrategy strategy : OrchestrationStrategy.values()) {
            decisionCounters.put(strategy, Counter.builder("orchestration.strategy.decisions")
                .tag("strategy", strategy.name().toLowerCase())
                .description("Strategy decisions")
                .register(meterRegistry));
        }
    }

    /**
     * 根据数据源、规则依赖和当前资源状态选择策略
     *
     * @param dataSourceIds       参与编排的数据源（去重后计数）
     * @param ruleDependencies    规则间显式依赖
     * @param criticalDataSources 标记为关键的数据源
     * @param resourceState       当前资源池快照
     */
    public StrategyDecision chooseStrategy(Collection<String> dataSourceIds,
                                           Collection<RuleDependency> ruleDependencies,
                                           Collection<String> criticalDataSources,
                                           ResourcePoolState resourceState) {
        double availability = availabilityScore(resourceState);
        double complexity = dependencyComplexity(dataSourceIds, ruleDependencies);
        boolean anyCritical = criticalDataSources != null && !criticalDataSources.isEmpty();
        return chooseStrategy(availability, complexity, anyCritical);
    }

    /**
     * 纯阈值决策
     */
    public StrategyDecision chooseStrategy(double availability, double complexity, boolean anyCritical) {
        OrchestrationStrategy strategy;
        String rationale;
        if (availability > HIGH_AVAILABILITY && complexity < LOW_DEPENDENCY) {
            strategy = OrchestrationStrategy.PARALLEL;
            rationale = String.format("availability %.2f > %.1f and dependency complexity %.2f < %.1f",
                availability, HIGH_AVAILABILITY, complexity, LOW_DEPENDENCY);
        } else if (complexity > HIGH_DEPENDENCY) {
            strategy = OrchestrationStrategy.DEPENDENCY_AWARE;
            rationale = String.format("dependency complexity %.2f > %.1f", complexity, HIGH_DEPENDENCY);
        } else if (availability < LOW_AVAILABILITY) {
            strategy = OrchestrationStrategy.RESOURCE_AWARE;
            rationale = String.format("availability %.2f < %.1f", availability, LOW_AVAILABILITY);
        } else if (anyCritical) {
            strategy = OrchestrationStrategy.PRIORITY_BASED;
            rationale = "at least one data source is marked critical";
        } else {
            strategy = OrchestrationStrategy.ADAPTIVE;
            rationale = String.format("no threshold matched (availability %.2f, dependency complexity %.2f)",
                availability, complexity);
        }
        decisionCounters.get(strategy).increment();
        log.info("Strategy selected: {} ({})", strategy, rationale);
        return new StrategyDecision(strategy, availability, complexity, anyCritical, false, rationale);
    }

    /**
     * 资源可用度 = CPU / 内存 / 网络三项 (1 - 利用率) 的平均值
     */
    public static double availabilityScore(ResourcePoolState state) {
        double sum = 0;
        ResourceKind[] kinds = {ResourceKind.CPU, ResourceKind.MEMORY, ResourceKind.NETWORK};
        for (ResourceKind kind : kinds) {
            double utilization = Math.max(0, Math.min(1, state.utilization(kind)));
            sum += 1 - utilization;
        }
        return sum / kinds.length;
    }

    /**
     * 依赖复杂度 = 规则间显式依赖数 / 数据源两两组合数，裁剪到 [0,1]
     * 少于两个数据源时为 0
     */
    public static double dependencyComplexity(Collection<String> dataSourceIds,
                                              Collection<RuleDependency> ruleDependencies) {
        Set<String> distinct = dataSourceIds == null ? Set.of() : new HashSet<>(dataSourceIds);
        int n = distinct.size();
        if (n < 2 || ruleDependencies == null || ruleDependencies.isEmpty()) {
            return 0.0;
        }
        double maxPairs = n * (n - 1) / 2.0;
        return Math.min(1.0, Math.max(0.0, ruleDependencies.size() / maxPairs));
    }
}
