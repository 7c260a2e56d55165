package com.governance.orchestration.optimizer;

import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.exception.AdaptationNotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleFunction;

/**
 * 自适应优化器
 *
 * <p>按规则维护有界执行历史，样本足够且最近窗口出现劣化或高波动时，
 * 生成参数调整建议并按审批策略应用，每项变更都带回滚计划。
 *
 * <p>同一规则两次自适应之间至少要有一个对比窗口的新样本，避免对同一批数据反复调整。
 */
@Component
public class AdaptiveOptimizer {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveOptimizer.class);

    // 资源瓶颈判定
    static final double HIGH_MEMORY_USAGE = 80.0;
    static final double HIGH_CPU_USAGE = 85.0;

    private final OrchestrationProperties.AdaptationConfig config;
    private final RuleParameterStore parameterStore;
    private final SafetyWeightingPolicy weightingPolicy;
    private final AnomalyScorer anomalyScorer;

    private final Map<String, PerformanceHistory> histories = new ConcurrentHashMap<>();
    private final Map<String, Double> latestAnomaly = new ConcurrentHashMap<>();
    private final Map<String, Long> lastAdaptedAt = new ConcurrentHashMap<>();
    private final Map<String, Object> ruleLocks = new ConcurrentHashMap<>();
    private final Map<String, AppliedChange> changes = new ConcurrentHashMap<>();
    private final Map<String, Instant> rolledBack = new ConcurrentHashMap<>();
    private final Deque<String> changeOrder = new ArrayDeque<>();

    private final Counter appliedCounter;
    private final Counter rolledBackCounter;
    private final Counter recommendedCounter;

    public AdaptiveOptimizer(OrchestrationProperties properties,
                             RuleParameterStore parameterStore,
                             SafetyWeightingPolicy weightingPolicy,
                             AnomalyScorer anomalyScorer,
                             MeterRegistry meterRegistry) {
        this.config = properties.getAdaptation();
        this.parameterStore = parameterStore;
        this.weightingPolicy = weightingPolicy;
        this.anomalyScorer = anomalyScorer;
        this.appliedCounter = Counter.builder("orchestration.adaptations")
            .tag("result", "applied").register(meterRegistry);
        this.rolledBackCounter = Counter.builder("orchestration.adaptations")
            .tag("result", "rolled_back").register(meterRegistry);
        this.recommendedCounter = Counter.builder("orchestration.adaptations")
            .tag("result", "recommended").register(meterRegistry);
        Gauge.builder("orchestration.adaptation.tracked_rules", histories, Map::size)
            .register(meterRegistry);
    }

    // ==================== 观测 ====================

    /**
     * 追加一次执行观测
     *
     * @return 本次观测的异常分 [0,1]
     */
    public double observe(String ruleId, ExecutionMetrics metrics) {
        PerformanceHistory history = histories.computeIfAbsent(ruleId,
            k -> new PerformanceHistory(config.getHistoryCapacity()));
        double score = 0.0;
        try {
            score = clamp01(anomalyScorer.score(history.snapshot(), metrics));
        } catch (RuntimeException e) {
            log.warn("Anomaly scoring failed for rule {}: {}", ruleId, e.getMessage());
        }
        history.append(metrics);
        latestAnomaly.put(ruleId, score);
        return score;
    }

    public int historySize(String ruleId) {
        PerformanceHistory history = histories.get(ruleId);
        return history == null ? 0 : history.size();
    }

    public List<ExecutionMetrics> history(String ruleId) {
        PerformanceHistory history = histories.get(ruleId);
        return history == null ? List.of() : history.snapshot();
    }

    /**
     * 按最近异常分从高到低排列规则
     */
    public List<RuleAnomaly> rankByAnomaly() {
        List<RuleAnomaly> ranked = new ArrayList<>();
        latestAnomaly.forEach((ruleId, score) -> ranked.add(new RuleAnomaly(ruleId, score)));
        ranked.sort(Comparator.comparingDouble(RuleAnomaly::score).reversed().thenComparing(RuleAnomaly::ruleId));
        return ranked;
    }

    // ==================== 趋势 ====================

    /**
     * 最近窗口对比上一窗口；样本不足两个窗口时为空
     */
    public Optional<PerformanceTrend> analyzeTrend(String ruleId) {
        List<ExecutionMetrics> data = history(ruleId);
        int window = Math.max(2, config.getComparisonWindow());
        if (data.size() < window * 2) {
            return Optional.empty();
        }
        List<ExecutionMetrics> recent = data.subList(data.size() - window, data.size());
        List<ExecutionMetrics> previous = data.subList(data.size() - 2 * window, data.size() - window);

        double recentTime = average(recent, ExecutionMetrics::executionTimeSeconds);
        double previousTime = average(previous, ExecutionMetrics::executionTimeSeconds);
        double timeChange = previousTime > 0 ? (recentTime - previousTime) / previousTime : 0.0;

        double recentAccuracy = averageAccuracy(recent);
        double previousAccuracy = averageAccuracy(previous);
        double accuracyChange = 0.0;
        if (!Double.isNaN(recentAccuracy) && !Double.isNaN(previousAccuracy) && previousAccuracy > 0) {
            accuracyChange = (previousAccuracy - recentAccuracy) / previousAccuracy;
        }

        double variance = 0;
        for (ExecutionMetrics metrics : recent) {
            double d = metrics.executionTimeSeconds() - recentTime;
            variance += d * d;
        }
        double cv = recentTime > 0 ? Math.sqrt(variance / recent.size()) / recentTime : 0.0;

        Set<AdaptationTrigger> triggers = EnumSet.noneOf(AdaptationTrigger.class);
        if (timeChange > config.getTimeDeclineThreshold()) {
            triggers.add(AdaptationTrigger.TIME_DECLINE);
        }
        if (accuracyChange > config.getAccuracyDeclineThreshold()) {
            triggers.add(AdaptationTrigger.ACCURACY_DECLINE);
        }
        if (cv > config.getVarianceThreshold()) {
            triggers.add(AdaptationTrigger.HIGH_VARIANCE);
        }

        return Optional.of(new PerformanceTrend(ruleId, window, recentTime, previousTime, timeChange,
            recentAccuracy, previousAccuracy, accuracyChange, cv,
            average(recent, ExecutionMetrics::cpuUsage), average(recent, ExecutionMetrics::memoryUsage),
            Set.copyOf(triggers)));
    }

    // ==================== 自适应 ====================

    /**
     * 安全分高于自动应用阈值的建议直接应用
     */
    public List<AppliedChange> maybeAdapt(String ruleId) {
        return maybeAdapt(ruleId, AdaptationApproval.safetyAbove(config.getAutoApplySafetyThreshold())).applied();
    }

    /**
     * 评估并按审批策略应用
     */
    public AdaptationOutcome maybeAdapt(String ruleId, AdaptationApproval approval) {
        PerformanceHistory history = histories.get(ruleId);
        int samples = history == null ? 0 : history.size();
        if (samples < config.getMinSamples()) {
            log.debug("Adaptation skipped for rule {}: {}/{} samples", ruleId, samples, config.getMinSamples());
            return AdaptationOutcome.skipped(ruleId, null,
                "insufficient samples: " + samples + "/" + config.getMinSamples());
        }

        // 冷却判断、应用与打点须按规则串行
        synchronized (ruleLock(ruleId)) {
            Long last = lastAdaptedAt.get(ruleId);
            if (last != null && history.totalObserved() - last < config.getComparisonWindow()) {
                return AdaptationOutcome.skipped(ruleId, null, "waiting for new samples since last adaptation");
            }

            PerformanceTrend trend = analyzeTrend(ruleId).orElse(null);
            if (trend == null || !trend.requiresAdaptation()) {
                return AdaptationOutcome.skipped(ruleId, trend, "no decline or variance signal");
            }

            List<ParameterRecommendation> recommendations = recommend(ruleId, trend);
            List<OptimizationCandidate> candidates = new ArrayList<>();
            for (ParameterRecommendation recommendation : recommendations) {
                candidates.add(toCandidate(recommendation, trend));
            }
            recommendedCounter.increment(recommendations.size());

            List<AppliedChange> applied = new ArrayList<>();
            for (ParameterRecommendation recommendation : recommendations) {
                boolean approved;
                try {
                    approved = approval.approve(recommendation);
                } catch (RuntimeException e) {
                    log.warn("Approval of {} for rule {} failed, treating as rejected: {}",
                        recommendation.parameter(), ruleId, e.getMessage());
                    approved = false;
                }
                if (approved) {
                    applied.add(apply(recommendation, trend.triggers()));
                } else {
                    log.info("Adaptation recommended but not applied: rule={}, {} {} -> {} (safety={})",
                        ruleId, recommendation.parameter(), recommendation.currentValue(),
                        recommendation.proposedValue(), String.format("%.2f", recommendation.safetyScore()));
                }
            }
            lastAdaptedAt.put(ruleId, history.totalObserved());
            return new AdaptationOutcome(ruleId, trend, recommendations, candidates, applied, null);
        }
    }

    /**
     * 基于瓶颈生成建议，按 预期改善 × 安全分 排序，最多保留 maxCandidates 条
     */
    List<ParameterRecommendation> recommend(String ruleId, PerformanceTrend trend) {
        Map<String, Double> current = parameterStore.get(ruleId);
        List<ParameterRecommendation> recommendations = new ArrayList<>();

        if (trend.triggers().contains(AdaptationTrigger.TIME_DECLINE) || trend.isHighVariance()) {
            double timeout = current.get(RuleParameters.EXECUTION_TIMEOUT);
            double proposed = Math.min(timeout * 1.2, RuleParameters.MAX_EXECUTION_TIMEOUT);
            if (proposed > timeout) {
                recommendations.add(recommendation(ruleId, RuleParameters.EXECUTION_TIMEOUT, timeout, proposed,
                    0.15, 0.9, "reduce timeout-related failures"));
            }
        }
        if (trend.recentMemoryUsage() > HIGH_MEMORY_USAGE) {
            double memory = current.get(RuleParameters.MEMORY_LIMIT_MB);
            recommendations.add(recommendation(ruleId, RuleParameters.MEMORY_LIMIT_MB, memory,
                Math.floor(memory * 1.1), 0.10, 0.85, "prevent memory-related failures"));
        }
        if (trend.recentCpuUsage() > HIGH_CPU_USAGE) {
            double parallelism = current.get(RuleParameters.MAX_PARALLELISM);
            if (parallelism > 1) {
                recommendations.add(recommendation(ruleId, RuleParameters.MAX_PARALLELISM, parallelism,
                    parallelism - 1, 0.12, 0.82, "relieve CPU contention"));
            }
        }
        if (trend.triggers().contains(AdaptationTrigger.ACCURACY_DECLINE)) {
            double sensitivity = current.get(RuleParameters.SENSITIVITY_THRESHOLD);
            recommendations.add(recommendation(ruleId, RuleParameters.SENSITIVITY_THRESHOLD, sensitivity,
                sensitivity * 0.95, 0.08, 0.75, "improve detection accuracy"));
        }

        recommendations.sort(Comparator.comparingDouble(ParameterRecommendation::rankScore).reversed());
        if (recommendations.size() > config.getMaxCandidates()) {
            return new ArrayList<>(recommendations.subList(0, config.getMaxCandidates()));
        }
        return recommendations;
    }

    private ParameterRecommendation recommendation(String ruleId, String parameter, double current, double proposed,
                                                   double improvement, double baseSafety, String reason) {
        double safety = clamp01(baseSafety * weightingPolicy.weight(parameter));
        return new ParameterRecommendation(ruleId, parameter, current, proposed, improvement, baseSafety, safety, reason);
    }

    private OptimizationCandidate toCandidate(ParameterRecommendation recommendation, PerformanceTrend trend) {
        Map<String, Double> configuration = new LinkedHashMap<>(parameterStore.get(recommendation.ruleId()));
        configuration.put(recommendation.parameter(), recommendation.proposedValue());
        Map<String, Double> predicted = new LinkedHashMap<>();
        predicted.put("execution_time", trend.recentAverageTime() * (1 - recommendation.expectedImprovement()));
        if (!Double.isNaN(trend.recentAccuracy())) {
            predicted.put("accuracy", Math.min(1.0, trend.recentAccuracy() * (1 + recommendation.expectedImprovement())));
        }
        return new OptimizationCandidate(recommendation.ruleId(), configuration, predicted,
            recommendation.safetyScore(), recommendation.rankScore());
    }

    private AppliedChange apply(ParameterRecommendation recommendation, Set<AdaptationTrigger> triggers) {
        double previous = parameterStore.set(recommendation.ruleId(), recommendation.parameter(),
            recommendation.proposedValue());
        RollbackPlan rollback = new RollbackPlan(recommendation.ruleId(),
            Map.of(recommendation.parameter(), previous), Instant.now());
        AppliedChange change = new AppliedChange("chg_" + UUID.randomUUID().toString().substring(0, 12),
            recommendation.ruleId(), recommendation.parameter(), previous, recommendation.proposedValue(),
            recommendation.expectedImprovement(), recommendation.safetyScore(), triggers, Instant.now(), rollback);
        remember(change);
        appliedCounter.increment();
        log.info("Adaptation applied: rule={}, {} {} -> {} (safety={}, expected +{}%)",
            change.ruleId(), change.parameter(), previous, change.newValue(),
            String.format("%.2f", change.safetyScore()), Math.round(change.expectedImprovement() * 100));
        return change;
    }

    private void remember(AppliedChange change) {
        changes.put(change.changeId(), change);
        synchronized (changeOrder) {
            changeOrder.addLast(change.changeId());
            while (changeOrder.size() > config.getAppliedChangeHistory()) {
                String evicted = changeOrder.removeFirst();
                changes.remove(evicted);
                rolledBack.remove(evicted);
            }
        }
    }

    // ==================== 回滚与反馈 ====================

    /**
     * 按回滚计划恢复变更前的参数；重复回滚是空操作，参数已被后续变更覆盖时拒绝
     */
    public AppliedChange rollback(String changeId) {
        AppliedChange change = findChange(changeId).orElseThrow(() -> new AdaptationNotFoundException(changeId));
        synchronized (ruleLock(change.ruleId())) {
            if (rolledBack.containsKey(changeId)) {
                return change;
            }
            double current = parameterStore.get(change.ruleId(), change.parameter());
            if (Double.compare(current, change.newValue()) != 0) {
                throw new IllegalStateException("Change " + changeId + " is superseded: " + change.parameter()
                    + " is now " + current + ", expected " + change.newValue() + "; roll back newer changes first");
            }
            rolledBack.put(changeId, Instant.now());
            parameterStore.setAll(change.ruleId(), change.rollbackPlan().previousValues());
            rolledBackCounter.increment();
            log.info("Adaptation {} rolled back: rule={}, restored {}", changeId, change.ruleId(),
                change.rollbackPlan().previousValues());
        }
        return change;
    }

    private Object ruleLock(String ruleId) {
        return ruleLocks.computeIfAbsent(ruleId, k -> new Object());
    }

    public boolean isRolledBack(String changeId) {
        return rolledBack.containsKey(changeId);
    }

    /**
     * 反馈变更是否有效，影响后续同类参数的安全分
     */
    public void feedback(String changeId, boolean helpful) {
        AppliedChange change = findChange(changeId).orElseThrow(() -> new AdaptationNotFoundException(changeId));
        weightingPolicy.recordFeedback(change.parameter(), helpful);
    }

    public Optional<AppliedChange> findChange(String changeId) {
        return Optional.ofNullable(changes.get(changeId));
    }

    /**
     * 最近应用的变更，新的在前
     */
    public List<AppliedChange> recentChanges(int limit) {
        List<AppliedChange> result = new ArrayList<>();
        synchronized (changeOrder) {
            Iterator<String> it = changeOrder.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                AppliedChange change = changes.get(it.next());
                if (change != null) {
                    result.add(change);
                }
            }
        }
        return result;
    }

    public Map<String, Double> currentParameters(String ruleId) {
        return parameterStore.get(ruleId);
    }

    private static double average(List<ExecutionMetrics> data, ToDoubleFunction<ExecutionMetrics> f) {
        if (data.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (ExecutionMetrics metrics : data) {
            sum += f.applyAsDouble(metrics);
        }
        return sum / data.size();
    }

    private static double averageAccuracy(List<ExecutionMetrics> data) {
        double sum = 0;
        int count = 0;
        for (ExecutionMetrics metrics : data) {
            if (metrics.hasAccuracy()) {
                sum += metrics.accuracy();
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
