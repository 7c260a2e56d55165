package com.governance.orchestration.optimizer;

import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.exception.AdaptationNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 自适应优化器单元测试
 */
class AdaptiveOptimizerTest {

    private AdaptiveOptimizer optimizer;
    private RuleParameterStore parameterStore;
    private FeedbackSafetyWeightingPolicy weightingPolicy;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        parameterStore = new RuleParameterStore();
        weightingPolicy = new FeedbackSafetyWeightingPolicy();
        meterRegistry = new SimpleMeterRegistry();
        optimizer = new AdaptiveOptimizer(new OrchestrationProperties(), parameterStore, weightingPolicy,
            new ZScoreAnomalyScorer(), meterRegistry);
    }

    private void feed(String ruleId, int count, double seconds) {
        for (int i = 0; i < count; i++) {
            optimizer.observe(ruleId, ExecutionMetrics.ofTime(seconds));
        }
    }

    @Test
    @DisplayName("样本不足时跳过")
    void testInsufficientSamples() {
        feed("rule-1", 50, 10);

        AdaptationOutcome outcome = optimizer.maybeAdapt("rule-1", AdaptationApproval.safetyAbove(0.8));

        assertFalse(outcome.isTriggered());
        assertTrue(outcome.skippedReason().contains("insufficient samples"));
        assertTrue(outcome.applied().isEmpty());
    }

    @Test
    @DisplayName("执行时间劣化 25%：延长超时并生成回滚计划")
    void testTimeDeclineAppliesTimeoutIncrease() {
        feed("rule-1", 90, 10);
        feed("rule-1", 10, 12.5);

        PerformanceTrend trend = optimizer.analyzeTrend("rule-1").orElseThrow();
        assertEquals(0.25, trend.timeChange(), 1e-9);
        assertTrue(trend.triggers().contains(AdaptationTrigger.TIME_DECLINE));

        List<AppliedChange> applied = optimizer.maybeAdapt("rule-1");

        assertEquals(1, applied.size());
        AppliedChange change = applied.get(0);
        assertEquals(RuleParameters.EXECUTION_TIMEOUT, change.parameter());
        assertEquals(300.0, change.previousValue());
        assertEquals(360.0, change.newValue(), 1e-9);
        assertEquals(300.0, change.rollbackPlan().previousValues().get(RuleParameters.EXECUTION_TIMEOUT));
        assertEquals(360.0, parameterStore.get("rule-1", RuleParameters.EXECUTION_TIMEOUT), 1e-9);
    }

    @Test
    @DisplayName("审批拒绝时只记录建议")
    void testRecommendationOnly() {
        feed("rule-1", 90, 10);
        feed("rule-1", 10, 12.5);

        AdaptationOutcome outcome = optimizer.maybeAdapt("rule-1", AdaptationApproval.none());

        assertTrue(outcome.isTriggered());
        assertEquals(1, outcome.recommendations().size());
        assertEquals(1, outcome.candidates().size());
        assertTrue(outcome.applied().isEmpty());
        assertEquals(300.0, parameterStore.get("rule-1", RuleParameters.EXECUTION_TIMEOUT));
    }

    @Test
    @DisplayName("两次自适应之间需要新的对比窗口样本")
    void testCooldownBetweenAdaptations() {
        feed("rule-1", 90, 10);
        feed("rule-1", 10, 12.5);
        optimizer.maybeAdapt("rule-1");

        AdaptationOutcome again = optimizer.maybeAdapt("rule-1", AdaptationApproval.safetyAbove(0.8));

        assertFalse(again.isTriggered());
        assertEquals(1, optimizer.recentChanges(10).size());
    }

    @Test
    @DisplayName("回滚恢复旧值，重复回滚是空操作")
    void testRollback() {
        feed("rule-1", 90, 10);
        feed("rule-1", 10, 12.5);
        AppliedChange change = optimizer.maybeAdapt("rule-1").get(0);

        optimizer.rollback(change.changeId());
        optimizer.rollback(change.changeId());

        assertTrue(optimizer.isRolledBack(change.changeId()));
        assertEquals(300.0, parameterStore.get("rule-1", RuleParameters.EXECUTION_TIMEOUT));
        assertEquals(1.0, meterRegistry.get("orchestration.adaptations")
            .tag("result", "rolled_back").counter().count());
    }

    @Test
    @DisplayName("并发评估同一规则只应用一次")
    void testConcurrentAdaptationAppliesOnce() throws Exception {
        feed("rule-1", 90, 10);
        feed("rule-1", 10, 12.5);

        // 两个线程都进入审批回调时才放行；串行时第一个线程等待超时后放行
        CountDownLatch bothApproving = new CountDownLatch(2);
        AdaptationApproval approval = recommendation -> {
            bothApproving.countDown();
            try {
                bothApproving.await(300, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<AdaptationOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(executor.submit(() -> optimizer.maybeAdapt("rule-1", approval)));
            }
            int applied = 0;
            for (Future<AdaptationOutcome> future : futures) {
                applied += future.get(5, TimeUnit.SECONDS).applied().size();
            }

            assertEquals(1, applied);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, optimizer.recentChanges(10).size());
        assertEquals(360.0, parameterStore.get("rule-1", RuleParameters.EXECUTION_TIMEOUT), 1e-9);
        assertEquals(1.0, meterRegistry.get("orchestration.adaptations")
            .tag("result", "applied").counter().count());
    }

    @Test
    @DisplayName("已被后续变更覆盖的变更不能单独回滚")
    void testRollbackSupersededChange() {
        feed("rule-1", 90, 10);
        feed("rule-1", 10, 12.5);
        AppliedChange first = optimizer.maybeAdapt("rule-1").get(0);
        feed("rule-1", 10, 16);
        AppliedChange second = optimizer.maybeAdapt("rule-1").get(0);
        assertEquals(360.0, second.previousValue(), 1e-9);
        assertEquals(432.0, second.newValue(), 1e-9);

        assertThrows(IllegalStateException.class, () -> optimizer.rollback(first.changeId()));
        assertFalse(optimizer.isRolledBack(first.changeId()));
        assertEquals(432.0, parameterStore.get("rule-1", RuleParameters.EXECUTION_TIMEOUT), 1e-9);

        // 从新到旧依次回滚
        optimizer.rollback(second.changeId());
        optimizer.rollback(first.changeId());
        assertEquals(300.0, parameterStore.get("rule-1", RuleParameters.EXECUTION_TIMEOUT), 1e-9);
    }

    @Test
    @DisplayName("未知变更回滚抛异常")
    void testRollbackUnknown() {
        assertThrows(AdaptationNotFoundException.class, () -> optimizer.rollback("chg_missing"));
    }

    @Test
    @DisplayName("负反馈降低安全分，使后续建议不再自动应用")
    void testNegativeFeedbackLowersSafety() {
        feed("rule-1", 90, 10);
        feed("rule-1", 10, 12.5);
        AppliedChange change = optimizer.maybeAdapt("rule-1").get(0);

        optimizer.feedback(change.changeId(), false);
        assertEquals(0.9, weightingPolicy.weight(RuleParameters.EXECUTION_TIMEOUT), 1e-9);

        feed("rule-2", 90, 10);
        feed("rule-2", 10, 12.5);
        AdaptationOutcome outcome = optimizer.maybeAdapt("rule-2", AdaptationApproval.safetyAbove(0.8));

        // 0.9 × 0.9 = 0.81 仍高于 0.8
        assertEquals(0.81, outcome.recommendations().get(0).safetyScore(), 1e-9);
        assertEquals(1, outcome.applied().size());
    }

    @Test
    @DisplayName("资源瓶颈生成内存 / 并行度建议")
    void testResourceBottleneckRecommendations() {
        for (int i = 0; i < 90; i++) {
            optimizer.observe("rule-1", new ExecutionMetrics(Instant.now(), 10, Double.NaN, 90, 85, 100, 1.0));
        }
        for (int i = 0; i < 10; i++) {
            optimizer.observe("rule-1", new ExecutionMetrics(Instant.now(), 13, Double.NaN, 90, 85, 100, 1.0));
        }

        AdaptationOutcome outcome = optimizer.maybeAdapt("rule-1", AdaptationApproval.none());

        List<String> parameters = outcome.recommendations().stream().map(ParameterRecommendation::parameter).toList();
        assertTrue(parameters.contains(RuleParameters.EXECUTION_TIMEOUT));
        assertTrue(parameters.contains(RuleParameters.MEMORY_LIMIT_MB));
        assertTrue(parameters.contains(RuleParameters.MAX_PARALLELISM));
    }

    @Test
    @DisplayName("异常分：偏离历史均值越远分越高")
    void testAnomalyRanking() {
        for (int i = 0; i < 10; i++) {
            optimizer.observe("steady", ExecutionMetrics.ofTime(10 + (i % 2)));
            optimizer.observe("spiky", ExecutionMetrics.ofTime(10 + (i % 2)));
        }
        optimizer.observe("steady", ExecutionMetrics.ofTime(10.5));
        double score = optimizer.observe("spiky", ExecutionMetrics.ofTime(100));

        assertEquals(1.0, score);
        List<RuleAnomaly> ranked = optimizer.rankByAnomaly();
        assertEquals("spiky", ranked.get(0).ruleId());
    }
}
