package com.governance.orchestration.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.governance.orchestration.alert.AlertEvaluator;
import com.governance.orchestration.alert.AlertMetrics;
import com.governance.orchestration.alert.PerformanceSnapshot;
import com.governance.orchestration.alert.SubjectKind;
import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.optimizer.AdaptiveOptimizer;
import com.governance.orchestration.optimizer.FeedbackSafetyWeightingPolicy;
import com.governance.orchestration.optimizer.RuleParameterStore;
import com.governance.orchestration.optimizer.ZScoreAnomalyScorer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 性能快照接入单元测试
 */
class MetricsIngestionServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private MetricsIngestionService service;

    @BeforeEach
    void setUp() {
        OrchestrationProperties properties = new OrchestrationProperties();
        meterRegistry = new SimpleMeterRegistry();
        AdaptiveOptimizer optimizer = new AdaptiveOptimizer(properties, new RuleParameterStore(),
            new FeedbackSafetyWeightingPolicy(), new ZScoreAnomalyScorer(), meterRegistry);
        service = new MetricsIngestionService(
            new PerformanceSeriesStore(Caffeine.newBuilder().maximumSize(100).build(), properties),
            new AlertEvaluator(properties, meterRegistry), optimizer, meterRegistry);
    }

    private static PerformanceSnapshot snapshot(SubjectKind kind, String subject, double executionTimeMs, double cpu) {
        return new PerformanceSnapshot(kind, subject, null, executionTimeMs, cpu, 40, 100, 1.0, 0, 1, null);
    }

    @Test
    @DisplayName("规则快照：触发告警并返回异常分")
    void testIngestRuleSnapshot() {
        MetricsIngestionService.IngestionResult result =
            service.ingest(snapshot(SubjectKind.RULE, "rule-a", 1000, 90));

        assertNotNull(result.anomalyScore());
        assertTrue(result.alerts().stream().anyMatch(a -> AlertMetrics.CPU_UTILIZATION.equals(a.getMetric())));
        assertEquals(1.0, meterRegistry.get("orchestration.metrics.ingested")
            .tag("subject", "rule").counter().count());
    }

    @Test
    @DisplayName("非规则快照不计算异常分")
    void testIngestDataSourceSnapshot() {
        MetricsIngestionService.IngestionResult result =
            service.ingest(snapshot(SubjectKind.DATA_SOURCE, "ds-1", 1000, 10));

        assertNull(result.anomalyScore());
        assertTrue(result.alerts().isEmpty());
        assertEquals(1, service.latest(SubjectKind.DATA_SOURCE, "ds-1", 10).size());
        assertTrue(service.latest(SubjectKind.RULE, "ds-1", 10).isEmpty());
    }

    @Test
    @DisplayName("latest 按时间顺序返回最近 N 条")
    void testLatest() {
        service.ingest(snapshot(SubjectKind.SCAN, "scan-1", 100, 10));
        service.ingest(snapshot(SubjectKind.SCAN, "scan-1", 200, 10));
        service.ingest(snapshot(SubjectKind.SCAN, "scan-1", 300, 10));

        List<PerformanceSnapshot> latest = service.latest(SubjectKind.SCAN, "scan-1", 2);

        assertEquals(2, latest.size());
        assertEquals(200, latest.get(0).executionTimeMs());
        assertEquals(300, latest.get(1).executionTimeMs());
    }

    @Test
    @DisplayName("缺少对象 ID 的快照被拒绝")
    void testRejectBlankSubject() {
        assertThrows(IllegalArgumentException.class, () -> service.ingest(null));
        assertThrows(IllegalArgumentException.class,
            () -> service.ingest(snapshot(SubjectKind.RULE, " ", 1000, 10)));
    }

    @Test
    @DisplayName("转换为规则执行指标：毫秒换算为秒，缺失准确率为 NaN")
    void testToRuleMetrics() {
        var metrics = MetricsIngestionService.toRuleMetrics(snapshot(SubjectKind.RULE, "rule-a", 2500, 30));

        assertEquals(2.5, metrics.executionTimeSeconds());
        assertTrue(Double.isNaN(metrics.accuracy()));
        assertEquals(30, metrics.cpuUsage());
    }
}
