package com.governance.orchestration.service;

import com.governance.orchestration.alert.Alert;
import com.governance.orchestration.alert.AlertEvaluator;
import com.governance.orchestration.alert.PerformanceSnapshot;
import com.governance.orchestration.alert.SubjectKind;
import com.governance.orchestration.optimizer.AdaptiveOptimizer;
import com.governance.orchestration.optimizer.ExecutionMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 接收连接器层推送的性能快照：入序列、评估告警，规则快照同时喂给自适应优化器
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsIngestionService {

    private final PerformanceSeriesStore seriesStore;
    private final AlertEvaluator alertEvaluator;
    private final AdaptiveOptimizer optimizer;
    private final MeterRegistry meterRegistry;

    /**
     * @return 本次触发或更新的告警，以及规则快照的异常分（其它对象为 null）
     * @throws IllegalArgumentException 快照缺少对象 ID
     */
    public IngestionResult ingest(PerformanceSnapshot snapshot) {
        if (snapshot == null || snapshot.subjectId() == null || snapshot.subjectId().isBlank()) {
            throw new IllegalArgumentException("snapshot subjectId must not be blank");
        }
        seriesStore.append(snapshot);
        List<Alert> alerts = alertEvaluator.evaluate(snapshot);
        Double anomalyScore = null;
        if (snapshot.subjectKind() == SubjectKind.RULE) {
            anomalyScore = optimizer.observe(snapshot.subjectId(), toRuleMetrics(snapshot));
        }
        meterRegistry.counter("orchestration.metrics.ingested",
            "subject", snapshot.subjectKind().name().toLowerCase()).increment();
        log.debug("Ingested snapshot {}:{} alerts={} anomaly={}",
            snapshot.subjectKind(), snapshot.subjectId(), alerts.size(), anomalyScore);
        return new IngestionResult(alerts, anomalyScore);
    }

    public List<PerformanceSnapshot> latest(SubjectKind kind, String subjectId, int limit) {
        return seriesStore.latest(kind, subjectId, limit);
    }

    static ExecutionMetrics toRuleMetrics(PerformanceSnapshot snapshot) {
        return new ExecutionMetrics(snapshot.timestamp(),
            snapshot.executionTimeMs() / 1000.0,
            snapshot.accuracy() == null ? Double.NaN : snapshot.accuracy(),
            snapshot.cpuUsage(),
            snapshot.memoryUsage(),
            snapshot.throughput(),
            snapshot.successRate());
    }

    /**
     * @param anomalyScore 规则快照相对历史的异常分
     */
    public record IngestionResult(List<Alert> alerts, Double anomalyScore) {
    }
}
