package com.governance.orchestration.alert;

import com.governance.orchestration.config.OrchestrationProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 阈值告警评估
 *
 * <p>告警是观测信号而不是错误：{@link #evaluate} 任何情况下都不向调用方抛异常。
 * 所有突破过阈值的对象都回落后，对应的活动告警自动解决。
 */
@Component
public class AlertEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluator.class);

    private static final int RESOLVED_HISTORY = 500;

    private final Map<String, Double> thresholds;
    private final MeterRegistry meterRegistry;

    // (type, metric) → 活动告警
    private final Map<AlertKey, Alert> active = new ConcurrentHashMap<>();
    private final Deque<Alert> resolvedHistory = new ArrayDeque<>();

    public AlertEvaluator(OrchestrationProperties properties, MeterRegistry meterRegistry) {
        this.thresholds = new LinkedHashMap<>(properties.getAlerts().getThresholds());
        this.meterRegistry = meterRegistry;
        Gauge.builder("orchestration.alerts.active", active, Map::size)
            .description("Active (unresolved) alerts")
            .register(meterRegistry);
        log.info("AlertEvaluator initialized: thresholds={}", thresholds);
    }

    /**
     * 用一条快照评估所有已配置阈值
     *
     * @return 本次新建或更新的告警
     */
    public List<Alert> evaluate(PerformanceSnapshot snapshot) {
        try {
            return doEvaluate(snapshot);
        } catch (RuntimeException e) {
            log.error("Alert evaluation failed for subject {}", snapshot == null ? null : snapshot.subjectId(), e);
            return List.of();
        }
    }

    private List<Alert> doEvaluate(PerformanceSnapshot snapshot) {
        if (snapshot == null) {
            return List.of();
        }
        List<Alert> touched = new ArrayList<>();
        for (Map.Entry<String, Double> entry : thresholds.entrySet()) {
            String metric = entry.getKey();
            double threshold = entry.getValue();
            double value = snapshot.metric(metric);
            if (Double.isNaN(value)) {
                continue;
            }
            AlertKey key = new AlertKey(AlertMetrics.THRESHOLD_BREACH, metric);
            if (value > threshold) {
                touched.add(raiseOrUpdate(key, threshold, value, snapshot.subjectId()));
            } else {
                recover(key, snapshot.subjectId(), value, threshold);
            }
        }
        return touched;
    }

    /**
     * 对象回落到阈值以下；其它对象仍在突破时告警保持活动
     */
    private void recover(AlertKey key, String subject, double value, double threshold) {
        Alert[] recovered = {null};
        active.computeIfPresent(key, (k, existing) -> {
            if (existing.recover(subject)) {
                recovered[0] = existing;
                return null;
            }
            return existing;
        });
        Alert alert = recovered[0];
        if (alert != null) {
            alert.resolve("auto-resolved: " + key.metric() + " back under threshold");
            archive(alert);
            log.info("Alert {} auto-resolved: {}={} <= {}", alert.getId(), key.metric(), value, threshold);
        }
    }

    private Alert raiseOrUpdate(AlertKey key, double threshold, double value, String subject) {
        boolean[] created = {false};
        Alert alert = active.compute(key, (k, existing) -> {
            if (existing != null) {
                existing.update(value, subject);
                return existing;
            }
            created[0] = true;
            return new Alert("alert_" + UUID.randomUUID().toString().substring(0, 8),
                k.type(), k.metric(), threshold, value, subject);
        });
        if (created[0]) {
            meterRegistry.counter("orchestration.alerts.raised",
                "severity", alert.getSeverity().name().toLowerCase(), "metric", key.metric()).increment();
            log.warn("Alert raised: {} {} (severity={}, value={}, threshold={})",
                alert.getId(), key.metric(), alert.getSeverity(), value, threshold);
        } else {
            log.debug("Alert {} updated: {}={}", alert.getId(), key.metric(), value);
        }
        return alert;
    }

    /**
     * 人工解决告警
     *
     * @return 告警存在且此前未解决时返回 true
     */
    public boolean resolve(String alertId, String note) {
        for (Map.Entry<AlertKey, Alert> entry : active.entrySet()) {
            Alert alert = entry.getValue();
            if (alert.getId().equals(alertId) && active.remove(entry.getKey(), alert)) {
                alert.resolve(note == null ? "resolved by operator" : note);
                archive(alert);
                log.info("Alert {} resolved manually", alertId);
                return true;
            }
        }
        return false;
    }

    public List<Alert> activeAlerts() {
        List<Alert> alerts = new ArrayList<>(active.values());
        alerts.sort(Comparator.comparing(Alert::getSeverity).thenComparing(Alert::getCreatedAt));
        return alerts;
    }

    public Optional<Alert> findActive(String type, String metric) {
        return Optional.ofNullable(active.get(new AlertKey(type, metric)));
    }

    public boolean hasActive(AlertSeverity severity) {
        for (Alert alert : active.values()) {
            if (alert.getSeverity() == severity) {
                return true;
            }
        }
        return false;
    }

    /**
     * 最近解决的告警，新的在前
     */
    public List<Alert> resolvedAlerts() {
        synchronized (resolvedHistory) {
            return new ArrayList<>(resolvedHistory);
        }
    }

    public Map<String, Double> thresholds() {
        return Map.copyOf(thresholds);
    }

    private void archive(Alert alert) {
        synchronized (resolvedHistory) {
            resolvedHistory.addFirst(alert);
            while (resolvedHistory.size() > RESOLVED_HISTORY) {
                resolvedHistory.removeLast();
            }
        }
    }

    private record AlertKey(String type, String metric) {
    }
}
