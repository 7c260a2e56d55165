package com.governance.orchestration.optimizer;

import java.time.Instant;

/**
 * 一次规则执行的观测指标
 *
 * @param executionTimeSeconds 执行耗时（秒）
 * @param accuracy             准确率 [0,1]，未知时为 NaN
 * @param cpuUsage             CPU 使用率（百分比）
 * @param memoryUsage          内存使用率（百分比）
 * @param throughput           吞吐（记录/秒）
 * @param successRate          成功率 [0,1]
 */
public record ExecutionMetrics(
    Instant observedAt,
    double executionTimeSeconds,
    double accuracy,
    double cpuUsage,
    double memoryUsage,
    double throughput,
    double successRate) {

    public ExecutionMetrics {
        if (observedAt == null) {
            observedAt = Instant.now();
        }
    }

    public static ExecutionMetrics ofTime(double executionTimeSeconds) {
        return new ExecutionMetrics(Instant.now(), executionTimeSeconds, Double.NaN, 0, 0, 0, 1.0);
    }

    public boolean hasAccuracy() {
        return !Double.isNaN(accuracy);
    }
}
