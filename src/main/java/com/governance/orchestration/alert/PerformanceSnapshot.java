package com.governance.orchestration.alert;

import java.time.Instant;

/**
 * 一条性能快照，由实际执行扫描 I/O 的连接器层推送
 *
 * @param subjectKind     归属对象类型
 * @param subjectId       规则 / 数据源 / 扫描 ID
 * @param executionTimeMs 执行耗时（毫秒）
 * @param cpuUsage        CPU 使用率（百分比）
 * @param memoryUsage     内存使用率（百分比）
 * @param throughput      吞吐（记录/秒）
 * @param successRate     成功率 [0,1]
 * @param queueLength     排队长度
 * @param concurrentScans 并发扫描数
 * @param accuracy        准确率 [0,1]，未知时为 null
 */
public record PerformanceSnapshot(
    SubjectKind subjectKind,
    String subjectId,
    Instant timestamp,
    double executionTimeMs,
    double cpuUsage,
    double memoryUsage,
    double throughput,
    double successRate,
    double queueLength,
    int concurrentScans,
    Double accuracy) {

    public PerformanceSnapshot {
        if (subjectKind == null) {
            subjectKind = SubjectKind.SCAN;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        requireNonNegative("executionTimeMs", executionTimeMs);
        requireNonNegative("cpuUsage", cpuUsage);
        requireNonNegative("memoryUsage", memoryUsage);
        requireNonNegative("throughput", throughput);
        requireNonNegative("queueLength", queueLength);
        requireFraction("successRate", successRate);
        if (accuracy != null) {
            requireFraction("accuracy", accuracy);
        }
        if (concurrentScans < 0) {
            throw new IllegalArgumentException("Malformed performance snapshot: concurrentScans=" + concurrentScans);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException("Malformed performance snapshot: " + name + "=" + value);
        }
    }

    private static void requireFraction(String name, double value) {
        requireNonNegative(name, value);
        if (value > 1) {
            throw new IllegalArgumentException("Malformed performance snapshot: " + name + "=" + value
                + ", expected [0,1]");
        }
    }

    /**
     * 错误率（百分比）
     */
    public double errorRate() {
        return (1.0 - successRate) * 100.0;
    }

    /**
     * 按告警指标名取值，未知指标返回 NaN
     */
    public double metric(String name) {
        switch (name) {
            case AlertMetrics.CPU_UTILIZATION:
                return cpuUsage;
            case AlertMetrics.MEMORY_USAGE:
                return memoryUsage;
            case AlertMetrics.ERROR_RATE:
                return errorRate();
            case AlertMetrics.QUEUE_SIZE:
                return queueLength;
            case AlertMetrics.RESPONSE_TIME:
                return executionTimeMs;
            default:
                return Double.NaN;
        }
    }
}
