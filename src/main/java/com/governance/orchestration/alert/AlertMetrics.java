package com.governance.orchestration.alert;

import java.util.List;
import java.util.Map;

/**
 * 告警指标名及对应的处置建议
 */
public final class AlertMetrics {

    public static final String CPU_UTILIZATION = "cpu_utilization";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String ERROR_RATE = "error_rate";
    public static final String QUEUE_SIZE = "queue_size";
    public static final String RESPONSE_TIME = "response_time";

    /** 默认告警类型：阈值突破 */
    public static final String THRESHOLD_BREACH = "threshold_breach";

    private static final Map<String, List<String>> RECOMMENDATIONS = Map.of(
        CPU_UTILIZATION, List.of(
            "Scale up compute resources",
            "Optimize scanning algorithms",
            "Distribute workload across more workers",
            "Reduce scan parallelism"),
        MEMORY_USAGE, List.of(
            "Increase memory allocation",
            "Process data in smaller batches",
            "Release unused data structures between batches"),
        ERROR_RATE, List.of(
            "Review error logs for recurring failures",
            "Enable retries for transient errors",
            "Validate data source connectivity and credentials"),
        QUEUE_SIZE, List.of(
            "Increase processing capacity",
            "Prioritize the queue by scan priority",
            "Scale worker processes"),
        RESPONSE_TIME, List.of(
            "Check for resource contention",
            "Review scan rule complexity",
            "Optimize data source connections"));

    private AlertMetrics() {
    }

    public static List<String> recommendationsFor(String metric) {
        return RECOMMENDATIONS.getOrDefault(metric, List.of("Investigate the metric trend"));
    }
}
