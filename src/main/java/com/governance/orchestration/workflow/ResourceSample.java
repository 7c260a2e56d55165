package com.governance.orchestration.workflow;

import java.time.Instant;

/**
 * 步骤运行期间的一次资源采样
 *
 * @param cpuLoad    进程 CPU 负载 [0,1]，不可用时为 -1
 * @param heapUsedMb 已用堆内存（MB）
 * @param heapMaxMb  堆上限（MB），未定义时为 -1
 * @param threadCount 活动线程数
 */
public record ResourceSample(Instant sampledAt, double cpuLoad, double heapUsedMb, double heapMaxMb, int threadCount) {

    /**
     * 堆使用率（百分比），上限未定义时为 0
     */
    public double heapUsagePercent() {
        return heapMaxMb > 0 ? heapUsedMb / heapMaxMb * 100.0 : 0.0;
    }
}
