package com.governance.orchestration.workflow;

import java.util.List;

/**
 * 步骤性能数据
 *
 * @param peakCpuLoad    采样到的最高 CPU 负载，无采样时为 0
 * @param peakHeapUsedMb 采样到的最高堆内存
 * @param peakHeapPercent 采样到的最高堆使用率（百分比）
 */
public record StepPerformance(
    long durationMs,
    int attempts,
    int sampleCount,
    double peakCpuLoad,
    double peakHeapUsedMb,
    double peakHeapPercent,
    List<ResourceSample> samples) {

    static StepPerformance of(StepExecutionRecord step) {
        List<ResourceSample> samples = step.getSamples();
        double cpu = 0;
        double heap = 0;
        double heapPercent = 0;
        for (ResourceSample sample : samples) {
            cpu = Math.max(cpu, sample.cpuLoad());
            heap = Math.max(heap, sample.heapUsedMb());
            heapPercent = Math.max(heapPercent, sample.heapUsagePercent());
        }
        return new StepPerformance(step.getDuration().toMillis(), step.getAttempts(), samples.size(),
            cpu, heap, heapPercent, samples);
    }
}
