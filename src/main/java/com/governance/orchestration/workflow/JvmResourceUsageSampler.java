package com.governance.orchestration.workflow;

import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;
import java.time.Instant;

/**
 * 基于 JMX 的进程级采样
 */
@Component
public class JvmResourceUsageSampler implements ResourceUsageSampler {

    private static final double MB = 1024.0 * 1024.0;

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final ThreadMXBean threadBean = ManagementFactory.getThreadMXBean();
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public ResourceSample sample() {
        double cpu = -1;
        if (osBean instanceof com.sun.management.OperatingSystemMXBean) {
            cpu = ((com.sun.management.OperatingSystemMXBean) osBean).getProcessCpuLoad();
        } else {
            double loadAverage = osBean.getSystemLoadAverage();
            if (loadAverage >= 0) {
                cpu = Math.min(1.0, loadAverage / osBean.getAvailableProcessors());
            }
        }
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        double heapMax = heap.getMax() > 0 ? heap.getMax() / MB : -1;
        return new ResourceSample(Instant.now(), cpu, heap.getUsed() / MB, heapMax, threadBean.getThreadCount());
    }
}
