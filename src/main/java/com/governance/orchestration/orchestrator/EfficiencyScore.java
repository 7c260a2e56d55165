package com.governance.orchestration.orchestrator;

import com.governance.orchestration.alert.PerformanceSnapshot;

/**
 * 效率分：0.3(100-cpu) + 0.3(100-内存) + 0.3·min(100, 吞吐/10) - 0.1·(10·错误率)，裁剪到 [0,100]
 */
public final class EfficiencyScore {

    private EfficiencyScore() {
    }

    public static double of(PerformanceSnapshot snapshot) {
        double cpuEfficiency = 100 - snapshot.cpuUsage();
        double memoryEfficiency = 100 - snapshot.memoryUsage();
        double throughputScore = Math.min(100, snapshot.throughput() / 10);
        double errorPenalty = snapshot.errorRate() * 10;
        double score = cpuEfficiency * 0.3 + memoryEfficiency * 0.3 + throughputScore * 0.3 - errorPenalty * 0.1;
        return Math.max(0, Math.min(100, score));
    }
}
