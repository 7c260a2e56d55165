package com.governance.orchestration.optimizer;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 执行时间 z-score，|z| = 3 对应满分
 */
@Component
public class ZScoreAnomalyScorer implements AnomalyScorer {

    private static final int MIN_HISTORY = 5;
    private static final double SATURATION = 3.0;

    @Override
    public double score(List<ExecutionMetrics> history, ExecutionMetrics observation) {
        if (history == null || history.size() < MIN_HISTORY) {
            return 0.0;
        }
        double mean = 0;
        for (ExecutionMetrics metrics : history) {
            mean += metrics.executionTimeSeconds();
        }
        mean /= history.size();
        double variance = 0;
        for (ExecutionMetrics metrics : history) {
            double d = metrics.executionTimeSeconds() - mean;
            variance += d * d;
        }
        double std = Math.sqrt(variance / history.size());
        if (std < 1e-9) {
            return observation.executionTimeSeconds() == mean ? 0.0 : 1.0;
        }
        double z = Math.abs(observation.executionTimeSeconds() - mean) / std;
        return Math.min(1.0, z / SATURATION);
    }
}
