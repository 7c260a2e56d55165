package com.governance.orchestration.predictor;

/**
 * 预测目标及其合法取值区间
 */
public enum PredictionTarget {

    EXECUTION_TIME(0, Double.MAX_VALUE, 60.0),
    ACCURACY(0, 1, 0.8),
    FALSE_POSITIVE_RATE(0, 1, 0.1),
    RESOURCE_USAGE(0, 1, 0.5),
    THROUGHPUT(0, Double.MAX_VALUE, 0.0),
    COST_SCORE(0, 1, 0.5),
    COVERAGE_SCORE(0, 1, 0.5),
    COMPLEXITY_SCORE(0, 1, 0.5);

    private final double min;
    private final double max;
    private final double neutral;

    PredictionTarget(double min, double max, double neutral) {
        this.min = min;
        this.max = max;
        this.neutral = neutral;
    }

    public double clamp(double value) {
        if (Double.isNaN(value)) {
            return neutral;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * 模型未训练时使用的中性估计
     */
    public double neutral() {
        return neutral;
    }

    public double valueOf(PerformanceOutcome outcome) {
        switch (this) {
            case EXECUTION_TIME:
                return outcome.executionTimeSeconds();
            case ACCURACY:
                return outcome.accuracyScore();
            case FALSE_POSITIVE_RATE:
                return outcome.falsePositiveRate();
            case RESOURCE_USAGE:
                return outcome.resourceUsage();
            case THROUGHPUT:
                return outcome.throughput();
            case COST_SCORE:
                return outcome.costScore();
            case COVERAGE_SCORE:
                return outcome.coverageScore();
            case COMPLEXITY_SCORE:
                return outcome.complexityScore();
            default:
                throw new IllegalStateException("Unknown target " + this);
        }
    }
}
