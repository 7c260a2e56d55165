package com.governance.orchestration.resource;

/**
 * 单一资源的水位
 */
public record ResourceLevel(double total, double used, double reserved) {

    public double available() {
        return Math.max(0, total - used - reserved);
    }

    /**
     * 归一化利用率 (used + reserved) / total，容量为 0 视为满载
     */
    public double utilization() {
        if (total <= 0) {
            return 1.0;
        }
        return Math.min(1.0, Math.max(0.0, (used + reserved) / total));
    }
}
