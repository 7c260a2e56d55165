package com.governance.orchestration.alert;

/**
 * 告警级别
 */
public enum AlertSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /**
     * 按超阈比例（当前值 / 阈值）定级
     */
    public static AlertSeverity fromBreachRatio(double ratio) {
        if (ratio >= 2.0) {
            return CRITICAL;
        } else if (ratio >= 1.5) {
            return HIGH;
        } else if (ratio >= 1.2) {
            return MEDIUM;
        }
        return LOW;
    }
}
