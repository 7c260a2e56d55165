package com.governance.orchestration.orchestrator;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 请求复杂度分档
 */
public enum ComplexityGrade {

    VERY_LOW("very_low"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    VERY_HIGH("very_high");

    private final String label;

    ComplexityGrade(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * ≥80 very_high, ≥60 high, ≥40 medium, ≥20 low, 其余 very_low
     */
    public static ComplexityGrade fromScore(int score) {
        if (score >= 80) {
            return VERY_HIGH;
        } else if (score >= 60) {
            return HIGH;
        } else if (score >= 40) {
            return MEDIUM;
        } else if (score >= 20) {
            return LOW;
        }
        return VERY_LOW;
    }
}
