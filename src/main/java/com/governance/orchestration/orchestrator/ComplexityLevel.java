package com.governance.orchestration.orchestrator;

/**
 * 规则复杂度及其对请求复杂度分的贡献
 */
public enum ComplexityLevel {

    SIMPLE(0),
    MODERATE(8),
    COMPLEX(15),
    VERY_COMPLEX(25);

    private final int weight;

    ComplexityLevel(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
