package com.governance.orchestration.orchestrator;

public enum RiskType {
    HIGH_COMPLEXITY,
    RESOURCE_TIGHTNESS,
    COMPLEX_DEPENDENCIES,
    BUDGET_OVERRUN,
    DEADLINE_OVERRUN
}
