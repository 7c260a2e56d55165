package com.governance.orchestration.orchestrator;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
