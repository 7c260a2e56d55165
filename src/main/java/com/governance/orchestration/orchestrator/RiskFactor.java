package com.governance.orchestration.orchestrator;

public record RiskFactor(RiskType type, RiskLevel level, String description) {
}
