package com.governance.orchestration.orchestrator;

import com.governance.orchestration.resource.ResourceRequirement;

import java.time.Duration;
import java.util.List;

/**
 * 请求复杂度分析结果
 *
 * @param factors 计分明细，便于审计
 */
public record ComplexityAnalysis(
    String requestId,
    int score,
    ComplexityGrade grade,
    List<String> factors,
    Duration estimatedDuration,
    ResourceRequirement recommendedResources) {
}
