package com.governance.orchestration.decision;

/**
 * 规则间的显式依赖：{@code ruleId} 依赖 {@code dependsOnRuleId}
 */
public record RuleDependency(String ruleId, String dependsOnRuleId) {
}
