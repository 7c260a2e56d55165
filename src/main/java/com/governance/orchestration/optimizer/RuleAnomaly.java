package com.governance.orchestration.optimizer;

/**
 * 规则当前的异常程度，用于决定先调哪条规则
 */
public record RuleAnomaly(String ruleId, double score) {
}
