package com.governance.orchestration.orchestrator;

import java.util.Set;

/**
 * 请求中的一条扫描规则
 *
 * @param dependsOn 必须先执行的其它规则
 */
public record RuleSpec(String ruleId, ComplexityLevel complexity, Set<String> dependsOn) {

    public RuleSpec {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId must not be blank");
        }
        complexity = complexity == null ? ComplexityLevel.SIMPLE : complexity;
        dependsOn = dependsOn == null ? Set.of() : Set.copyOf(dependsOn);
    }

    public static RuleSpec of(String ruleId, ComplexityLevel complexity) {
        return new RuleSpec(ruleId, complexity, Set.of());
    }
}
