package com.governance.orchestration.dto;

import com.governance.orchestration.orchestrator.ComplexityLevel;
import com.governance.orchestration.orchestrator.RuleSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * 扫描规则
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleSpecDTO {

    private String ruleId;

    /** 缺省为 SIMPLE */
    private ComplexityLevel complexity;

    /** 同一请求内必须先执行的规则 */
    private Set<String> dependsOn;

    public RuleSpec toRuleSpec() {
        return new RuleSpec(ruleId, complexity, dependsOn);
    }
}
