package com.governance.orchestration.orchestrator;

import java.util.List;

/**
 * 针对某类风险的应对预案
 */
public record ContingencyPlan(RiskType riskType, String trigger, List<String> actions) {

    public ContingencyPlan {
        actions = List.copyOf(actions);
    }
}
