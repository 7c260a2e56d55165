package com.governance.orchestration.workflow;

/**
 * 步骤类型
 */
public enum StepType {
    SCAN,
    VALIDATION,
    QUALITY_CHECK,
    COMPLIANCE_CHECK,
    NOTIFICATION,
    CONDITION
}
