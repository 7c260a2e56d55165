package com.governance.orchestration.orchestrator;

/**
 * 执行模式：决定自适应变更如何落地
 */
public enum OrchestrationMode {
    /** 自动执行前置优化与事后学习 */
    AUTONOMOUS,
    /** 每项变更都需要确认 */
    SUPERVISED,
    /** 只自动应用低风险变更 */
    HYBRID,
    /** 只记录建议 */
    MANUAL
}
