package com.governance.orchestration.workflow;

/**
 * 失败原因，超时与逻辑错误分开，重试策略不同
 */
public enum FailureReason {
    /** 步骤处理器抛出异常 */
    LOGIC_ERROR,
    /** 超过步骤超时且重试用尽 */
    TIMEOUT,
    /** 上游步骤 / 工作流失败 */
    DEPENDENCY_FAILED,
    /** 被取消 */
    CANCELLED,
    /** 依赖成环或引用了不存在的步骤 */
    CONFIGURATION,
    /** 资源不足，未能启动 */
    INSUFFICIENT_RESOURCES
}
