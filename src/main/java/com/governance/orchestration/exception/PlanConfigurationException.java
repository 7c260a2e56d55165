package com.governance.orchestration.exception;

/**
 * 计划配置错误：依赖成环、依赖不存在、资源需求非法、未知策略等
 * 只在创建计划时抛出，不会出现在执行过程中
 */
public class PlanConfigurationException extends RuntimeException {

    public PlanConfigurationException(String message) {
        super(message);
    }

    public PlanConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
