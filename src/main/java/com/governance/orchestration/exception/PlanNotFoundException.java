package com.governance.orchestration.exception;

/**
 * 计划不存在（或已过保留期被清理）
 */
public class PlanNotFoundException extends RuntimeException {

    public PlanNotFoundException(String planId) {
        super("计划不存在: " + planId);
    }
}
