package com.governance.orchestration.optimizer;

/**
 * 根据调用方反馈调整各参数的安全分权重
 */
public interface SafetyWeightingPolicy {

    /**
     * 参数当前权重，乘到基础安全分上
     */
    double weight(String parameter);

    void recordFeedback(String parameter, boolean helpful);
}
