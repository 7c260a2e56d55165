package com.governance.orchestration.orchestrator;

import com.governance.orchestration.optimizer.ParameterRecommendation;

/**
 * SUPERVISED 模式下的人工确认入口
 *
 * <p>容器中没有实现时，SUPERVISED 模式的建议一律只记录不应用。
 */
@FunctionalInterface
public interface AdaptationConfirmationHook {

    /**
     * @return true 表示批准应用该建议
     */
    boolean confirm(String planId, ParameterRecommendation recommendation);
}
