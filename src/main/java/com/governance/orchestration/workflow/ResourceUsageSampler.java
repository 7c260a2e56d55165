package com.governance.orchestration.workflow;

/**
 * 资源使用采样器，步骤运行期间按固定间隔调用
 */
public interface ResourceUsageSampler {

    ResourceSample sample();
}
