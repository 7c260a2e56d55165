package com.governance.orchestration.workflow;

import java.time.Duration;
import java.util.List;

/**
 * 工作流静态分析结果
 *
 * @param levels                   分层，同层步骤可并行
 * @param criticalPath             按超时加权的最长路径
 * @param criticalPathDuration     关键路径总时长（上界）
 */
public record WorkflowAnalysis(
    String workflowId,
    List<List<String>> levels,
    List<String> criticalPath,
    Duration criticalPathDuration) {
}
