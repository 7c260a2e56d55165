package com.governance.orchestration.optimizer;

import java.util.List;

/**
 * 异常打分，返回 [0,1]，越大越异常
 */
public interface AnomalyScorer {

    double score(List<ExecutionMetrics> history, ExecutionMetrics observation);
}
