package com.governance.orchestration.predictor;

import java.util.List;

/**
 * 性能预测能力
 *
 * <p>实现可以是任意模型；约束只有三条：
 * <ul>
 *   <li>样本不足时 {@link #train} 返回未训练状态而不是抛异常</li>
 *   <li>未训练时 {@link #predict} 返回中性估计</li>
 *   <li>同一模型状态 + 同一输入，预测结果可复现</li>
 * </ul>
 */
public interface PerformancePredictor {

    ModelQualityReport train(List<ExecutionRecord> history);

    PerformancePrediction predict(FeatureVector features);

    boolean isTrained();

    ModelQualityReport lastQuality();
}
