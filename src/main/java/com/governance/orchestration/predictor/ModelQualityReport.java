package com.governance.orchestration.predictor;

import java.time.Instant;
import java.util.Map;

/**
 * 训练结果与模型质量
 *
 * @param rSquared          各目标的 R²
 * @param meanAbsoluteError 各目标的平均绝对误差
 * @param validatedOnHoldout 质量指标是否来自留出集
 */
public record ModelQualityReport(
    ModelStatus status,
    int sampleCount,
    Map<PredictionTarget, Double> rSquared,
    Map<PredictionTarget, Double> meanAbsoluteError,
    boolean validatedOnHoldout,
    Instant trainedAt,
    String message) {

    public boolean isTrained() {
        return status == ModelStatus.TRAINED;
    }

    public static ModelQualityReport notTrained(ModelStatus status, int sampleCount, String message) {
        return new ModelQualityReport(status, sampleCount, Map.of(), Map.of(), false, Instant.now(), message);
    }
}
