package com.governance.orchestration.predictor;

import com.governance.orchestration.config.OrchestrationProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 回归预测器单元测试
 */
class RegressionPerformancePredictorTest {

    private RegressionPerformancePredictor predictor;

    @BeforeEach
    void setUp() {
        predictor = new RegressionPerformancePredictor(new OrchestrationProperties(), new SimpleMeterRegistry());
    }

    /**
     * 执行时间 = 10 + 5 × data_volume，其余目标为常量
     */
    private static List<ExecutionRecord> linearHistory(int size) {
        List<ExecutionRecord> history = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            FeatureVector features = FeatureVector.of(Map.of("data_volume", (double) i));
            PerformanceOutcome outcome = new PerformanceOutcome(10 + 5.0 * i, 0.9, 0.05, 0.4, 100, 0.3, 0.8, 0.5);
            history.add(new ExecutionRecord("rule-a", features, outcome, Instant.now()));
        }
        return history;
    }

    @Test
    @DisplayName("未训练时返回中性估计")
    void testPredictBeforeTraining() {
        PerformancePrediction prediction = predictor.predict(FeatureVector.of(Map.of("data_volume", 3.0)));

        assertTrue(prediction.defaulted());
        assertEquals(60.0, prediction.executionTimeSeconds());
        assertEquals(0.8, prediction.accuracyScore());
        assertFalse(predictor.isTrained());
        assertEquals(ModelStatus.NOT_TRAINED, predictor.lastQuality().status());
    }

    @Test
    @DisplayName("样本不足时不训练")
    void testInsufficientSamples() {
        ModelQualityReport report = predictor.train(linearHistory(5));

        assertEquals(ModelStatus.INSUFFICIENT_SAMPLES, report.status());
        assertEquals(5, report.sampleCount());
        assertFalse(predictor.isTrained());
        assertFalse(predictor.train(null).isTrained());
    }

    @Test
    @DisplayName("少于留出阈值：在训练集上评估")
    void testTrainWithoutHoldout() {
        ModelQualityReport report = predictor.train(linearHistory(12));

        assertEquals(ModelStatus.TRAINED, report.status());
        assertFalse(report.validatedOnHoldout());
        assertTrue(predictor.isTrained());
    }

    @Test
    @DisplayName("足够样本：留出 20% 验证，拟合线性关系")
    void testTrainWithHoldout() {
        ModelQualityReport report = predictor.train(linearHistory(30));

        assertEquals(ModelStatus.TRAINED, report.status());
        assertTrue(report.validatedOnHoldout());
        assertTrue(report.rSquared().get(PredictionTarget.EXECUTION_TIME) > 0.99);

        PerformancePrediction prediction = predictor.predict(FeatureVector.of(Map.of("data_volume", 10.0)));
        assertFalse(prediction.defaulted());
        assertEquals(60.0, prediction.executionTimeSeconds(), 0.5);
        assertEquals(0.9, prediction.accuracyScore(), 1e-6);
    }

    @Test
    @DisplayName("预测值裁剪到合法区间")
    void testPredictionsClamped() {
        predictor.train(linearHistory(30));

        PerformancePrediction prediction = predictor.predict(FeatureVector.of(Map.of("data_volume", -100.0)));

        assertEquals(0.0, prediction.executionTimeSeconds());
    }

    @Test
    @DisplayName("高斯消元求解线性方程组")
    void testSolve() {
        double[] x = RegressionPerformancePredictor.solve(new double[][]{{2, 1}, {1, 3}}, new double[]{5, 10});

        assertEquals(1.0, x[0], 1e-9);
        assertEquals(3.0, x[1], 1e-9);
    }
}
