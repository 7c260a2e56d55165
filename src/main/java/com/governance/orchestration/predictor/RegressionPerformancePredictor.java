package com.governance.orchestration.predictor;

import com.governance.orchestration.config.OrchestrationProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 基于岭回归的性能预测器
 *
 * <p>每个预测目标一组线性系数，特征先做 z-score 标准化。
 * 求解正规方程使用带主元的高斯消元，没有任何随机过程，结果可复现。
 * 模型状态整体替换（volatile），训练和预测可以并发。
 */
@Component
public class RegressionPerformancePredictor implements PerformancePredictor {

    private static final Logger log = LoggerFactory.getLogger(RegressionPerformancePredictor.class);

    private final OrchestrationProperties.PredictorConfig config;

    private volatile LinearModel model;
    private volatile ModelQualityReport lastQuality =
        ModelQualityReport.notTrained(ModelStatus.NOT_TRAINED, 0, "model has not been trained");

    private final Counter trainings;
    private final Counter predictions;
    private final Counter defaultedPredictions;

    public RegressionPerformancePredictor(OrchestrationProperties properties, MeterRegistry meterRegistry) {
        this.config = properties.getPredictor();
        this.trainings = Counter.builder("orchestration.predictor.trainings")
            .description("Predictor training runs").register(meterRegistry);
        this.predictions = Counter.builder("orchestration.predictor.predictions")
            .tag("source", "model").register(meterRegistry);
        this.defaultedPredictions = Counter.builder("orchestration.predictor.predictions")
            .tag("source", "default").register(meterRegistry);
    }

    @Override
    public ModelQualityReport train(List<ExecutionRecord> history) {
        trainings.increment();
        int n = history == null ? 0 : history.size();
        if (n < config.getMinTrainingSamples()) {
            log.info("Predictor training skipped: {} sample(s), {} required", n, config.getMinTrainingSamples());
            ModelQualityReport report = ModelQualityReport.notTrained(ModelStatus.INSUFFICIENT_SAMPLES, n,
                "at least " + config.getMinTrainingSamples() + " samples required");
            lastQuality = report;
            return report;
        }

        try {
            boolean holdout = n >= config.getHoldoutMinSamples();
            Map<PredictionTarget, Double> r2;
            Map<PredictionTarget, Double> mae;
            if (holdout) {
                int split = (int) Math.floor(n * 0.8);
                LinearModel candidate = fit(history.subList(0, split));
                List<ExecutionRecord> validation = history.subList(split, n);
                r2 = candidate.rSquared(validation);
                mae = candidate.meanAbsoluteError(validation);
            } else {
                LinearModel candidate = fit(history);
                r2 = candidate.rSquared(history);
                mae = candidate.meanAbsoluteError(history);
            }

            this.model = fit(history);
            ModelQualityReport report = new ModelQualityReport(ModelStatus.TRAINED, n, r2, mae, holdout,
                Instant.now(), "trained on " + n + " samples");
            lastQuality = report;
            log.info("Predictor trained: samples={}, holdout={}, r2(execution_time)={}",
                n, holdout, String.format("%.3f", r2.getOrDefault(PredictionTarget.EXECUTION_TIME, 0.0)));
            return report;
        } catch (RuntimeException e) {
            log.error("Predictor training failed on {} samples", n, e);
            ModelQualityReport report = ModelQualityReport.notTrained(ModelStatus.FAILED, n, e.getMessage());
            lastQuality = report;
            return report;
        }
    }

    @Override
    public PerformancePrediction predict(FeatureVector features) {
        LinearModel current = this.model;
        if (current == null) {
            defaultedPredictions.increment();
            return PerformancePrediction.neutral();
        }
        predictions.increment();
        Map<PredictionTarget, Double> values = new EnumMap<>(PredictionTarget.class);
        double[] row = current.standardize(features);
        for (PredictionTarget target : PredictionTarget.values()) {
            values.put(target, target.clamp(current.evaluate(target, row)));
        }
        return PerformancePrediction.fromMap(values, false);
    }

    @Override
    public boolean isTrained() {
        return model != null;
    }

    @Override
    public ModelQualityReport lastQuality() {
        return lastQuality;
    }

    // ==================== 拟合 ====================

    private LinearModel fit(List<ExecutionRecord> records) {
        TreeSet<String> names = new TreeSet<>();
        for (ExecutionRecord record : records) {
            names.addAll(record.features().features().keySet());
        }
        List<String> featureNames = new ArrayList<>(names);
        int p = featureNames.size();
        int n = records.size();

        double[] means = new double[p];
        double[] stds = new double[p];
        for (int j = 0; j < p; j++) {
            String name = featureNames.get(j);
            double sum = 0;
            for (ExecutionRecord record : records) {
                sum += record.features().get(name);
            }
            means[j] = sum / n;
            double sq = 0;
            for (ExecutionRecord record : records) {
                double d = record.features().get(name) - means[j];
                sq += d * d;
            }
            double std = Math.sqrt(sq / n);
            stds[j] = std > 1e-12 ? std : 1.0;
        }

        // 设计矩阵，第 0 列为截距
        double[][] x = new double[n][p + 1];
        for (int i = 0; i < n; i++) {
            x[i][0] = 1.0;
            FeatureVector fv = records.get(i).features();
            for (int j = 0; j < p; j++) {
                x[i][j + 1] = (fv.get(featureNames.get(j)) - means[j]) / stds[j];
            }
        }

        double[][] xtx = new double[p + 1][p + 1];
        for (int a = 0; a <= p; a++) {
            for (int b = 0; b <= p; b++) {
                double s = 0;
                for (int i = 0; i < n; i++) {
                    s += x[i][a] * x[i][b];
                }
                xtx[a][b] = s;
            }
            if (a > 0) {
                xtx[a][a] += config.getRidgeLambda() * n;
            }
        }

        Map<PredictionTarget, double[]> coefficients = new EnumMap<>(PredictionTarget.class);
        for (PredictionTarget target : PredictionTarget.values()) {
            double[] xty = new double[p + 1];
            for (int a = 0; a <= p; a++) {
                double s = 0;
                for (int i = 0; i < n; i++) {
                    s += x[i][a] * target.valueOf(records.get(i).outcome());
                }
                xty[a] = s;
            }
            coefficients.put(target, solve(xtx, xty));
        }
        return new LinearModel(featureNames, means, stds, coefficients);
    }

    /**
     * 高斯消元（部分主元）解 A·x = b，不修改入参
     */
    static double[] solve(double[][] matrix, double[] rhs) {
        int size = rhs.length;
        double[][] a = new double[size][size + 1];
        for (int i = 0; i < size; i++) {
            System.arraycopy(matrix[i], 0, a[i], 0, size);
            a[i][size] = rhs[i];
        }
        for (int col = 0; col < size; col++) {
            int pivot = col;
            for (int row = col + 1; row < size; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;
            if (Math.abs(a[col][col]) < 1e-12) {
                // 奇异列：系数置 0
                a[col][col] = 1.0;
                for (int k = col + 1; k <= size; k++) {
                    a[col][k] = 0.0;
                }
            }
            for (int row = col + 1; row < size; row++) {
                double factor = a[row][col] / a[col][col];
                for (int k = col; k <= size; k++) {
                    a[row][k] -= factor * a[col][k];
                }
            }
        }
        double[] result = new double[size];
        for (int row = size - 1; row >= 0; row--) {
            double s = a[row][size];
            for (int k = row + 1; k < size; k++) {
                s -= a[row][k] * result[k];
            }
            result[row] = s / a[row][row];
        }
        return result;
    }

    private static final class LinearModel {
        private final List<String> featureNames;
        private final double[] means;
        private final double[] stds;
        private final Map<PredictionTarget, double[]> coefficients;

        LinearModel(List<String> featureNames, double[] means, double[] stds,
                    Map<PredictionTarget, double[]> coefficients) {
            this.featureNames = List.copyOf(featureNames);
            this.means = means;
            this.stds = stds;
            this.coefficients = coefficients;
        }

        double[] standardize(FeatureVector features) {
            double[] row = new double[featureNames.size() + 1];
            row[0] = 1.0;
            for (int j = 0; j < featureNames.size(); j++) {
                String name = featureNames.get(j);
                double value = features.has(name) ? features.get(name) : means[j];
                row[j + 1] = (value - means[j]) / stds[j];
            }
            return row;
        }

        double evaluate(PredictionTarget target, double[] row) {
            double[] beta = coefficients.get(target);
            double s = 0;
            for (int k = 0; k < row.length; k++) {
                s += beta[k] * row[k];
            }
            return s;
        }

        Map<PredictionTarget, Double> rSquared(List<ExecutionRecord> records) {
            Map<PredictionTarget, Double> result = new EnumMap<>(PredictionTarget.class);
            for (PredictionTarget target : PredictionTarget.values()) {
                double mean = 0;
                for (ExecutionRecord record : records) {
                    mean += target.valueOf(record.outcome());
                }
                mean /= records.size();
                double ssRes = 0;
                double ssTot = 0;
                for (ExecutionRecord record : records) {
                    double actual = target.valueOf(record.outcome());
                    double predicted = target.clamp(evaluate(target, standardize(record.features())));
                    ssRes += (actual - predicted) * (actual - predicted);
                    ssTot += (actual - mean) * (actual - mean);
                }
                double r2 = ssTot < 1e-12 ? (ssRes < 1e-9 ? 1.0 : 0.0) : 1.0 - ssRes / ssTot;
                result.put(target, r2);
            }
            return result;
        }

        Map<PredictionTarget, Double> meanAbsoluteError(List<ExecutionRecord> records) {
            Map<PredictionTarget, Double> result = new EnumMap<>(PredictionTarget.class);
            for (PredictionTarget target : PredictionTarget.values()) {
                double sum = 0;
                for (ExecutionRecord record : records) {
                    double predicted = target.clamp(evaluate(target, standardize(record.features())));
                    sum += Math.abs(target.valueOf(record.outcome()) - predicted);
                }
                result.put(target, sum / records.size());
            }
            return result;
        }
    }
}
