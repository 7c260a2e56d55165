package com.governance.orchestration.service;

import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.predictor.ExecutionRecord;
import com.governance.orchestration.predictor.FeatureVector;
import com.governance.orchestration.predictor.ModelQualityReport;
import com.governance.orchestration.predictor.ModelStatus;
import com.governance.orchestration.predictor.PerformancePrediction;
import com.governance.orchestration.predictor.PerformancePredictor;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 预测 / 训练的线程池边界
 *
 * <p>所有模型调用都在独立的有界池内执行，协调线程只等待带超时的结果。
 * 预测失败或超时退化为中性估计，训练失败返回 FAILED 报告，两者都不向调用方抛异常。
 */
@Slf4j
@Service
public class PredictionService {

    private final PerformancePredictor predictor;
    private final OrchestrationProperties.OrchestratorConfig config;
    private final MeterRegistry meterRegistry;

    // 最近的执行记录，供重新训练
    private final Deque<ExecutionRecord> trainingHistory = new ArrayDeque<>();

    private ExecutorService predictionExecutor;

    public PredictionService(PerformancePredictor predictor,
                             OrchestrationProperties properties,
                             MeterRegistry meterRegistry) {
        this.predictor = predictor;
        this.config = properties.getOrchestrator();
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "prediction-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.predictionExecutor = Executors.newFixedThreadPool(config.getPredictionPoolSize(), factory);
        log.info("PredictionService initialized: poolSize={}, timeout={}",
            config.getPredictionPoolSize(), config.getPredictionTimeout());
    }

    @PreDestroy
    public void shutdown() {
        predictionExecutor.shutdownNow();
    }

    /**
     * 批量预测，整体共享一个超时；未完成或失败的项返回中性估计
     */
    public Map<String, PerformancePrediction> predictAll(Map<String, FeatureVector> features) {
        Map<String, PerformancePrediction> result = new LinkedHashMap<>();
        if (features.isEmpty()) {
            return result;
        }
        Future<Map<String, PerformancePrediction>> future = predictionExecutor.submit(() -> {
            Map<String, PerformancePrediction> predictions = new LinkedHashMap<>();
            features.forEach((key, vector) -> predictions.put(key, predictor.predict(vector)));
            return predictions;
        });
        Duration timeout = config.getPredictionTimeout();
        try {
            result.putAll(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Prediction timed out after {}ms, using neutral estimates", timeout.toMillis());
            meterRegistry.counter("orchestration.predictor.fallbacks", "reason", "timeout").increment();
        } catch (ExecutionException e) {
            log.warn("Prediction failed, using neutral estimates: {}", e.getCause().getMessage());
            meterRegistry.counter("orchestration.predictor.fallbacks", "reason", "error").increment();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
        }
        for (String key : features.keySet()) {
            result.putIfAbsent(key, PerformancePrediction.neutral());
        }
        return result;
    }

    /**
     * 用给定记录训练；会阻塞直到训练结束
     */
    public ModelQualityReport train(List<ExecutionRecord> history) {
        List<ExecutionRecord> batch = List.copyOf(history);
        Future<ModelQualityReport> future = predictionExecutor.submit(() -> predictor.train(batch));
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Predictor training crashed on {} records", batch.size(), e.getCause());
            return ModelQualityReport.notTrained(ModelStatus.FAILED, batch.size(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ModelQualityReport.notTrained(ModelStatus.FAILED, batch.size(), "interrupted");
        }
    }

    /**
     * 记录一批执行结果，超出容量时丢弃最旧的
     */
    public void record(List<ExecutionRecord> records) {
        synchronized (trainingHistory) {
            for (ExecutionRecord record : records) {
                trainingHistory.addLast(record);
                while (trainingHistory.size() > config.getTrainingHistoryCapacity()) {
                    trainingHistory.removeFirst();
                }
            }
        }
    }

    /**
     * 用累积的执行记录重新训练
     */
    public ModelQualityReport retrainFromHistory() {
        List<ExecutionRecord> snapshot;
        synchronized (trainingHistory) {
            snapshot = new ArrayList<>(trainingHistory);
        }
        return train(snapshot);
    }

    public int trainingHistorySize() {
        synchronized (trainingHistory) {
            return trainingHistory.size();
        }
    }

    public ModelQualityReport lastQuality() {
        return predictor.lastQuality();
    }

    public boolean isTrained() {
        return predictor.isTrained();
    }
}
