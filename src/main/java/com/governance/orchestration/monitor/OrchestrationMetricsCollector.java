package com.governance.orchestration.monitor;

import com.governance.orchestration.alert.AlertEvaluator;
import com.governance.orchestration.orchestrator.PlanRegistry;
import com.governance.orchestration.resource.ResourceKind;
import com.governance.orchestration.resource.ResourcePool;
import com.governance.orchestration.resource.ResourcePoolState;
import com.governance.orchestration.service.PerformanceSeriesStore;
import com.governance.orchestration.service.PredictionService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 编排运行指标收集器
 * 注册序列 / 训练历史规模等 Gauge，并定时输出资源池摘要
 */
@Component
public class OrchestrationMetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationMetricsCollector.class);

    private static final double HIGH_UTILIZATION = 0.9;

    private final ResourcePool resourcePool;
    private final PlanRegistry planRegistry;
    private final AlertEvaluator alertEvaluator;

    public OrchestrationMetricsCollector(MeterRegistry meterRegistry,
                                         ResourcePool resourcePool,
                                         PlanRegistry planRegistry,
                                         AlertEvaluator alertEvaluator,
                                         PerformanceSeriesStore seriesStore,
                                         PredictionService predictionService) {
        this.resourcePool = resourcePool;
        this.planRegistry = planRegistry;
        this.alertEvaluator = alertEvaluator;

        meterRegistry.gauge("orchestration.series.count", seriesStore, PerformanceSeriesStore::seriesCount);
        meterRegistry.gauge("orchestration.predictor.training_history", predictionService,
            PredictionService::trainingHistorySize);
        meterRegistry.gauge("orchestration.predictor.trained", predictionService, p -> p.isTrained() ? 1 : 0);
    }

    /**
     * 每分钟输出一次资源池与计划摘要
     */
    @Scheduled(fixedRate = 60000)
    public void logPoolStats() {
        ResourcePoolState state = resourcePool.snapshot();
        log.info("Orchestration stats: cpu={}%, memory={}%, network={}%, storage={}%, allocations={}, "
                + "activePlans={}, activeAlerts={}",
            percent(state, ResourceKind.CPU), percent(state, ResourceKind.MEMORY),
            percent(state, ResourceKind.NETWORK), percent(state, ResourceKind.STORAGE),
            state.activeAllocations(), planRegistry.activeCount(), alertEvaluator.activeAlerts().size());

        for (ResourceKind kind : ResourceKind.values()) {
            if (state.utilization(kind) > HIGH_UTILIZATION) {
                log.warn("Resource pool {} utilization high: {}%", kind, percent(state, kind));
            }
        }
    }

    private static long percent(ResourcePoolState state, ResourceKind kind) {
        return Math.round(state.utilization(kind) * 100);
    }
}
