package com.governance.orchestration.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.governance.orchestration.constant.OrchestrationConstants;
import com.governance.orchestration.orchestrator.PlanExecution;
import com.governance.orchestration.service.PerformanceSeries;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine 本地缓存配置
 * 已结束计划按时长 / 数量保留，性能序列空闲后淘汰
 */
@Configuration
public class CaffeineConfig {

    private static final Logger log = LoggerFactory.getLogger(CaffeineConfig.class);

    /**
     * 已结束的计划执行（状态查询、报告、统计）
     */
    @Bean(OrchestrationConstants.FINISHED_PLAN_CACHE)
    public Cache<String, PlanExecution> finishedPlanCache(OrchestrationProperties properties,
                                                          MeterRegistry meterRegistry) {
        OrchestrationProperties.OrchestratorConfig config = properties.getOrchestrator();
        Cache<String, PlanExecution> cache = Caffeine.newBuilder()
            .maximumSize(config.getMaxRetainedPlans())
            .expireAfterWrite(config.getPlanRetention())
            .recordStats()
            .removalListener((String key, PlanExecution value, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE || cause == RemovalCause.EXPIRED) {
                    log.debug("Finished plan evicted: planId={}, cause={}", key, cause);
                }
            })
            .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, "finished_plan_cache");

        log.info("Finished plan cache initialized: maximumSize={}, retention={}",
            config.getMaxRetainedPlans(), config.getPlanRetention());
        return cache;
    }

    /**
     * 每个监控对象一条性能时间序列，空闲超时后淘汰
     */
    @Bean(OrchestrationConstants.PERFORMANCE_SERIES_CACHE)
    public Cache<String, PerformanceSeries> performanceSeriesCache(OrchestrationProperties properties,
                                                                   MeterRegistry meterRegistry) {
        OrchestrationProperties.AlertConfig config = properties.getAlerts();
        Cache<String, PerformanceSeries> cache = Caffeine.newBuilder()
            .expireAfterAccess(config.getSeriesIdleExpiry())
            .recordStats()
            .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, "performance_series_cache");
        return cache;
    }
}
