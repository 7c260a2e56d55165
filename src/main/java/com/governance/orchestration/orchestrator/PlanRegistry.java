package com.governance.orchestration.orchestrator;

import com.github.benmanes.caffeine.cache.Cache;
import com.governance.orchestration.constant.OrchestrationConstants;
import com.governance.orchestration.exception.PlanNotFoundException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 计划登记：未结束的计划常驻内存，结束后转入有时长 / 数量上限的缓存
 */
@Component
public class PlanRegistry {

    private final Map<String, PlanExecution> active = new ConcurrentHashMap<>();
    private final Cache<String, PlanExecution> finished;

    public PlanRegistry(@Qualifier(OrchestrationConstants.FINISHED_PLAN_CACHE) Cache<String, PlanExecution> finished,
                        MeterRegistry meterRegistry) {
        this.finished = finished;
        Gauge.builder("orchestration.plans.active", active, Map::size)
            .description("Plans created or running")
            .register(meterRegistry);
    }

    public void register(PlanExecution execution) {
        active.put(execution.getPlanId(), execution);
    }

    /**
     * 结束的计划移入保留缓存
     */
    public void archive(PlanExecution execution) {
        finished.put(execution.getPlanId(), execution);
        active.remove(execution.getPlanId(), execution);
    }

    public Optional<PlanExecution> find(String planId) {
        PlanExecution execution = active.get(planId);
        if (execution == null) {
            execution = finished.getIfPresent(planId);
        }
        return Optional.ofNullable(execution);
    }

    /**
     * @throws PlanNotFoundException 计划不存在或已过保留期
     */
    public PlanExecution require(String planId) {
        return find(planId).orElseThrow(() -> new PlanNotFoundException(planId));
    }

    public List<PlanExecution> activePlans() {
        return new ArrayList<>(active.values());
    }

    public List<PlanExecution> finishedPlans() {
        return new ArrayList<>(finished.asMap().values());
    }

    public int activeCount() {
        return active.size();
    }
}
