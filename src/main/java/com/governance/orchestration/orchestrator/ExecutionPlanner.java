package com.governance.orchestration.orchestrator;

import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.constant.OrchestrationConstants;
import com.governance.orchestration.config.OrchestrationProperties.InsufficientResourcesPolicy;
import com.governance.orchestration.decision.DecisionEngine;
import com.governance.orchestration.decision.OrchestrationStrategy;
import com.governance.orchestration.decision.RuleDependency;
import com.governance.orchestration.decision.StrategyDecision;
import com.governance.orchestration.exception.InsufficientResourcesException;
import com.governance.orchestration.exception.PlanConfigurationException;
import com.governance.orchestration.optimizer.RuleParameterStore;
import com.governance.orchestration.predictor.FeatureVector;
import com.governance.orchestration.predictor.PerformancePrediction;
import com.governance.orchestration.resource.ResourceKind;
import com.governance.orchestration.resource.ResourcePool;
import com.governance.orchestration.resource.ResourcePoolState;
import com.governance.orchestration.resource.ResourceRequirement;
import com.governance.orchestration.service.PredictionService;
import com.governance.orchestration.workflow.DependencyGraph;
import com.governance.orchestration.workflow.Workflow;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 执行计划构建（create_plan）
 *
 * <p>只做试算，不产生任何真实的资源预留：计划创建失败时资源池保持原状。
 * 配置错误（依赖成环、依赖不存在、未知策略）在这里直接失败，不会带到执行阶段。
 */
@Component
public class ExecutionPlanner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanner.class);

    static final double LOAD_BALANCING_SHARE = 0.3;
    static final double COST_OPTIMIZATION_FACTOR = 0.8;

    // 小时单价
    static final double COST_PER_CORE_HOUR = 0.05;
    static final double COST_PER_MEMORY_GB_HOUR = 0.01;
    static final double COST_PER_STORAGE_GB_HOUR = 0.001;

    private final ComplexityAnalyzer complexityAnalyzer;
    private final WorkflowFactory workflowFactory;
    private final DecisionEngine decisionEngine;
    private final ResourcePool resourcePool;
    private final RiskAnalyzer riskAnalyzer;
    private final PredictionService predictionService;
    private final RuleParameterStore parameterStore;
    private final OrchestrationProperties.OrchestratorConfig config;
    private final MeterRegistry meterRegistry;

    public ExecutionPlanner(ComplexityAnalyzer complexityAnalyzer,
                            WorkflowFactory workflowFactory,
                            DecisionEngine decisionEngine,
                            ResourcePool resourcePool,
                            RiskAnalyzer riskAnalyzer,
                            PredictionService predictionService,
                            RuleParameterStore parameterStore,
                            OrchestrationProperties properties,
                            MeterRegistry meterRegistry) {
        this.complexityAnalyzer = complexityAnalyzer;
        this.workflowFactory = workflowFactory;
        this.decisionEngine = decisionEngine;
        this.resourcePool = resourcePool;
        this.riskAnalyzer = riskAnalyzer;
        this.predictionService = predictionService;
        this.parameterStore = parameterStore;
        this.config = properties.getOrchestrator();
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws PlanConfigurationException     请求本身有误
     * @throws InsufficientResourcesException REJECT / QUEUE 策略下总容量无法满足
     */
    public ExecutionPlan createPlan(OrchestrationRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "created";
        try {
            ExecutionPlan plan = doCreatePlan(request);
            log.info("Plan {} created: workflows={}, strategy={}, risk={}, estimatedDuration={}, cost={}",
                plan.planId(), plan.workflows().size(), plan.strategy().strategy(),
                plan.riskAssessment().level(), plan.estimatedDuration(), plan.estimatedCost());
            return plan;
        } catch (InsufficientResourcesException e) {
            outcome = "insufficient_resources";
            throw e;
        } catch (PlanConfigurationException e) {
            outcome = "invalid";
            throw e;
        } finally {
            sample.stop(Timer.builder("orchestration.plan.creation")
                .tag("outcome", outcome)
                .description("Plan creation latency")
                .register(meterRegistry));
            meterRegistry.counter("orchestration.plans", "outcome", outcome).increment();
        }
    }

    private ExecutionPlan doCreatePlan(OrchestrationRequest request) {
        List<ScanRequest> requests = request.requests();
        if (requests.isEmpty()) {
            throw new PlanConfigurationException("orchestration request contains no scan requests");
        }
        String planId = OrchestrationConstants.PLAN_ID_PREFIX
            + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        Instant now = Instant.now();

        // 1. 工作流与复杂度
        Map<String, String> workflowIdByRequest = new LinkedHashMap<>();
        for (ScanRequest scanRequest : requests) {
            if (workflowIdByRequest.put(scanRequest.requestId(), WorkflowFactory.workflowIdOf(scanRequest)) != null) {
                throw new PlanConfigurationException("duplicate scan request id: " + scanRequest.requestId());
            }
        }

        List<Workflow> workflows = new ArrayList<>();
        Map<String, ComplexityAnalysis> complexity = new LinkedHashMap<>();
        Map<String, ScanRequest> requestByWorkflow = new LinkedHashMap<>();
        for (ScanRequest scanRequest : requests) {
            Set<String> upstream = new LinkedHashSet<>();
            for (String dependsOn : scanRequest.dependsOn()) {
                String upstreamWorkflow = workflowIdByRequest.get(dependsOn);
                if (upstreamWorkflow == null) {
                    throw new PlanConfigurationException("request " + scanRequest.requestId()
                        + " depends on unknown request " + dependsOn);
                }
                upstream.add(upstreamWorkflow);
            }
            Workflow workflow = workflowFactory.build(scanRequest, upstream);
            workflow.dependencyGraph().validate(workflow.workflowId());
            workflows.add(workflow);
            requestByWorkflow.put(workflow.workflowId(), scanRequest);
            complexity.put(workflow.workflowId(), complexityAnalyzer.analyze(scanRequest));
        }

        Map<String, Set<String>> workflowDependencies = new LinkedHashMap<>();
        for (Workflow workflow : workflows) {
            workflowDependencies.put(workflow.workflowId(), workflow.dependsOnWorkflowIds());
        }
        DependencyGraph workflowGraph = DependencyGraph.of(workflowDependencies);
        workflowGraph.validate(planId);

        // 2. 策略
        ResourcePoolState poolState = resourcePool.snapshot();
        List<String> dataSources = new ArrayList<>();
        List<String> criticalSources = new ArrayList<>();
        List<RuleDependency> ruleDependencies = new ArrayList<>();
        for (ScanRequest scanRequest : requests) {
            dataSources.addAll(scanRequest.dataSourceIds());
            if (scanRequest.criticalDataSource()) {
                criticalSources.addAll(scanRequest.dataSourceIds());
            }
            for (RuleSpec rule : scanRequest.rules()) {
                for (String dependsOn : rule.dependsOn()) {
                    ruleDependencies.add(new RuleDependency(rule.ruleId(), dependsOn));
                }
            }
        }
        StrategyDecision decision = resolveStrategy(request.explicitStrategy(), dataSources, ruleDependencies,
            criticalSources, poolState);
        double availability = DecisionEngine.availabilityScore(poolState);

        // 3. 资源分配与可行性
        Map<String, ResourceRequirement> allocation = new LinkedHashMap<>();
        for (Workflow workflow : workflows) {
            allocation.put(workflow.workflowId(), allocationFor(request.optimizationType(), workflow,
                complexity.get(workflow.workflowId()).recommendedResources(), availability));
        }
        allocation = enforceFeasibility(planId, allocation);
        ResourceRequirement total = sum(allocation.values());

        // 4. 执行顺序
        List<String> executionOrder = workflowGraph.topologicalOrder(tieBreak(decision.strategy(), workflows));

        // 5. 预测（在预测线程池内，超时退化为中性估计）
        Map<String, FeatureVector> features = new LinkedHashMap<>();
        for (Workflow workflow : workflows) {
            ScanRequest scanRequest = requestByWorkflow.get(workflow.workflowId());
            for (RuleSpec rule : scanRequest.rules()) {
                features.put(ExecutionPlan.predictionKey(workflow.workflowId(), rule.ruleId()),
                    RuleFeatures.of(scanRequest, rule, parameterStore.get(rule.ruleId())));
            }
        }
        Map<String, PerformancePrediction> predictions = predictionService.predictAll(features);

        // 6. 时长、成本、风险
        Map<String, Duration> workflowDurations = new LinkedHashMap<>();
        for (Workflow workflow : workflows) {
            workflowDurations.put(workflow.workflowId(), estimateWorkflowDuration(workflow,
                requestByWorkflow.get(workflow.workflowId()), complexity.get(workflow.workflowId()), predictions));
        }
        Duration estimatedDuration = estimatePlanDuration(decision.strategy(), workflowGraph, workflowDurations);
        double estimatedCost = estimateCost(total, estimatedDuration);

        double dependencyComplexity = Double.isNaN(decision.dependencyComplexity())
            ? DecisionEngine.dependencyComplexity(dataSources, ruleDependencies)
            : decision.dependencyComplexity();
        RiskAssessment risk = riskAnalyzer.assess(complexity.values(), total, poolState.available(),
            dependencyComplexity, estimatedCost, estimatedDuration, request.constraints(), now);
        List<ContingencyPlan> contingencies = riskAnalyzer.contingencies(risk);

        return new ExecutionPlan(planId, now, workflows, executionOrder, allocation, estimatedDuration, risk,
            contingencies, decision, request.optimizationType(), complexity, total, estimatedCost, features,
            predictions, request.context(), request.constraints());
    }

    private StrategyDecision resolveStrategy(String explicitStrategy, List<String> dataSources,
                                             List<RuleDependency> ruleDependencies, List<String> criticalSources,
                                             ResourcePoolState poolState) {
        if (explicitStrategy != null && !explicitStrategy.isBlank()) {
            try {
                return StrategyDecision.explicit(OrchestrationStrategy.parse(explicitStrategy));
            } catch (IllegalArgumentException e) {
                throw new PlanConfigurationException(e.getMessage(), e);
            }
        }
        return decisionEngine.chooseStrategy(dataSources, ruleDependencies, criticalSources, poolState);
    }

    /**
     * 按资源优化方式由推荐量推导单个工作流的分配量
     */
    ResourceRequirement allocationFor(ResourceOptimizationType type, Workflow workflow,
                                      ResourceRequirement recommended, double availability) {
        double multiplier = workflow.priority().getResourceMultiplier();
        switch (type) {
            case PRIORITY_SCHEDULING:
                return recommended.scale(multiplier);
            case LOAD_BALANCING:
                return recommended.scale(multiplier).min(resourcePool.capacity().scale(LOAD_BALANCING_SHARE));
            case COST_OPTIMIZATION:
                ResourceRequirement reduced = recommended.scale(COST_OPTIMIZATION_FACTOR);
                return new ResourceRequirement(Math.max(1.0, reduced.cpuCores()), Math.max(1024.0, reduced.memoryMb()),
                    reduced.networkMbps(), reduced.storageGb());
            case DYNAMIC_SCALING:
                return recommended.scale(Math.max(0.5, Math.min(1.5, 0.5 + availability)));
            case RESOURCE_POOLING:
            default:
                return recommended;
        }
    }

    private Map<String, ResourceRequirement> enforceFeasibility(String planId,
                                                               Map<String, ResourceRequirement> allocation) {
        ResourceRequirement capacity = resourcePool.capacity();
        ResourceRequirement total = sum(allocation.values());
        InsufficientResourcesPolicy policy = config.getInsufficientResourcesPolicy();
        switch (policy) {
            case SHRINK:
                if (resourcePool.canEverSatisfy(total)) {
                    return allocation;
                }
                double factor = shrinkFactor(total, capacity);
                log.warn("Plan {} exceeds pool capacity, shrinking allocations by factor {}",
                    planId, String.format("%.3f", factor));
                Map<String, ResourceRequirement> shrunk = new LinkedHashMap<>();
                allocation.forEach((id, requirement) -> shrunk.put(id, requirement.scale(factor)));
                return shrunk;
            case QUEUE:
                for (Map.Entry<String, ResourceRequirement> entry : allocation.entrySet()) {
                    if (!resourcePool.canEverSatisfy(entry.getValue())) {
                        log.warn("Plan {} rejected: workflow {} alone exceeds pool capacity", planId, entry.getKey());
                        throw new InsufficientResourcesException(entry.getValue(), capacity);
                    }
                }
                return allocation;
            case REJECT:
            default:
                if (!resourcePool.canEverSatisfy(total)) {
                    log.warn("Plan {} rejected: total requirement {} exceeds capacity {}", planId, total, capacity);
                    throw new InsufficientResourcesException(total, capacity);
                }
                return allocation;
        }
    }

    static double shrinkFactor(ResourceRequirement total, ResourceRequirement capacity) {
        double factor = 1.0;
        for (ResourceKind kind : ResourceKind.values()) {
            double need = total.get(kind);
            if (need > capacity.get(kind)) {
                factor = Math.min(factor, capacity.get(kind) / need);
            }
        }
        return factor;
    }

    /**
     * PARALLEL / SEQUENTIAL 保持提交顺序，其余策略同一层内按优先级、关键路径排序
     */
    private static Comparator<String> tieBreak(OrchestrationStrategy strategy, List<Workflow> workflows) {
        if (strategy == OrchestrationStrategy.PARALLEL || strategy == OrchestrationStrategy.SEQUENTIAL) {
            return (a, b) -> 0;
        }
        Map<String, Workflow> byId = new LinkedHashMap<>();
        for (Workflow workflow : workflows) {
            byId.put(workflow.workflowId(), workflow);
        }
        Comparator<String> byPriority = Comparator.comparingInt(id -> -byId.get(id).priority().getRank());
        return byPriority.thenComparingInt(id -> byId.get(id).criticalPath() ? 0 : 1);
    }

    /**
     * 有模型预测时取规则预测耗时之和，否则取复杂度估算
     */
    static Duration estimateWorkflowDuration(Workflow workflow, ScanRequest request, ComplexityAnalysis analysis,
                                             Map<String, PerformancePrediction> predictions) {
        double predictedSeconds = 0;
        boolean modelBacked = false;
        for (RuleSpec rule : request.rules()) {
            PerformancePrediction prediction =
                predictions.get(ExecutionPlan.predictionKey(workflow.workflowId(), rule.ruleId()));
            if (prediction != null && !prediction.defaulted()) {
                modelBacked = true;
                predictedSeconds += prediction.executionTimeSeconds();
            }
        }
        if (modelBacked) {
            return Duration.ofMillis((long) (predictedSeconds * 1000));
        }
        return analysis.estimatedDuration();
    }

    /**
     * SEQUENTIAL 取总和，其余取工作流依赖图上的最长路径
     */
    static Duration estimatePlanDuration(OrchestrationStrategy strategy, DependencyGraph workflowGraph,
                                         Map<String, Duration> durations) {
        if (strategy == OrchestrationStrategy.SEQUENTIAL) {
            Duration total = Duration.ZERO;
            for (Duration duration : durations.values()) {
                total = total.plus(duration);
            }
            return total;
        }
        double longest = workflowGraph.longestPathWeight(id -> durations.getOrDefault(id, Duration.ZERO).toMillis());
        return Duration.ofMillis((long) longest);
    }

    /**
     * 每小时：0.05/核 + 0.01/GB 内存 + 0.001/GB 存储，乘以预估小时数
     */
    static double estimateCost(ResourceRequirement total, Duration duration) {
        double perHour = total.cpuCores() * COST_PER_CORE_HOUR
            + total.memoryMb() / 1024.0 * COST_PER_MEMORY_GB_HOUR
            + total.storageGb() * COST_PER_STORAGE_GB_HOUR;
        double hours = duration.toMillis() / 3_600_000.0;
        return Math.round(perHour * hours * 10_000) / 10_000.0;
    }

    static ResourceRequirement sum(Iterable<ResourceRequirement> requirements) {
        ResourceRequirement total = ResourceRequirement.ZERO;
        for (ResourceRequirement requirement : requirements) {
            total = total.plus(requirement);
        }
        return total;
    }
}
