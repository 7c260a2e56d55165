package com.governance.orchestration.orchestrator;

import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.config.OrchestrationProperties.InsufficientResourcesPolicy;
import com.governance.orchestration.decision.DecisionEngine;
import com.governance.orchestration.decision.OrchestrationStrategy;
import com.governance.orchestration.exception.InsufficientResourcesException;
import com.governance.orchestration.exception.PlanConfigurationException;
import com.governance.orchestration.optimizer.RuleParameterStore;
import com.governance.orchestration.predictor.RegressionPerformancePredictor;
import com.governance.orchestration.resource.ResourcePool;
import com.governance.orchestration.resource.ResourcePoolState;
import com.governance.orchestration.resource.ResourceRequirement;
import com.governance.orchestration.service.PredictionService;
import com.governance.orchestration.workflow.StepType;
import com.governance.orchestration.workflow.Workflow;
import com.governance.orchestration.workflow.WorkflowStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 执行计划构建单元测试
 */
class ExecutionPlannerTest {

    private static final ResourceRequirement CAPACITY = new ResourceRequirement(4, 16384, 1000, 1000);

    private OrchestrationProperties properties;
    private ResourcePool pool;
    private PredictionService predictionService;
    private ExecutionPlanner planner;

    @BeforeEach
    void setUp() {
        properties = new OrchestrationProperties();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        RuleParameterStore parameterStore = new RuleParameterStore();
        pool = new ResourcePool(CAPACITY, meterRegistry);
        predictionService = new PredictionService(new RegressionPerformancePredictor(properties, meterRegistry),
            properties, meterRegistry);
        predictionService.init();
        planner = new ExecutionPlanner(new ComplexityAnalyzer(), new WorkflowFactory(parameterStore),
            new DecisionEngine(meterRegistry), pool, new RiskAnalyzer(), predictionService, parameterStore,
            properties, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        predictionService.shutdown();
    }

    private static ScanRequest simple(String id, String dataSource) {
        return ScanRequest.of(id, dataSource, List.of(RuleSpec.of("rule-" + id, ComplexityLevel.SIMPLE)));
    }

    @Test
    @DisplayName("两个独立请求：默认工作流、并行策略、按复杂度估时估价")
    void testCreatePlan() {
        ExecutionPlan plan = planner.createPlan(OrchestrationRequest.of(
            List.of(simple("a", "ds-1"), simple("b", "ds-2"))));

        assertTrue(plan.planId().startsWith("plan_"));
        assertEquals(List.of("wf_a", "wf_b"), plan.executionOrder());
        assertEquals(OrchestrationStrategy.PARALLEL, plan.strategy().strategy());

        Workflow workflow = plan.workflow("wf_a").orElseThrow();
        assertEquals(List.of("validate-source", "scan-rule-a", "notify"),
            workflow.steps().stream().map(WorkflowStep::stepId).toList());

        assertEquals(new ResourceRequirement(2, 4096, 50, 10), plan.resourceAllocation().get("wf_a"));
        assertEquals(new ResourceRequirement(4, 8192, 100, 20), plan.totalRequirement());
        // 无依赖时取最长单个工作流
        assertEquals(Duration.ofMinutes(30), plan.estimatedDuration());
        assertEquals(0.15, plan.estimatedCost(), 1e-9);
        assertEquals(2, plan.predictions().size());
        assertTrue(plan.predictions().values().stream().allMatch(p -> p.defaulted()));
    }

    @Test
    @DisplayName("请求间依赖决定执行顺序，串联估时")
    void testRequestDependencies() {
        ScanRequest upstream = simple("a", "ds-1");
        ScanRequest downstream = simple("b", "ds-2").withDependsOn(Set.of("a"));

        ExecutionPlan plan = planner.createPlan(OrchestrationRequest.of(List.of(downstream, upstream)));

        assertEquals(List.of("wf_a", "wf_b"), plan.executionOrder());
        assertEquals(Set.of("wf_a"), plan.workflow("wf_b").orElseThrow().dependsOnWorkflowIds());
        assertEquals(Duration.ofMinutes(60), plan.estimatedDuration());
    }

    @Test
    @DisplayName("REJECT：总需求超过容量时拒绝，资源池不变")
    void testRejectWhenExceedingCapacity() {
        ResourcePoolState before = pool.snapshot();

        assertThrows(InsufficientResourcesException.class, () -> planner.createPlan(OrchestrationRequest.of(
            List.of(simple("a", "ds-1"), simple("b", "ds-2"), simple("c", "ds-3")))));

        assertEquals(before.levels(), pool.snapshot().levels());
        assertEquals(0, pool.snapshot().activeAllocations());
    }

    @Test
    @DisplayName("SHRINK：按比例缩减到容量以内")
    void testShrink() {
        properties.getOrchestrator().setInsufficientResourcesPolicy(InsufficientResourcesPolicy.SHRINK);

        ExecutionPlan plan = planner.createPlan(OrchestrationRequest.of(
            List.of(simple("a", "ds-1"), simple("b", "ds-2"), simple("c", "ds-3"))));

        assertTrue(plan.totalRequirement().cpuCores() <= CAPACITY.cpuCores() + 1e-9);
        assertEquals(4.0 / 3, plan.resourceAllocation().get("wf_a").cpuCores(), 1e-9);
    }

    @Test
    @DisplayName("QUEUE：只要单个工作流放得下就接受")
    void testQueueAcceptsOversizedPlan() {
        properties.getOrchestrator().setInsufficientResourcesPolicy(InsufficientResourcesPolicy.QUEUE);

        ExecutionPlan plan = planner.createPlan(OrchestrationRequest.of(
            List.of(simple("a", "ds-1"), simple("b", "ds-2"), simple("c", "ds-3"))));

        assertEquals(6, plan.totalRequirement().cpuCores(), 1e-9);
    }

    @Test
    @DisplayName("请求依赖成环被拒绝")
    void testCyclicRequests() {
        ScanRequest a = simple("a", "ds-1").withDependsOn(Set.of("b"));
        ScanRequest b = simple("b", "ds-2").withDependsOn(Set.of("a"));

        assertThrows(PlanConfigurationException.class,
            () -> planner.createPlan(OrchestrationRequest.of(List.of(a, b))));
    }

    @Test
    @DisplayName("依赖未知请求、重复请求 ID、空请求都被拒绝")
    void testInvalidRequests() {
        assertThrows(PlanConfigurationException.class, () -> planner.createPlan(OrchestrationRequest.of(
            List.of(simple("a", "ds-1").withDependsOn(Set.of("ghost"))))));
        assertThrows(PlanConfigurationException.class, () -> planner.createPlan(OrchestrationRequest.of(
            List.of(simple("a", "ds-1"), simple("a", "ds-2")))));
        assertThrows(PlanConfigurationException.class, () -> planner.createPlan(OrchestrationRequest.of(List.of())));
    }

    @Test
    @DisplayName("显式步骤成环被拒绝")
    void testCyclicSteps() {
        ScanRequest request = simple("a", "ds-1").withSteps(List.of(
            WorkflowStep.of("s1", StepType.SCAN, "s2"),
            WorkflowStep.of("s2", StepType.VALIDATION, "s1")));

        assertThrows(PlanConfigurationException.class,
            () -> planner.createPlan(OrchestrationRequest.of(List.of(request))));
    }

    @Test
    @DisplayName("显式策略优先，未知策略名被拒绝")
    void testExplicitStrategy() {
        ExecutionPlan plan = planner.createPlan(new OrchestrationRequest(List.of(simple("a", "ds-1")),
            null, "sequential", null, null));
        assertEquals(OrchestrationStrategy.SEQUENTIAL, plan.strategy().strategy());
        assertTrue(plan.strategy().explicit());

        assertThrows(PlanConfigurationException.class, () -> planner.createPlan(
            new OrchestrationRequest(List.of(simple("a", "ds-1")), null, "bogus", null, null)));
    }

    @Test
    @DisplayName("超出预算和截止时间产生高风险与应急预案")
    void testBudgetAndDeadlineRisk() {
        OrchestrationConstraints constraints = new OrchestrationConstraints(0.01, Instant.now().plusSeconds(60));

        ExecutionPlan plan = planner.createPlan(new OrchestrationRequest(List.of(simple("a", "ds-1")),
            null, null, constraints, null));

        assertEquals(RiskLevel.HIGH, plan.riskAssessment().level());
        List<RiskType> types = plan.riskAssessment().factors().stream().map(RiskFactor::type).toList();
        assertTrue(types.contains(RiskType.BUDGET_OVERRUN));
        assertTrue(types.contains(RiskType.DEADLINE_OVERRUN));
        assertFalse(plan.contingencyPlans().isEmpty());
    }

    @Test
    @DisplayName("成本优化分配打八折但有下限")
    void testCostOptimizationAllocation() {
        ExecutionPlan plan = planner.createPlan(new OrchestrationRequest(List.of(simple("a", "ds-1")),
            null, null, null, ResourceOptimizationType.COST_OPTIMIZATION));

        ResourceRequirement allocation = plan.resourceAllocation().get("wf_a");
        assertEquals(1.6, allocation.cpuCores(), 1e-9);
        assertEquals(4096 * 0.8, allocation.memoryMb(), 1e-9);
    }

    @Test
    @DisplayName("成本估算")
    void testEstimateCost() {
        double cost = ExecutionPlanner.estimateCost(new ResourceRequirement(4, 8192, 0, 100), Duration.ofHours(2));

        // (0.2 + 0.08 + 0.1) * 2
        assertEquals(0.76, cost, 1e-9);
    }
}
