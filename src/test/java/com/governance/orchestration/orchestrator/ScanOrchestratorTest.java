package com.governance.orchestration.orchestrator;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.governance.orchestration.alert.AlertEvaluator;
import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.config.OrchestrationProperties.InsufficientResourcesPolicy;
import com.governance.orchestration.decision.DecisionEngine;
import com.governance.orchestration.exception.PlanNotFoundException;
import com.governance.orchestration.optimizer.AdaptationApproval;
import com.governance.orchestration.optimizer.AdaptiveOptimizer;
import com.governance.orchestration.optimizer.FeedbackSafetyWeightingPolicy;
import com.governance.orchestration.optimizer.ParameterRecommendation;
import com.governance.orchestration.optimizer.RuleParameterStore;
import com.governance.orchestration.optimizer.ZScoreAnomalyScorer;
import com.governance.orchestration.predictor.RegressionPerformancePredictor;
import com.governance.orchestration.resource.ResourcePool;
import com.governance.orchestration.resource.ResourceRequirement;
import com.governance.orchestration.service.PerformanceSeriesStore;
import com.governance.orchestration.service.PredictionService;
import com.governance.orchestration.workflow.FailureReason;
import com.governance.orchestration.workflow.ResourceSample;
import com.governance.orchestration.workflow.StepContext;
import com.governance.orchestration.workflow.StepHandler;
import com.governance.orchestration.workflow.StepHandlerRegistry;
import com.governance.orchestration.workflow.StepType;
import com.governance.orchestration.workflow.WorkflowExecutionEngine;
import com.governance.orchestration.workflow.WorkflowStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * 编排器单元测试：各组件真实装配，步骤处理器按用例注册
 */
class ScanOrchestratorTest {

    private static final ResourceRequirement CAPACITY = new ResourceRequirement(16, 65536, 1000, 1000);

    private OrchestrationProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ResourcePool pool;
    private StepHandlerRegistry handlers;
    private WorkflowExecutionEngine engine;
    private PredictionService predictionService;
    private ObjectProvider<AdaptationConfirmationHook> hookProvider;
    private ScanOrchestrator orchestrator;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new OrchestrationProperties();
        properties.getWorkflow().setDefaultStepTimeout(Duration.ofSeconds(5));
        properties.getWorkflow().setRetryInitialBackoff(Duration.ofMillis(10));
        properties.getWorkflow().setSamplingInterval(Duration.ofMillis(20));
        properties.getWorkflow().setCancellationGracePeriod(Duration.ofSeconds(1));
        properties.getWorkflow().setStepPoolSize(4);
        properties.getOrchestrator().setAdmissionRetryInterval(Duration.ofMillis(10));
        meterRegistry = new SimpleMeterRegistry();
        hookProvider = mock(ObjectProvider.class);
        build(CAPACITY);
    }

    private void build(ResourceRequirement capacity) {
        RuleParameterStore parameterStore = new RuleParameterStore();
        WorkflowFactory workflowFactory = new WorkflowFactory(parameterStore);
        pool = new ResourcePool(capacity, meterRegistry);
        handlers = new StepHandlerRegistry();
        engine = new WorkflowExecutionEngine(properties, handlers,
            () -> new ResourceSample(Instant.now(), 0.2, 128, 1024, 20), meterRegistry);
        engine.init();
        predictionService = new PredictionService(new RegressionPerformancePredictor(properties, meterRegistry),
            properties, meterRegistry);
        predictionService.init();
        AlertEvaluator alertEvaluator = new AlertEvaluator(properties, meterRegistry);
        AdaptiveOptimizer optimizer = new AdaptiveOptimizer(properties, parameterStore,
            new FeedbackSafetyWeightingPolicy(), new ZScoreAnomalyScorer(), meterRegistry);
        ExecutionPlanner planner = new ExecutionPlanner(new ComplexityAnalyzer(), workflowFactory,
            new DecisionEngine(meterRegistry), pool, new RiskAnalyzer(), predictionService, parameterStore,
            properties, meterRegistry);
        orchestrator = new ScanOrchestrator(planner,
            new PlanRegistry(Caffeine.newBuilder().maximumSize(100).build(), meterRegistry),
            engine, workflowFactory, pool, optimizer, alertEvaluator, predictionService,
            new PerformanceSeriesStore(Caffeine.newBuilder().maximumSize(100).build(), properties),
            hookProvider, properties, meterRegistry);
        orchestrator.init();
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
        engine.shutdown();
        predictionService.shutdown();
    }

    private static ScanRequest request(String id) {
        return ScanRequest.of(id, "ds-" + id, List.of(RuleSpec.of("rule-" + id, ComplexityLevel.MODERATE)));
    }

    @FunctionalInterface
    private interface StepBody {
        Map<String, Object> run(StepContext context) throws Exception;
    }

    private static WorkflowReport workflow(OrchestrationReport report, String workflowId) {
        return report.workflows().stream()
            .filter(w -> w.workflowId().equals(workflowId))
            .findFirst()
            .orElseThrow();
    }

    private void handle(StepType type, StepBody body) {
        handlers.register(new StepHandler() {
            @Override
            public StepType type() {
                return type;
            }

            @Override
            public Map<String, Object> execute(StepContext context) throws Exception {
                return body.run(context);
            }
        });
    }

    @Test
    @DisplayName("正常执行：全部工作流完成，资源全部归还")
    void testHappyPath() {
        handle(StepType.SCAN, ctx -> Map.of("records_processed", 1000, "accuracy", 0.95));
        ExecutionPlan plan = orchestrator.createPlan(OrchestrationRequest.of(
            List.of(request("a"), request("b"), request("c"))));

        OrchestrationReport report = orchestrator.executePlan(plan.planId(), OrchestrationMode.MANUAL);

        assertEquals(PlanStatus.COMPLETED, report.status());
        assertEquals(3, report.workflows().size());
        assertTrue(report.workflows().stream().allMatch(w -> w.status() == WorkflowStatus.COMPLETED));
        assertEquals(3, report.allocationsReleased());
        assertEquals(CAPACITY, pool.available());
        assertEquals(0, pool.snapshot().activeAllocations());
        assertTrue(report.summary().contains("3/3 workflows completed"));

        assertEquals(report, orchestrator.getReport(plan.planId()).orElseThrow());
        PlanStatusView status = orchestrator.getStatus(plan.planId());
        assertEquals(100.0, status.progressPercent());
        assertEquals(3, status.workflowsCompleted());
        // 每条规则的 SCAN 步骤都产生一条训练记录
        assertEquals(3, predictionService.trainingHistorySize());
    }

    @Test
    @DisplayName("计划只能执行一次")
    void testExecuteTwice() {
        ExecutionPlan plan = orchestrator.createPlan(OrchestrationRequest.of(List.of(request("a"))));
        orchestrator.executePlan(plan.planId(), OrchestrationMode.MANUAL);

        assertThrows(IllegalStateException.class,
            () -> orchestrator.executePlan(plan.planId(), OrchestrationMode.MANUAL));
        assertThrows(IllegalStateException.class,
            () -> orchestrator.executeAsync(plan.planId(), OrchestrationMode.MANUAL));
    }

    @Test
    @DisplayName("未知计划抛 PlanNotFoundException")
    void testUnknownPlan() {
        assertThrows(PlanNotFoundException.class, () -> orchestrator.getStatus("plan_missing"));
        assertThrows(PlanNotFoundException.class, () -> orchestrator.cancel("plan_missing", null));
    }

    @Test
    @DisplayName("启动前取消：计划 CANCELLED，重复取消返回 false")
    void testCancelBeforeStart() {
        ExecutionPlan plan = orchestrator.createPlan(OrchestrationRequest.of(List.of(request("a"), request("b"))));

        assertTrue(orchestrator.cancel(plan.planId(), "no longer needed"));
        assertFalse(orchestrator.cancel(plan.planId(), "again"));

        OrchestrationReport report = orchestrator.getReport(plan.planId()).orElseThrow();
        assertEquals(PlanStatus.CANCELLED, report.status());
        assertEquals("no longer needed", report.stopReason());
        assertTrue(report.workflows().stream().allMatch(w -> w.status() == WorkflowStatus.CANCELLED));
        assertThrows(IllegalStateException.class,
            () -> orchestrator.executePlan(plan.planId(), OrchestrationMode.MANUAL));
        assertEquals(CAPACITY, pool.available());
    }

    @Test
    @DisplayName("执行中取消：在途工作流收尾，其余取消，资源归还")
    void testCancelWhileRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        handle(StepType.SCAN, ctx -> {
            started.countDown();
            while (!ctx.cancellationToken().isCancelled()) {
                Thread.sleep(10);
            }
            return Map.of();
        });
        ExecutionPlan plan = orchestrator.createPlan(new OrchestrationRequest(
            List.of(request("a"), request("b")), null, "sequential", null, null));

        var future = orchestrator.executeAsync(plan.planId(), OrchestrationMode.MANUAL);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(orchestrator.cancel(plan.planId(), "operator"));

        OrchestrationReport report = future.get(10, TimeUnit.SECONDS);
        assertEquals(PlanStatus.CANCELLED, report.status());
        assertEquals(WorkflowStatus.CANCELLED, workflow(report, "wf_b").status());
        assertEquals(CAPACITY, pool.available());
    }

    @Test
    @DisplayName("关键路径工作流失败：终止计划，后续工作流跳过")
    void testCriticalPathFailureStopsPlan() {
        handle(StepType.SCAN, ctx -> {
            throw new IllegalStateException("connector unavailable");
        });
        ExecutionPlan plan = orchestrator.createPlan(new OrchestrationRequest(
            List.of(request("a").asCriticalPath(), request("b")), null, "sequential", null, null));

        OrchestrationReport report = orchestrator.executePlan(plan.planId(), OrchestrationMode.MANUAL);

        assertEquals(PlanStatus.STOPPED_CRITICAL_FAILURE, report.status());
        assertTrue(report.stopReason().contains("wf_a"));
        assertEquals(WorkflowStatus.FAILED, workflow(report, "wf_a").status());
        assertEquals(WorkflowStatus.SKIPPED, workflow(report, "wf_b").status());
        assertEquals(CAPACITY, pool.available());
    }

    @Test
    @DisplayName("非关键工作流失败：下游跳过，其余继续，结果部分失败")
    void testUpstreamFailureSkipsDownstream() {
        handle(StepType.SCAN, ctx -> {
            if ("rule-a".equals(ctx.step().ruleId())) {
                throw new IllegalStateException("bad rule");
            }
            return Map.of();
        });
        ExecutionPlan plan = orchestrator.createPlan(OrchestrationRequest.of(List.of(
            request("a"), request("b").withDependsOn(Set.of("a")), request("c"))));

        OrchestrationReport report = orchestrator.executePlan(plan.planId(), OrchestrationMode.MANUAL);

        assertEquals(PlanStatus.PARTIALLY_FAILED, report.status());
        Map<String, WorkflowStatus> statuses = orchestrator.getStatus(plan.planId()).workflowStatuses();
        assertEquals(WorkflowStatus.FAILED, statuses.get("wf_a"));
        assertEquals(WorkflowStatus.SKIPPED, statuses.get("wf_b"));
        assertEquals(WorkflowStatus.COMPLETED, statuses.get("wf_c"));
        assertEquals(FailureReason.DEPENDENCY_FAILED, workflow(report, "wf_b").failureReason());
    }

    @Test
    @DisplayName("QUEUE 策略：资源不足时排队等待，最终全部完成")
    void testQueueWaitsForResources() {
        orchestrator.shutdown();
        engine.shutdown();
        predictionService.shutdown();
        properties.getOrchestrator().setInsufficientResourcesPolicy(InsufficientResourcesPolicy.QUEUE);
        // 每个工作流需要 2 核，一次只放得下两个
        ResourceRequirement small = new ResourceRequirement(4, 65536, 1000, 1000);
        build(small);

        ExecutionPlan plan = orchestrator.createPlan(OrchestrationRequest.of(
            List.of(request("a"), request("b"), request("c"))));
        OrchestrationReport report = orchestrator.executePlan(plan.planId(), OrchestrationMode.MANUAL);

        assertEquals(PlanStatus.COMPLETED, report.status());
        assertEquals(small, pool.available());
    }

    @Test
    @DisplayName("取消单个工作流不影响其它工作流")
    void testCancelSingleWorkflow() {
        ExecutionPlan plan = orchestrator.createPlan(OrchestrationRequest.of(List.of(request("a"), request("b"))));

        assertTrue(orchestrator.cancelWorkflow(plan.planId(), "wf_b", "not needed"));
        assertThrows(IllegalArgumentException.class,
            () -> orchestrator.cancelWorkflow(plan.planId(), "wf_zzz", null));

        OrchestrationReport report = orchestrator.executePlan(plan.planId(), OrchestrationMode.MANUAL);

        assertEquals(WorkflowStatus.COMPLETED, workflow(report, "wf_a").status());
        assertEquals(WorkflowStatus.CANCELLED, workflow(report, "wf_b").status());
        assertEquals(PlanStatus.PARTIALLY_FAILED, report.status());
    }

    @Test
    @DisplayName("统计：成功率与平均耗时")
    void testAnalytics() {
        ExecutionPlan first = orchestrator.createPlan(OrchestrationRequest.of(List.of(request("a"))));
        orchestrator.executePlan(first.planId(), OrchestrationMode.MANUAL);
        ExecutionPlan second = orchestrator.createPlan(OrchestrationRequest.of(List.of(request("b"))));
        orchestrator.cancel(second.planId(), null);

        OrchestrationAnalytics analytics = orchestrator.analytics();

        assertEquals(2, analytics.plansCreated());
        assertEquals(0, analytics.activePlans());
        assertEquals(1L, analytics.plansByStatus().get(PlanStatus.COMPLETED));
        assertEquals(1L, analytics.plansByStatus().get(PlanStatus.CANCELLED));
        assertEquals(0.5, analytics.successRate());
        assertEquals(1.0, meterRegistry.get("orchestration.plan.executions")
            .tag("status", "completed").counter().count());
    }

    @Test
    @DisplayName("审批策略：SUPERVISED 无确认钩子时不应用，有钩子时按钩子决定")
    void testApprovalByMode() {
        ParameterRecommendation safe = new ParameterRecommendation("rule-a", "execution_timeout", 300, 360,
            0.15, 0.9, 0.9, "reduce timeout-related failures");
        ParameterRecommendation risky = new ParameterRecommendation("rule-a", "sensitivity_threshold", 0.5, 0.475,
            0.08, 0.75, 0.75, "improve detection accuracy");

        assertTrue(orchestrator.approvalFor(OrchestrationMode.AUTONOMOUS, "p").approve(safe));
        assertFalse(orchestrator.approvalFor(OrchestrationMode.AUTONOMOUS, "p").approve(risky));
        // HYBRID 需要安全分严格大于 0.9
        assertFalse(orchestrator.approvalFor(OrchestrationMode.HYBRID, "p").approve(safe));
        assertFalse(orchestrator.approvalFor(OrchestrationMode.MANUAL, "p").approve(safe));
        assertFalse(orchestrator.approvalFor(OrchestrationMode.SUPERVISED, "p").approve(safe));

        when(hookProvider.getIfAvailable()).thenReturn((planId, recommendation) -> "p".equals(planId));
        AdaptationApproval supervised = orchestrator.approvalFor(OrchestrationMode.SUPERVISED, "p");
        assertTrue(supervised.approve(safe));
        assertFalse(supervised.approve(risky));
        assertFalse(orchestrator.approvalFor(OrchestrationMode.SUPERVISED, "other").approve(safe));
    }
}
