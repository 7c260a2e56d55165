package com.governance.orchestration.workflow;

import com.governance.orchestration.config.OrchestrationProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 工作流执行引擎单元测试
 */
class WorkflowExecutionEngineTest {

    private WorkflowExecutionEngine engine;
    private StepHandlerRegistry registry;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        OrchestrationProperties properties = new OrchestrationProperties();
        properties.getWorkflow().setDefaultStepTimeout(Duration.ofSeconds(5));
        properties.getWorkflow().setRetryInitialBackoff(Duration.ofMillis(10));
        properties.getWorkflow().setSamplingInterval(Duration.ofMillis(20));
        properties.getWorkflow().setCancellationGracePeriod(Duration.ofMillis(500));
        properties.getWorkflow().setStepPoolSize(4);

        registry = new StepHandlerRegistry();
        meterRegistry = new SimpleMeterRegistry();
        ResourceUsageSampler sampler = () -> new ResourceSample(Instant.now(), 0.1, 64, 1024, 10);
        engine = new WorkflowExecutionEngine(properties, registry, sampler, meterRegistry);
        engine.init();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private void handle(StepType type, Function<StepContext, Map<String, Object>> body) {
        registry.register(new StepHandler() {
            @Override
            public StepType type() {
                return type;
            }

            @Override
            public Map<String, Object> execute(StepContext context) {
                return body.apply(context);
            }
        });
    }

    @Test
    @DisplayName("依赖顺序执行，全部完成")
    void testCompletesInDependencyOrder() {
        List<String> executed = new CopyOnWriteArrayList<>();
        handle(StepType.SCAN, ctx -> {
            executed.add(ctx.step().stepId());
            return Map.of("rows", 10);
        });
        handle(StepType.VALIDATION, ctx -> {
            executed.add(ctx.step().stepId());
            return Map.of();
        });
        Workflow workflow = Workflow.of("wf-1", List.of(
            WorkflowStep.of("scan", StepType.SCAN),
            WorkflowStep.of("validate", StepType.VALIDATION, "scan")));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", new CancellationToken());

        assertEquals(WorkflowStatus.COMPLETED, record.getStatus());
        assertEquals(List.of("scan", "validate"), executed);
        assertEquals(2, record.getStepsCompleted());
        assertEquals(10, record.getStep("scan").getOutput().get("rows"));
        assertEquals(1, record.getStep("scan").getAttempts());
    }

    @Test
    @DisplayName("必需步骤失败短路，下游跳过")
    void testRequiredStepFailureShortCircuits() {
        handle(StepType.SCAN, ctx -> {
            throw new IllegalStateException("connector down");
        });
        Workflow workflow = Workflow.of("wf-2", List.of(
            WorkflowStep.of("scan", StepType.SCAN),
            WorkflowStep.of("validate", StepType.VALIDATION, "scan")));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", new CancellationToken());

        assertEquals(WorkflowStatus.FAILED, record.getStatus());
        assertEquals(FailureReason.LOGIC_ERROR, record.getFailureReason());
        assertEquals(StepStatus.FAILED, record.getStep("scan").getStatus());
        assertEquals(StepStatus.SKIPPED, record.getStep("validate").getStatus());
        // 逻辑错误不重试
        assertEquals(1, record.getStep("scan").getAttempts());
    }

    @Test
    @DisplayName("可选步骤失败不影响工作流，依赖它的步骤跳过")
    void testOptionalStepFailureContinues() {
        handle(StepType.QUALITY_CHECK, ctx -> {
            throw new IllegalArgumentException("bad sample");
        });
        Workflow workflow = Workflow.of("wf-3", List.of(
            WorkflowStep.of("scan", StepType.SCAN),
            WorkflowStep.of("quality", StepType.QUALITY_CHECK, "scan").optional(),
            new WorkflowStep("notify", "notify", StepType.NOTIFICATION, Set.of("quality"), false, null, 0, null, Map.of()),
            WorkflowStep.of("report", StepType.VALIDATION, "scan")));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", new CancellationToken());

        assertEquals(WorkflowStatus.COMPLETED, record.getStatus());
        assertEquals(StepStatus.FAILED, record.getStep("quality").getStatus());
        assertEquals(StepStatus.SKIPPED, record.getStep("notify").getStatus());
        assertEquals(StepStatus.COMPLETED, record.getStep("report").getStatus());
    }

    @Test
    @DisplayName("超时按重试次数重试后失败，原因为 TIMEOUT")
    void testTimeoutRetriedThenFails() {
        AtomicInteger calls = new AtomicInteger();
        handle(StepType.SCAN, ctx -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Map.of();
        });
        Workflow workflow = Workflow.of("wf-4", List.of(
            WorkflowStep.of("scan", StepType.SCAN).withTimeout(Duration.ofMillis(50)).withMaxAttempts(2)));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", new CancellationToken());

        assertEquals(WorkflowStatus.FAILED, record.getStatus());
        assertEquals(FailureReason.TIMEOUT, record.getFailureReason());
        assertEquals(2, record.getStep("scan").getAttempts());
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("超时后重试成功")
    void testTimeoutThenSuccess() {
        AtomicInteger calls = new AtomicInteger();
        handle(StepType.SCAN, ctx -> {
            if (calls.incrementAndGet() == 1) {
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return Map.of("attempt", ctx.attempt());
        });
        Workflow workflow = Workflow.of("wf-5", List.of(
            WorkflowStep.of("scan", StepType.SCAN).withTimeout(Duration.ofMillis(100))));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", new CancellationToken());

        assertEquals(WorkflowStatus.COMPLETED, record.getStatus());
        assertEquals(2, record.getStep("scan").getAttempts());
        assertEquals(2, record.getStep("scan").getOutput().get("attempt"));
    }

    @Test
    @DisplayName("没有处理器的步骤默认直接通过")
    void testUnhandledStepPassesThrough() {
        Workflow workflow = Workflow.of("wf-6", List.of(WorkflowStep.of("notify", StepType.NOTIFICATION)));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", new CancellationToken());

        assertEquals(WorkflowStatus.COMPLETED, record.getStatus());
        assertEquals(false, record.getStep("notify").getOutput().get("handled"));
    }

    @Test
    @DisplayName("依赖不存在时以 CONFIGURATION 失败")
    void testUnresolvableDependency() {
        Workflow workflow = Workflow.of("wf-7", List.of(
            WorkflowStep.of("scan", StepType.SCAN, "missing")));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", new CancellationToken());

        assertEquals(WorkflowStatus.FAILED, record.getStatus());
        assertEquals(FailureReason.CONFIGURATION, record.getFailureReason());
    }

    @Test
    @DisplayName("已取消的令牌：步骤不启动，工作流 CANCELLED")
    void testCancelledBeforeStart() {
        CancellationToken token = new CancellationToken();
        token.cancel("operator");
        Workflow workflow = Workflow.of("wf-8", List.of(WorkflowStep.of("scan", StepType.SCAN)));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", token);

        assertEquals(WorkflowStatus.CANCELLED, record.getStatus());
        assertEquals(StepStatus.CANCELLED, record.getStep("scan").getStatus());
    }

    @Test
    @DisplayName("运行中取消：在途步骤跑完，后续步骤取消")
    void testCancelWhileRunning() {
        CancellationToken token = new CancellationToken();
        handle(StepType.SCAN, ctx -> {
            token.cancel("operator");
            return Map.of();
        });
        Workflow workflow = Workflow.of("wf-9", List.of(
            WorkflowStep.of("scan", StepType.SCAN),
            WorkflowStep.of("validate", StepType.VALIDATION, "scan")));

        WorkflowExecutionRecord record = engine.execute(workflow, "plan-1", token);

        assertEquals(WorkflowStatus.CANCELLED, record.getStatus());
        assertEquals(StepStatus.COMPLETED, record.getStep("scan").getStatus());
        assertEquals(StepStatus.CANCELLED, record.getStep("validate").getStatus());
    }

    @Test
    @DisplayName("同一工作流内并行步骤不超过上限")
    void testParallelismBounded() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Map<String, Boolean> seen = new ConcurrentHashMap<>();
        handle(StepType.SCAN, ctx -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            seen.put(ctx.step().stepId(), true);
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return Map.of();
        });
        List<WorkflowStep> steps = List.of(
            WorkflowStep.of("s1", StepType.SCAN), WorkflowStep.of("s2", StepType.SCAN),
            WorkflowStep.of("s3", StepType.SCAN), WorkflowStep.of("s4", StepType.SCAN),
            WorkflowStep.of("s5", StepType.SCAN), WorkflowStep.of("s6", StepType.SCAN));

        WorkflowExecutionRecord record = engine.execute(Workflow.of("wf-10", steps), "plan-1", new CancellationToken());

        assertEquals(WorkflowStatus.COMPLETED, record.getStatus());
        assertEquals(6, seen.size());
        assertTrue(peak.get() <= 4, "peak parallelism " + peak.get());
    }

    @Test
    @DisplayName("静态分析：分层与关键路径")
    void testAnalyze() {
        Workflow workflow = Workflow.of("wf-11", List.of(
            WorkflowStep.of("scan", StepType.SCAN).withTimeout(Duration.ofSeconds(10)),
            WorkflowStep.of("quality", StepType.QUALITY_CHECK, "scan").withTimeout(Duration.ofSeconds(1)),
            WorkflowStep.of("compliance", StepType.COMPLIANCE_CHECK, "scan").withTimeout(Duration.ofSeconds(3))));

        WorkflowAnalysis analysis = engine.analyze(workflow);

        assertEquals(2, analysis.levels().size());
        assertEquals(List.of("scan", "compliance"), analysis.criticalPath());
        assertEquals(Duration.ofSeconds(13), analysis.criticalPathDuration());
    }
}
