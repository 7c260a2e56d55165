package com.governance.orchestration.orchestrator;

import com.governance.orchestration.alert.Alert;
import com.governance.orchestration.alert.AlertEvaluator;
import com.governance.orchestration.alert.AlertMetrics;
import com.governance.orchestration.alert.AlertSeverity;
import com.governance.orchestration.alert.PerformanceSnapshot;
import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.config.OrchestrationProperties.InsufficientResourcesPolicy;
import com.governance.orchestration.constant.OrchestrationConstants;
import com.governance.orchestration.decision.DecisionEngine;
import com.governance.orchestration.decision.OrchestrationStrategy;
import com.governance.orchestration.optimizer.AdaptationApproval;
import com.governance.orchestration.optimizer.AdaptationOutcome;
import com.governance.orchestration.optimizer.AdaptiveOptimizer;
import com.governance.orchestration.optimizer.AppliedChange;
import com.governance.orchestration.optimizer.ParameterRecommendation;
import com.governance.orchestration.predictor.ExecutionRecord;
import com.governance.orchestration.predictor.FeatureVector;
import com.governance.orchestration.predictor.ModelQualityReport;
import com.governance.orchestration.resource.Allocation;
import com.governance.orchestration.resource.AllocationResult;
import com.governance.orchestration.resource.ResourcePool;
import com.governance.orchestration.resource.ResourceRequirement;
import com.governance.orchestration.service.PerformanceSeriesStore;
import com.governance.orchestration.service.PredictionService;
import com.governance.orchestration.workflow.CancellationToken;
import com.governance.orchestration.workflow.DependencyGraph;
import com.governance.orchestration.workflow.FailureReason;
import com.governance.orchestration.workflow.StepExecutionRecord;
import com.governance.orchestration.workflow.StepPerformance;
import com.governance.orchestration.workflow.StepType;
import com.governance.orchestration.workflow.Workflow;
import com.governance.orchestration.workflow.WorkflowExecutionEngine;
import com.governance.orchestration.workflow.WorkflowExecutionRecord;
import com.governance.orchestration.workflow.WorkflowStatus;
import com.governance.orchestration.workflow.WorkflowStep;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 扫描编排入口：建计划、按模式执行、取消、状态查询、报告
 *
 * <p>执行由一个协调线程驱动：按 executionOrder 逐个放行工作流，放行前检查上游状态、
 * 并发上限和资源；工作流本身在独立的线程池里由 {@link WorkflowExecutionEngine} 执行。
 * 每个工作流结束后立即归还其资源，计划结束时再按属主兜底释放一次。
 *
 * <p>各模式对参数调整的处理：
 * <ul>
 *   <li>AUTONOMOUS：执行前先做一轮调整，安全分超过自动阈值的建议直接应用，执行后用结果重训预测器</li>
 *   <li>SUPERVISED：安全分超过自动阈值且 {@link AdaptationConfirmationHook} 确认才应用</li>
 *   <li>HYBRID：只自动应用安全分超过更高阈值的建议</li>
 *   <li>MANUAL：只记录建议</li>
 * </ul>
 */
@Component
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private static final Duration COMPLETION_POLL = Duration.ofMillis(200);

    private final ExecutionPlanner planner;
    private final PlanRegistry registry;
    private final WorkflowExecutionEngine engine;
    private final WorkflowFactory workflowFactory;
    private final ResourcePool resourcePool;
    private final AdaptiveOptimizer optimizer;
    private final AlertEvaluator alertEvaluator;
    private final PredictionService predictionService;
    private final PerformanceSeriesStore seriesStore;
    private final ObjectProvider<AdaptationConfirmationHook> confirmationHook;
    private final OrchestrationProperties properties;
    private final MeterRegistry meterRegistry;

    private final AtomicLong plansCreated = new AtomicLong();
    private final AtomicLong adaptationsApplied = new AtomicLong();
    private final AtomicLong totalDurationMs = new AtomicLong();
    private final AtomicLong executedPlans = new AtomicLong();
    private final Map<PlanStatus, AtomicLong> finishedByStatus = new EnumMap<>(PlanStatus.class);

    private ExecutorService workflowExecutor;
    private ExecutorService coordinatorExecutor;

    public ScanOrchestrator(ExecutionPlanner planner,
                            PlanRegistry registry,
                            WorkflowExecutionEngine engine,
                            WorkflowFactory workflowFactory,
                            ResourcePool resourcePool,
                            AdaptiveOptimizer optimizer,
                            AlertEvaluator alertEvaluator,
                            PredictionService predictionService,
                            PerformanceSeriesStore seriesStore,
                            ObjectProvider<AdaptationConfirmationHook> confirmationHook,
                            OrchestrationProperties properties,
                            MeterRegistry meterRegistry) {
        this.planner = planner;
        this.registry = registry;
        this.engine = engine;
        this.workflowFactory = workflowFactory;
        this.resourcePool = resourcePool;
        this.optimizer = optimizer;
        this.alertEvaluator = alertEvaluator;
        this.predictionService = predictionService;
        this.seriesStore = seriesStore;
        this.confirmationHook = confirmationHook;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        for (PlanStatus status : PlanStatus.values()) {
            if (status.isTerminal()) {
                finishedByStatus.put(status, new AtomicLong());
            }
        }
    }

    @PostConstruct
    public void init() {
        OrchestrationProperties.OrchestratorConfig config = properties.getOrchestrator();
        this.workflowExecutor = Executors.newFixedThreadPool(config.getWorkflowPoolSize(), namedDaemon("workflow-runner"));
        this.coordinatorExecutor = Executors.newFixedThreadPool(config.getCoordinatorPoolSize(),
            namedDaemon("plan-coordinator"));
        log.info("ScanOrchestrator initialized: workflowPool={}, coordinatorPool={}, maxConcurrentWorkflows={}",
            config.getWorkflowPoolSize(), config.getCoordinatorPoolSize(), config.getMaxConcurrentWorkflows());
    }

    @PreDestroy
    public void shutdown() {
        for (PlanExecution execution : registry.activePlans()) {
            cancelTokens(execution, "orchestrator shutting down");
        }
        coordinatorExecutor.shutdown();
        workflowExecutor.shutdown();
        try {
            long graceMs = properties.getWorkflow().getCancellationGracePeriod().toMillis();
            if (!coordinatorExecutor.awaitTermination(graceMs, TimeUnit.MILLISECONDS)) {
                coordinatorExecutor.shutdownNow();
            }
            if (!workflowExecutor.awaitTermination(graceMs, TimeUnit.MILLISECONDS)) {
                workflowExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            coordinatorExecutor.shutdownNow();
            workflowExecutor.shutdownNow();
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ==================== 计划 ====================

    /**
     * 建计划并登记，计划处于 CREATED 状态等待执行
     *
     * @throws com.governance.orchestration.exception.PlanConfigurationException 请求或依赖配置非法
     * @throws com.governance.orchestration.exception.InsufficientResourcesException 资源永远无法满足
     */
    public ExecutionPlan createPlan(OrchestrationRequest request) {
        ExecutionPlan plan = planner.createPlan(request);
        registry.register(new PlanExecution(plan));
        plansCreated.incrementAndGet();
        return plan;
    }

    /**
     * 同步执行计划，返回最终报告
     *
     * @throws IllegalStateException 计划不是 CREATED 状态
     */
    public OrchestrationReport executePlan(String planId, OrchestrationMode mode) {
        return run(registry.require(planId), mode);
    }

    /**
     * 在协调线程池上执行计划
     */
    public CompletableFuture<OrchestrationReport> executeAsync(String planId, OrchestrationMode mode) {
        PlanExecution execution = registry.require(planId);
        if (execution.getStatus() != PlanStatus.CREATED) {
            throw new IllegalStateException("Plan " + planId + " is " + execution.getStatus()
                + ", only CREATED plans can be executed");
        }
        return CompletableFuture.supplyAsync(() -> run(execution, mode), coordinatorExecutor);
    }

    /**
     * 建计划并立即异步执行
     */
    public ExecutionPlan submit(OrchestrationRequest request, OrchestrationMode mode) {
        ExecutionPlan plan = createPlan(request);
        executeAsync(plan.planId(), mode).whenComplete((report, error) -> {
            if (error != null) {
                log.error("Plan {} execution failed", plan.planId(), error);
            }
        });
        return plan;
    }

    /**
     * 取消计划，可重复调用
     *
     * @return 本次调用是否真正触发了取消
     * @throws com.governance.orchestration.exception.PlanNotFoundException 计划不存在
     */
    public boolean cancel(String planId, String reason) {
        PlanExecution execution = registry.require(planId);
        String cancelReason = reason == null || reason.isBlank() ? "cancelled by caller" : reason;
        if (execution.isTerminal()) {
            log.debug("Cancel ignored, plan {} already {}", planId, execution.getStatus());
            return false;
        }
        boolean signalled = cancelTokens(execution, cancelReason);
        if (execution.cancelBeforeStart(cancelReason)) {
            for (WorkflowExecutionRecord record : execution.getWorkflowRecords().values()) {
                record.finish(WorkflowStatus.CANCELLED, FailureReason.CANCELLED, "plan cancelled: " + cancelReason);
            }
            int released = resourcePool.releaseAll(planId);
            RunState state = new RunState();
            state.allocationsReleased = released;
            execution.attachReport(buildReport(execution, PlanStatus.CANCELLED, cancelReason, state));
            recordFinished(execution, PlanStatus.CANCELLED);
            registry.archive(execution);
            log.info("Plan {} cancelled before start: {}", planId, cancelReason);
            return true;
        }
        if (signalled) {
            log.info("Plan {} cancellation requested: {}", planId, cancelReason);
        }
        return signalled;
    }

    /**
     * 取消计划中的单个工作流；已启动的步骤按宽限期收尾，资源在工作流结束时归还
     *
     * @return 本次调用是否真正触发了取消
     */
    public boolean cancelWorkflow(String planId, String workflowId, String reason) {
        PlanExecution execution = registry.require(planId);
        CancellationToken token = execution.getWorkflowToken(workflowId);
        if (token == null) {
            throw new IllegalArgumentException("Plan " + planId + " has no workflow " + workflowId);
        }
        if (execution.isTerminal() || execution.getWorkflowRecord(workflowId).isTerminal()) {
            return false;
        }
        boolean signalled = token.cancel(reason == null || reason.isBlank() ? "cancelled by caller" : reason);
        if (signalled) {
            log.info("Workflow {} of plan {} cancellation requested: {}", workflowId, planId, token.getReason());
        }
        return signalled;
    }

    private static boolean cancelTokens(PlanExecution execution, String reason) {
        boolean signalled = execution.getCancellationToken().cancel(reason);
        for (String workflowId : execution.getPlan().workflowIds()) {
            execution.getWorkflowToken(workflowId).cancel(reason);
        }
        return signalled;
    }

    public PlanStatusView getStatus(String planId) {
        PlanExecution execution = registry.require(planId);
        Map<String, WorkflowStatus> statuses = new LinkedHashMap<>();
        Map<String, Map<String, StepPerformance>> performance = new LinkedHashMap<>();
        int completed = 0;
        int failed = 0;
        int running = 0;
        int queued = 0;
        int terminal = 0;
        for (Map.Entry<String, WorkflowExecutionRecord> entry : execution.getWorkflowRecords().entrySet()) {
            WorkflowExecutionRecord record = entry.getValue();
            WorkflowStatus status = record.getStatus();
            statuses.put(entry.getKey(), status);
            performance.put(entry.getKey(), record.getPerformanceData());
            switch (status) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case RUNNING -> running++;
                case QUEUED -> queued++;
                default -> {
                }
            }
            if (status.isTerminal()) {
                terminal++;
            }
        }
        int total = statuses.size();
        List<ResourceRequirement> held = new ArrayList<>();
        for (Allocation allocation : resourcePool.allocationsOf(planId)) {
            held.add(allocation.getRequirement());
        }
        double progress = total == 0 ? 100.0 : Math.round(terminal * 1000.0 / total) / 10.0;
        return new PlanStatusView(planId, execution.getStatus(), execution.getMode(), progress, total,
            completed, failed, running, queued, statuses, ExecutionPlanner.sum(held), resourcePool.snapshot(),
            performance, alertEvaluator.activeAlerts(), execution.getStartedAt(), execution.getDuration().toMillis());
    }

    /**
     * 已结束计划的报告
     */
    public Optional<OrchestrationReport> getReport(String planId) {
        return Optional.ofNullable(registry.require(planId).getReport());
    }

    public ExecutionPlan getPlan(String planId) {
        return registry.require(planId).getPlan();
    }

    public OrchestrationAnalytics analytics() {
        Map<PlanStatus, Long> byStatus = new EnumMap<>(PlanStatus.class);
        long finished = 0;
        for (Map.Entry<PlanStatus, AtomicLong> entry : finishedByStatus.entrySet()) {
            long count = entry.getValue().get();
            byStatus.put(entry.getKey(), count);
            finished += count;
        }
        long completed = byStatus.getOrDefault(PlanStatus.COMPLETED, 0L);
        double successRate = finished == 0 ? 0.0 : (double) completed / finished;
        long executed = executedPlans.get();
        long averageMs = executed == 0 ? 0 : totalDurationMs.get() / executed;
        return new OrchestrationAnalytics(plansCreated.get(), registry.activeCount(),
            registry.finishedPlans().size(), byStatus, successRate, averageMs, adaptationsApplied.get(),
            alertEvaluator.activeAlerts().size(), predictionService.lastQuality().status(),
            predictionService.trainingHistorySize());
    }

    /**
     * 计划之外对单条规则做一次自适应评估，按给定模式决定是否应用
     */
    public AdaptationOutcome adaptRule(String ruleId, OrchestrationMode mode) {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId must not be blank");
        }
        OrchestrationMode effectiveMode = mode == null ? OrchestrationMode.MANUAL : mode;
        AdaptationOutcome outcome = optimizer.maybeAdapt(ruleId, approvalFor(effectiveMode, "rule:" + ruleId));
        adaptationsApplied.addAndGet(outcome.applied().size());
        return outcome;
    }

    /**
     * 用外部提供的执行记录训练预测器，记录同时并入训练历史
     */
    public ModelQualityReport trainPredictor(List<ExecutionRecord> records) {
        predictionService.record(records);
        return predictionService.train(records);
    }

    // ==================== 执行 ====================

    private OrchestrationReport run(PlanExecution execution, OrchestrationMode mode) {
        String planId = execution.getPlanId();
        OrchestrationMode effectiveMode = mode == null ? OrchestrationMode.SUPERVISED : mode;
        if (!execution.start(effectiveMode)) {
            throw new IllegalStateException("Plan " + planId + " is " + execution.getStatus()
                + ", only CREATED plans can be executed");
        }
        ExecutionPlan plan = execution.getPlan();
        log.info("Executing plan {}: mode={}, strategy={}, workflows={}",
            planId, effectiveMode, plan.strategy().strategy(), plan.workflows().size());

        RunState state = new RunState();
        try {
            if (effectiveMode == OrchestrationMode.AUTONOMOUS) {
                preExecutionOptimization(execution, state);
            }
            coordinate(execution, effectiveMode, state);
        } catch (RuntimeException e) {
            log.error("Plan {} aborted by orchestrator error", planId, e);
            state.abortError = "orchestrator error: " + e.getMessage();
            for (WorkflowExecutionRecord record : execution.getWorkflowRecords().values()) {
                record.finish(WorkflowStatus.FAILED, FailureReason.LOGIC_ERROR, state.abortError);
            }
        } finally {
            state.allocationsReleased += resourcePool.releaseAll(planId);
        }

        learnFromExecution(effectiveMode, state);

        PlanStatus status = resolveStatus(execution, state);
        String stopReason = switch (status) {
            case CANCELLED -> execution.getCancellationToken().getReason();
            case STOPPED_CRITICAL_FAILURE -> OrchestrationConstants.STOPPED_DUE_TO_CRITICAL_FAILURE
                + (state.criticalWorkflow != null ? ": " + state.criticalWorkflow : "");
            case FAILED -> state.abortError;
            default -> null;
        };
        OrchestrationReport report = buildReport(execution, status, stopReason, state);
        execution.finish(status, stopReason, report);
        recordFinished(execution, status);
        registry.archive(execution);
        log.info("Plan {} finished: {}", planId, report.summary());
        return report;
    }

    private void coordinate(PlanExecution execution, OrchestrationMode mode, RunState state) {
        ExecutionPlan plan = execution.getPlan();
        CancellationToken planToken = execution.getCancellationToken();
        Duration retryInterval = properties.getOrchestrator().getAdmissionRetryInterval();
        Map<String, Integer> levelOf = workflowLevels(plan);

        List<String> pending = new ArrayList<>(plan.executionOrder());
        Map<String, Future<String>> inFlight = new LinkedHashMap<>();
        Map<String, Allocation> held = new HashMap<>();
        CompletionService<String> completion = new ExecutorCompletionService<>(workflowExecutor);

        while (!pending.isEmpty() || !inFlight.isEmpty()) {
            boolean waitingForResources = false;
            if (planToken.isCancelled()) {
                finishPending(execution, pending, WorkflowStatus.CANCELLED, FailureReason.CANCELLED,
                    "plan cancelled: " + planToken.getReason());
            } else if (state.stopped) {
                finishPending(execution, pending, WorkflowStatus.SKIPPED, FailureReason.DEPENDENCY_FAILED,
                    OrchestrationConstants.STOPPED_DUE_TO_CRITICAL_FAILURE);
            } else {
                waitingForResources = startEligible(execution, pending, inFlight, held, completion, levelOf, state);
            }

            if (inFlight.isEmpty()) {
                if (pending.isEmpty()) {
                    break;
                }
                if (waitingForResources || planToken.isCancelled() || state.stopped) {
                    if (!pause(retryInterval, planToken)) {
                        finishPending(execution, pending, WorkflowStatus.CANCELLED, FailureReason.CANCELLED,
                            "coordinator interrupted");
                        return;
                    }
                    continue;
                }
                log.error("Plan {} has {} workflow(s) that can never start", plan.planId(), pending.size());
                finishPending(execution, pending, WorkflowStatus.FAILED, FailureReason.CONFIGURATION,
                    "unresolvable workflow dependency");
                break;
            }

            Future<String> done;
            try {
                done = completion.poll(waitingForResources ? retryInterval.toMillis() : COMPLETION_POLL.toMillis(),
                    TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelTokens(execution, "coordinator interrupted");
                finishPending(execution, pending, WorkflowStatus.CANCELLED, FailureReason.CANCELLED,
                    "coordinator interrupted");
                return;
            }
            if (done == null) {
                continue;
            }
            String workflowId = keyOf(inFlight, done);
            if (workflowId == null) {
                continue;
            }
            inFlight.remove(workflowId);
            Allocation allocation = held.remove(workflowId);
            if (allocation != null && resourcePool.release(allocation)) {
                state.allocationsReleased++;
            }
            afterWorkflow(execution, mode, workflowId, pending.size(), inFlight.size(), state);
        }
    }

    /**
     * 按顺序放行可以启动的工作流
     *
     * @return 是否有工作流因资源暂不可用而等待
     */
    private boolean startEligible(PlanExecution execution,
                                  List<String> pending,
                                  Map<String, Future<String>> inFlight,
                                  Map<String, Allocation> held,
                                  CompletionService<String> completion,
                                  Map<String, Integer> levelOf,
                                  RunState state) {
        ExecutionPlan plan = execution.getPlan();
        OrchestrationStrategy strategy = plan.strategy().strategy();
        int limit = concurrencyLimit(strategy);
        int wave = strategy == OrchestrationStrategy.DEPENDENCY_AWARE ? currentWave(pending, inFlight, levelOf) : -1;

        Iterator<String> it = pending.iterator();
        while (it.hasNext()) {
            if (state.stopped || inFlight.size() >= limit) {
                return false;
            }
            String workflowId = it.next();
            Workflow workflow = plan.workflow(workflowId).orElseThrow();
            WorkflowExecutionRecord record = execution.getWorkflowRecord(workflowId);
            CancellationToken token = execution.getWorkflowToken(workflowId);

            if (token.isCancelled()) {
                record.finish(WorkflowStatus.CANCELLED, FailureReason.CANCELLED, "workflow cancelled: " + token.getReason());
                it.remove();
                continue;
            }

            String failedUpstream = null;
            boolean blocked = false;
            for (String upstream : workflow.dependsOnWorkflowIds()) {
                WorkflowStatus upstreamStatus = execution.getWorkflowRecord(upstream).getStatus();
                if (upstreamStatus == WorkflowStatus.COMPLETED) {
                    continue;
                }
                if (upstreamStatus.isTerminal()) {
                    failedUpstream = upstream + " " + upstreamStatus.name().toLowerCase();
                    break;
                }
                blocked = true;
            }
            if (failedUpstream != null) {
                record.finish(WorkflowStatus.SKIPPED, FailureReason.DEPENDENCY_FAILED,
                    "upstream workflow " + failedUpstream);
                it.remove();
                log.warn("Workflow {} skipped, upstream workflow {}", workflowId, failedUpstream);
                stopIfCritical(workflow, state);
                continue;
            }
            if (blocked) {
                if (strategy == OrchestrationStrategy.SEQUENTIAL) {
                    return false;
                }
                continue;
            }
            if (wave >= 0 && levelOf.getOrDefault(workflowId, 0) > wave) {
                continue;
            }

            ResourceRequirement requirement = plan.resourceAllocation().getOrDefault(workflowId, ResourceRequirement.ZERO);
            AllocationResult result = resourcePool.allocate(plan.planId(), requirement);
            if (!result.isGranted()) {
                boolean queue = properties.getOrchestrator().getInsufficientResourcesPolicy()
                    == InsufficientResourcesPolicy.QUEUE;
                if (queue || !inFlight.isEmpty()) {
                    log.debug("Workflow {} waiting for resources, short on {}", workflowId, result.insufficientKinds());
                    return true;
                }
                record.finish(WorkflowStatus.FAILED, FailureReason.INSUFFICIENT_RESOURCES,
                    "insufficient resources, short on " + result.insufficientKinds());
                it.remove();
                log.warn("Workflow {} failed admission: short on {}", workflowId, result.insufficientKinds());
                stopIfCritical(workflow, state);
                continue;
            }

            Allocation allocation = result.allocation();
            resourcePool.commit(allocation);
            it.remove();
            try {
                inFlight.put(workflowId, completion.submit(() -> runWorkflow(workflow, record, token)));
                held.put(workflowId, allocation);
                state.allocated.put(workflowId, requirement);
            } catch (RejectedExecutionException e) {
                log.error("Workflow executor rejected {}", workflowId, e);
                if (resourcePool.release(allocation)) {
                    state.allocationsReleased++;
                }
                record.finish(WorkflowStatus.FAILED, FailureReason.LOGIC_ERROR, "workflow executor rejected the task");
                stopIfCritical(workflow, state);
            }
        }
        return false;
    }

    private String runWorkflow(Workflow workflow, WorkflowExecutionRecord record, CancellationToken token) {
        try {
            engine.execute(workflowFactory.refreshParameters(workflow), record, token);
        } catch (RuntimeException e) {
            log.error("Workflow {} crashed", workflow.workflowId(), e);
            record.finish(WorkflowStatus.FAILED, FailureReason.LOGIC_ERROR, "engine error: " + e.getMessage());
        }
        return workflow.workflowId();
    }

    private int concurrencyLimit(OrchestrationStrategy strategy) {
        int max = Math.max(1, properties.getOrchestrator().getMaxConcurrentWorkflows());
        switch (strategy) {
            case SEQUENTIAL:
                return 1;
            case RESOURCE_AWARE:
                return Math.max(1, max / 2);
            case ADAPTIVE:
                double availability = DecisionEngine.availabilityScore(resourcePool.snapshot());
                int limit = Math.max(1, (int) Math.round(max * availability));
                return underResourcePressure() ? Math.max(1, limit / 2) : limit;
            default:
                return max;
        }
    }

    private boolean underResourcePressure() {
        for (String metric : List.of(AlertMetrics.CPU_UTILIZATION, AlertMetrics.MEMORY_USAGE)) {
            Optional<Alert> alert = alertEvaluator.findActive(AlertMetrics.THRESHOLD_BREACH, metric);
            if (alert.isPresent() && alert.get().getSeverity().compareTo(AlertSeverity.HIGH) <= 0) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Integer> workflowLevels(ExecutionPlan plan) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (Workflow workflow : plan.workflows()) {
            dependencies.put(workflow.workflowId(), workflow.dependsOnWorkflowIds());
        }
        Map<String, Integer> levelOf = new HashMap<>();
        List<List<String>> levels = DependencyGraph.of(dependencies).levels();
        for (int i = 0; i < levels.size(); i++) {
            for (String workflowId : levels.get(i)) {
                levelOf.put(workflowId, i);
            }
        }
        return levelOf;
    }

    private static int currentWave(List<String> pending, Map<String, Future<String>> inFlight,
                                   Map<String, Integer> levelOf) {
        int wave = Integer.MAX_VALUE;
        for (String workflowId : pending) {
            wave = Math.min(wave, levelOf.getOrDefault(workflowId, 0));
        }
        for (String workflowId : inFlight.keySet()) {
            wave = Math.min(wave, levelOf.getOrDefault(workflowId, 0));
        }
        return wave;
    }

    private static void finishPending(PlanExecution execution, List<String> pending, WorkflowStatus status,
                                      FailureReason reason, String message) {
        for (String workflowId : pending) {
            execution.getWorkflowRecord(workflowId).finish(status, reason, message);
        }
        pending.clear();
    }

    private static void stopIfCritical(Workflow workflow, RunState state) {
        if (workflow.criticalPath() && !state.stopped) {
            state.stopped = true;
            state.criticalWorkflow = workflow.workflowId();
            log.warn("Critical-path workflow {} did not complete, stopping plan", workflow.workflowId());
        }
    }

    private static boolean pause(Duration interval, CancellationToken token) {
        try {
            Thread.sleep(Math.max(1, interval.toMillis()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("coordinator interrupted");
            return false;
        }
    }

    private static String keyOf(Map<String, Future<String>> inFlight, Future<String> done) {
        for (Map.Entry<String, Future<String>> entry : inFlight.entrySet()) {
            if (entry.getValue() == done) {
                return entry.getKey();
            }
        }
        return null;
    }

    // ==================== 观测与自适应 ====================

    private void afterWorkflow(PlanExecution execution, OrchestrationMode mode, String workflowId,
                               int queueLength, int concurrent, RunState state) {
        ExecutionPlan plan = execution.getPlan();
        Workflow workflow = plan.workflow(workflowId).orElseThrow();
        WorkflowExecutionRecord record = execution.getWorkflowRecord(workflowId);
        if (record.getStatus() != WorkflowStatus.COMPLETED && !execution.getCancellationToken().isCancelled()
            && !execution.getWorkflowToken(workflowId).isCancelled()) {
            stopIfCritical(workflow, state);
        }
        if (record.getStartedAt() == null) {
            return;
        }
        try {
            PerformanceSnapshot snapshot = ExecutionObservations.workflowSnapshot(record, queueLength, concurrent);
            state.efficiency.put(workflowId, EfficiencyScore.of(snapshot));
            seriesStore.append(snapshot);
            alertEvaluator.evaluate(snapshot);

            Map<String, StepPerformance> performance = record.getPerformanceData();
            Set<String> observedRules = new LinkedHashSet<>();
            for (WorkflowStep step : workflow.steps()) {
                if (step.type() != StepType.SCAN || step.ruleId() == null) {
                    continue;
                }
                StepExecutionRecord stepRecord = record.getStep(step.stepId());
                StepPerformance stepPerformance = performance.get(step.stepId());
                if (stepPerformance == null || !ExecutionObservations.hasRun(stepRecord)) {
                    continue;
                }
                optimizer.observe(step.ruleId(), ExecutionObservations.ruleMetrics(stepRecord, stepPerformance));
                observedRules.add(step.ruleId());
                FeatureVector features = plan.features().get(ExecutionPlan.predictionKey(workflowId, step.ruleId()));
                if (features != null) {
                    state.trainingRecords.add(new ExecutionRecord(step.ruleId(), features,
                        ExecutionObservations.outcome(stepRecord, stepPerformance,
                            features.get(RuleFeatures.RULE_COMPLEXITY)),
                        Instant.now()));
                }
            }
            for (String ruleId : observedRules) {
                adapt(execution, mode, ruleId, state);
            }
        } catch (RuntimeException e) {
            log.warn("Post-workflow processing failed for {}", workflowId, e);
        }
    }

    private void preExecutionOptimization(PlanExecution execution, RunState state) {
        Set<String> rules = new LinkedHashSet<>();
        for (Workflow workflow : execution.getPlan().workflows()) {
            for (WorkflowStep step : workflow.steps()) {
                if (step.type() == StepType.SCAN && step.ruleId() != null) {
                    rules.add(step.ruleId());
                }
            }
        }
        for (String ruleId : rules) {
            try {
                adapt(execution, OrchestrationMode.AUTONOMOUS, ruleId, state);
            } catch (RuntimeException e) {
                log.warn("Pre-execution optimization failed for rule {}", ruleId, e);
            }
        }
    }

    private void adapt(PlanExecution execution, OrchestrationMode mode, String ruleId, RunState state) {
        AdaptationOutcome outcome = optimizer.maybeAdapt(ruleId, approvalFor(mode, execution.getPlanId()));
        if (!outcome.isTriggered()) {
            return;
        }
        execution.recordAdaptation(outcome);
        state.appliedChanges.addAll(outcome.applied());
        adaptationsApplied.addAndGet(outcome.applied().size());
        for (ParameterRecommendation recommendation : outcome.recommendations()) {
            if (!isApplied(recommendation, outcome.applied())) {
                state.pendingRecommendations.add(recommendation);
            }
        }
        if (!outcome.applied().isEmpty()) {
            log.info("Plan {} applied {} change(s) to rule {} in {} mode",
                execution.getPlanId(), outcome.applied().size(), ruleId, mode);
        }
    }

    private static boolean isApplied(ParameterRecommendation recommendation, List<AppliedChange> applied) {
        for (AppliedChange change : applied) {
            if (change.ruleId().equals(recommendation.ruleId())
                && change.parameter().equals(recommendation.parameter())) {
                return true;
            }
        }
        return false;
    }

    AdaptationApproval approvalFor(OrchestrationMode mode, String planId) {
        OrchestrationProperties.AdaptationConfig config = properties.getAdaptation();
        switch (mode) {
            case AUTONOMOUS:
                return AdaptationApproval.safetyAbove(config.getAutoApplySafetyThreshold());
            case HYBRID:
                return AdaptationApproval.safetyAbove(config.getHybridSafetyThreshold());
            case SUPERVISED:
                AdaptationConfirmationHook hook = confirmationHook.getIfAvailable();
                if (hook == null) {
                    return AdaptationApproval.none();
                }
                double threshold = config.getAutoApplySafetyThreshold();
                return recommendation -> recommendation.safetyScore() > threshold
                    && hook.confirm(planId, recommendation);
            default:
                return AdaptationApproval.none();
        }
    }

    private void learnFromExecution(OrchestrationMode mode, RunState state) {
        if (state.trainingRecords.isEmpty()) {
            return;
        }
        try {
            predictionService.record(state.trainingRecords);
            if (mode == OrchestrationMode.AUTONOMOUS
                && predictionService.trainingHistorySize() >= properties.getPredictor().getMinTrainingSamples()) {
                ModelQualityReport quality = predictionService.retrainFromHistory();
                log.info("Predictor retrained after execution: status={}, samples={}",
                    quality.status(), quality.sampleCount());
            }
        } catch (RuntimeException e) {
            log.warn("Post-execution learning failed", e);
        }
    }

    // ==================== 结果 ====================

    private static PlanStatus resolveStatus(PlanExecution execution, RunState state) {
        if (execution.getCancellationToken().isCancelled()) {
            return PlanStatus.CANCELLED;
        }
        if (state.stopped) {
            return PlanStatus.STOPPED_CRITICAL_FAILURE;
        }
        if (state.abortError != null) {
            return PlanStatus.FAILED;
        }
        int completed = 0;
        boolean anyStepFailed = false;
        Map<String, WorkflowExecutionRecord> records = execution.getWorkflowRecords();
        for (WorkflowExecutionRecord record : records.values()) {
            if (record.getStatus() == WorkflowStatus.COMPLETED) {
                completed++;
            }
            if (record.getStepsFailed() > 0) {
                anyStepFailed = true;
            }
        }
        if (completed == records.size()) {
            return anyStepFailed ? PlanStatus.PARTIALLY_FAILED : PlanStatus.COMPLETED;
        }
        return completed == 0 ? PlanStatus.FAILED : PlanStatus.PARTIALLY_FAILED;
    }

    private OrchestrationReport buildReport(PlanExecution execution, PlanStatus status, String stopReason,
                                            RunState state) {
        ExecutionPlan plan = execution.getPlan();
        List<WorkflowReport> workflows = new ArrayList<>();
        Map<WorkflowStatus, Integer> counts = new EnumMap<>(WorkflowStatus.class);
        double actualCost = 0;
        double efficiencySum = 0;
        for (Workflow workflow : plan.workflows()) {
            String workflowId = workflow.workflowId();
            WorkflowExecutionRecord record = execution.getWorkflowRecord(workflowId);
            List<StepReport> steps = new ArrayList<>();
            for (StepExecutionRecord step : record.getSteps().values()) {
                steps.add(StepReport.of(step));
            }
            ResourceRequirement allocated = state.allocated.getOrDefault(workflowId, ResourceRequirement.ZERO);
            double efficiency = state.efficiency.getOrDefault(workflowId, 0.0);
            efficiencySum += efficiency;
            actualCost += ExecutionPlanner.estimateCost(allocated, record.getDuration());
            counts.merge(record.getStatus(), 1, Integer::sum);
            workflows.add(new WorkflowReport(workflowId, workflow.requestId(), record.getStatus(),
                record.getFailureReason(), record.getStepsCompleted(), record.getStepsFailed(),
                record.getDuration().toMillis(), allocated, efficiency, steps, record.getErrors()));
        }
        double efficiencyScore = state.efficiency.isEmpty() ? 0.0
            : Math.round(efficiencySum / state.efficiency.size() * 100) / 100.0;
        actualCost = Math.round(actualCost * 10_000) / 10_000.0;

        Instant startedAt = execution.getStartedAt();
        Instant finishedAt = Instant.now();
        long durationMs = startedAt == null ? 0 : Duration.between(startedAt, finishedAt).toMillis();
        String summary = String.format("%s: %d/%d workflows completed, %d failed, %d skipped, %d cancelled; "
                + "%d change(s) applied, %d recommendation(s) pending; %d allocation(s) released; "
                + "cost %.4f (estimated %.4f)%s",
            status, counts.getOrDefault(WorkflowStatus.COMPLETED, 0), plan.workflows().size(),
            counts.getOrDefault(WorkflowStatus.FAILED, 0), counts.getOrDefault(WorkflowStatus.SKIPPED, 0),
            counts.getOrDefault(WorkflowStatus.CANCELLED, 0), state.appliedChanges.size(),
            state.pendingRecommendations.size(), state.allocationsReleased, actualCost, plan.estimatedCost(),
            stopReason == null ? "" : "; " + stopReason);

        return new OrchestrationReport(plan.planId(), status, execution.getMode(), plan.strategy().strategy(),
            startedAt, finishedAt, durationMs, workflows, state.appliedChanges, state.pendingRecommendations,
            ExecutionPlanner.sum(state.allocated.values()), state.allocationsReleased, plan.estimatedCost(),
            actualCost, efficiencyScore, stopReason, summary);
    }

    private void recordFinished(PlanExecution execution, PlanStatus status) {
        finishedByStatus.get(status).incrementAndGet();
        String tag = status.name().toLowerCase();
        meterRegistry.counter("orchestration.plan.executions", "status", tag).increment();
        if (execution.getStartedAt() != null) {
            executedPlans.incrementAndGet();
            long durationMs = execution.getDuration().toMillis();
            totalDurationMs.addAndGet(durationMs);
            Timer.builder("orchestration.plan.execution.duration")
                .tag("status", tag)
                .register(meterRegistry)
                .record(Duration.ofMillis(durationMs));
        }
    }

    /**
     * 单次执行的簿记，只在协调线程上读写
     */
    private static final class RunState {
        private final Map<String, ResourceRequirement> allocated = new LinkedHashMap<>();
        private final Map<String, Double> efficiency = new HashMap<>();
        private final List<AppliedChange> appliedChanges = new ArrayList<>();
        private final List<ParameterRecommendation> pendingRecommendations = new ArrayList<>();
        private final List<ExecutionRecord> trainingRecords = new ArrayList<>();
        private int allocationsReleased;
        private boolean stopped;
        private String criticalWorkflow;
        private String abortError;
    }
}
