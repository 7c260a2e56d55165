package com.governance.orchestration.workflow;

import com.governance.orchestration.config.OrchestrationProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 工作流执行引擎
 *
 * <p>反复计算"可执行前沿"（依赖全部 COMPLETED 且尚未启动的步骤），在并行上限内并发执行。
 * 每次尝试有独立超时，超时经 Resilience4j Retry 按指数退避重试，逻辑错误不重试。
 *
 * <p>失败语义：
 * <ul>
 *   <li>必需步骤失败 → 工作流 FAILED，不再启动新步骤，在途步骤允许跑完</li>
 *   <li>可选步骤失败 → 记录后继续，依赖它的步骤 SKIPPED</li>
 *   <li>仍有 PENDING 步骤但前沿为空且无在途步骤 → CONFIGURATION 失败（成环 / 依赖不存在）</li>
 * </ul>
 *
 * <p>线程模型：协调循环运行在调用方线程（编排器的工作流池），步骤运行器、步骤主体、采样各用一个有界池。
 */
@Component
public class WorkflowExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionEngine.class);

    private final OrchestrationProperties.WorkflowConfig config;
    private final StepHandlerRegistry handlerRegistry;
    private final ResourceUsageSampler sampler;
    private final MeterRegistry meterRegistry;

    private ExecutorService stepRunnerExecutor;
    private ExecutorService stepBodyExecutor;
    private ScheduledExecutorService samplingScheduler;

    public WorkflowExecutionEngine(OrchestrationProperties properties,
                                   StepHandlerRegistry handlerRegistry,
                                   ResourceUsageSampler sampler,
                                   MeterRegistry meterRegistry) {
        this.config = properties.getWorkflow();
        this.handlerRegistry = handlerRegistry;
        this.sampler = sampler;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        this.stepRunnerExecutor = Executors.newFixedThreadPool(config.getStepPoolSize(), namedDaemon("step-runner"));
        this.stepBodyExecutor = Executors.newFixedThreadPool(config.getStepPoolSize() * 2, namedDaemon("step-body"));
        this.samplingScheduler = Executors.newScheduledThreadPool(1, namedDaemon("step-sampler"));
        log.info("WorkflowExecutionEngine initialized: maxParallelSteps={}, stepPoolSize={}, defaultTimeout={}",
            config.getMaxParallelSteps(), config.getStepPoolSize(), config.getDefaultStepTimeout());
    }

    @PreDestroy
    public void shutdown() {
        stepRunnerExecutor.shutdownNow();
        stepBodyExecutor.shutdownNow();
        samplingScheduler.shutdownNow();
        try {
            stepRunnerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
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

    /**
     * 同步执行一个工作流，返回终态记录
     */
    public WorkflowExecutionRecord execute(Workflow workflow, String planId, CancellationToken token) {
        WorkflowExecutionRecord record = new WorkflowExecutionRecord(workflow, planId);
        execute(workflow, record, token);
        return record;
    }

    /**
     * 在已创建（QUEUED）的记录上执行，编排器用它让状态查询能看到排队中的工作流
     */
    public void execute(Workflow workflow, WorkflowExecutionRecord record, CancellationToken token) {
        if (!record.markRunning()) {
            log.debug("Workflow {} not started, record is already {}", workflow.workflowId(), record.getStatus());
            return;
        }
        Timer.Sample timerSample = Timer.start(meterRegistry);
        try {
            runLoop(workflow, record, token);
        } catch (RuntimeException e) {
            log.error("Workflow {} aborted by engine error", workflow.workflowId(), e);
            record.finish(WorkflowStatus.FAILED, FailureReason.LOGIC_ERROR, "engine error: " + e.getMessage());
        }
        timerSample.stop(Timer.builder("orchestration.workflow.duration")
            .tag("status", record.getStatus().name().toLowerCase())
            .register(meterRegistry));
        meterRegistry.counter("orchestration.workflows", "status", record.getStatus().name().toLowerCase())
            .increment();
        log.info("Workflow {} finished: status={}, completed={}, failed={}, duration={}ms",
            workflow.workflowId(), record.getStatus(), record.getStepsCompleted(), record.getStepsFailed(),
            record.getDuration().toMillis());
    }

    private void runLoop(Workflow workflow, WorkflowExecutionRecord record, CancellationToken token) {
        CompletionService<String> completion = new ExecutorCompletionService<>(stepRunnerExecutor);
        Map<String, Future<String>> inFlight = new LinkedHashMap<>();
        Map<String, WorkflowStep> steps = new LinkedHashMap<>();
        for (WorkflowStep step : workflow.steps()) {
            steps.put(step.stepId(), step);
        }

        boolean failed = false;
        FailureReason failureReason = null;
        String failureMessage = null;
        Instant graceDeadline = null;

        while (true) {
            boolean cancelled = token != null && token.isCancelled();

            if (!failed && !cancelled) {
                // 上游失败 / 跳过 → 下游跳过
                String blockedRequired = skipBlockedSteps(steps, record);
                if (blockedRequired != null) {
                    failed = true;
                    failureReason = FailureReason.DEPENDENCY_FAILED;
                    failureMessage = "required step " + blockedRequired + " cannot run: a dependency did not complete";
                }
            }

            if (!failed && !cancelled) {
                int capacity = Math.max(1, config.getMaxParallelSteps()) - inFlight.size();
                for (WorkflowStep step : frontier(steps, record, inFlight)) {
                    if (capacity <= 0) {
                        break;
                    }
                    StepExecutionRecord stepRecord = record.step(step.stepId());
                    inFlight.put(step.stepId(), completion.submit(
                        () -> runStep(workflow, step, stepRecord, record.getPlanId(), token)));
                    capacity--;
                }
            }

            if (inFlight.isEmpty()) {
                List<String> pending = pendingSteps(record);
                if (failed || cancelled || pending.isEmpty()) {
                    break;
                }
                failed = true;
                failureReason = FailureReason.CONFIGURATION;
                failureMessage = "no executable step while " + pending.size()
                    + " step(s) remain pending (cycle or unknown dependency): " + pending;
                log.error("Workflow {} configuration error: {}", workflow.workflowId(), failureMessage);
                break;
            }

            Future<String> done;
            try {
                if (cancelled) {
                    if (graceDeadline == null) {
                        graceDeadline = Instant.now().plus(config.getCancellationGracePeriod());
                        log.info("Workflow {} cancelled, waiting up to {} for {} in-flight step(s)",
                            workflow.workflowId(), config.getCancellationGracePeriod(), inFlight.size());
                    }
                    long remaining = Duration.between(Instant.now(), graceDeadline).toMillis();
                    done = remaining > 0 ? completion.poll(remaining, TimeUnit.MILLISECONDS) : null;
                    if (done == null) {
                        abandonInFlight(inFlight, record, "abandoned after cancellation grace period");
                        break;
                    }
                } else {
                    // 周期性醒来以感知取消
                    done = completion.poll(200, TimeUnit.MILLISECONDS);
                    if (done == null) {
                        continue;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandonInFlight(inFlight, record, "coordinator interrupted");
                if (token != null) {
                    token.cancel("interrupted");
                }
                break;
            }

            String stepId = resolve(done);
            inFlight.remove(stepId);
            StepExecutionRecord stepRecord = record.step(stepId);
            if (stepRecord.getStatus() == StepStatus.FAILED) {
                WorkflowStep step = steps.get(stepId);
                record.addError(stepId + ": " + stepRecord.getError());
                if (step.required() && !failed) {
                    failed = true;
                    failureReason = stepRecord.getFailureReason();
                    failureMessage = "required step " + stepId + " failed: " + stepRecord.getError();
                    log.warn("Workflow {} short-circuited by required step {} ({})",
                        workflow.workflowId(), stepId, stepRecord.getFailureReason());
                } else if (!step.required()) {
                    log.info("Optional step {} of workflow {} failed, continuing", stepId, workflow.workflowId());
                }
            }
        }

        boolean cancelled = token != null && token.isCancelled();
        for (String stepId : pendingSteps(record)) {
            if (cancelled && !failed) {
                record.step(stepId).markNotRun(StepStatus.CANCELLED, FailureReason.CANCELLED, token.getReason());
            } else {
                record.step(stepId).markNotRun(StepStatus.SKIPPED, FailureReason.DEPENDENCY_FAILED,
                    "not started: workflow " + (failed ? "failed" : "stopped"));
            }
        }

        if (failed) {
            record.finish(WorkflowStatus.FAILED, failureReason, failureMessage);
        } else if (cancelled) {
            record.finish(WorkflowStatus.CANCELLED, FailureReason.CANCELLED, "cancelled: " + token.getReason());
        } else {
            record.finish(WorkflowStatus.COMPLETED, null, null);
        }
    }

    /**
     * 把依赖已经 FAILED / SKIPPED / CANCELLED 的待执行步骤标为 SKIPPED
     *
     * @return 被跳过的第一个必需步骤，没有则为 null
     */
    private String skipBlockedSteps(Map<String, WorkflowStep> steps, WorkflowExecutionRecord record) {
        String blockedRequired = null;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (WorkflowStep step : steps.values()) {
                StepExecutionRecord stepRecord = record.step(step.stepId());
                if (stepRecord.getStatus() != StepStatus.PENDING) {
                    continue;
                }
                for (String dep : step.dependencies()) {
                    StepExecutionRecord depRecord = record.step(dep);
                    if (depRecord == null) {
                        continue;
                    }
                    StepStatus depStatus = depRecord.getStatus();
                    if (depStatus == StepStatus.FAILED || depStatus == StepStatus.SKIPPED
                        || depStatus == StepStatus.CANCELLED) {
                        stepRecord.markNotRun(StepStatus.SKIPPED, FailureReason.DEPENDENCY_FAILED,
                            "dependency " + dep + " is " + depStatus);
                        changed = true;
                        if (step.required() && blockedRequired == null) {
                            blockedRequired = step.stepId();
                        }
                        break;
                    }
                }
            }
        }
        return blockedRequired;
    }

    private List<WorkflowStep> frontier(Map<String, WorkflowStep> steps, WorkflowExecutionRecord record,
                                        Map<String, Future<String>> inFlight) {
        List<WorkflowStep> ready = new ArrayList<>();
        for (WorkflowStep step : steps.values()) {
            if (inFlight.containsKey(step.stepId())
                || record.step(step.stepId()).getStatus() != StepStatus.PENDING) {
                continue;
            }
            boolean satisfied = true;
            for (String dep : step.dependencies()) {
                StepExecutionRecord depRecord = record.step(dep);
                if (depRecord == null || depRecord.getStatus() != StepStatus.COMPLETED) {
                    satisfied = false;
                    break;
                }
            }
            if (satisfied) {
                ready.add(step);
            }
        }
        return ready;
    }

    private List<String> pendingSteps(WorkflowExecutionRecord record) {
        List<String> pending = new ArrayList<>();
        record.getSteps().forEach((id, step) -> {
            if (step.getStatus() == StepStatus.PENDING) {
                pending.add(id);
            }
        });
        return pending;
    }

    private void abandonInFlight(Map<String, Future<String>> inFlight, WorkflowExecutionRecord record, String why) {
        inFlight.forEach((stepId, future) -> {
            future.cancel(true);
            record.step(stepId).markNotRun(StepStatus.CANCELLED, FailureReason.CANCELLED, why);
            log.warn("Step {} of workflow {} {}", stepId, record.getWorkflowId(), why);
        });
        inFlight.clear();
    }

    private String resolve(Future<String> done) {
        try {
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading a completed step future", e);
        } catch (ExecutionException e) {
            // runStep 自身不抛异常，走到这里说明引擎有缺陷
            throw new IllegalStateException("Step runner failed unexpectedly", e.getCause());
        }
    }

    // ==================== 单步执行 ====================

    private String runStep(Workflow workflow, WorkflowStep step, StepExecutionRecord stepRecord,
                           String planId, CancellationToken token) {
        stepRecord.markRunning();
        ScheduledFuture<?> sampling = startSampling(stepRecord);
        Duration timeout = step.timeout() != null ? step.timeout() : config.getDefaultStepTimeout();
        int maxAttempts = step.maxAttempts() > 0 ? step.maxAttempts() : config.getMaxAttempts();
        try {
            StepHandler handler = handlerRegistry.handlerFor(step.type()).orElse(null);
            if (handler == null) {
                stepRecord.incrementAttempts();
                if (config.getUnhandledStepPolicy() == OrchestrationProperties.UnhandledStepPolicy.FAIL) {
                    stepRecord.markFailed(FailureReason.LOGIC_ERROR, "no handler registered for " + step.type());
                    countStep("failed");
                } else {
                    stepRecord.markCompleted(Map.of("handled", false));
                    countStep("completed");
                }
                return step.stepId();
            }

            Retry retry = Retry.of(workflow.workflowId() + ":" + step.stepId(), RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                    config.getRetryInitialBackoff(), config.getRetryBackoffMultiplier()))
                .retryExceptions(StepTimeoutException.class)
                .build());
            retry.getEventPublisher().onRetry(event -> log.warn("Retrying step {} (attempt {}/{}) after {}",
                step.stepId(), event.getNumberOfRetryAttempts() + 1, maxAttempts,
                event.getLastThrowable().getMessage()));

            AtomicInteger attempt = new AtomicInteger();
            Map<String, Object> output = retry.executeCallable(() -> {
                int current = attempt.incrementAndGet();
                if (current > 1 && token != null && token.isCancelled()) {
                    throw new CancellationException("cancelled before attempt " + current);
                }
                stepRecord.incrementAttempts();
                return runAttempt(handler, new StepContext(planId, workflow.workflowId(), step, current, token),
                    timeout);
            });
            stepRecord.markCompleted(output);
            countStep("completed");
        } catch (StepTimeoutException e) {
            stepRecord.markFailed(FailureReason.TIMEOUT, e.getMessage());
            countStep("timeout");
        } catch (CancellationException e) {
            stepRecord.markNotRun(StepStatus.CANCELLED, FailureReason.CANCELLED, e.getMessage());
            countStep("cancelled");
        } catch (StepFailedException e) {
            stepRecord.markFailed(FailureReason.LOGIC_ERROR, e.getMessage());
            countStep("failed");
        } catch (Exception e) {
            stepRecord.markFailed(FailureReason.LOGIC_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
            countStep("failed");
        } finally {
            if (sampling != null) {
                sampling.cancel(false);
            }
        }
        return step.stepId();
    }

    private Map<String, Object> runAttempt(StepHandler handler, StepContext context, Duration timeout) {
        Future<Map<String, Object>> body = stepBodyExecutor.submit(() -> handler.execute(context));
        try {
            return body.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            body.cancel(true);
            throw new StepTimeoutException(context.step().stepId(), timeout);
        } catch (InterruptedException e) {
            body.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("step " + context.step().stepId() + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StepFailedException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    private ScheduledFuture<?> startSampling(StepExecutionRecord stepRecord) {
        long interval = Math.max(1, config.getSamplingInterval().toMillis());
        try {
            return samplingScheduler.scheduleAtFixedRate(() -> {
                try {
                    stepRecord.addSample(sampler.sample());
                } catch (RuntimeException e) {
                    log.debug("Resource sampling failed for step {}: {}", stepRecord.getStepId(), e.getMessage());
                }
            }, 0, interval, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Resource sampling unavailable for step {}: {}", stepRecord.getStepId(), e.getMessage());
            return null;
        }
    }

    private void countStep(String outcome) {
        meterRegistry.counter("orchestration.workflow.steps", "outcome", outcome).increment();
    }

    // ==================== 静态分析 ====================

    /**
     * 分层与关键路径（按步骤超时加权）
     */
    public WorkflowAnalysis analyze(Workflow workflow) {
        DependencyGraph graph = workflow.dependencyGraph();
        graph.validate(workflow.workflowId());
        Map<String, Double> weights = new LinkedHashMap<>();
        for (WorkflowStep step : workflow.steps()) {
            Duration timeout = step.timeout() != null ? step.timeout() : config.getDefaultStepTimeout();
            weights.put(step.stepId(), (double) timeout.toMillis());
        }
        List<String> criticalPath = graph.criticalPath(weights::get);
        long totalMs = (long) graph.longestPathWeight(weights::get);
        return new WorkflowAnalysis(workflow.workflowId(), graph.levels(), criticalPath, Duration.ofMillis(totalMs));
    }

    /**
     * 处理器抛出的逻辑错误，不参与重试
     */
    static class StepFailedException extends RuntimeException {
        StepFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
