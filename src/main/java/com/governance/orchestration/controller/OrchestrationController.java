package com.governance.orchestration.controller;

import com.governance.orchestration.dto.ApiResponse;
import com.governance.orchestration.dto.CancelRequestDTO;
import com.governance.orchestration.dto.OrchestrationRequestDTO;
import com.governance.orchestration.orchestrator.ExecutionPlan;
import com.governance.orchestration.orchestrator.OrchestrationAnalytics;
import com.governance.orchestration.orchestrator.OrchestrationMode;
import com.governance.orchestration.orchestrator.OrchestrationReport;
import com.governance.orchestration.orchestrator.PlanStatusView;
import com.governance.orchestration.orchestrator.ScanOrchestrator;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * 扫描编排 API
 * 提供：
 * 1. 建计划 / 提交即执行
 * 2. 同步或异步执行
 * 3. 状态查询与执行报告
 * 4. 取消计划或单个工作流
 */
@Slf4j
@RestController
@RequestMapping("/api/orchestration")
@RequiredArgsConstructor
public class OrchestrationController {

    private final ScanOrchestrator orchestrator;

    /**
     * 建计划，不执行
     * POST /api/orchestration/plans
     */
    @PostMapping("/plans")
    @Timed(value = "orchestration.api.plans.create", description = "Plan creation API latency")
    public ApiResponse<ExecutionPlan> createPlan(@RequestBody OrchestrationRequestDTO request) {
        ExecutionPlan plan = orchestrator.createPlan(request.toRequest());
        log.info("Plan {} created via API: workflows={}, strategy={}",
            plan.planId(), plan.workflows().size(), plan.strategy().strategy());
        return ApiResponse.success(plan);
    }

    /**
     * 建计划并立即在后台执行
     * POST /api/orchestration/plans/submit
     */
    @PostMapping("/plans/submit")
    public ResponseEntity<ApiResponse<ExecutionPlan>> submit(@RequestBody OrchestrationRequestDTO request) {
        ExecutionPlan plan = orchestrator.submit(request.toRequest(), request.getMode());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(plan));
    }

    /**
     * 执行已创建的计划；async=true 时立即返回
     * POST /api/orchestration/plans/{planId}/execute?mode=AUTONOMOUS
     */
    @PostMapping("/plans/{planId}/execute")
    @Timed(value = "orchestration.api.plans.execute", description = "Plan execution API latency")
    public ResponseEntity<ApiResponse<OrchestrationReport>> execute(
            @PathVariable String planId,
            @RequestParam(defaultValue = "SUPERVISED") OrchestrationMode mode,
            @RequestParam(defaultValue = "false") boolean async) {
        if (async) {
            orchestrator.executeAsync(planId, mode).whenComplete((report, error) -> {
                if (error != null) {
                    log.error("Async execution of plan {} failed", planId, error);
                }
            });
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success());
        }
        return ResponseEntity.ok(ApiResponse.success(orchestrator.executePlan(planId, mode)));
    }

    @GetMapping("/plans/{planId}")
    public ApiResponse<ExecutionPlan> getPlan(@PathVariable String planId) {
        return ApiResponse.success(orchestrator.getPlan(planId));
    }

    /**
     * 实时状态：进度、各工作流状态、占用资源、活动告警
     */
    @GetMapping("/plans/{planId}/status")
    public ApiResponse<PlanStatusView> getStatus(@PathVariable String planId) {
        return ApiResponse.success(orchestrator.getStatus(planId));
    }

    /**
     * 执行报告，计划未结束时返回 404
     */
    @GetMapping("/plans/{planId}/report")
    public ResponseEntity<ApiResponse<OrchestrationReport>> getReport(@PathVariable String planId) {
        Optional<OrchestrationReport> report = orchestrator.getReport(planId);
        if (report.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.notFound("计划尚未结束: " + planId));
        }
        return ResponseEntity.ok(ApiResponse.success(report.get()));
    }

    /**
     * 取消计划，重复取消返回 false 而不是错误
     */
    @PostMapping("/plans/{planId}/cancel")
    public ApiResponse<Boolean> cancel(@PathVariable String planId,
                                       @RequestBody(required = false) CancelRequestDTO request) {
        String reason = request == null ? null : request.getReason();
        return ApiResponse.success(orchestrator.cancel(planId, reason));
    }

    @PostMapping("/plans/{planId}/workflows/{workflowId}/cancel")
    public ApiResponse<Boolean> cancelWorkflow(@PathVariable String planId,
                                               @PathVariable String workflowId,
                                               @RequestBody(required = false) CancelRequestDTO request) {
        String reason = request == null ? null : request.getReason();
        return ApiResponse.success(orchestrator.cancelWorkflow(planId, workflowId, reason));
    }

    @GetMapping("/analytics")
    public ApiResponse<OrchestrationAnalytics> analytics() {
        return ApiResponse.success(orchestrator.analytics());
    }
}
