package com.governance.orchestration.controller;

import com.governance.orchestration.alert.Alert;
import com.governance.orchestration.alert.AlertEvaluator;
import com.governance.orchestration.alert.PerformanceSnapshot;
import com.governance.orchestration.alert.SubjectKind;
import com.governance.orchestration.dto.ApiResponse;
import com.governance.orchestration.dto.PerformanceSnapshotDTO;
import com.governance.orchestration.dto.TrainingRecordDTO;
import com.governance.orchestration.optimizer.AdaptationOutcome;
import com.governance.orchestration.optimizer.AdaptiveOptimizer;
import com.governance.orchestration.optimizer.AppliedChange;
import com.governance.orchestration.optimizer.PerformanceTrend;
import com.governance.orchestration.optimizer.RuleAnomaly;
import com.governance.orchestration.orchestrator.OrchestrationMode;
import com.governance.orchestration.orchestrator.ScanOrchestrator;
import com.governance.orchestration.predictor.ExecutionRecord;
import com.governance.orchestration.predictor.ModelQualityReport;
import com.governance.orchestration.resource.ResourcePool;
import com.governance.orchestration.resource.ResourcePoolState;
import com.governance.orchestration.service.MetricsIngestionService;
import com.governance.orchestration.service.PredictionService;
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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 编排运维 API
 * 提供：
 * 1. 性能快照上报与查询
 * 2. 告警查看与处理
 * 3. 参数自适应：评估、回滚、反馈
 * 4. 预测器训练
 * 5. 资源池状态
 */
@Slf4j
@RestController
@RequestMapping("/api/orchestration/admin")
@RequiredArgsConstructor
public class OrchestrationAdminController {

    private final MetricsIngestionService metricsIngestionService;
    private final AlertEvaluator alertEvaluator;
    private final AdaptiveOptimizer optimizer;
    private final ScanOrchestrator orchestrator;
    private final PredictionService predictionService;
    private final ResourcePool resourcePool;

    // ==================== 指标 ====================

    @PostMapping("/metrics")
    public ApiResponse<MetricsIngestionService.IngestionResult> ingest(@RequestBody PerformanceSnapshotDTO snapshot) {
        return ApiResponse.success(metricsIngestionService.ingest(snapshot.toSnapshot()));
    }

    @GetMapping("/metrics/{kind}/{subjectId}")
    public ApiResponse<List<PerformanceSnapshot>> latestMetrics(@PathVariable SubjectKind kind,
                                                               @PathVariable String subjectId,
                                                               @RequestParam(defaultValue = "50") int limit) {
        return ApiResponse.success(metricsIngestionService.latest(kind, subjectId, limit));
    }

    // ==================== 告警 ====================

    @GetMapping("/alerts")
    public ApiResponse<List<Alert>> activeAlerts() {
        return ApiResponse.success(alertEvaluator.activeAlerts());
    }

    @GetMapping("/alerts/resolved")
    public ApiResponse<List<Alert>> resolvedAlerts() {
        return ApiResponse.success(alertEvaluator.resolvedAlerts());
    }

    @PostMapping("/alerts/{alertId}/resolve")
    public ResponseEntity<ApiResponse<Boolean>> resolveAlert(@PathVariable String alertId,
                                                             @RequestParam(required = false) String note) {
        if (!alertEvaluator.resolve(alertId, note)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.notFound("活动告警不存在: " + alertId));
        }
        return ResponseEntity.ok(ApiResponse.success(true));
    }

    @GetMapping("/alerts/thresholds")
    public ApiResponse<Map<String, Double>> thresholds() {
        return ApiResponse.success(alertEvaluator.thresholds());
    }

    // ==================== 自适应 ====================

    /**
     * 手动触发一次规则自适应评估，缺省只记录建议
     */
    @PostMapping("/rules/{ruleId}/adapt")
    public ApiResponse<AdaptationOutcome> adaptRule(@PathVariable String ruleId,
                                                    @RequestParam(defaultValue = "MANUAL") OrchestrationMode mode) {
        return ApiResponse.success(orchestrator.adaptRule(ruleId, mode));
    }

    @GetMapping("/rules/{ruleId}/parameters")
    public ApiResponse<Map<String, Double>> ruleParameters(@PathVariable String ruleId) {
        return ApiResponse.success(optimizer.currentParameters(ruleId));
    }

    @GetMapping("/rules/{ruleId}/trend")
    public ResponseEntity<ApiResponse<PerformanceTrend>> ruleTrend(@PathVariable String ruleId) {
        return optimizer.analyzeTrend(ruleId)
            .map(trend -> ResponseEntity.ok(ApiResponse.success(trend)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.notFound("样本不足，无法分析趋势: " + ruleId)));
    }

    @GetMapping("/rules/anomalies")
    public ApiResponse<List<RuleAnomaly>> anomalies() {
        return ApiResponse.success(optimizer.rankByAnomaly());
    }

    @GetMapping("/adaptations")
    public ApiResponse<List<Map<String, Object>>> recentChanges(@RequestParam(defaultValue = "20") int limit) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (AppliedChange change : optimizer.recentChanges(limit)) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("change", change);
            entry.put("rolledBack", optimizer.isRolledBack(change.changeId()));
            result.add(entry);
        }
        return ApiResponse.success(result);
    }

    @PostMapping("/adaptations/{changeId}/rollback")
    public ApiResponse<AppliedChange> rollback(@PathVariable String changeId) {
        log.info("Manual rollback of adaptation {}", changeId);
        return ApiResponse.success(optimizer.rollback(changeId));
    }

    @PostMapping("/adaptations/{changeId}/feedback")
    public ApiResponse<Void> feedback(@PathVariable String changeId, @RequestParam boolean helpful) {
        optimizer.feedback(changeId, helpful);
        return ApiResponse.success();
    }

    // ==================== 预测器 ====================

    @PostMapping("/predictor/train")
    public ApiResponse<ModelQualityReport> train(@RequestBody List<TrainingRecordDTO> records) {
        List<ExecutionRecord> history = new ArrayList<>(records.size());
        for (TrainingRecordDTO record : records) {
            history.add(record.toRecord());
        }
        log.info("Training predictor on {} submitted records", history.size());
        return ApiResponse.success(orchestrator.trainPredictor(history));
    }

    @GetMapping("/predictor/status")
    public ApiResponse<ModelQualityReport> predictorStatus() {
        return ApiResponse.success(predictionService.lastQuality());
    }

    // ==================== 资源 ====================

    @GetMapping("/resources")
    public ApiResponse<ResourcePoolState> resources() {
        return ApiResponse.success(resourcePool.snapshot());
    }
}
