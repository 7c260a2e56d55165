package com.governance.orchestration.controller;

import com.governance.orchestration.alert.AlertEvaluator;
import com.governance.orchestration.exception.AdaptationNotFoundException;
import com.governance.orchestration.optimizer.AdaptiveOptimizer;
import com.governance.orchestration.orchestrator.ScanOrchestrator;
import com.governance.orchestration.resource.ResourcePool;
import com.governance.orchestration.service.MetricsIngestionService;
import com.governance.orchestration.service.PredictionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 运维控制器测试
 */
@WebMvcTest(OrchestrationAdminController.class)
class OrchestrationAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MetricsIngestionService metricsIngestionService;

    @MockBean
    private AlertEvaluator alertEvaluator;

    @MockBean
    private AdaptiveOptimizer optimizer;

    @MockBean
    private ScanOrchestrator orchestrator;

    @MockBean
    private PredictionService predictionService;

    @MockBean
    private ResourcePool resourcePool;

    @Test
    @DisplayName("上报快照 - 缺少对象 ID")
    void testIngest_blankSubject() throws Exception {
        when(metricsIngestionService.ingest(any()))
            .thenThrow(new IllegalArgumentException("snapshot subjectId must not be blank"));

        mockMvc.perform(post("/api/orchestration/admin/metrics")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"subjectKind\": \"RULE\", \"cpuUsage\": 50}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    @DisplayName("上报快照 - 成功")
    void testIngest_success() throws Exception {
        when(metricsIngestionService.ingest(any()))
            .thenReturn(new MetricsIngestionService.IngestionResult(List.of(), 0.25));

        mockMvc.perform(post("/api/orchestration/admin/metrics")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"subjectKind\": \"RULE\", \"subjectId\": \"rule-a\", \"executionTimeMs\": 1200}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data.anomalyScore").value(0.25));
    }

    @Test
    @DisplayName("上报快照 - 成功率超出范围")
    void testIngest_successRateOutOfRange() throws Exception {
        mockMvc.perform(post("/api/orchestration/admin/metrics")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"subjectKind\": \"RULE\", \"subjectId\": \"rule-a\", \"successRate\": 1.5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));

        verify(metricsIngestionService, never()).ingest(any());
    }

    @Test
    @DisplayName("解除告警 - 告警不存在")
    void testResolveAlert_notFound() throws Exception {
        when(alertEvaluator.resolve("alert_x", null)).thenReturn(false);

        mockMvc.perform(post("/api/orchestration/admin/alerts/alert_x/resolve"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("回滚 - 变更不存在")
    void testRollback_notFound() throws Exception {
        when(optimizer.rollback("chg_x")).thenThrow(new AdaptationNotFoundException("chg_x"));

        mockMvc.perform(post("/api/orchestration/admin/adaptations/chg_x/rollback"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("回滚 - 参数已被后续变更覆盖")
    void testRollback_superseded() throws Exception {
        when(optimizer.rollback("chg_old")).thenThrow(new IllegalStateException("Change chg_old is superseded"));

        mockMvc.perform(post("/api/orchestration/admin/adaptations/chg_old/rollback"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value(409));
    }

    @Test
    @DisplayName("趋势 - 样本不足")
    void testTrend_insufficientSamples() throws Exception {
        when(optimizer.analyzeTrend("rule-a")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/orchestration/admin/rules/rule-a/trend"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));
    }
}
