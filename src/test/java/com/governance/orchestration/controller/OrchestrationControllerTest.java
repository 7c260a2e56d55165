package com.governance.orchestration.controller;

import com.governance.orchestration.exception.PlanConfigurationException;
import com.governance.orchestration.exception.PlanNotFoundException;
import com.governance.orchestration.orchestrator.OrchestrationAnalytics;
import com.governance.orchestration.orchestrator.OrchestrationMode;
import com.governance.orchestration.orchestrator.PlanStatus;
import com.governance.orchestration.orchestrator.ScanOrchestrator;
import com.governance.orchestration.predictor.ModelStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 编排控制器测试
 */
@WebMvcTest(OrchestrationController.class)
class OrchestrationControllerTest {

    private static final String PLAN_BODY = """
        {
          "requests": [
            {
              "requestId": "r1",
              "dataSourceIds": ["ds-1"],
              "rules": [{"ruleId": "rule-a", "complexity": "MODERATE"}]
            }
          ],
          "strategy": "bogus"
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScanOrchestrator orchestrator;

    @Test
    @DisplayName("建计划 - 请求为空")
    void testCreatePlan_emptyRequests() throws Exception {
        mockMvc.perform(post("/api/orchestration/plans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"requests\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("建计划 - 配置非法")
    void testCreatePlan_invalidConfiguration() throws Exception {
        when(orchestrator.createPlan(any())).thenThrow(new PlanConfigurationException("unknown strategy: bogus"));

        mockMvc.perform(post("/api/orchestration/plans")
                .contentType(MediaType.APPLICATION_JSON)
                .content(PLAN_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.message").value("unknown strategy: bogus"));
    }

    @Test
    @DisplayName("建计划 - 请求体无法解析")
    void testCreatePlan_malformedBody() throws Exception {
        mockMvc.perform(post("/api/orchestration/plans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    @DisplayName("执行计划 - 重复执行")
    void testExecute_alreadyExecuted() throws Exception {
        when(orchestrator.executePlan("plan_1", OrchestrationMode.AUTONOMOUS))
            .thenThrow(new IllegalStateException("Plan plan_1 is COMPLETED, only CREATED plans can be executed"));

        mockMvc.perform(post("/api/orchestration/plans/plan_1/execute")
                .param("mode", "AUTONOMOUS"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value(409));
    }

    @Test
    @DisplayName("执行计划 - 无效模式")
    void testExecute_invalidMode() throws Exception {
        mockMvc.perform(post("/api/orchestration/plans/plan_1/execute")
                .param("mode", "SOMETIMES"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("查询状态 - 计划不存在")
    void testGetStatus_notFound() throws Exception {
        when(orchestrator.getStatus("plan_x")).thenThrow(new PlanNotFoundException("plan_x"));

        mockMvc.perform(get("/api/orchestration/plans/plan_x/status"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("查询报告 - 计划未结束")
    void testGetReport_notFinished() throws Exception {
        when(orchestrator.getReport("plan_1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/orchestration/plans/plan_1/report"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("取消计划 - 无请求体")
    void testCancel_withoutBody() throws Exception {
        when(orchestrator.cancel(eq("plan_1"), isNull())).thenReturn(true);

        mockMvc.perform(post("/api/orchestration/plans/plan_1/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data").value(true));
        verify(orchestrator).cancel("plan_1", null);
    }

    @Test
    @DisplayName("取消工作流 - 带原因")
    void testCancelWorkflow() throws Exception {
        when(orchestrator.cancelWorkflow("plan_1", "wf_a", "operator")).thenReturn(false);

        mockMvc.perform(post("/api/orchestration/plans/plan_1/workflows/wf_a/cancel")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"operator\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value(false));
    }

    @Test
    @DisplayName("编排统计")
    void testAnalytics() throws Exception {
        when(orchestrator.analytics()).thenReturn(new OrchestrationAnalytics(3, 1, 2,
            Map.of(PlanStatus.COMPLETED, 2L), 1.0, 1500, 4, 0, ModelStatus.NOT_TRAINED, 12));

        mockMvc.perform(get("/api/orchestration/analytics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data.plansCreated").value(3))
            .andExpect(jsonPath("$.data.plansByStatus.COMPLETED").value(2))
            .andExpect(jsonPath("$.data.predictorStatus").value("NOT_TRAINED"));
    }
}
