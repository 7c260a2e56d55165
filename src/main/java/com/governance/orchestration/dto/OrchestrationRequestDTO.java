package com.governance.orchestration.dto;

import com.governance.orchestration.orchestrator.OrchestrationConstraints;
import com.governance.orchestration.orchestrator.OrchestrationContext;
import com.governance.orchestration.orchestrator.OrchestrationMode;
import com.governance.orchestration.orchestrator.OrchestrationRequest;
import com.governance.orchestration.orchestrator.ResourceOptimizationType;
import com.governance.orchestration.orchestrator.ScanRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 编排请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestrationRequestDTO {

    private List<ScanRequestDTO> requests;

    private String userId;
    private Map<String, Object> businessContext;
    private Map<String, Double> performanceTargets;

    /** 显式策略，为空时自动选择 */
    private String strategy;

    private Double budget;
    private Instant deadline;

    /** 缺省 RESOURCE_POOLING */
    private ResourceOptimizationType optimizationType;

    /** 仅在提交即执行时使用，缺省 SUPERVISED */
    private OrchestrationMode mode;

    public OrchestrationRequest toRequest() {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("requests must not be empty");
        }
        List<ScanRequest> scanRequests = new ArrayList<>();
        for (ScanRequestDTO request : requests) {
            scanRequests.add(request.toScanRequest());
        }
        return new OrchestrationRequest(scanRequests,
            new OrchestrationContext(userId, businessContext, performanceTargets),
            strategy,
            new OrchestrationConstraints(budget, deadline),
            optimizationType);
    }
}
