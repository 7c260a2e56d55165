package com.governance.orchestration.orchestrator;

import com.governance.orchestration.exception.PlanConfigurationException;
import com.governance.orchestration.optimizer.RuleParameterStore;
import com.governance.orchestration.optimizer.RuleParameters;
import com.governance.orchestration.workflow.StepType;
import com.governance.orchestration.workflow.Workflow;
import com.governance.orchestration.workflow.WorkflowStep;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 为扫描请求生成工作流
 *
 * <p>请求带显式步骤时原样使用；否则生成默认流程：
 * validate-source → scan-&lt;规则&gt;（遵守规则间依赖）→ compliance-check（有合规要求时）→ notify（可选）
 */
@Component
public class WorkflowFactory {

    static final String VALIDATE_SOURCE = "validate-source";
    static final String SCAN_PREFIX = "scan-";
    static final String COMPLIANCE_CHECK = "compliance-check";
    static final String NOTIFY = "notify";

    private final RuleParameterStore parameterStore;

    public WorkflowFactory(RuleParameterStore parameterStore) {
        this.parameterStore = parameterStore;
    }

    public static String workflowIdOf(ScanRequest request) {
        return "wf_" + request.requestId();
    }

    /**
     * @param upstreamWorkflowIds 已解析好的上游工作流
     */
    public Workflow build(ScanRequest request, Set<String> upstreamWorkflowIds) {
        List<WorkflowStep> steps = request.steps().isEmpty() ? defaultSteps(request) : request.steps();
        return new Workflow(workflowIdOf(request), request.requestId(), request.priority(), steps,
            upstreamWorkflowIds, request.criticalPath());
    }

    private List<WorkflowStep> defaultSteps(ScanRequest request) {
        List<WorkflowStep> steps = new ArrayList<>();
        Map<String, Object> validateParams = new LinkedHashMap<>();
        validateParams.put("data_source_ids", request.dataSourceIds());
        steps.add(new WorkflowStep(VALIDATE_SOURCE, "Validate data source", StepType.VALIDATION,
            Set.of(), true, null, 0, null, validateParams));

        Set<String> ruleIds = new LinkedHashSet<>(request.getRuleIds());
        List<String> scanStepIds = new ArrayList<>();
        for (RuleSpec rule : request.rules()) {
            Set<String> deps = new LinkedHashSet<>();
            deps.add(VALIDATE_SOURCE);
            for (String upstreamRule : rule.dependsOn()) {
                if (!ruleIds.contains(upstreamRule)) {
                    throw new PlanConfigurationException("request " + request.requestId() + ": rule "
                        + rule.ruleId() + " depends on unknown rule " + upstreamRule);
                }
                deps.add(SCAN_PREFIX + upstreamRule);
            }

            Map<String, Double> ruleParams = parameterStore.get(rule.ruleId());
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("data_source_ids", request.dataSourceIds());
            params.put("complexity", rule.complexity().name());
            params.put("estimated_data_volume_gb", request.estimatedDataVolumeGb());
            params.putAll(ruleParams);

            String stepId = SCAN_PREFIX + rule.ruleId();
            steps.add(new WorkflowStep(stepId, "Scan " + rule.ruleId(), StepType.SCAN, deps, true,
                timeoutOf(ruleParams), 0, rule.ruleId(), params));
            scanStepIds.add(stepId);
        }

        Set<String> tail = scanStepIds.isEmpty() ? Set.of(VALIDATE_SOURCE) : new LinkedHashSet<>(scanStepIds);
        if (!request.complianceRequirements().isEmpty()) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("requirements", request.complianceRequirements());
            steps.add(new WorkflowStep(COMPLIANCE_CHECK, "Compliance check", StepType.COMPLIANCE_CHECK,
                tail, true, null, 0, null, params));
            tail = Set.of(COMPLIANCE_CHECK);
        }

        steps.add(new WorkflowStep(NOTIFY, "Notify owners", StepType.NOTIFICATION, tail, false,
            null, 0, null, Map.of("request_id", request.requestId())));
        return steps;
    }

    /**
     * 用规则参数的当前值刷新生成的扫描步骤（参数可能在计划创建后被自适应调整）
     * 显式提交的步骤不带参数快照，保持原样
     */
    public Workflow refreshParameters(Workflow workflow) {
        List<WorkflowStep> steps = new ArrayList<>(workflow.steps().size());
        boolean changed = false;
        for (WorkflowStep step : workflow.steps()) {
            if (step.type() == StepType.SCAN && step.ruleId() != null
                && step.parameters().containsKey(RuleParameters.EXECUTION_TIMEOUT)) {
                Map<String, Double> current = parameterStore.get(step.ruleId());
                Map<String, Object> params = new LinkedHashMap<>(step.parameters());
                params.putAll(current);
                steps.add(step.withRule(step.ruleId(), params).withTimeout(timeoutOf(current)));
                changed = true;
            } else {
                steps.add(step);
            }
        }
        if (!changed) {
            return workflow;
        }
        return new Workflow(workflow.workflowId(), workflow.requestId(), workflow.priority(), steps,
            workflow.dependsOnWorkflowIds(), workflow.criticalPath());
    }

    private static Duration timeoutOf(Map<String, Double> ruleParams) {
        double seconds = ruleParams.getOrDefault(RuleParameters.EXECUTION_TIMEOUT, 0.0);
        return seconds > 0 ? Duration.ofMillis((long) (seconds * 1000)) : null;
    }
}
