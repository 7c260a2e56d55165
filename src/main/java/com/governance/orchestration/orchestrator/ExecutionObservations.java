package com.governance.orchestration.orchestrator;

import com.governance.orchestration.alert.PerformanceSnapshot;
import com.governance.orchestration.alert.SubjectKind;
import com.governance.orchestration.constant.OrchestrationConstants;
import com.governance.orchestration.optimizer.ExecutionMetrics;
import com.governance.orchestration.predictor.PerformanceOutcome;
import com.governance.orchestration.workflow.StepExecutionRecord;
import com.governance.orchestration.workflow.StepPerformance;
import com.governance.orchestration.workflow.StepStatus;
import com.governance.orchestration.workflow.WorkflowExecutionRecord;

import java.time.Instant;
import java.util.Map;

/**
 * 把执行记录换算成告警快照、优化器观测和训练标签
 */
final class ExecutionObservations {

    private ExecutionObservations() {
    }

    /**
     * 工作流级快照：耗时、峰值 CPU / 堆、吞吐、步骤成功率
     */
    static PerformanceSnapshot workflowSnapshot(WorkflowExecutionRecord record, int queueLength, int concurrent) {
        double cpu = 0;
        double memory = 0;
        double throughput = 0;
        double accuracySum = 0;
        int accuracyCount = 0;
        int succeeded = 0;
        int failed = 0;
        for (Map.Entry<String, StepPerformance> entry : record.getPerformanceData().entrySet()) {
            StepPerformance performance = entry.getValue();
            StepExecutionRecord step = record.getStep(entry.getKey());
            cpu = Math.max(cpu, Math.max(0, performance.peakCpuLoad()) * 100);
            memory = Math.max(memory, performance.peakHeapPercent());
            throughput += Math.max(0, throughputOf(step, performance));
            Double accuracy = number(step.getOutput(), OrchestrationConstants.OUTPUT_ACCURACY);
            if (accuracy != null) {
                accuracySum += accuracy;
                accuracyCount++;
            }
            if (step.getStatus() == StepStatus.COMPLETED) {
                succeeded++;
            } else if (step.getStatus() == StepStatus.FAILED) {
                failed++;
            }
        }
        double successRate = succeeded + failed == 0 ? 1.0 : (double) succeeded / (succeeded + failed);
        return new PerformanceSnapshot(SubjectKind.SCAN, record.getWorkflowId(), Instant.now(),
            record.getDuration().toMillis(), cpu, memory, throughput, successRate, queueLength, concurrent,
            accuracyCount == 0 ? null : Math.max(0, Math.min(1, accuracySum / accuracyCount)));
    }

    /**
     * 规则级观测，只针对真正运行过（完成或失败）的步骤
     */
    static ExecutionMetrics ruleMetrics(StepExecutionRecord step, StepPerformance performance) {
        Double accuracy = number(step.getOutput(), OrchestrationConstants.OUTPUT_ACCURACY);
        return new ExecutionMetrics(Instant.now(),
            performance.durationMs() / 1000.0,
            accuracy == null ? Double.NaN : accuracy,
            Math.max(0, performance.peakCpuLoad()) * 100,
            performance.peakHeapPercent(),
            throughputOf(step, performance),
            step.getStatus() == StepStatus.COMPLETED ? 1.0 : 0.0);
    }

    /**
     * 训练标签；步骤没有给出的质量指标按执行结果取保守值
     */
    static PerformanceOutcome outcome(StepExecutionRecord step, StepPerformance performance, double complexityWeight) {
        boolean completed = step.getStatus() == StepStatus.COMPLETED;
        Map<String, Object> output = step.getOutput();
        double resourceUsage = Math.max(0, Math.min(1, Math.max(performance.peakCpuLoad(),
            performance.peakHeapPercent() / 100.0)));
        return new PerformanceOutcome(
            performance.durationMs() / 1000.0,
            orDefault(number(output, OrchestrationConstants.OUTPUT_ACCURACY), completed ? 1.0 : 0.0),
            orDefault(number(output, OrchestrationConstants.OUTPUT_FALSE_POSITIVE_RATE), 0.0),
            resourceUsage,
            throughputOf(step, performance),
            resourceUsage,
            orDefault(number(output, OrchestrationConstants.OUTPUT_COVERAGE), completed ? 1.0 : 0.0),
            Math.min(1.0, complexityWeight / 25.0));
    }

    static boolean hasRun(StepExecutionRecord step) {
        return step.getStatus() == StepStatus.COMPLETED || step.getStatus() == StepStatus.FAILED;
    }

    private static double throughputOf(StepExecutionRecord step, StepPerformance performance) {
        Map<String, Object> output = step.getOutput();
        Double throughput = number(output, OrchestrationConstants.OUTPUT_THROUGHPUT);
        if (throughput != null) {
            return Math.max(0, throughput);
        }
        Double records = number(output, OrchestrationConstants.OUTPUT_RECORDS_SCANNED);
        if (records != null && performance.durationMs() > 0) {
            return Math.max(0, records / (performance.durationMs() / 1000.0));
        }
        return 0.0;
    }

    private static Double number(Map<String, Object> output, String key) {
        Object value = output == null ? null : output.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
