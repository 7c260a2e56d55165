package com.governance.orchestration.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 编排服务配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "orchestration")
public class OrchestrationProperties {

    /** 资源池容量 */
    private ResourcePoolConfig resourcePool = new ResourcePoolConfig();

    /** 工作流执行引擎 */
    private WorkflowConfig workflow = new WorkflowConfig();

    /** 编排器 */
    private OrchestratorConfig orchestrator = new OrchestratorConfig();

    /** 自适应优化 */
    private AdaptationConfig adaptation = new AdaptationConfig();

    /** 告警阈值 */
    private AlertConfig alerts = new AlertConfig();

    /** 性能预测器 */
    private PredictorConfig predictor = new PredictorConfig();

    @Data
    public static class ResourcePoolConfig {
        /** CPU 核数 */
        private double cpuCores = 64;
        /** 内存（MB） */
        private double memoryMb = 262_144;
        /** 网络带宽（Mbps） */
        private double networkMbps = 10_000;
        /** 存储（GB） */
        private double storageGb = 10_000;
    }

    @Data
    public static class WorkflowConfig {
        /** 单个工作流内最大并行步骤数 */
        private int maxParallelSteps = 4;
        /** 步骤默认超时 */
        private Duration defaultStepTimeout = Duration.ofMinutes(30);
        /** 超时重试最大尝试次数（含首次） */
        private int maxAttempts = 3;
        /** 首次重试退避 */
        private Duration retryInitialBackoff = Duration.ofSeconds(1);
        /** 退避倍数 */
        private double retryBackoffMultiplier = 2.0;
        /** 资源采样间隔 */
        private Duration samplingInterval = Duration.ofSeconds(1);
        /** 取消后等待在途步骤的宽限期 */
        private Duration cancellationGracePeriod = Duration.ofSeconds(10);
        /** 步骤调度线程数 */
        private int stepPoolSize = 16;
        /** 没有注册处理器的步骤类型如何处理 */
        private UnhandledStepPolicy unhandledStepPolicy = UnhandledStepPolicy.PASS_THROUGH;
    }

    @Data
    public static class OrchestratorConfig {
        /** 同时执行的工作流上限 */
        private int maxConcurrentWorkflows = 8;
        /** 工作流执行线程数 */
        private int workflowPoolSize = 8;
        /** 异步执行计划时的协调线程数 */
        private int coordinatorPoolSize = 4;
        /** 资源暂不可用时的重新尝试间隔 */
        private Duration admissionRetryInterval = Duration.ofMillis(100);
        /** 为预测器训练保留的执行记录数 */
        private int trainingHistoryCapacity = 5000;
        /** 预测 / 训练线程数（CPU 密集） */
        private int predictionPoolSize = 2;
        /** 单次预测超时 */
        private Duration predictionTimeout = Duration.ofSeconds(2);
        /** 资源不足时的处理策略 */
        private InsufficientResourcesPolicy insufficientResourcesPolicy = InsufficientResourcesPolicy.REJECT;
        /** 已结束计划的保留时长 */
        private Duration planRetention = Duration.ofHours(6);
        /** 已结束计划的最大保留数量 */
        private long maxRetainedPlans = 1000;
    }

    @Data
    public static class AdaptationConfig {
        /** 每条规则保留的执行记录数 */
        private int historyCapacity = 1000;
        /** 触发自适应所需最少样本 */
        private int minSamples = 100;
        /** 新旧对比窗口大小 */
        private int comparisonWindow = 10;
        /** 执行时间劣化阈值（相对） */
        private double timeDeclineThreshold = 0.20;
        /** 准确率劣化阈值（相对） */
        private double accuracyDeclineThreshold = 0.10;
        /** 执行时间变异系数阈值 */
        private double varianceThreshold = 0.5;
        /** 自动应用所需安全分 */
        private double autoApplySafetyThreshold = 0.8;
        /** HYBRID 模式下自动应用所需安全分 */
        private double hybridSafetyThreshold = 0.9;
        /** 每次最多保留的候选数 */
        private int maxCandidates = 5;
        /** 每条规则保留的已应用变更数 */
        private int appliedChangeHistory = 200;
    }

    @Data
    public static class AlertConfig {
        /** 指标 → 阈值 */
        private Map<String, Double> thresholds = defaultThresholds();
        /** 每条指标序列保留的快照数 */
        private int seriesCapacity = 1000;
        /** 序列空闲多久后淘汰 */
        private Duration seriesIdleExpiry = Duration.ofHours(1);

        private static Map<String, Double> defaultThresholds() {
            Map<String, Double> thresholds = new LinkedHashMap<>();
            thresholds.put("cpu_utilization", 85.0);
            thresholds.put("memory_usage", 90.0);
            thresholds.put("error_rate", 5.0);
            thresholds.put("queue_size", 1000.0);
            thresholds.put("response_time", 30000.0);
            return thresholds;
        }
    }

    @Data
    public static class PredictorConfig {
        /** 训练最少样本数 */
        private int minTrainingSamples = 10;
        /** 岭回归正则系数 */
        private double ridgeLambda = 1e-3;
        /** 样本数达到该值时划出 20% 作为验证集 */
        private int holdoutMinSamples = 20;
    }

    public enum UnhandledStepPolicy {
        /** 视为空操作直接完成 */
        PASS_THROUGH,
        /** 视为逻辑失败 */
        FAIL
    }

    public enum InsufficientResourcesPolicy {
        /** 计划阶段直接拒绝 */
        REJECT,
        /** 按比例缩减分配以适配容量 */
        SHRINK,
        /** 接受计划，执行时排队等待资源释放 */
        QUEUE
    }
}
