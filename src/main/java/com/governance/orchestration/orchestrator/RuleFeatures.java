package com.governance.orchestration.orchestrator;

import com.governance.orchestration.predictor.FeatureVector;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 从请求和规则参数抽取预测特征，计划阶段和训练样本使用同一套特征
 */
final class RuleFeatures {

    static final String RULE_COMPLEXITY = "rule_complexity";
    static final String DATA_VOLUME_GB = "data_volume_gb";
    static final String DATA_SOURCE_COUNT = "data_source_count";
    static final String COMPLIANCE_COUNT = "compliance_count";
    static final String PRIORITY_RANK = "priority_rank";

    private RuleFeatures() {
    }

    static FeatureVector of(ScanRequest request, RuleSpec rule, Map<String, Double> ruleParameters) {
        Map<String, Double> features = new LinkedHashMap<>();
        features.put(RULE_COMPLEXITY, (double) rule.complexity().getWeight());
        features.put(DATA_VOLUME_GB, request.estimatedDataVolumeGb());
        features.put(DATA_SOURCE_COUNT, (double) request.dataSourceIds().size());
        features.put(COMPLIANCE_COUNT, (double) request.complianceRequirements().size());
        features.put(PRIORITY_RANK, (double) request.priority().getRank());
        ruleParameters.forEach((name, value) -> features.put("param_" + name, value));
        return FeatureVector.of(features);
    }
}
