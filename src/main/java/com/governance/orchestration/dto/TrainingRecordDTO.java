package com.governance.orchestration.dto;

import com.governance.orchestration.predictor.ExecutionRecord;
import com.governance.orchestration.predictor.FeatureVector;
import com.governance.orchestration.predictor.PerformanceOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 一条带标签的历史执行记录，用于训练预测器
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingRecordDTO {

    private String ruleId;
    private Map<String, Double> features;
    private PerformanceOutcome outcome;
    private Instant observedAt;

    public ExecutionRecord toRecord() {
        if (features == null || outcome == null) {
            throw new IllegalArgumentException("training record for rule " + ruleId + " lacks features or outcome");
        }
        return new ExecutionRecord(ruleId, FeatureVector.of(features), outcome,
            observedAt == null ? Instant.now() : observedAt);
    }
}
