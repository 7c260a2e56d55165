package com.governance.orchestration.predictor;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 规则 / 工作负载特征向量，按特征名排序
 */
public record FeatureVector(Map<String, Double> features) {

    public FeatureVector {
        features = Collections.unmodifiableMap(new TreeMap<>(features));
    }

    public double get(String name) {
        Double value = features.get(name);
        return value != null ? value : 0.0;
    }

    public boolean has(String name) {
        return features.containsKey(name);
    }

    public static FeatureVector of(Map<String, Double> features) {
        return new FeatureVector(features);
    }
}
