package com.governance.orchestration.optimizer;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 规则可调参数的当前值（内存态）
 */
@Component
public class RuleParameterStore {

    private final Map<String, Map<String, Double>> parameters = new ConcurrentHashMap<>();

    /**
     * 当前参数（含默认值）的副本
     */
    public Map<String, Double> get(String ruleId) {
        Map<String, Double> merged = new LinkedHashMap<>(RuleParameters.DEFAULTS);
        Map<String, Double> overrides = parameters.get(ruleId);
        if (overrides != null) {
            synchronized (overrides) {
                merged.putAll(overrides);
            }
        }
        return merged;
    }

    public double get(String ruleId, String parameter) {
        Double value = get(ruleId).get(parameter);
        return value != null ? value : 0.0;
    }

    /**
     * 设置参数，返回旧值
     */
    public double set(String ruleId, String parameter, double value) {
        Map<String, Double> overrides = parameters.computeIfAbsent(ruleId, k -> new LinkedHashMap<>());
        synchronized (overrides) {
            Double previous = overrides.put(parameter, value);
            if (previous != null) {
                return previous;
            }
            return RuleParameters.DEFAULTS.getOrDefault(parameter, 0.0);
        }
    }

    public void setAll(String ruleId, Map<String, Double> values) {
        values.forEach((parameter, value) -> set(ruleId, parameter, value));
    }
}
