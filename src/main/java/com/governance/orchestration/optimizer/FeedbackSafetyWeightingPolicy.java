package com.governance.orchestration.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 有效 +0.05（上限 1.2），无效 -0.1（下限 0.5）
 */
@Component
public class FeedbackSafetyWeightingPolicy implements SafetyWeightingPolicy {

    private static final Logger log = LoggerFactory.getLogger(FeedbackSafetyWeightingPolicy.class);

    static final double REWARD = 0.05;
    static final double PENALTY = 0.1;
    static final double MAX_WEIGHT = 1.2;
    static final double MIN_WEIGHT = 0.5;

    private final Map<String, Double> weights = new ConcurrentHashMap<>();

    @Override
    public double weight(String parameter) {
        return weights.getOrDefault(parameter, 1.0);
    }

    @Override
    public void recordFeedback(String parameter, boolean helpful) {
        double updated = weights.merge(parameter, helpful ? 1.0 + REWARD : 1.0 - PENALTY, (current, ignored) ->
            helpful ? Math.min(MAX_WEIGHT, current + REWARD) : Math.max(MIN_WEIGHT, current - PENALTY));
        log.info("Safety weight for {} -> {} (helpful={})", parameter, String.format("%.2f", updated), helpful);
    }
}
