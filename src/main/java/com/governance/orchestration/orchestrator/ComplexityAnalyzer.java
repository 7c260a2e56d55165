package com.governance.orchestration.orchestrator;

import com.governance.orchestration.resource.ResourceRequirement;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 请求复杂度评分
 *
 * <p>常数是固定约定，不随配置变化：
 * 数据源 &gt;10 加 30、&gt;5 加 15；每条规则按复杂度加 25 / 15 / 8；
 * 数据量 &gt;1000GB 加 40、&gt;100GB 加 20；每项合规要求加 5。
 */
@Component
public class ComplexityAnalyzer {

    public ComplexityAnalysis analyze(ScanRequest request) {
        int score = 0;
        List<String> factors = new ArrayList<>();

        int dataSources = request.dataSourceIds().size();
        if (dataSources > 10) {
            score += 30;
            factors.add("data_sources(" + dataSources + ") > 10: +30");
        } else if (dataSources > 5) {
            score += 15;
            factors.add("data_sources(" + dataSources + ") > 5: +15");
        }

        for (RuleSpec rule : request.rules()) {
            int weight = rule.complexity().getWeight();
            if (weight > 0) {
                score += weight;
                factors.add("rule " + rule.ruleId() + " " + rule.complexity().name().toLowerCase() + ": +" + weight);
            }
        }

        double volume = request.estimatedDataVolumeGb();
        if (volume > 1000) {
            score += 40;
            factors.add("data_volume(" + volume + "GB) > 1000: +40");
        } else if (volume > 100) {
            score += 20;
            factors.add("data_volume(" + volume + "GB) > 100: +20");
        }

        int compliance = request.complianceRequirements().size();
        if (compliance > 0) {
            score += 5 * compliance;
            factors.add("compliance_requirements(" + compliance + "): +" + (5 * compliance));
        }

        return new ComplexityAnalysis(request.requestId(), score, ComplexityGrade.fromScore(score), factors,
            Duration.ofMinutes(Math.max(30, score * 2L)), recommendedResources(score, volume));
    }

    /**
     * cpu = max(2, score/20)，内存 = max(4, score/10) GB，存储 = max(10, 数据量×1.2) GB，网络 = max(50, score×5) Mbps
     */
    static ResourceRequirement recommendedResources(int score, double volumeGb) {
        double cpu = Math.max(2, score / 20);
        double memoryMb = Math.max(4, score / 10) * 1024.0;
        double storage = Math.max(10.0, volumeGb * 1.2);
        double network = Math.max(50, score * 5);
        return new ResourceRequirement(cpu, memoryMb, network, storage);
    }
}
