package com.governance.orchestration.dto;

import com.governance.orchestration.alert.PerformanceSnapshot;
import com.governance.orchestration.alert.SubjectKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 连接器层推送的性能快照；未给出的指标按"无压力"取值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSnapshotDTO {

    private SubjectKind subjectKind;
    private String subjectId;
    private Instant timestamp;
    private double executionTimeMs;

    /** 百分比 */
    private double cpuUsage;

    /** 百分比 */
    private double memoryUsage;

    private double throughput;

    /** [0,1]，缺省 1.0 */
    private Double successRate;

    private double queueLength;
    private int concurrentScans;
    private Double accuracy;

    public PerformanceSnapshot toSnapshot() {
        return new PerformanceSnapshot(subjectKind, subjectId, timestamp, executionTimeMs, cpuUsage, memoryUsage,
            throughput, successRate == null ? 1.0 : successRate, queueLength, concurrentScans, accuracy);
    }
}
