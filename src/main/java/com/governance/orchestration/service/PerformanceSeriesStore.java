package com.governance.orchestration.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.governance.orchestration.alert.PerformanceSnapshot;
import com.governance.orchestration.alert.SubjectKind;
import com.governance.orchestration.config.OrchestrationProperties;
import com.governance.orchestration.constant.OrchestrationConstants;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 按 (对象类型, 对象 ID) 保存性能时间序列
 */
@Service
public class PerformanceSeriesStore {

    private final Cache<String, PerformanceSeries> cache;
    private final int capacity;

    public PerformanceSeriesStore(@Qualifier(OrchestrationConstants.PERFORMANCE_SERIES_CACHE)
                                  Cache<String, PerformanceSeries> cache,
                                  OrchestrationProperties properties) {
        this.cache = cache;
        this.capacity = properties.getAlerts().getSeriesCapacity();
    }

    public void append(PerformanceSnapshot snapshot) {
        cache.get(key(snapshot.subjectKind(), snapshot.subjectId()), k -> new PerformanceSeries(capacity))
            .append(snapshot);
    }

    public List<PerformanceSnapshot> latest(SubjectKind kind, String subjectId, int limit) {
        PerformanceSeries series = cache.getIfPresent(key(kind, subjectId));
        return series == null ? List.of() : series.latest(limit);
    }

    public Optional<PerformanceSnapshot> last(SubjectKind kind, String subjectId) {
        PerformanceSeries series = cache.getIfPresent(key(kind, subjectId));
        return series == null ? Optional.empty() : Optional.ofNullable(series.last());
    }

    public long seriesCount() {
        return cache.estimatedSize();
    }

    private static String key(SubjectKind kind, String subjectId) {
        return kind.name() + ":" + subjectId;
    }
}
