package com.governance.orchestration.service;

import com.governance.orchestration.alert.PerformanceSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 单个监控对象的有界、只追加性能序列
 */
public class PerformanceSeries {

    private final int capacity;
    private final Deque<PerformanceSnapshot> snapshots = new ArrayDeque<>();
    private long totalAppended;

    public PerformanceSeries(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void append(PerformanceSnapshot snapshot) {
        snapshots.addLast(snapshot);
        totalAppended++;
        while (snapshots.size() > capacity) {
            snapshots.removeFirst();
        }
    }

    /**
     * 最近的 limit 条，旧的在前
     */
    public synchronized List<PerformanceSnapshot> latest(int limit) {
        List<PerformanceSnapshot> all = new ArrayList<>(snapshots);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    public synchronized PerformanceSnapshot last() {
        return snapshots.peekLast();
    }

    public synchronized int size() {
        return snapshots.size();
    }

    public synchronized long getTotalAppended() {
        return totalAppended;
    }
}
