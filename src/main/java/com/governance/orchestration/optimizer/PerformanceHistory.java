package com.governance.orchestration.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 单条规则的有界执行历史（环形缓冲）
 * 只有监控路径写入，读多写少
 */
final class PerformanceHistory {

    private final ExecutionMetrics[] buffer;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private int head;
    private int size;
    private long totalObserved;

    PerformanceHistory(int capacity) {
        this.buffer = new ExecutionMetrics[Math.max(1, capacity)];
    }

    void append(ExecutionMetrics metrics) {
        lock.writeLock().lock();
        try {
            buffer[head] = metrics;
            head = (head + 1) % buffer.length;
            if (size < buffer.length) {
                size++;
            }
            totalObserved++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 按时间顺序（旧 → 新）返回副本
     */
    List<ExecutionMetrics> snapshot() {
        lock.readLock().lock();
        try {
            List<ExecutionMetrics> copy = new ArrayList<>(size);
            int start = (head - size + buffer.length) % buffer.length;
            for (int i = 0; i < size; i++) {
                copy.add(buffer[(start + i) % buffer.length]);
            }
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 累计观测次数（不受容量限制）
     */
    long totalObserved() {
        lock.readLock().lock();
        try {
            return totalObserved;
        } finally {
            lock.readLock().unlock();
        }
    }
}
