package com.governance.orchestration.workflow;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 取消信号，计划内所有工作流共享一个
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private volatile Instant cancelledAt;

    /**
     * @return 本次调用是否真正触发了取消（重复取消返回 false）
     */
    public boolean cancel(String cancelReason) {
        if (reason.compareAndSet(null, cancelReason == null ? "cancelled" : cancelReason)) {
            cancelledAt = Instant.now();
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }
}
