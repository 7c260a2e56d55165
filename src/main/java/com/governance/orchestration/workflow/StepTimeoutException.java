package com.governance.orchestration.workflow;

import java.time.Duration;

/**
 * 单次步骤尝试超时，会按退避策略重试
 */
public class StepTimeoutException extends RuntimeException {

    public StepTimeoutException(String stepId, Duration timeout) {
        super("Step " + stepId + " timed out after " + timeout.toMillis() + " ms");
    }
}
