package com.governance.orchestration.exception;

public class AdaptationNotFoundException extends RuntimeException {

    public AdaptationNotFoundException(String changeId) {
        super("自适应变更不存在: " + changeId);
    }
}
