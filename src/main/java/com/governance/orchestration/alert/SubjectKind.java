package com.governance.orchestration.alert;

/**
 * 性能序列的归属对象类型
 */
public enum SubjectKind {
    RULE,
    DATA_SOURCE,
    SCAN
}
