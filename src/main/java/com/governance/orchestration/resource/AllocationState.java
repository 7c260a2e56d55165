package com.governance.orchestration.resource;

/**
 * 分配状态：RESERVED → COMMITTED → RELEASED，或 RESERVED → RELEASED
 */
public enum AllocationState {
    RESERVED,
    COMMITTED,
    RELEASED
}
