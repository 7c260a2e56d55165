package com.governance.orchestration.resource;

/**
 * 资源类型
 */
public enum ResourceKind {

    /** 计算（核） */
    CPU("cpu_cores"),

    /** 内存（MB） */
    MEMORY("memory_mb"),

    /** 网络（Mbps） */
    NETWORK("network_mbps"),

    /** 存储（GB） */
    STORAGE("storage_gb");

    private final String unitKey;

    ResourceKind(String unitKey) {
        this.unitKey = unitKey;
    }

    public String getUnitKey() {
        return unitKey;
    }
}
