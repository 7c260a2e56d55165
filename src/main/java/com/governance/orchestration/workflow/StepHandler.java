package com.governance.orchestration.workflow;

import java.util.Map;

/**
 * 某一类步骤的实际执行逻辑（扫描 I/O 由外部连接器层实现）
 */
public interface StepHandler {

    StepType type();

    /**
     * 执行一次步骤
     *
     * @return 步骤输出，写入执行记录
     * @throws Exception 任何异常都视为逻辑失败，不重试
     */
    Map<String, Object> execute(StepContext context) throws Exception;
}
