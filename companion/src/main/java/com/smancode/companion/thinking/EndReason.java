package com.smancode.companion.thinking;

/**
 * 会话结束原因（诊断用）
 */
public enum EndReason {

    /**
     * 持续阶段收到终止请求，已追加收尾语
     */
    NATURAL_TERMINATION,

    /**
     * 初始阶段收到终止请求，不追加收尾语
     */
    EARLY_TERMINATION,

    /**
     * 异常结束（显示端不可用、任务被拒绝等）
     */
    FAILURE,

    /**
     * 持续循环在未取消的情况下退出，正常运行时不可达
     */
    LOOP_EXHAUSTED
}
