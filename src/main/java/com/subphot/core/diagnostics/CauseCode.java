package com.subphot.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：统一描述单帧或单任务失败的原因，供日志、阶段汇总与测试断言使用。
 */
public enum CauseCode {
    NONE,
    MISSING_COMPANION_FILE,
    UNREADABLE_METRIC,
    BINARY_READER_UNAVAILABLE,
    CCD_PARAMETERS_UNRESOLVED,
    TRANSFORM_FAILED,
    TRANSFORM_OUTPUT_MISSING,
    TRANSFORM_ERROR,
    NOT_EXECUTED
}
