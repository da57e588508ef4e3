package com.smancode.companion.thinking;

/**
 * 思考内容来源，仅用于诊断，不影响渲染
 */
public enum ThoughtOrigin {
    TEMPLATE,
    GENERATED
}
