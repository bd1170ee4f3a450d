package com.aura.types.enums;

/**
 * 模型调用结果分类。
 */
public enum InvocationStatusEnum {
    SUCCESS,
    REFUSED,
    UPSTREAM_ERROR,
    EMPTY_OUTPUT
}
