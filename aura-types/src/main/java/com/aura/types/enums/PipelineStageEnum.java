package com.aura.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 模型流水线环节，用于日志与指标打标。
 */
public enum PipelineStageEnum {

    /**
     * 简历分析
     */
    ANALYSIS("analysis"),

    /**
     * 面试题生成
     */
    QUESTIONS("questions"),

    /**
     * 回答评估
     */
    EVALUATION("evaluation");

    private final String code;

    PipelineStageEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
