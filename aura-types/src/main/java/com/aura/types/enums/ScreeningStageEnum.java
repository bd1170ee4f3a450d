package com.aura.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 候选人筛选会话阶段枚举。
 * <p>
 * 阶段只能由前一阶段推进：CREATED -> ANALYZED -> INTERVIEW_STARTED -> ANSWERING -> COMPLETED。
 * </p>
 */
public enum ScreeningStageEnum {

    /**
     * 已创建 - 简历文本已就绪
     */
    CREATED("created"),

    /**
     * 已分析 - 简历分析结果已存在
     */
    ANALYZED("analyzed"),

    /**
     * 面试已开始 - 题目已固定，尚无回答
     */
    INTERVIEW_STARTED("interview_started"),

    /**
     * 作答中 - 0 < 已答 < 题目总数
     */
    ANSWERING("answering"),

    /**
     * 已完成 - 全部作答并已生成最终结果
     */
    COMPLETED("completed");

    private final String code;

    ScreeningStageEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isInterviewInProgress() {
        return this == INTERVIEW_STARTED || this == ANSWERING;
    }
}
