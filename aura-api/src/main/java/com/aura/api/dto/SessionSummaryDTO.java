package com.aura.api.dto;

import com.aura.types.enums.ScreeningStageEnum;
import lombok.Data;

/**
 * 会话概要 DTO
 */
@Data
public class SessionSummaryDTO {

    private String sessionId;

    private ScreeningStageEnum stage;

    private Boolean hasAnalysis;

    /**
     * 已作答题目数
     */
    private Integer interviewProgress;

    private Integer totalQuestions;

    private FinalResultDTO finalResult;
}
