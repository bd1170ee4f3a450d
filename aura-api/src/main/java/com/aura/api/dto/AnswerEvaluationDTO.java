package com.aura.api.dto;

import lombok.Data;

/**
 * 单题评估结果 DTO
 */
@Data
public class AnswerEvaluationDTO {

    private Integer questionIndex;

    private String question;

    private Integer score;

    private String feedback;

    private String strengths;

    private String improvements;

    /**
     * 是否为兜底评估（模型不可用或输出不可解析）
     */
    private Boolean fallback;
}
