package com.aura.api.dto;

import lombok.Data;

/**
 * 提交回答响应 DTO
 */
@Data
public class AnswerSubmitResponseDTO {

    private AnswerEvaluationDTO evaluation;

    private Integer questionIndex;

    /**
     * 是否已全部作答
     */
    private Boolean complete;

    /**
     * 完成时的最终结果，未完成为 null
     */
    private FinalResultDTO finalResult;
}
