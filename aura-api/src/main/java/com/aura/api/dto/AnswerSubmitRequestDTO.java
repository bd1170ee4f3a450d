package com.aura.api.dto;

import lombok.Data;

/**
 * 提交回答请求 DTO
 */
@Data
public class AnswerSubmitRequestDTO {

    private String sessionId;

    /**
     * 题目下标，从 0 开始
     */
    private Integer questionIndex;

    private String answer;
}
