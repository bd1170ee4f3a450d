package com.aura.api.dto;

import lombok.Data;

/**
 * 开始面试请求 DTO
 */
@Data
public class InterviewStartRequestDTO {

    private String sessionId;
}
