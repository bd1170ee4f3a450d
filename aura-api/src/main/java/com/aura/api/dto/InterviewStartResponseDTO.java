package com.aura.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 开始面试响应 DTO
 */
@Data
public class InterviewStartResponseDTO {

    private String sessionId;

    private List<String> questions;

    private Integer total;
}
