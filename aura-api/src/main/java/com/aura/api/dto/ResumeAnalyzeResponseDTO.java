package com.aura.api.dto;

import lombok.Data;

/**
 * 简历分析响应 DTO
 */
@Data
public class ResumeAnalyzeResponseDTO {

    private String sessionId;

    private ResumeAnalysisDTO analysis;
}
