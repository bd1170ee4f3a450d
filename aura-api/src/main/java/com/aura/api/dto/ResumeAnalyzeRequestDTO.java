package com.aura.api.dto;

import lombok.Data;

/**
 * 简历分析请求 DTO
 */
@Data
public class ResumeAnalyzeRequestDTO {

    private String sessionId;

    /**
     * 岗位描述（JD）
     */
    private String jobDescription;
}
