package com.aura.api.dto;

import lombok.Data;

/**
 * 简历上传响应 DTO
 */
@Data
public class ResumeUploadResponseDTO {

    private String sessionId;

    /**
     * 抽取文本的前 200 个字符
     */
    private String preview;
}
