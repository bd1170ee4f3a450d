package com.aura.api.dto;

import lombok.Data;

/**
 * 健康检查响应。
 */
@Data
public class HealthStatusDTO {

    private String status;

    private String backend;

    private Boolean ready;
}
