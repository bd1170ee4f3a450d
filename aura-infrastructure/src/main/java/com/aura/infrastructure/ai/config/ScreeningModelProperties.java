package com.aura.infrastructure.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 筛选流水线模型调用配置，前缀 aura.model。
 * <p>
 * 连接地址与密钥沿用 spring.ai.openai.*，这里只约束每次调用的生成参数与超时。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "aura.model", ignoreInvalidFields = true)
public class ScreeningModelProperties {

    /** 模型名称，为空时使用 spring.ai.openai.chat.options.model */
    private String model;

    /** 采样温度，默认0.7 */
    private Double temperature = 0.7D;

    /** 输出 token 上限，默认2000 */
    private Integer maxTokens = 2000;

    /** 单次调用等待上限（秒），默认60 */
    private Long timeoutSeconds = 60L;

}
