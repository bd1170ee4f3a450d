package com.aura.infrastructure.ai.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 筛选流水线专用 ChatClient 装配。
 * <p>
 * 所有环节共用同一组确定的生成参数（温度与输出上限），不在单次调用中覆盖。
 * </p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ScreeningModelProperties.class)
public class ScreeningChatClientConfig {

    @Bean(name = "screeningChatClient")
    public ChatClient screeningChatClient(ChatModel chatModel, ScreeningModelProperties properties) {
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens());
        if (StringUtils.isNotBlank(properties.getModel())) {
            options.model(properties.getModel());
        }
        log.info("Screening chat client ready. model={}, temperature={}, maxTokens={}, timeoutSeconds={}",
                StringUtils.defaultIfBlank(properties.getModel(), "<default>"),
                properties.getTemperature(),
                properties.getMaxTokens(),
                properties.getTimeoutSeconds());
        return ChatClient.builder(chatModel)
                .defaultOptions(options.build())
                .build();
    }
}
