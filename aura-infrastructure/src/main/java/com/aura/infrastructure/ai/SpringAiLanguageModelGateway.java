package com.aura.infrastructure.ai;

import com.aura.domain.screening.adapter.gateway.ILanguageModelGateway;
import com.aura.domain.screening.model.valobj.ModelOutcome;
import com.aura.infrastructure.ai.config.ScreeningModelProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatGenerationMetadata;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring AI ChatClient 的模型调用实现。
 * <p>
 * 调用在公共线程池中执行并按配置超时等待；结果依据响应结构（生成数量与 finish reason）分类，
 * 不解析异常文本。本类从不向调用方抛出异常。
 * </p>
 *
 * @author aura
 * @since 2026-02-01
 */
@Slf4j
@Component
public class SpringAiLanguageModelGateway implements ILanguageModelGateway {

    private static final Set<String> REFUSAL_FINISH_REASONS = Set.of(
            "CONTENT_FILTER", "SAFETY", "BLOCKLIST", "PROHIBITED_CONTENT", "RECITATION", "SPII");

    private final ChatClient chatClient;
    private final ThreadPoolExecutor executor;
    private final ScreeningModelProperties properties;

    public SpringAiLanguageModelGateway(@Qualifier("screeningChatClient") ChatClient chatClient,
                                        @Qualifier("commonThreadPoolExecutor") ThreadPoolExecutor executor,
                                        ScreeningModelProperties properties) {
        this.chatClient = chatClient;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public ModelOutcome invoke(String prompt) {
        long startedAt = System.currentTimeMillis();
        ModelOutcome outcome = doInvoke(prompt);
        log.debug("MODEL_CALL status={}, promptLength={}, costMs={}",
                outcome.getStatus(), StringUtils.length(prompt), System.currentTimeMillis() - startedAt);
        return outcome;
    }

    private ModelOutcome doInvoke(String prompt) {
        if (StringUtils.isBlank(prompt)) {
            return ModelOutcome.upstreamError("Prompt is empty");
        }
        long timeoutSeconds = resolveTimeoutSeconds();
        Future<ChatResponse> future;
        try {
            future = executor.submit(() -> chatClient.prompt().user(prompt).call().chatResponse());
        } catch (RejectedExecutionException ex) {
            log.warn("Model call rejected by worker pool. error={}", ex.getMessage());
            return ModelOutcome.upstreamError("Model call rejected: worker pool saturated");
        }
        try {
            return classify(future.get(timeoutSeconds, TimeUnit.SECONDS));
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Model call timed out. timeoutSeconds={}", timeoutSeconds);
            return ModelOutcome.upstreamError("Model call timed out after " + timeoutSeconds + "s");
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ModelOutcome.upstreamError("Model call interrupted");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("Model call failed. errorType={}, error={}", cause.getClass().getSimpleName(), cause.getMessage());
            return ModelOutcome.upstreamError(cause.getClass().getSimpleName() + ": "
                    + StringUtils.defaultIfBlank(cause.getMessage(), "no detail"));
        }
    }

    private ModelOutcome classify(ChatResponse response) {
        if (response == null) {
            return ModelOutcome.refused("Model returned no response");
        }
        List<Generation> generations = response.getResults();
        if (generations == null || generations.isEmpty()) {
            return ModelOutcome.refused("Model returned no candidates");
        }
        Generation generation = generations.get(0);
        String finishReason = finishReasonOf(generation);
        if (finishReason != null && REFUSAL_FINISH_REASONS.contains(finishReason)) {
            return ModelOutcome.refused("finish_reason=" + finishReason);
        }
        AssistantMessage output = generation == null ? null : generation.getOutput();
        String text = output == null ? null : output.getText();
        if (StringUtils.isBlank(text)) {
            return ModelOutcome.emptyOutput();
        }
        return ModelOutcome.success(text);
    }

    private String finishReasonOf(Generation generation) {
        if (generation == null) {
            return null;
        }
        ChatGenerationMetadata metadata = generation.getMetadata();
        if (metadata == null || StringUtils.isBlank(metadata.getFinishReason())) {
            return null;
        }
        return metadata.getFinishReason().trim().toUpperCase(Locale.ROOT);
    }

    private long resolveTimeoutSeconds() {
        Long configured = properties == null ? null : properties.getTimeoutSeconds();
        return configured == null || configured <= 0 ? 60L : configured;
    }
}
