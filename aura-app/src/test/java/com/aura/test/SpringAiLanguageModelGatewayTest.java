package com.aura.test;

import com.aura.domain.screening.model.valobj.ModelOutcome;
import com.aura.infrastructure.ai.SpringAiLanguageModelGateway;
import com.aura.infrastructure.ai.config.ScreeningModelProperties;
import com.aura.types.enums.InvocationStatusEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatGenerationMetadata;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;

import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SpringAiLanguageModelGatewayTest {

    private ChatClient chatClient;
    private ThreadPoolExecutor executor;
    private ScreeningModelProperties properties;
    private SpringAiLanguageModelGateway gateway;

    @BeforeEach
    public void setUp() {
        this.chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        this.executor = new ThreadPoolExecutor(2, 2, 0L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(8));
        this.properties = new ScreeningModelProperties();
        this.gateway = new SpringAiLanguageModelGateway(chatClient, executor, properties);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldReturnSuccessText() {
        stubResponse(response("{\"score\": 80}", "STOP"));

        ModelOutcome outcome = gateway.invoke("prompt");

        assertTrue(outcome.isSuccess());
        assertEquals("{\"score\": 80}", outcome.getText());
    }

    @Test
    public void shouldClassifyContentFilterAsRefused() {
        stubResponse(response("", "content_filter"));

        ModelOutcome outcome = gateway.invoke("prompt");

        assertEquals(InvocationStatusEnum.REFUSED, outcome.getStatus());
        assertEquals("finish_reason=CONTENT_FILTER", outcome.getDetail());
    }

    @Test
    public void shouldClassifyMissingCandidatesAsRefused() {
        stubResponse(new ChatResponse(List.of()));

        assertEquals(InvocationStatusEnum.REFUSED, gateway.invoke("prompt").getStatus());
    }

    @Test
    public void shouldClassifyBlankTextAsEmptyOutput() {
        stubResponse(response("   ", "STOP"));

        assertEquals(InvocationStatusEnum.EMPTY_OUTPUT, gateway.invoke("prompt").getStatus());
    }

    @Test
    public void shouldClassifyClientFailureAsUpstreamError() {
        when(chatClient.prompt().user(anyString()).call().chatResponse())
                .thenThrow(new IllegalStateException("503 Service Unavailable"));

        ModelOutcome outcome = gateway.invoke("prompt");

        assertEquals(InvocationStatusEnum.UPSTREAM_ERROR, outcome.getStatus());
        assertTrue(outcome.getDetail().contains("503 Service Unavailable"));
    }

    @Test
    public void shouldClassifyTimeoutAsUpstreamError() {
        properties.setTimeoutSeconds(1L);
        when(chatClient.prompt().user(anyString()).call().chatResponse()).thenAnswer(invocation -> {
            Thread.sleep(3000L);
            return response("late", "STOP");
        });

        ModelOutcome outcome = gateway.invoke("prompt");

        assertEquals(InvocationStatusEnum.UPSTREAM_ERROR, outcome.getStatus());
        assertTrue(outcome.getDetail().contains("timed out"));
    }

    @Test
    public void shouldRejectBlankPromptWithoutCallingModel() {
        ModelOutcome outcome = gateway.invoke("  ");

        assertEquals(InvocationStatusEnum.UPSTREAM_ERROR, outcome.getStatus());
        verify(chatClient, never()).prompt();
    }

    private void stubResponse(ChatResponse response) {
        when(chatClient.prompt().user(anyString()).call().chatResponse()).thenReturn(response);
    }

    private ChatResponse response(String text, String finishReason) {
        ChatGenerationMetadata metadata = ChatGenerationMetadata.builder().finishReason(finishReason).build();
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text), metadata)));
    }
}
