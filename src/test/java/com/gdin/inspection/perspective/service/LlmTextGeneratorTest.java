package com.gdin.inspection.perspective.service;

import com.gdin.inspection.perspective.config.AIConfig;
import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.exception.GenerationTimeoutException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 超时 -> 重试 -> 成功 的完整链路：真实 AiServices + 流式模型桩。
 */
public class LlmTextGeneratorTest {

    /**
     * 前 silentCalls 次调用永不回调，之后同步返回 answer
     */
    static class SilentThenAnsweringModel implements StreamingChatModel {

        private final int silentCalls;
        private final String answer;
        private final AtomicInteger calls = new AtomicInteger();
        private final List<StreamingChatResponseHandler> silentHandlers = new CopyOnWriteArrayList<>();

        SilentThenAnsweringModel(int silentCalls, String answer) {
            this.silentCalls = silentCalls;
            this.answer = answer;
        }

        @Override
        public void doChat(ChatRequest chatRequest, StreamingChatResponseHandler handler) {
            if (calls.incrementAndGet() <= silentCalls) {
                silentHandlers.add(handler);
                return;
            }
            handler.onPartialResponse(answer);
            handler.onCompleteResponse(ChatResponse.builder().aiMessage(AiMessage.from(answer)).build());
        }
    }

    private static PerspectiveProperties properties(int maxAttempts) {
        PerspectiveProperties properties = new PerspectiveProperties();
        properties.getLlm().setTimeoutMillis(150L);
        properties.getGeneration().setMaxAttempts(maxAttempts);
        properties.getGeneration().setRateLimited(false);
        return properties;
    }

    private static LlmTextGenerator generator(StreamingChatModel model, PerspectiveProperties properties, Retry retry) {
        return new LlmTextGenerator(new AssistantGenerator(model), properties, retry);
    }

    @Test
    public void testTimeoutIsRetriedUntilAnswer() {
        PerspectiveProperties properties = properties(3);
        Retry retry = AIConfig.buildGenerationRetry(properties.getGeneration());
        List<Throwable> retried = new CopyOnWriteArrayList<>();
        retry.getEventPublisher().onRetry(event -> retried.add(event.getLastThrowable()));
        SilentThenAnsweringModel model = new SilentThenAnsweringModel(1, "<think>plan</think>Uniforms build school identity.");

        String text = generator(model, properties, retry).generate("Should schools require uniforms?");

        assertEquals("Uniforms build school identity.", text);
        assertEquals(2, model.calls.get());
        assertEquals(1, retried.size());
        assertInstanceOf(GenerationTimeoutException.class, retried.get(0));
        assertEquals(1, retry.getMetrics().getNumberOfSuccessfulCallsWithRetryAttempt());
    }

    @Test
    public void testEveryAttemptTimesOut() {
        PerspectiveProperties properties = properties(2);
        Retry retry = AIConfig.buildGenerationRetry(properties.getGeneration());
        SilentThenAnsweringModel model = new SilentThenAnsweringModel(Integer.MAX_VALUE, "never");

        GenerationTimeoutException e = assertThrows(GenerationTimeoutException.class,
                () -> generator(model, properties, retry).generate("Is coffee healthy?"));

        assertEquals(150L, e.getTimeoutMillis());
        assertEquals(2, model.calls.get());
        assertEquals(1, retry.getMetrics().getNumberOfFailedCallsWithRetryAttempt());
    }

    @Test
    public void testLateCallbacksFromAbandonedAttemptAreIgnored() {
        PerspectiveProperties properties = properties(2);
        Retry retry = AIConfig.buildGenerationRetry(properties.getGeneration());
        SilentThenAnsweringModel model = new SilentThenAnsweringModel(1, "Cars crowd city centres.");
        LlmTextGenerator generator = generator(model, properties, retry);

        assertEquals("Cars crowd city centres.", generator.generate("Should cities ban cars downtown?"));

        // 第一次调用的流这时才回来
        StreamingChatResponseHandler late = model.silentHandlers.get(0);
        assertDoesNotThrow(() -> {
            late.onPartialResponse("stale tokens");
            late.onCompleteResponse(ChatResponse.builder().aiMessage(AiMessage.from("stale tokens")).build());
            late.onError(new IllegalStateException("connection reset"));
        });
        assertEquals(2, model.calls.get());
    }
}
