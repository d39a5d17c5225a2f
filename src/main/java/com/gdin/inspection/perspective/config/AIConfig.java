package com.gdin.inspection.perspective.config;

import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.exception.GenerationException;
import dev.langchain4j.community.model.dashscope.QwenChatRequestParameters;
import dev.langchain4j.community.model.dashscope.QwenStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
public class AIConfig {
    @Resource
    private PerspectiveProperties perspectiveProperties;

    @Bean
    public StreamingChatModel streamingChatModel() {
        PerspectiveProperties.Llm llm = perspectiveProperties.getLlm();
        QwenChatRequestParameters qwenChatRequestParameters = QwenChatRequestParameters.builder()
                .enableThinking(llm.getEnableThinking())
                .build();
        return QwenStreamingChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .defaultRequestParameters(qwenChatRequestParameters)
                .modelName(llm.getModelName())
                .apiKey(llm.getApiKey())
                .temperature(llm.getTemperature())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gdin.ai.perspective.similarity", name = "mode", havingValue = "embedding")
    public EmbeddingModel embeddingModel() {
        PerspectiveProperties.Embedding embedding = perspectiveProperties.getEmbedding();
        return OllamaEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .modelName(embedding.getModelName())
                .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                .build();
    }

    @Bean
    public Retry generationRetry() {
        return buildGenerationRetry(perspectiveProperties.getGeneration());
    }

    /**
     * 单次生成调用的重试：只重试超时 / 调用失败；下游限流时才做指数退避
     */
    public static Retry buildGenerationRetry(PerspectiveProperties.Generation generation) {
        IntervalFunction interval = Boolean.TRUE.equals(generation.getRateLimited())
                ? IntervalFunction.ofExponentialBackoff(generation.getBackoffMillis(), generation.getBackoffMultiplier())
                : attempt -> 0L;
        Retry retry = Retry.of("generation-retry", RetryConfig.custom()
                .maxAttempts(Math.max(1, generation.getMaxAttempts()))
                .intervalFunction(interval)
                .retryExceptions(GenerationException.class)
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("generation retry #{}: {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        return retry;
    }
}
