package com.gdin.inspection.perspective.service;

import cn.hutool.core.util.IdUtil;
import com.gdin.inspection.perspective.assistant.SummaryAssistant;
import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.exception.PerspectiveException;
import com.gdin.inspection.perspective.util.ResponseUtil;
import dev.langchain4j.service.TokenStream;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 基于 LangChain4j 流式模型的生成实现：
 * - 每次调用新建临时助手和 memoryId，互不串话
 * - 响应收集受 timeoutMillis 约束，超时 / 失败交给 Retry 重试
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmTextGenerator implements TextGenerator {

    private final AssistantGenerator assistantGenerator;

    private final PerspectiveProperties properties;

    private final Retry generationRetry;

    @Override
    public String generate(String prompt) {
        return Retry.decorateSupplier(generationRetry, () -> generateOnce(prompt)).get();
    }

    private String generateOnce(String prompt) {
        String memoryId = IdUtil.getSnowflakeNextIdStr();
        SummaryAssistant assistant = assistantGenerator.createTempAssistant(SummaryAssistant.class);
        TokenStream tokenStream = assistant.streamChat(memoryId, prompt);
        try {
            return ResponseUtil.getResponseWithoutThink(tokenStream, memoryId, properties.getLlm().getTimeoutMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PerspectiveException("generation [" + memoryId + "] interrupted", e);
        }
    }
}
