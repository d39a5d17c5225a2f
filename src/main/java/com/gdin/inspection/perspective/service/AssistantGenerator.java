package com.gdin.inspection.perspective.service;

import dev.langchain4j.memory.ChatMemory;
import dev.langchain4j.memory.chat.ChatMemoryProvider;
import dev.langchain4j.memory.chat.MessageWindowChatMemory;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.service.AiServices;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AssistantGenerator {

    private final StreamingChatModel streamingChatModel;

    public <T> T createTempAssistant(@NonNull Class<T> clazz) {
        return createTempAssistant(clazz, null);
    }

    /**
     * 创建临时会话的AI助手实例（使用内存窗口模式）
     * @param clazz 需要创建的AI服务接口类型
     * @param systemMessage 系统提示信息（可选）
     * @param <T> 泛型类型参数
     * @return 配置完成的临时AI服务实例
     */
    public <T> T createTempAssistant(@NonNull Class<T> clazz, String systemMessage) {
        // 一次性生成不需要长历史
        ChatMemory chatMemory = MessageWindowChatMemory.withMaxMessages(10);
        ChatMemoryProvider chatMemoryProvider = memoryId -> chatMemory;

        AiServices<T> builder = AiServices.builder(clazz)
                .streamingChatModel(streamingChatModel)
                .chatMemoryProvider(chatMemoryProvider);

        // 可选配置系统消息
        if (systemMessage != null) builder.systemMessageProvider(memoryId -> systemMessage);

        return builder.build();
    }
}
