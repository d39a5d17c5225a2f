package com.gdin.inspection.perspective.assistant;

import dev.langchain4j.service.MemoryId;
import dev.langchain4j.service.TokenStream;
import dev.langchain4j.service.UserMessage;

/**
 * 一次性生成助手：prompt 全部放在 user 消息里，每次调用使用新的 memoryId。
 */
public interface SummaryAssistant {

    TokenStream streamChat(@MemoryId String memoryId, @UserMessage String prompt);
}
