package com.gdin.inspection.originality.assistant;

import dev.langchain4j.service.MemoryId;
import dev.langchain4j.service.UserMessage;

/**
 * 开启思考模式的助手，用于作者身份深度分析
 */
public interface ThinkAssistant {

    String chat(@MemoryId String memoryId, @UserMessage String prompt);
}
