package com.gdin.inspection.originality.assistant;

import dev.langchain4j.service.MemoryId;
import dev.langchain4j.service.UserMessage;

/**
 * 普通的对话助手：作者身份初筛、建议润色
 */
public interface CommonAssistant {

    String chat(@MemoryId String memoryId, @UserMessage String prompt);
}
