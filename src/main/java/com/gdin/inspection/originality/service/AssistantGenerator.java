package com.gdin.inspection.originality.service;

import dev.langchain4j.memory.ChatMemory;
import dev.langchain4j.memory.chat.ChatMemoryProvider;
import dev.langchain4j.memory.chat.MessageWindowChatMemory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import jakarta.annotation.Resource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

@Component
public class AssistantGenerator {
    @Resource
    @Qualifier("thinkCm")
    private ChatModel thinkChatModel;

    @Resource
    @Qualifier("commonCm")
    private ChatModel commonChatModel;

    public <T> T createTempAssistant(@NonNull Class<T> clazz) {
        return createTempAssistant(clazz, null);
    }

    /**
     * 创建临时会话的AI助手实例，每次分析一个单元，互不共享上下文
     * @param clazz 需要创建的AI服务接口类型
     * @param systemMessage 系统提示信息（可选）
     */
    public <T> T createTempAssistant(@NonNull Class<T> clazz, String systemMessage) {
        // 单轮调用，窗口够放一问一答即可
        ChatMemory chatMemory = MessageWindowChatMemory.withMaxMessages(4);
        ChatMemoryProvider chatMemoryProvider = memoryId -> chatMemory;
        return createAssistant(clazz, chatMemoryProvider, systemMessage);
    }

    /**
     * 根据接口类名选择模型：Think 开头的用思考模型
     */
    public <T> T createAssistant(@NonNull Class<T> clazz, @NonNull ChatMemoryProvider chatMemoryProvider, String systemMessage) {
        ChatModel chatModel = clazz.getName().toLowerCase().contains("think") ? thinkChatModel : commonChatModel;
        AiServices<T> builder = AiServices.builder(clazz)
                .chatModel(chatModel)
                .chatMemoryProvider(chatMemoryProvider);

        if (systemMessage != null) builder.systemMessageProvider(memoryId -> systemMessage);

        return builder.build();
    }
}
