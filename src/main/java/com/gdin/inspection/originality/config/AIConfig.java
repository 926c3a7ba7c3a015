package com.gdin.inspection.originality.config;

import com.gdin.inspection.originality.config.properties.ModelProperties;
import dev.langchain4j.community.model.dashscope.QwenChatModel;
import dev.langchain4j.community.model.dashscope.QwenChatRequestParameters;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import jakarta.annotation.Resource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AIConfig {
    @Resource
    private ModelProperties modelProperties;

    private ChatModel buildChatModel(boolean thinking) {
        ModelProperties.Chat chat = modelProperties.getChat();
        QwenChatRequestParameters qwenChatRequestParameters = QwenChatRequestParameters.builder()
                .enableThinking(thinking)
                .build();
        return QwenChatModel.builder()
                    .baseUrl(chat.getBaseUrl())
                    .defaultRequestParameters(qwenChatRequestParameters)
                    .modelName(chat.getModelName())
                    .apiKey(chat.getApiKey())
                    .temperature(thinking ? chat.getThinkTemperature() : chat.getTemperature())
                    .build();
    }

    @Bean("thinkCm")
    public ChatModel thinkChatModel() {
        return buildChatModel(true);
    }

    @Bean("commonCm")
    public ChatModel commonChatModel() {
        return buildChatModel(false);
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        return OllamaEmbeddingModel.builder()
                .baseUrl(modelProperties.getEmbedding().getBaseUrl())
                .modelName(modelProperties.getEmbedding().getModelName())
                .build();
    }
}
