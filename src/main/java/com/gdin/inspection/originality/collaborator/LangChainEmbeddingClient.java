package com.gdin.inspection.originality.collaborator;

import cn.hutool.core.util.StrUtil;
import dev.langchain4j.model.embedding.EmbeddingModel;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

@Component
public class LangChainEmbeddingClient implements EmbeddingClient {

    @Resource
    private EmbeddingModel embeddingModel;

    @Override
    public float[] embed(String text) {
        return embeddingModel.embed(StrUtil.blankToDefault(text, " ")).content().vector();
    }
}
