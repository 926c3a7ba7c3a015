package com.gdin.inspection.originality.collaborator;

/**
 * 文本生成协作方：初筛、深度分析、建议润色
 */
public interface TextGenerationClient {

    String complete(String prompt, GenerationConstraints constraints);
}
