package com.gdin.inspection.originality.collaborator;

import cn.hutool.core.util.IdUtil;
import com.gdin.inspection.originality.assistant.CommonAssistant;
import com.gdin.inspection.originality.assistant.ThinkAssistant;
import com.gdin.inspection.originality.service.AssistantGenerator;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 基于 LangChain4j AiServices 的文本生成
 */
@Slf4j
@Component
public class AssistantTextGenerationClient implements TextGenerationClient {

    private static final String JSON_SYSTEM_MESSAGE = "你是严谨的代码与文本原创性评审助手。只输出一个 JSON 对象，不要输出任何解释或 Markdown。";

    @Resource
    private AssistantGenerator assistantGenerator;

    @Override
    public String complete(String prompt, GenerationConstraints constraints) {
        String memoryId = IdUtil.getSnowflakeNextIdStr();
        String systemMessage = constraints.isExpectJson() ? JSON_SYSTEM_MESSAGE : null;
        long start = System.currentTimeMillis();
        String raw;
        if (constraints.isDeliberate()) {
            raw = assistantGenerator.createTempAssistant(ThinkAssistant.class, systemMessage).chat(memoryId, prompt);
        } else {
            raw = assistantGenerator.createTempAssistant(CommonAssistant.class, systemMessage).chat(memoryId, prompt);
        }
        log.debug("{} 完成，耗时 {} ms，输出 {} 字符", constraints.getPurpose(),
                System.currentTimeMillis() - start, raw == null ? 0 : raw.length());
        return raw;
    }
}
