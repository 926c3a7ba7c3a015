package com.gdin.inspection.originality.util;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.ModelType;
import org.springframework.stereotype.Component;

/**
 * 提示词、嵌入输入的 token 预算
 */
@Component
public class TokenUtil {

    private final Encoding encoding;

    public TokenUtil() {
        EncodingRegistry registry = Encodings.newLazyEncodingRegistry();
        encoding = registry.getEncodingForModel(ModelType.GPT_4);
    }

    public int getTokenCount(String text) {
        if (text == null || text.isEmpty()) return 0;
        return encoding.countTokens(text);
    }

    /**
     * 截断到 maxTokens 以内，未超出时原样返回
     */
    public String truncate(String text, int maxTokens) {
        if (text == null || text.isEmpty() || maxTokens <= 0) return "";
        EncodingResult result = encoding.encode(text, maxTokens);
        if (!result.isTruncated()) return text;
        return encoding.decode(result.getTokens());
    }
}
