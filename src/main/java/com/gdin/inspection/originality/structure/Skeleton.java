package com.gdin.inspection.originality.structure;

import com.gdin.inspection.originality.similarity.TextToken;
import lombok.Value;

import java.util.List;

/**
 * 与命名无关的代码骨架：KIND@depth 与 op:CATEGORY 序列，位置指向原始代码
 */
@Value
public class Skeleton {

    public static final String OPAQUE_TOKEN = "<opaque>";

    List<TextToken> tokens;

    boolean parseFailed;

    /** 解析失败原因，成功时为 null */
    String failureReason;

    public static Skeleton of(List<TextToken> tokens) {
        return new Skeleton(List.copyOf(tokens), false, null);
    }

    public static Skeleton failed(String reason, int length) {
        return new Skeleton(List.of(new TextToken(OPAQUE_TOKEN, 0, length)), true, reason);
    }

    public List<String> texts() {
        return tokens.stream().map(TextToken::text).toList();
    }
}
