package com.gdin.inspection.originality.similarity;

import com.gdin.inspection.originality.models.MatchedSpan;

import java.util.List;

/**
 * @param ratio     [0,1] 的相似度
 * @param spans     达到最短长度的匹配片段，可能为空
 * @param truncated 任一侧超过长度上限被截断
 */
public record LexicalComparison(double ratio, List<MatchedSpan> spans, boolean truncated,
                                int sourceLength, int targetLength) {

    /**
     * 没有合格片段时退化为整段对整段
     */
    public List<MatchedSpan> spansOrWhole() {
        if (!spans.isEmpty()) return spans;
        return List.of(new MatchedSpan(0, sourceLength, 0, targetLength));
    }
}
