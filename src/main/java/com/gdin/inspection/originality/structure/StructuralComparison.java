package com.gdin.inspection.originality.structure;

import com.gdin.inspection.originality.models.MatchedSpan;

import java.util.List;

/**
 * @param spans 原始代码上的片段；任一侧解析失败时为空
 */
public record StructuralComparison(double similarity, List<MatchedSpan> spans, boolean parseFailed) {

    static StructuralComparison failed() {
        return new StructuralComparison(0.0, List.of(), true);
    }
}
