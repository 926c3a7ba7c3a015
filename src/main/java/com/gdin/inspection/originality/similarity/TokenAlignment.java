package com.gdin.inspection.originality.similarity;

import com.gdin.inspection.originality.models.MatchedSpan;

import java.util.List;

/**
 * 两组词元的对齐结果；spans 只包含达到最短长度的匹配块
 */
public record TokenAlignment(double ratio, List<MatchedSpan> spans) {
}
