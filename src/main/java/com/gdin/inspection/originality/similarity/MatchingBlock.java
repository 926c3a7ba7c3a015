package com.gdin.inspection.originality.similarity;

/**
 * a[aStart, aStart+size) 与 b[bStart, bStart+size) 完全相同
 */
public record MatchingBlock(int aStart, int bStart, int size) {
}
