package com.gdin.inspection.originality.similarity;

/**
 * 词元及其在原文中的 [start, end) 位置
 */
public record TextToken(String text, int start, int end) {
}
