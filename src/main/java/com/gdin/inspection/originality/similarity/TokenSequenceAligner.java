package com.gdin.inspection.originality.similarity;

import com.gdin.inspection.originality.models.MatchedSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * 对称的词元序列对齐：先按字典序确定方向再对齐，结果映射回调用方的 (a, b) 顺序
 */
public final class TokenSequenceAligner {

    private TokenSequenceAligner() {}

    public static TokenAlignment align(List<TextToken> a, List<TextToken> b, int minBlockTokens) {
        if (a.isEmpty() && b.isEmpty()) return new TokenAlignment(1.0, List.of());
        if (a.isEmpty() || b.isEmpty()) return new TokenAlignment(0.0, List.of());

        boolean swapped = compareTokenTexts(a, b) > 0;
        List<TextToken> first = swapped ? b : a;
        List<TextToken> second = swapped ? a : b;

        int[][] encoded = TextTokenizer.encodePair(texts(first), texts(second));
        List<MatchingBlock> blocks = SequenceAligner.matchingBlocks(encoded[0], encoded[1]);
        double ratio = SequenceAligner.ratio(encoded[0], encoded[1], blocks);

        List<MatchedSpan> spans = new ArrayList<>();
        for (MatchingBlock block : blocks) {
            if (block.size() < Math.max(1, minBlockTokens)) continue;
            int firstStart = first.get(block.aStart()).start();
            int firstEnd = first.get(block.aStart() + block.size() - 1).end();
            int secondStart = second.get(block.bStart()).start();
            int secondEnd = second.get(block.bStart() + block.size() - 1).end();
            spans.add(swapped
                    ? new MatchedSpan(secondStart, secondEnd, firstStart, firstEnd)
                    : new MatchedSpan(firstStart, firstEnd, secondStart, secondEnd));
        }
        if (swapped) spans.sort((x, y) -> Integer.compare(x.getSourceStart(), y.getSourceStart()));
        return new TokenAlignment(Math.min(1.0, ratio), List.copyOf(spans));
    }

    private static int compareTokenTexts(List<TextToken> a, List<TextToken> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).text().compareTo(b.get(i).text());
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static List<String> texts(List<TextToken> tokens) {
        List<String> out = new ArrayList<>(tokens.size());
        for (TextToken t : tokens) out.add(t.text());
        return out;
    }
}
