package com.gdin.inspection.originality.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * 最长公共块递归对齐（Ratcliff/Obershelp）。
 * |b| >= 200 时，b 中出现次数超过 1 + |b|/100 的元素视为高频元素，不作为匹配起点，只在扩展已有块时参与。
 * 结果只依赖输入顺序，调用方需自行保证对称性。
 * 线程被中断时抛出 {@link CancellationException}，中断标记保留。
 */
public final class SequenceAligner {

    static final int AUTOJUNK_MIN_LENGTH = 200;

    private SequenceAligner() {}

    public static List<MatchingBlock> matchingBlocks(int[] a, int[] b) {
        Map<Integer, int[]> b2j = indexOf(b);
        Workspace ws = new Workspace(b.length);

        List<MatchingBlock> blocks = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length, 0, b.length});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];
            MatchingBlock m = findLongestMatch(a, b, b2j, ws, alo, ahi, blo, bhi);
            if (m.size() == 0) continue;
            blocks.add(m);
            if (alo < m.aStart() && blo < m.bStart()) {
                queue.push(new int[]{alo, m.aStart(), blo, m.bStart()});
            }
            int aEnd = m.aStart() + m.size();
            int bEnd = m.bStart() + m.size();
            if (aEnd < ahi && bEnd < bhi) {
                queue.push(new int[]{aEnd, ahi, bEnd, bhi});
            }
        }
        blocks.sort(Comparator.comparingInt(MatchingBlock::aStart).thenComparingInt(MatchingBlock::bStart));
        return mergeAdjacent(blocks);
    }

    /**
     * 2M / (|a| + |b|)，两边都为空时为 1
     */
    public static double ratio(int[] a, int[] b, List<MatchingBlock> blocks) {
        int total = a.length + b.length;
        if (total == 0) return 1.0;
        int matched = 0;
        for (MatchingBlock block : blocks) matched += block.size();
        return 2.0 * matched / total;
    }

    /**
     * 元素 -> b 中升序位置，已剔除高频元素
     */
    static Map<Integer, int[]> indexOf(int[] b) {
        Map<Integer, int[]> counts = new HashMap<>();
        for (int x : b) {
            counts.computeIfAbsent(x, k -> new int[1])[0]++;
        }
        int popularAbove = b.length >= AUTOJUNK_MIN_LENGTH ? 1 + b.length / 100 : Integer.MAX_VALUE;

        Map<Integer, int[]> b2j = new HashMap<>();
        Map<Integer, int[]> filled = new HashMap<>();
        for (Map.Entry<Integer, int[]> e : counts.entrySet()) {
            int n = e.getValue()[0];
            if (n > popularAbove) continue;
            b2j.put(e.getKey(), new int[n]);
            filled.put(e.getKey(), new int[1]);
        }
        for (int j = 0; j < b.length; j++) {
            int[] positions = b2j.get(b[j]);
            if (positions == null) continue;
            int[] cursor = filled.get(b[j]);
            positions[cursor[0]++] = j;
        }
        return b2j;
    }

    private static MatchingBlock findLongestMatch(int[] a, int[] b, Map<Integer, int[]> b2j, Workspace ws,
                                                  int alo, int ahi, int blo, int bhi) {
        int bestI = alo, bestJ = blo, bestSize = 0;
        for (int i = alo; i < ahi; i++) {
            if (Thread.currentThread().isInterrupted()) {
                ws.reset();
                throw new CancellationException("alignment interrupted");
            }
            int[] js = b2j.get(a[i]);
            if (js != null) {
                for (int j : js) {
                    if (j < blo) continue;
                    if (j >= bhi) break;
                    // len 数组按 j+1 存放，j-1 的长度在下标 j
                    int k = ws.len[j] + 1;
                    ws.nextLen[j + 1] = k;
                    ws.nextTouched[ws.nextCount++] = j + 1;
                    // 严格大于：长度相同时保留 a 中更靠前、再 b 中更靠前的块
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            ws.advance();
        }
        ws.reset();

        // 高频元素不在 b2j 中，在这里把块向两端扩展
        while (bestI > alo && bestJ > blo && a[bestI - 1] == b[bestJ - 1]) {
            bestI--;
            bestJ--;
            bestSize++;
        }
        while (bestI + bestSize < ahi && bestJ + bestSize < bhi && a[bestI + bestSize] == b[bestJ + bestSize]) {
            bestSize++;
        }
        return new MatchingBlock(bestI, bestJ, bestSize);
    }

    private static List<MatchingBlock> mergeAdjacent(List<MatchingBlock> blocks) {
        List<MatchingBlock> merged = new ArrayList<>();
        MatchingBlock current = null;
        for (MatchingBlock block : blocks) {
            if (current != null
                    && current.aStart() + current.size() == block.aStart()
                    && current.bStart() + current.size() == block.bStart()) {
                current = new MatchingBlock(current.aStart(), current.bStart(), current.size() + block.size());
            } else {
                if (current != null) merged.add(current);
                current = block;
            }
        }
        if (current != null) merged.add(current);
        return merged;
    }

    /**
     * 两行滚动的匹配长度表，只清理写过的位置
     */
    private static final class Workspace {
        int[] len;
        int[] nextLen;
        int[] touched;
        int[] nextTouched;
        int count;
        int nextCount;

        Workspace(int bLength) {
            len = new int[bLength + 1];
            nextLen = new int[bLength + 1];
            touched = new int[bLength];
            nextTouched = new int[bLength];
        }

        void advance() {
            for (int t = 0; t < count; t++) len[touched[t]] = 0;
            int[] swapLen = len;
            len = nextLen;
            nextLen = swapLen;
            int[] swapTouched = touched;
            touched = nextTouched;
            nextTouched = swapTouched;
            count = nextCount;
            nextCount = 0;
        }

        void reset() {
            for (int t = 0; t < count; t++) len[touched[t]] = 0;
            for (int t = 0; t < nextCount; t++) nextLen[nextTouched[t]] = 0;
            count = 0;
            nextCount = 0;
        }
    }
}
