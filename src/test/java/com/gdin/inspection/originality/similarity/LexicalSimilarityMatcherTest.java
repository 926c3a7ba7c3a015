package com.gdin.inspection.originality.similarity;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.models.MatchedSpan;
import com.gdin.inspection.originality.support.TestFixtures;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class LexicalSimilarityMatcherTest {

    private final OriginalityProperties properties = TestFixtures.properties();
    private final LexicalSimilarityMatcher matcher = new LexicalSimilarityMatcher(properties);

    private static final String ESSAY_A = "the quick brown fox jumps over the lazy dog near the river bank";
    private static final String ESSAY_B = "a quick brown fox leaps over one lazy dog close to the river bank";

    @Test
    public void testSelfSimilarityIsOne() {
        LexicalComparison self = matcher.compare(ESSAY_A, ESSAY_A);
        assertEquals(1.0, self.ratio(), 1e-9);
        assertEquals(List.of(new MatchedSpan(0, ESSAY_A.length(), 0, ESSAY_A.length())), self.spans());
        assertEquals(1.0, matcher.similarity("", ""), 1e-9);
    }

    @Test
    public void testSimilarityIsSymmetric() {
        String[][] pairs = {
                {ESSAY_A, ESSAY_B},
                {"def add(a, b): return a + b", "def add(x, y):\n    return x + y"},
                {"中文 文本 的 相似度 计算", "相似度 计算 的 中文 文本"},
                {"x = 1\ny = 2\nz = x + y", "z = x + y\nx = 1"},
        };
        for (String[] pair : pairs) {
            double ab = matcher.similarity(pair[0], pair[1]);
            double ba = matcher.similarity(pair[1], pair[0]);
            log.info("{} <-> {} : {} / {}", pair[0], pair[1], ab, ba);
            assertEquals(ab, ba, 1e-12);
        }
    }

    @Test
    public void testSpansAreMappedBackToCallerOrder() {
        LexicalComparison ab = matcher.compare(ESSAY_A, ESSAY_B);
        LexicalComparison ba = matcher.compare(ESSAY_B, ESSAY_A);
        assertFalse(ab.spans().isEmpty());
        assertEquals(ab.spans().size(), ba.spans().size());
        for (MatchedSpan span : ab.spans()) {
            String left = ESSAY_A.substring(span.getSourceStart(), span.getSourceEnd());
            String right = ESSAY_B.substring(span.getTargetStart(), span.getTargetEnd());
            assertEquals(left, right);
        }
    }

    @Test
    public void testShortIncidentalMatchesAreSuppressed() {
        LexicalComparison c = matcher.compare("if x return y", "while z return w");
        assertTrue(c.ratio() > 0.0);
        assertTrue(c.spans().isEmpty());
        assertEquals(1, c.spansOrWhole().size());
    }

    @Test
    public void testOversizedInputIsTruncatedAndFlagged() {
        properties.setMaxTextChars(20);
        LexicalComparison c = matcher.compare(ESSAY_A, ESSAY_A + " extra words");
        assertTrue(c.truncated());
        assertEquals(20, c.sourceLength());
        assertEquals(1.0, c.ratio(), 1e-9);
    }

    @Test
    public void testSequenceAlignerMatchesDifflibRatio() {
        int[] a = {1, 2, 3, 4};
        int[] b = {2, 3, 4, 5};
        List<MatchingBlock> blocks = SequenceAligner.matchingBlocks(a, b);
        assertEquals(new MatchingBlock(1, 0, 3), blocks.get(0));
        assertEquals(0.75, SequenceAligner.ratio(a, b, blocks), 1e-9);
    }

    @Test
    public void testCappedInputOverSmallVocabularyFinishesQuickly() {
        String a = randomCode(new Random(7), properties.getMaxTextChars());
        String b = randomCode(new Random(11), properties.getMaxTextChars());

        double ratio = assertTimeout(Duration.ofSeconds(3), () -> matcher.similarity(a, b));
        log.info("capped random code ratio: {}", ratio);
        assertTrue(ratio >= 0.0 && ratio <= 1.0);
        double self = assertTimeout(Duration.ofSeconds(3), () -> matcher.similarity(a, a));
        assertEquals(1.0, self, 1e-9);
    }

    @Test
    public void testPopularElementsOnlyExtendExistingBlocks() {
        // 长度 >= 200 时 0 出现过多，不能单独成为匹配起点
        int[] a = new int[300];
        int[] b = new int[300];
        a[150] = 1;
        b[10] = 1;
        List<MatchingBlock> blocks = SequenceAligner.matchingBlocks(a, b);
        assertEquals(new MatchingBlock(140, 0, 160), blocks.get(0));

        int[] same = new int[300];
        List<MatchingBlock> whole = SequenceAligner.matchingBlocks(same, same.clone());
        assertEquals(List.of(new MatchingBlock(0, 0, 300)), whole);
    }

    @Test
    public void testInterruptedAlignmentIsCancelled() {
        int[] a = {1, 2, 3, 4};
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> SequenceAligner.matchingBlocks(a, a.clone()));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    private static String randomCode(Random random, int length) {
        String[] vocabulary = {"int", "x", "=", ";", "(", ")", "{", "}", "return", "for"};
        StringBuilder sb = new StringBuilder(length + 16);
        while (sb.length() < length) {
            sb.append(vocabulary[random.nextInt(vocabulary.length)]).append(' ');
        }
        return sb.substring(0, length);
    }
}
