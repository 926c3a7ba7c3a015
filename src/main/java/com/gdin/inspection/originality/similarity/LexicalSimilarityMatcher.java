package com.gdin.inspection.originality.similarity;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 词元级最长公共块相似度，对称、确定
 */
@Component
@RequiredArgsConstructor
public class LexicalSimilarityMatcher {

    private final OriginalityProperties originalityProperties;

    public LexicalComparison compare(String source, String target) {
        int cap = originalityProperties.getMaxTextChars();
        String a = source == null ? "" : source;
        String b = target == null ? "" : target;
        boolean truncated = a.length() > cap || b.length() > cap;
        if (a.length() > cap) a = a.substring(0, cap);
        if (b.length() > cap) b = b.substring(0, cap);

        List<TextToken> tokensA = TextTokenizer.tokenize(a);
        List<TextToken> tokensB = TextTokenizer.tokenize(b);
        TokenAlignment alignment = TokenSequenceAligner.align(tokensA, tokensB, originalityProperties.getMinBlockTokens());
        return new LexicalComparison(alignment.ratio(), alignment.spans(), truncated, a.length(), b.length());
    }

    public double similarity(String source, String target) {
        return compare(source, target).ratio();
    }
}
