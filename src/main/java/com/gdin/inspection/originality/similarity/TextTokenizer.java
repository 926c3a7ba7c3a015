package com.gdin.inspection.originality.similarity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 切分为单词、数字、单个汉字和单个标点，空白丢弃
 */
public final class TextTokenizer {

    private static final Pattern TOKEN = Pattern.compile(
            "\\p{IsHan}"
                    + "|[[\\p{L}_]&&[^\\p{IsHan}]][[\\p{L}\\p{N}_]&&[^\\p{IsHan}]]*"
                    + "|\\p{N}+(?:\\.\\p{N}+)?"
                    + "|\\S");

    private TextTokenizer() {}

    public static List<TextToken> tokenize(String text) {
        List<TextToken> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) return tokens;
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            tokens.add(new TextToken(m.group(), m.start(), m.end()));
        }
        return tokens;
    }

    /**
     * 把两组词元映射到同一套整数编号
     */
    public static int[][] encodePair(List<String> a, List<String> b) {
        Map<String, Integer> ids = new HashMap<>();
        return new int[][]{encode(a, ids), encode(b, ids)};
    }

    private static int[] encode(List<String> tokens, Map<String, Integer> ids) {
        int[] out = new int[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            out[i] = ids.computeIfAbsent(tokens.get(i), k -> ids.size());
        }
        return out;
    }
}
