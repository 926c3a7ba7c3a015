package com.gdin.inspection.originality.structure;

import java.util.Map;
import java.util.Optional;

public enum OperatorCategory {
    ARITHMETIC,
    COMPARISON,
    LOGICAL,
    ASSIGNMENT,
    BITWISE,
    ACCESS,
    CALL;

    private static final Map<String, OperatorCategory> SYMBOLS = Map.ofEntries(
            Map.entry("+", ARITHMETIC), Map.entry("-", ARITHMETIC), Map.entry("*", ARITHMETIC),
            Map.entry("/", ARITHMETIC), Map.entry("%", ARITHMETIC), Map.entry("**", ARITHMETIC),
            Map.entry("//", ARITHMETIC), Map.entry("++", ARITHMETIC), Map.entry("--", ARITHMETIC),
            Map.entry("==", COMPARISON), Map.entry("!=", COMPARISON), Map.entry("<", COMPARISON),
            Map.entry(">", COMPARISON), Map.entry("<=", COMPARISON), Map.entry(">=", COMPARISON),
            Map.entry("===", COMPARISON), Map.entry("!==", COMPARISON), Map.entry("<>", COMPARISON),
            Map.entry("&&", LOGICAL), Map.entry("||", LOGICAL), Map.entry("!", LOGICAL),
            Map.entry("??", LOGICAL),
            Map.entry("=", ASSIGNMENT), Map.entry("+=", ASSIGNMENT), Map.entry("-=", ASSIGNMENT),
            Map.entry("*=", ASSIGNMENT), Map.entry("/=", ASSIGNMENT), Map.entry("%=", ASSIGNMENT),
            Map.entry("&=", ASSIGNMENT), Map.entry("|=", ASSIGNMENT), Map.entry("^=", ASSIGNMENT),
            Map.entry("<<=", ASSIGNMENT), Map.entry(">>=", ASSIGNMENT), Map.entry(">>>=", ASSIGNMENT),
            Map.entry(":=", ASSIGNMENT), Map.entry("**=", ASSIGNMENT), Map.entry("//=", ASSIGNMENT),
            Map.entry("&", BITWISE), Map.entry("|", BITWISE), Map.entry("^", BITWISE),
            Map.entry("~", BITWISE), Map.entry("<<", BITWISE), Map.entry(">>", BITWISE),
            Map.entry(">>>", BITWISE),
            Map.entry(".", ACCESS), Map.entry("->", ACCESS), Map.entry("::", ACCESS),
            Map.entry("?.", ACCESS));

    /** 缩进类语言里的单词运算符 */
    private static final Map<String, OperatorCategory> WORDS = Map.of(
            "and", LOGICAL, "or", LOGICAL, "not", LOGICAL,
            "in", COMPARISON, "is", COMPARISON);

    public static Optional<OperatorCategory> ofSymbol(String symbol) {
        return Optional.ofNullable(SYMBOLS.get(symbol));
    }

    public static Optional<OperatorCategory> ofWord(String word) {
        return Optional.ofNullable(WORDS.get(word));
    }

    public static boolean isAssignment(String symbol) {
        return SYMBOLS.get(symbol) == ASSIGNMENT;
    }
}
