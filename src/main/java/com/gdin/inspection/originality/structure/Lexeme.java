package com.gdin.inspection.originality.structure;

/**
 * @param indent      所在行的缩进宽度（tab 记 4）
 * @param firstOnLine 是否为该行第一个词素
 */
record Lexeme(Type type, String text, int start, int end, int indent, boolean firstOnLine) {

    enum Type {
        WORD,
        NUMBER,
        STRING,
        SYMBOL,
        NEWLINE,
        DIRECTIVE
    }

    boolean is(String symbol) {
        return type == Type.SYMBOL && text.equals(symbol);
    }
}
