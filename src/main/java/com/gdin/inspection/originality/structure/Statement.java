package com.gdin.inspection.originality.structure;

import java.util.List;

/**
 * 一条逻辑语句
 *
 * @param blockHeader 语句后面紧跟一个代码块（{ 或缩进语言的冒号）
 */
record Statement(List<Lexeme> lexemes, int depth, boolean blockHeader) {

    int start() {
        return lexemes.get(0).start();
    }

    int end() {
        return lexemes.get(lexemes.size() - 1).end();
    }
}
