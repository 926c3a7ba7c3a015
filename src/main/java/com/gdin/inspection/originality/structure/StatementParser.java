package com.gdin.inspection.originality.structure;

import com.gdin.inspection.originality.exception.StructureParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * 把词素切分成带嵌套深度的语句。
 * 花括号语言按 { } 计深度，缩进语言按缩进栈计深度。
 */
class StatementParser {

    private static final Set<String> INDENT_BLOCK_HEADERS = Set.of(
            "def", "class", "if", "elif", "else", "for", "while", "try", "except", "finally", "with", "async");

    private final List<Lexeme> lexemes;
    private final boolean indentMode;

    private final List<Statement> statements = new ArrayList<>();
    private final Deque<Character> brackets = new ArrayDeque<>();
    private List<Lexeme> current = new ArrayList<>();
    private int currentDepth;

    StatementParser(List<Lexeme> lexemes, boolean indentMode) {
        this.lexemes = lexemes;
        this.indentMode = indentMode;
    }

    List<Statement> parse() {
        if (indentMode) parseIndented();
        else parseBraced();
        if (!brackets.isEmpty()) {
            throw new StructureParseException("unclosed '" + brackets.peek() + "'");
        }
        return statements;
    }

    private void parseBraced() {
        int blockDepth = 0;
        for (Lexeme lx : lexemes) {
            if (lx.type() == Lexeme.Type.NEWLINE) {
                if (atBlockLevel()) flush(false);
                continue;
            }
            if (lx.type() == Lexeme.Type.DIRECTIVE) {
                flush(false);
                start(lx, blockDepth);
                flush(false);
                continue;
            }
            if (lx.is("{")) {
                flush(true);
                brackets.push('{');
                blockDepth++;
                continue;
            }
            if (lx.is("}")) {
                flush(false);
                close('{', lx);
                blockDepth--;
                continue;
            }
            if (lx.is(";") && atBlockLevel()) {
                flush(false);
                continue;
            }
            trackBrackets(lx);
            start(lx, blockDepth);
        }
        flush(false);
    }

    private void parseIndented() {
        Deque<Integer> indents = new ArrayDeque<>();
        indents.push(0);
        int nextDepth = 0;
        for (Lexeme lx : lexemes) {
            if (lx.type() == Lexeme.Type.NEWLINE) {
                if (brackets.isEmpty()) flush(false);
                continue;
            }
            if (brackets.isEmpty() && current.isEmpty()) {
                nextDepth = lx.firstOnLine() ? depthFor(indents, lx.indent()) : nextDepth;
            }
            if (brackets.isEmpty() && lx.is(";")) {
                nextDepth = currentDepth;
                flush(false);
                continue;
            }
            if (brackets.isEmpty() && lx.is(":") && isIndentHeader()) {
                // 冒号后同一行的语句属于下一层
                nextDepth = currentDepth + 1;
                flush(true);
                continue;
            }
            if (lx.is("{")) brackets.push('{');
            else if (lx.is("}")) close('{', lx);
            else trackBrackets(lx);
            start(lx, nextDepth);
        }
        flush(false);
    }

    private static int depthFor(Deque<Integer> indents, int indent) {
        while (indents.size() > 1 && indents.peek() > indent) indents.pop();
        if (indent > indents.peek()) indents.push(indent);
        return indents.size() - 1;
    }

    private boolean isIndentHeader() {
        if (current.isEmpty()) return false;
        Lexeme first = current.get(0);
        return first.type() == Lexeme.Type.WORD && INDENT_BLOCK_HEADERS.contains(first.text());
    }

    private boolean atBlockLevel() {
        return brackets.isEmpty() || brackets.peek() == '{';
    }

    private void trackBrackets(Lexeme lx) {
        if (lx.is("(")) brackets.push('(');
        else if (lx.is("[")) brackets.push('[');
        else if (lx.is(")")) close('(', lx);
        else if (lx.is("]")) close('[', lx);
    }

    private void close(char expected, Lexeme lx) {
        if (brackets.isEmpty() || brackets.peek() != expected) {
            throw new StructureParseException("unbalanced '" + lx.text() + "' at " + lx.start());
        }
        brackets.pop();
    }

    private void start(Lexeme lx, int depth) {
        if (current.isEmpty()) currentDepth = depth;
        current.add(lx);
    }

    private void flush(boolean blockHeader) {
        if (current.isEmpty()) return;
        boolean docString = current.stream().allMatch(l -> l.type() == Lexeme.Type.STRING);
        if (!docString) statements.add(new Statement(List.copyOf(current), currentDepth, blockHeader));
        current = new ArrayList<>();
    }
}
