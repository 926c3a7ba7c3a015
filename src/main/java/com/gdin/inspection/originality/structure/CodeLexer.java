package com.gdin.inspection.originality.structure;

import com.gdin.inspection.originality.exception.StructureParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 代码词法切分：丢弃注释，保留换行与缩进信息
 */
class CodeLexer {

    private static final String[] OPERATORS = {
            ">>>=", "<<=", ">>=", "**=", "//=", "...", "===", "!==", ">>>",
            "->", "=>", "::", "==", "!=", "<=", ">=", "<>", "&&", "||", "++", "--",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", ":=", "**", "//", "<<", ">>", "?.", "??"
    };

    private static final Set<String> DIRECTIVES = Set.of(
            "include", "define", "undef", "if", "ifdef", "ifndef", "elif", "else", "endif",
            "pragma", "error", "warning", "line", "import");

    /** 行首是块关键字、行尾是冒号：缩进类语言 */
    private static final Pattern INDENT_HEADER = Pattern.compile(
            "(?m)^[ \\t]*(?:async[ \\t]+)?(?:def|class|if|elif|else|for|while|try|except|finally|with)\\b[^\\n]*:[ \\t]*(?:#[^\\n]*)?$");

    private static final Pattern BRACE_LINE_END = Pattern.compile("(?m)\\{[ \\t]*$");

    private final String code;
    private final boolean indentMode;
    private final List<Lexeme> out = new ArrayList<>();
    private int pos;
    private int lineIndent;
    private boolean lineStart = true;
    private boolean indentPending = true;

    CodeLexer(String code) {
        this.code = code;
        this.indentMode = detectIndentMode(code);
    }

    static boolean detectIndentMode(String code) {
        if (INDENT_HEADER.matcher(code).find()) return !BRACE_LINE_END.matcher(code).find();
        return code.indexOf('{') < 0;
    }

    boolean isIndentMode() {
        return indentMode;
    }

    List<Lexeme> lex() {
        int n = code.length();
        while (pos < n) {
            char c = code.charAt(pos);

            if (indentPending) {
                readIndent();
                if (pos >= n) break;
                c = code.charAt(pos);
            }

            if (c == '\n') {
                add(Lexeme.Type.NEWLINE, pos, pos + 1);
                pos++;
                lineStart = true;
                indentPending = true;
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                pos++;
                continue;
            }
            if (c == '\\' && pos + 1 < n && (code.charAt(pos + 1) == '\n' || code.charAt(pos + 1) == '\r')) {
                // 续行，下一行的缩进不算
                pos = code.indexOf('\n', pos) + 1;
                while (pos < n && (code.charAt(pos) == ' ' || code.charAt(pos) == '\t')) pos++;
                continue;
            }
            if (isCommentStart()) {
                skipComment();
                continue;
            }
            if (c == '#' && !indentMode && atLineStart() && readDirective()) {
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                readString();
                continue;
            }
            if (Character.isDigit(c) || (c == '.' && pos + 1 < n && Character.isDigit(code.charAt(pos + 1)))) {
                readNumber();
                continue;
            }
            if (Character.isLetter(c) || c == '_' || c == '$') {
                readWord();
                continue;
            }
            readSymbol();
        }
        return out;
    }

    private void readIndent() {
        int width = 0;
        while (pos < code.length()) {
            char c = code.charAt(pos);
            if (c == ' ') width++;
            else if (c == '\t') width += 4;
            else if (c != '\r' && c != '\f') break;
            pos++;
        }
        lineIndent = width;
        indentPending = false;
    }

    private boolean atLineStart() {
        return lineStart;
    }

    private boolean isCommentStart() {
        char c = code.charAt(pos);
        if (indentMode) return c == '#';
        return code.startsWith("//", pos) || code.startsWith("/*", pos)
                || (c == '#' && !atLineStart());
    }

    private void skipComment() {
        if (!indentMode && code.startsWith("/*", pos)) {
            int end = code.indexOf("*/", pos + 2);
            if (end < 0) throw new StructureParseException("unterminated block comment at " + pos);
            pos = end + 2;
            return;
        }
        int end = code.indexOf('\n', pos);
        pos = end < 0 ? code.length() : end;
    }

    /**
     * # 后紧跟指令名；否则按行注释处理
     */
    private boolean readDirective() {
        int i = pos + 1;
        int j = i;
        while (j < code.length() && Character.isLetter(code.charAt(j))) j++;
        String name = code.substring(i, j);
        if (!DIRECTIVES.contains(name)) {
            skipComment();
            return true;
        }
        int end = code.indexOf('\n', pos);
        end = end < 0 ? code.length() : end;
        out.add(new Lexeme(Lexeme.Type.DIRECTIVE, name, pos, end, lineIndent, true));
        lineStart = false;
        pos = end;
        return true;
    }

    private void readString() {
        int start = pos;
        char quote = code.charAt(pos);
        if (quote != '`' && code.startsWith(String.valueOf(quote).repeat(3), pos)) {
            String delimiter = String.valueOf(quote).repeat(3);
            int end = code.indexOf(delimiter, pos + 3);
            if (end < 0) throw new StructureParseException("unterminated string at " + start);
            pos = end + 3;
            add(Lexeme.Type.STRING, start, pos);
            return;
        }
        int i = pos + 1;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                pos = i + 1;
                add(Lexeme.Type.STRING, start, pos);
                return;
            }
            if (c == '\n' && quote != '`') break;
            i++;
        }
        throw new StructureParseException("unterminated string at " + start);
    }

    private void readNumber() {
        int start = pos;
        while (pos < code.length()) {
            char c = code.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else if ((c == '+' || c == '-') && (code.charAt(pos - 1) == 'e' || code.charAt(pos - 1) == 'E')
                    && !code.substring(start, pos).startsWith("0x")) {
                pos++;
            } else {
                break;
            }
        }
        add(Lexeme.Type.NUMBER, start, pos);
    }

    private void readWord() {
        int start = pos;
        while (pos < code.length()) {
            char c = code.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '$') pos++;
            else break;
        }
        add(Lexeme.Type.WORD, start, pos);
    }

    private void readSymbol() {
        for (String op : OPERATORS) {
            if ("//".equals(op) && !indentMode) continue;
            if (code.startsWith(op, pos)) {
                add(Lexeme.Type.SYMBOL, pos, pos + op.length());
                pos += op.length();
                return;
            }
        }
        add(Lexeme.Type.SYMBOL, pos, pos + 1);
        pos++;
    }

    private void add(Lexeme.Type type, int start, int end) {
        boolean first = lineStart && type != Lexeme.Type.NEWLINE;
        out.add(new Lexeme(type, code.substring(start, end), start, end, lineIndent, first));
        if (type != Lexeme.Type.NEWLINE) lineStart = false;
    }
}
