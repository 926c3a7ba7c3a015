package com.gdin.inspection.originality.structure;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 语句种类与运算符类别。只看关键字和符号，标识符的名字不参与判断
 */
class StatementClassifier {

    /** 缩进类语言（Python）的关键字 */
    private static final Map<String, StatementKind> INDENT_KEYWORDS = Map.ofEntries(
            Map.entry("def", StatementKind.FUNCTION), Map.entry("class", StatementKind.CLASS),
            Map.entry("if", StatementKind.IF), Map.entry("elif", StatementKind.IF),
            Map.entry("else", StatementKind.ELSE), Map.entry("for", StatementKind.LOOP),
            Map.entry("while", StatementKind.LOOP), Map.entry("return", StatementKind.RETURN),
            Map.entry("yield", StatementKind.RETURN), Map.entry("try", StatementKind.TRY),
            Map.entry("except", StatementKind.CATCH), Map.entry("finally", StatementKind.FINALLY),
            Map.entry("import", StatementKind.IMPORT), Map.entry("from", StatementKind.IMPORT),
            Map.entry("raise", StatementKind.THROW), Map.entry("break", StatementKind.JUMP),
            Map.entry("continue", StatementKind.JUMP), Map.entry("pass", StatementKind.JUMP),
            Map.entry("global", StatementKind.DECLARATION), Map.entry("nonlocal", StatementKind.DECLARATION),
            Map.entry("with", StatementKind.EXPRESSION), Map.entry("assert", StatementKind.EXPRESSION),
            Map.entry("del", StatementKind.EXPRESSION), Map.entry("lambda", StatementKind.EXPRESSION));

    /** 花括号语言（C / Java / JS / Go ...）的关键字 */
    private static final Map<String, StatementKind> BRACE_KEYWORDS = Map.ofEntries(
            Map.entry("function", StatementKind.FUNCTION), Map.entry("func", StatementKind.FUNCTION),
            Map.entry("fn", StatementKind.FUNCTION), Map.entry("fun", StatementKind.FUNCTION),
            Map.entry("class", StatementKind.CLASS), Map.entry("struct", StatementKind.CLASS),
            Map.entry("interface", StatementKind.CLASS), Map.entry("enum", StatementKind.CLASS),
            Map.entry("trait", StatementKind.CLASS), Map.entry("impl", StatementKind.CLASS),
            Map.entry("union", StatementKind.CLASS), Map.entry("namespace", StatementKind.CLASS),
            Map.entry("if", StatementKind.IF), Map.entry("else", StatementKind.ELSE),
            Map.entry("for", StatementKind.LOOP), Map.entry("while", StatementKind.LOOP),
            Map.entry("do", StatementKind.LOOP), Map.entry("foreach", StatementKind.LOOP),
            Map.entry("return", StatementKind.RETURN), Map.entry("yield", StatementKind.RETURN),
            Map.entry("try", StatementKind.TRY), Map.entry("catch", StatementKind.CATCH),
            Map.entry("finally", StatementKind.FINALLY), Map.entry("import", StatementKind.IMPORT),
            Map.entry("package", StatementKind.IMPORT), Map.entry("using", StatementKind.IMPORT),
            Map.entry("use", StatementKind.IMPORT), Map.entry("throw", StatementKind.THROW),
            Map.entry("break", StatementKind.JUMP), Map.entry("continue", StatementKind.JUMP),
            Map.entry("goto", StatementKind.JUMP), Map.entry("switch", StatementKind.SWITCH),
            Map.entry("case", StatementKind.CASE), Map.entry("var", StatementKind.DECLARATION),
            Map.entry("let", StatementKind.DECLARATION), Map.entry("const", StatementKind.DECLARATION),
            Map.entry("val", StatementKind.DECLARATION), Map.entry("auto", StatementKind.DECLARATION),
            Map.entry("typedef", StatementKind.DECLARATION));

    private static final Set<String> MODIFIERS = Set.of(
            "public", "private", "protected", "static", "final", "abstract", "async", "export",
            "synchronized", "virtual", "override", "inline", "extern", "sealed", "readonly", "unsafe",
            "pub", "mut", "volatile", "transient", "native", "internal", "open", "data", "default");

    /** 不构成调用的关键字（if ( / while ( / return ( ...） */
    private static final Set<String> NON_CALL_WORDS = Set.of(
            "if", "elif", "while", "for", "switch", "catch", "return", "yield", "and", "or", "not", "in",
            "is", "with", "except", "sizeof", "typeof", "new", "throw", "raise", "await", "assert");

    private final boolean indentMode;

    StatementClassifier(boolean indentMode) {
        this.indentMode = indentMode;
    }

    StatementKind classify(Statement statement) {
        List<Lexeme> lx = statement.lexemes();
        Lexeme head = lx.get(0);

        if (head.type() == Lexeme.Type.DIRECTIVE) {
            return switch (head.text()) {
                case "include", "import" -> StatementKind.IMPORT;
                case "define", "undef" -> StatementKind.DECLARATION;
                default -> StatementKind.EXPRESSION;
            };
        }

        if (isWord(head, "default") && lx.size() > 1 && lx.get(1).is(":")) return StatementKind.CASE;

        int i = 0;
        // 修饰符后面必须还是单词，避免把名为 data / open 的变量当成修饰符
        while (!indentMode && i < lx.size() - 1 && lx.get(i).type() == Lexeme.Type.WORD
                && MODIFIERS.contains(lx.get(i).text()) && !isKeyword(lx.get(i))
                && lx.get(i + 1).type() == Lexeme.Type.WORD) {
            i++;
        }
        // async def / async function
        if (indentMode && isWord(lx.get(i), "async") && i + 1 < lx.size()) i++;

        Lexeme first = lx.get(i);
        StatementKind byKeyword = first.type() == Lexeme.Type.WORD ? keywords().get(first.text()) : null;
        if (byKeyword == StatementKind.ELSE && i + 1 < lx.size() && isWord(lx.get(i + 1), "if")) {
            return StatementKind.IF;
        }
        if (byKeyword != null) return byKeyword;

        if (!indentMode && statement.blockHeader() && looksLikeFunction(lx, i)) return StatementKind.FUNCTION;

        int assign = topLevelAssignment(lx, i);
        if (assign >= 0) {
            return isDeclarationTarget(lx, i, assign) ? StatementKind.DECLARATION : StatementKind.ASSIGNMENT;
        }
        if (hasTopLevel(lx, i, "++") || hasTopLevel(lx, i, "--")) return StatementKind.ASSIGNMENT;
        if (looksLikeCall(lx, i)) return StatementKind.CALL;
        if (i + 1 < lx.size() && isPlainWord(lx.get(i)) && isPlainWord(lx.get(i + 1))) {
            return StatementKind.DECLARATION;
        }
        return StatementKind.EXPRESSION;
    }

    /**
     * 语句中出现的运算符类别，按首次出现顺序去重；位置取首次出现的词素
     */
    Map<OperatorCategory, Lexeme> operators(Statement statement, StatementKind kind) {
        Map<OperatorCategory, Lexeme> found = new LinkedHashMap<>();
        List<Lexeme> lx = statement.lexemes();
        boolean header = kind == StatementKind.FUNCTION || kind == StatementKind.CLASS;
        for (int k = 0; k < lx.size(); k++) {
            Lexeme l = lx.get(k);
            Optional<OperatorCategory> category = Optional.empty();
            if (l.type() == Lexeme.Type.SYMBOL) {
                if (l.is("(")) {
                    if (!header && k > 0 && isCallee(lx.get(k - 1))) category = Optional.of(OperatorCategory.CALL);
                } else if (l.is("[")) {
                    if (k > 0 && isCallee(lx.get(k - 1))) category = Optional.of(OperatorCategory.ACCESS);
                } else {
                    category = OperatorCategory.ofSymbol(l.text());
                }
            } else if (l.type() == Lexeme.Type.WORD && indentMode) {
                category = OperatorCategory.ofWord(l.text());
            }
            category.ifPresent(c -> found.putIfAbsent(c, l));
        }
        return found;
    }

    private Map<String, StatementKind> keywords() {
        return indentMode ? INDENT_KEYWORDS : BRACE_KEYWORDS;
    }

    private boolean isKeyword(Lexeme l) {
        return l.type() == Lexeme.Type.WORD && keywords().containsKey(l.text());
    }

    private boolean isPlainWord(Lexeme l) {
        return l.type() == Lexeme.Type.WORD && !isKeyword(l) && !NON_CALL_WORDS.contains(l.text());
    }

    private boolean isCallee(Lexeme prev) {
        if (prev.is(")") || prev.is("]")) return true;
        return isPlainWord(prev);
    }

    private static boolean isWord(Lexeme l, String word) {
        return l.type() == Lexeme.Type.WORD && l.text().equals(word);
    }

    /**
     * 返回类型 + 名字 + ( ，例如 int add(int a, int b) {
     */
    private boolean looksLikeFunction(List<Lexeme> lx, int from) {
        int paren = indexOfTopLevel(lx, from, "(");
        if (paren < from + 2) return false;
        Lexeme name = lx.get(paren - 1);
        Lexeme before = lx.get(paren - 2);
        if (!isPlainWord(name)) return false;
        return isPlainWord(before) || before.is(">") || before.is("]") || before.is("*") || before.is("&");
    }

    private boolean looksLikeCall(List<Lexeme> lx, int from) {
        int k = from;
        if (k < lx.size() && (isWord(lx.get(k), "await") || isWord(lx.get(k), "new"))) k++;
        if (k >= lx.size() || !isPlainWord(lx.get(k))) return false;
        for (; k < lx.size(); k++) {
            Lexeme l = lx.get(k);
            if (l.is("(")) return true;
            boolean access = l.is(".") || l.is("->") || l.is("::") || l.is("?.");
            if (!access && !isPlainWord(l)) return false;
        }
        return false;
    }

    private boolean isDeclarationTarget(List<Lexeme> lx, int from, int assign) {
        int words = 0;
        for (int k = from; k < assign; k++) {
            Lexeme l = lx.get(k);
            if (l.is(".") || l.is("->") || l.is("[") || l.is("::")) return false;
            if (l.type() == Lexeme.Type.WORD) words++;
        }
        return words >= 2;
    }

    private static int topLevelAssignment(List<Lexeme> lx, int from) {
        int depth = 0;
        for (int k = from; k < lx.size(); k++) {
            Lexeme l = lx.get(k);
            if (l.is("(") || l.is("[") || l.is("{")) depth++;
            else if (l.is(")") || l.is("]") || l.is("}")) depth--;
            else if (depth == 0 && l.type() == Lexeme.Type.SYMBOL && OperatorCategory.isAssignment(l.text())) return k;
        }
        return -1;
    }

    private static boolean hasTopLevel(List<Lexeme> lx, int from, String symbol) {
        return indexOfTopLevel(lx, from, symbol) >= 0;
    }

    private static int indexOfTopLevel(List<Lexeme> lx, int from, String symbol) {
        int depth = 0;
        for (int k = from; k < lx.size(); k++) {
            Lexeme l = lx.get(k);
            if (depth == 0 && l.is(symbol)) return k;
            if (l.is("(") || l.is("[") || l.is("{")) depth++;
            else if (l.is(")") || l.is("]") || l.is("}")) depth--;
        }
        return -1;
    }
}
