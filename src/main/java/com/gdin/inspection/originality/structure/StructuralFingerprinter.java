package com.gdin.inspection.originality.structure;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.exception.StructureParseException;
import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.similarity.TextToken;
import com.gdin.inspection.originality.similarity.TokenAlignment;
import com.gdin.inspection.originality.similarity.TokenSequenceAligner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 代码结构指纹：语句种类、嵌套深度、运算符类别，丢弃标识符与字面量。
 * 任何解析错误都降级为不透明骨架，不向外抛出。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuralFingerprinter {

    private final OriginalityProperties originalityProperties;

    public Skeleton fingerprint(ContentUnit unit) {
        if (!unit.isCode()) {
            return Skeleton.failed("not code: " + unit.getContentKind().getValue(), lengthOf(unit.getRawText()));
        }
        return fingerprint(unit.getRawText());
    }

    public Skeleton fingerprint(String code) {
        String text = code == null ? "" : code;
        if (text.length() > originalityProperties.getMaxTextChars()) {
            text = text.substring(0, originalityProperties.getMaxTextChars());
        }
        try {
            return Skeleton.of(buildTokens(text));
        } catch (StructureParseException e) {
            log.debug("结构解析失败，降级为不透明骨架: {}", e.getMessage());
            return Skeleton.failed(e.getMessage(), text.length());
        }
    }

    public StructuralComparison compare(Skeleton a, Skeleton b) {
        if (a.isParseFailed() || b.isParseFailed()) return StructuralComparison.failed();
        TokenAlignment alignment = TokenSequenceAligner.align(a.getTokens(), b.getTokens(),
                originalityProperties.getMinBlockTokens());
        return new StructuralComparison(alignment.ratio(), alignment.spans(), false);
    }

    public StructuralComparison compare(ContentUnit a, ContentUnit b) {
        return compare(fingerprint(a), fingerprint(b));
    }

    private List<TextToken> buildTokens(String code) {
        CodeLexer lexer = new CodeLexer(code);
        List<Lexeme> lexemes = lexer.lex();
        List<Statement> statements = new StatementParser(lexemes, lexer.isIndentMode()).parse();
        if (statements.isEmpty()) throw new StructureParseException("no statements");

        StatementClassifier classifier = new StatementClassifier(lexer.isIndentMode());
        List<TextToken> tokens = new ArrayList<>();
        for (Statement statement : statements) {
            StatementKind kind = classifier.classify(statement);
            tokens.add(new TextToken(kind + "@" + statement.depth(), statement.start(), statement.end()));
            for (Map.Entry<OperatorCategory, Lexeme> op : classifier.operators(statement, kind).entrySet()) {
                tokens.add(new TextToken("op:" + op.getKey(), op.getValue().start(), op.getValue().end()));
            }
        }
        return tokens;
    }

    private static int lengthOf(String text) {
        return text == null ? 0 : text.length();
    }
}
